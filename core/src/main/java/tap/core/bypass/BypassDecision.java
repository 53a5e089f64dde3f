package tap.core.bypass;

public enum BypassDecision {
    BYPASS,
    NO_OPINION
}
