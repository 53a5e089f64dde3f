package tap.core.bypass;

import tap.core.model.FundingRequest;

import java.util.List;

/**
 * Runs bypass rules in configuration order and stops at the first one that
 * admits the request.
 *
 * Thread-safety: immutable, safe to share.
 */
public final class BypassEvaluator {
    private final List<Bypasser> bypassers;

    public BypassEvaluator(List<Bypasser> bypassers) {
        if (bypassers == null) throw new IllegalArgumentException("bypassers cannot be null");
        this.bypassers = List.copyOf(bypassers);
    }

    public static BypassEvaluator none() {
        return new BypassEvaluator(List.of());
    }

    public BypassDecision evaluate(FundingRequest request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        for (Bypasser bypasser : bypassers) {
            if (bypasser.evaluate(request) == BypassDecision.BYPASS) {
                return BypassDecision.BYPASS;
            }
        }
        return BypassDecision.NO_OPINION;
    }

    public List<Bypasser> bypassers() {
        return bypassers;
    }
}
