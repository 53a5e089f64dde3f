package tap.java.pipeline;

import tap.core.model.RejectionReason;

/**
 * Answer of a dry run.
 *
 * @param eligible true if the request would be admitted now
 * @param bypassed true if a bypass rule would admit it
 * @param reason why not, null when eligible
 */
public record Eligibility(boolean eligible, boolean bypassed, RejectionReason reason) {

    public static Eligibility viaBypass() {
        return new Eligibility(true, true, null);
    }

    public static Eligibility admitted() {
        return new Eligibility(true, false, null);
    }

    public static Eligibility rejected(RejectionReason reason) {
        return new Eligibility(false, false, reason);
    }
}
