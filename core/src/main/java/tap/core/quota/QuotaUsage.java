package tap.core.quota;

import tap.core.model.Identity;

/**
 * Snapshot of one identity's current window.
 *
 * @param identity the identity
 * @param windowStartNanos start of the current window
 * @param used everything reserved in the window
 * @param pending part of {@code used} still waiting for an outcome
 * @param held part of {@code used} held for reconciliation
 */
public record QuotaUsage(Identity identity, long windowStartNanos, long used, long pending, long held) {

    public static QuotaUsage empty(Identity identity) {
        return new QuotaUsage(identity, 0L, 0L, 0L, 0L);
    }

    public long committed() {
        return used - pending - held;
    }
}
