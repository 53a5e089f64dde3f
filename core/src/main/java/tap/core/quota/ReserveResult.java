package tap.core.quota;

import tap.core.model.Decision;

/**
 * Result of a check-and-reserve.
 *
 * @param decision ALLOW or REJECT
 * @param token the reservation, null on REJECT and on a dry run
 * @param retryAfterNanos time until the window rolls over, set on REJECT
 */
public record ReserveResult(Decision decision, ReservationToken token, long retryAfterNanos) {

    public static ReserveResult allow(ReservationToken token) {
        return new ReserveResult(Decision.ALLOW, token, 0L);
    }

    public static ReserveResult reject(long retryAfterNanos) {
        return new ReserveResult(Decision.REJECT, null, Math.max(0L, retryAfterNanos));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
