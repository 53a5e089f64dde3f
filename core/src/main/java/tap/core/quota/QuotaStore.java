package tap.core.quota;

import tap.core.model.Identity;

/**
 * Per-identity quota accounting with atomic check-and-reserve.
 *
 * Operations on one identity are linearizable. Admission for different
 * identities never waits on one another; a durable store may serialize the
 * writes made by {@link #resolve}.
 */
public interface QuotaStore {

    /**
     * Rolls the identity's window if it has run out, then reserves
     * {@code amount} if it fits under {@code limit}. Nothing is changed on
     * rejection.
     *
     * @param identity quota key
     * @param amount amount to reserve, > 0
     * @param limit ceiling for the window, > 0
     * @param windowNanos window length, > 0
     * @param nowNanos current time
     * @return ALLOW with a token, or REJECT with the time until rollover
     */
    ReserveResult checkAndReserve(Identity identity, long amount, long limit, long windowNanos, long nowNanos);

    /**
     * Same answer as {@link #checkAndReserve} without reserving anything.
     * The returned token is always null.
     */
    ReserveResult peek(Identity identity, long amount, long limit, long windowNanos, long nowNanos);

    /**
     * Ends a reservation. COMMIT and RELEASE apply to pending and held
     * reservations, HOLD only to pending ones.
     *
     * @return true if this call performed the transition; false if the
     *         reservation was already resolved or had expired
     */
    boolean resolve(ReservationToken token, Resolution resolution);

    QuotaUsage usage(Identity identity);
}
