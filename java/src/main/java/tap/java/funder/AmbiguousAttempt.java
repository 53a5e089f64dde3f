package tap.java.funder;

import tap.core.model.FundingAttempt;
import tap.core.quota.ReservationToken;

import java.util.List;

/**
 * A submitted attempt whose outcome is unknown, and the held reservations
 * that depend on it.
 *
 * @param attempt the timed-out attempt
 * @param reservations reservations held on its behalf
 * @param expirationTimestampSecs the chain drops the transaction after this time
 */
public record AmbiguousAttempt(FundingAttempt attempt, List<ReservationToken> reservations,
                               long expirationTimestampSecs) {

    public AmbiguousAttempt {
        if (attempt == null) throw new IllegalArgumentException("attempt cannot be null");
        reservations = reservations == null ? List.of() : List.copyOf(reservations);
    }

    /**
     * @return true once the transaction can no longer be executed
     */
    public boolean isExpired(long nowSecs) {
        return nowSecs > expirationTimestampSecs;
    }
}
