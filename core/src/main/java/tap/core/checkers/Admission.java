package tap.core.checkers;

import tap.core.model.Decision;
import tap.core.model.RejectionReason;
import tap.core.quota.ReservationToken;

import java.util.List;

/**
 * Verdict of a whole checker chain.
 *
 * @param decision ALLOW or REJECT
 * @param reason the first rejection, null on ALLOW
 * @param reservations every reservation taken on ALLOW, empty on REJECT
 */
public record Admission(Decision decision, RejectionReason reason, List<ReservationToken> reservations) {

    public Admission {
        reservations = reservations == null ? List.of() : List.copyOf(reservations);
    }

    public static Admission allow(List<ReservationToken> reservations) {
        return new Admission(Decision.ALLOW, null, reservations);
    }

    public static Admission reject(RejectionReason reason) {
        return new Admission(Decision.REJECT, reason, List.of());
    }

    public boolean admitted() {
        return decision == Decision.ALLOW;
    }
}
