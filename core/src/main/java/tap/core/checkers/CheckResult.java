package tap.core.checkers;

import tap.core.model.Decision;
import tap.core.model.RejectionReason;
import tap.core.quota.ReservationToken;

/**
 * @param decision ALLOW or REJECT
 * @param reason set on REJECT
 * @param reservation quota reserved by the check, may be null on ALLOW
 */
public record CheckResult(Decision decision, RejectionReason reason, ReservationToken reservation) {

    public static CheckResult allow() {
        return new CheckResult(Decision.ALLOW, null, null);
    }

    public static CheckResult allow(ReservationToken reservation) {
        return new CheckResult(Decision.ALLOW, null, reservation);
    }

    public static CheckResult reject(RejectionReason reason) {
        if (reason == null) throw new IllegalArgumentException("reason cannot be null");
        return new CheckResult(Decision.REJECT, reason, null);
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
