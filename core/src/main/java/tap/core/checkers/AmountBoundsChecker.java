package tap.core.checkers;

import tap.core.model.FundingRequest;
import tap.core.model.RejectionReason;
import tap.core.model.RejectionReasonCode;

public final class AmountBoundsChecker implements Checker {
    private final long minAmount;
    private final long maxAmount;

    public AmountBoundsChecker(long minAmount, long maxAmount) {
        if (minAmount <= 0) throw new IllegalArgumentException("minAmount must be > 0");
        if (maxAmount < minAmount) throw new IllegalArgumentException("maxAmount must be >= minAmount");
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }

    @Override
    public CheckResult check(FundingRequest request, boolean dryRun) {
        long amount = request.amount();
        if (amount < minAmount || amount > maxAmount) {
            return CheckResult.reject(RejectionReason.of(
                RejectionReasonCode.AMOUNT_OUT_OF_BOUNDS,
                "amount " + amount + " is outside [" + minAmount + ", " + maxAmount + "]"));
        }
        return CheckResult.allow();
    }

    @Override
    public CheckerKind kind() {
        return CheckerKind.AMOUNT_BOUNDS;
    }
}
