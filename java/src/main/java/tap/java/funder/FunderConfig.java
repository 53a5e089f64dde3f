package tap.java.funder;

import java.time.Duration;

/**
 * @param fundingAccount account every disbursement comes from
 * @param confirmationTimeout how long one attempt waits for confirmation
 * @param retry attempt budget and backoff
 * @param transactionTtl how long a submitted transaction stays valid on chain
 */
public record FunderConfig(
    String fundingAccount,
    Duration confirmationTimeout,
    RetryPolicy retry,
    Duration transactionTtl
) {
    public FunderConfig {
        if (fundingAccount == null || fundingAccount.isBlank()) {
            throw new IllegalArgumentException("fundingAccount cannot be blank");
        }
        if (confirmationTimeout == null || confirmationTimeout.isZero() || confirmationTimeout.isNegative()) {
            throw new IllegalArgumentException("confirmationTimeout must be > 0");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (transactionTtl == null || transactionTtl.isZero() || transactionTtl.isNegative()) {
            throw new IllegalArgumentException("transactionTtl must be > 0");
        }
    }

    /**
     * Longest a single {@code fund} call can keep its reservations pending.
     * The quota store's lease must be longer than this.
     */
    public Duration worstCaseFundingTime() {
        return confirmationTimeout.multipliedBy(retry.maxAttempts()).plus(retry.worstCaseBackoff());
    }
}
