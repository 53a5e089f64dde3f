package tap.core.model;

/**
 * One submission of a funding transaction. A request produces one attempt per try.
 *
 * @param requestId request the attempt belongs to
 * @param attemptNumber 1-based try counter
 * @param sequenceNumber sequence number of the funding account used by the transaction
 * @param txnRef reference returned by the chain on submission
 * @param submittedAtNanos submission time
 * @param status current status
 */
public record FundingAttempt(
    String requestId,
    int attemptNumber,
    long sequenceNumber,
    String txnRef,
    long submittedAtNanos,
    AttemptStatus status
) {
    public FundingAttempt {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (txnRef == null) {
            throw new IllegalArgumentException("txnRef cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static FundingAttempt pending(String requestId, int attemptNumber, long sequenceNumber,
                                         String txnRef, long submittedAtNanos) {
        return new FundingAttempt(requestId, attemptNumber, sequenceNumber, txnRef, submittedAtNanos,
            AttemptStatus.PENDING);
    }

    public FundingAttempt withStatus(AttemptStatus newStatus) {
        return new FundingAttempt(requestId, attemptNumber, sequenceNumber, txnRef, submittedAtNanos, newStatus);
    }
}
