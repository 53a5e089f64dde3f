package tap.core.model;

import tap.core.error.AdmissionRejectedException;
import tap.core.error.ConfirmationTimedOutException;
import tap.core.error.ErrorCode;
import tap.core.error.QuotaExceededException;
import tap.core.error.StorageException;
import tap.core.error.SubmissionFatalException;

import java.util.List;

/**
 * Final answer for a request.
 *
 * @param status terminal state
 * @param txnRef transaction reference, set for CONFIRMED and TIMED_OUT
 * @param rejection set for REJECTED
 * @param errorCode set for FAILED and TIMED_OUT
 * @param detail free-form detail for FAILED
 * @param bypassed true if a bypass rule admitted the request
 * @param attempts every funding attempt made for the request, in order
 */
public record FundingOutcome(
    OutcomeStatus status,
    String txnRef,
    RejectionReason rejection,
    ErrorCode errorCode,
    String detail,
    boolean bypassed,
    List<FundingAttempt> attempts
) {
    public FundingOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static FundingOutcome confirmed(String txnRef, List<FundingAttempt> attempts) {
        return new FundingOutcome(OutcomeStatus.CONFIRMED, txnRef, null, null, null, false, attempts);
    }

    public static FundingOutcome rejected(RejectionReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        ErrorCode code = reason.code() == RejectionReasonCode.QUOTA_EXCEEDED
            ? ErrorCode.QUOTA_EXCEEDED
            : ErrorCode.ADMISSION_REJECTED;
        return new FundingOutcome(OutcomeStatus.REJECTED, null, reason, code, null, false, List.of());
    }

    public static FundingOutcome failed(ErrorCode errorCode, String detail, List<FundingAttempt> attempts) {
        return new FundingOutcome(OutcomeStatus.FAILED, null, null, errorCode, detail, false, attempts);
    }

    public static FundingOutcome timedOut(String txnRef, List<FundingAttempt> attempts) {
        return new FundingOutcome(OutcomeStatus.TIMED_OUT, txnRef, null, ErrorCode.CONFIRMATION_TIMED_OUT, null,
            false, attempts);
    }

    public static FundingOutcome cancelled() {
        return new FundingOutcome(OutcomeStatus.CANCELLED, null, null, null, "cancelled before funding", false,
            List.of());
    }

    public FundingOutcome markBypassed() {
        return new FundingOutcome(status, txnRef, rejection, errorCode, detail, true, attempts);
    }

    public boolean isConfirmed() {
        return status == OutcomeStatus.CONFIRMED;
    }

    /**
     * @return retry-after hint for quota rejections, 0 otherwise
     */
    public long retryAfterNanos() {
        return rejection != null ? rejection.retryAfterNanos() : 0L;
    }

    /**
     * Returns the transaction reference of a confirmed outcome, or throws the
     * exception matching the failure.
     *
     * @return txnRef of the confirmed transaction
     * @throws QuotaExceededException if the request ran out of quota
     * @throws AdmissionRejectedException for any other rejection
     * @throws ConfirmationTimedOutException if the outcome is unknown
     * @throws SubmissionFatalException if funding failed
     * @throws StorageException if the quota store failed
     * @throws IllegalStateException if the request was cancelled
     */
    public String orThrow() {
        return switch (status) {
            case CONFIRMED -> txnRef;
            case REJECTED -> {
                if (rejection.code() == RejectionReasonCode.QUOTA_EXCEEDED) {
                    throw new QuotaExceededException(rejection);
                }
                throw new AdmissionRejectedException(rejection);
            }
            case TIMED_OUT -> throw new ConfirmationTimedOutException(txnRef);
            case FAILED -> {
                if (errorCode == ErrorCode.STORAGE_ERROR) {
                    throw new StorageException(detail);
                }
                throw new SubmissionFatalException(null, detail);
            }
            case CANCELLED -> throw new IllegalStateException("request was cancelled");
        };
    }
}
