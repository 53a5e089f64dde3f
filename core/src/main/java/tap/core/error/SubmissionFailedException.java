package tap.core.error;

/**
 * Submission did not go through but may on a later try.
 */
public class SubmissionFailedException extends TapException {

    private final FailureKind kind;

    public SubmissionFailedException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public SubmissionFailedException(FailureKind kind, String message, Throwable cause) {
        super(ErrorCode.SUBMISSION_FAILED, message, cause);
        if (!kind.isRetryable()) {
            throw new IllegalArgumentException(kind + " is not retryable");
        }
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
