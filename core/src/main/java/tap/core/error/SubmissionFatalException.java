package tap.core.error;

/**
 * Funding gave up: the chain refused the transaction for good, or the retry budget ran out.
 */
public class SubmissionFatalException extends TapException {

    private final FailureKind kind;

    public SubmissionFatalException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public SubmissionFatalException(FailureKind kind, String message, Throwable cause) {
        super(ErrorCode.SUBMISSION_FATAL, message, cause);
        this.kind = kind;
    }

    /**
     * @return the last failure seen, or null if funding stopped for a local reason
     */
    public FailureKind getKind() {
        return kind;
    }
}
