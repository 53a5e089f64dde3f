package tap.core.error;

/**
 * Base exception for everything the service reports as a domain failure.
 */
public abstract class TapException extends RuntimeException {

    private final ErrorCode errorCode;

    protected TapException(ErrorCode errorCode, String message) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected TapException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
