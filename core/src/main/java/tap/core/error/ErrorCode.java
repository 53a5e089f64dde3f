package tap.core.error;

/**
 * Error codes surfaced to callers.
 *
 * Every code belongs to a {@link Side}: ADMISSION codes mean "you cannot have
 * this resource now", FUNDING codes mean "the system failed to process your
 * admitted request", SYSTEM codes mean the service itself is unwell.
 */
public enum ErrorCode {

    // ==================== Admission (1xx) ====================

    ADMISSION_REJECTED("TAP-100", "Request was not admitted", Side.ADMISSION),
    QUOTA_EXCEEDED("TAP-101", "Quota exhausted for this window", Side.ADMISSION),
    INVALID_REQUEST("TAP-102", "Invalid request", Side.ADMISSION),

    // ==================== Funding (2xx) ====================

    SUBMISSION_FAILED("TAP-200", "Transaction submission failed, will retry", Side.FUNDING),
    SUBMISSION_FATAL("TAP-201", "Transaction could not be funded", Side.FUNDING),
    CONFIRMATION_TIMED_OUT("TAP-202", "Transaction outcome unknown", Side.FUNDING),

    // ==================== System (9xx) ====================

    STORAGE_ERROR("TAP-900", "Quota storage failure", Side.SYSTEM),
    INTERNAL_ERROR("TAP-901", "Internal error", Side.SYSTEM);

    private final String code;
    private final String defaultMessage;
    private final Side side;

    ErrorCode(String code, String defaultMessage, Side side) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.side = side;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public Side getSide() {
        return side;
    }

    public boolean isAdmission() {
        return side == Side.ADMISSION;
    }

    public enum Side {
        ADMISSION,
        FUNDING,
        SYSTEM
    }
}
