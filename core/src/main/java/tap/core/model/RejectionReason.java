package tap.core.model;

/**
 * User-facing explanation of a rejection.
 *
 * @param code machine-readable reason
 * @param message human-readable detail
 * @param retryAfterNanos how long until the same request could pass, 0 if retrying will not help
 */
public record RejectionReason(
    RejectionReasonCode code,
    String message,
    long retryAfterNanos
) {
    public RejectionReason {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null) {
            message = code.name();
        }
        retryAfterNanos = Math.max(0L, retryAfterNanos);
    }

    public static RejectionReason of(RejectionReasonCode code, String message) {
        return new RejectionReason(code, message, 0L);
    }

    public static RejectionReason quotaExceeded(String message, long retryAfterNanos) {
        return new RejectionReason(RejectionReasonCode.QUOTA_EXCEEDED, message, retryAfterNanos);
    }
}
