package tap.core.model;

/**
 * Why a checker turned a request away.
 */
public enum RejectionReasonCode {
    AMOUNT_OUT_OF_BOUNDS,
    AUTH_TOKEN_INVALID,
    IP_BLOCKED,
    IDENTITY_UNAVAILABLE,
    QUOTA_EXCEEDED
}
