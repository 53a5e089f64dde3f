package tap.core.bypass;

/**
 * Supported bypass rules.
 */
public enum BypasserKind {
    /**
     * Request carries one of the trusted credentials.
     */
    AUTH_TOKEN,

    /**
     * Caller address falls inside an allow-listed CIDR range.
     */
    IP_ALLOWLIST,

    /**
     * Receiver is on the allow list.
     */
    RECEIVER_ALLOWLIST
}
