package tap.core.error;

/**
 * Classification of a chain-side failure.
 */
public enum FailureKind {
    /** Transaction used a sequence number the account has already moved past. */
    SEQUENCE_MISMATCH(true, false),

    /** Network hiccup, overloaded node, or similar. */
    TRANSIENT(true, false),

    /** The funding account cannot cover the transfer. */
    INSUFFICIENT_BALANCE(false, false),

    /** The chain refused to parse or validate the transaction. */
    MALFORMED(false, false),

    /** The transaction executed and aborted. The sequence number is spent. */
    EXECUTION_FAILED(false, true);

    private final boolean retryable;
    private final boolean consumesSequence;

    FailureKind(boolean retryable, boolean consumesSequence) {
        this.retryable = retryable;
        this.consumesSequence = consumesSequence;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * @return true if the account's sequence number advanced despite the failure
     */
    public boolean consumesSequence() {
        return consumesSequence;
    }
}
