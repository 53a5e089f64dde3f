package tap.core.model;

/**
 * Terminal states of a request.
 */
public enum OutcomeStatus {
    /** Funds landed on chain. */
    CONFIRMED,

    /** A checker turned the request away; nothing was submitted. */
    REJECTED,

    /** The request was admitted but funding failed; its quota was given back. */
    FAILED,

    /** A transaction was submitted but not confirmed in time; its quota is held until reconciled. */
    TIMED_OUT,

    /** The caller withdrew the request before funding began. */
    CANCELLED
}
