package tap.java.funder;

/**
 * A transaction the chain accepted.
 */
public record Submission(long sequenceNumber, String txnRef, Transaction transaction) {
}
