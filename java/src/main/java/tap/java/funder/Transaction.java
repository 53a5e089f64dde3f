package tap.java.funder;

/**
 * Transfer from the funding account, before signing.
 *
 * @param sender funding account
 * @param sequenceNumber the sender's sequence number this transaction uses
 * @param receiver destination address
 * @param amount amount to transfer
 * @param expirationTimestampSecs the chain drops the transaction after this time
 */
public record Transaction(
    String sender,
    long sequenceNumber,
    String receiver,
    long amount,
    long expirationTimestampSecs
) {
    public Transaction {
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender cannot be blank");
        }
        if (receiver == null || receiver.isBlank()) {
            throw new IllegalArgumentException("receiver cannot be blank");
        }
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
    }
}
