package tap.java.funder;

import tap.core.error.SubmissionFailedException;
import tap.core.error.SubmissionFatalException;

import java.time.Duration;

/**
 * The blockchain as seen by the funder. Building, signing and broadcasting
 * are the implementation's business.
 */
public interface ChainClient {

    /**
     * Broadcasts a transaction.
     *
     * @return reference under which the transaction can be awaited
     * @throws SubmissionFailedException if the chain refused it for a reason
     *         that may go away (including a stale sequence number)
     * @throws SubmissionFatalException if the chain will never accept it
     */
    String submit(Transaction transaction);

    /**
     * Waits for a submitted transaction to be committed or discarded.
     *
     * @param txnRef reference returned by {@link #submit}
     * @param timeout how long to wait
     * @return CONFIRMED, FAILED with a kind, or TIMEOUT if the deadline passed first
     */
    Confirmation awaitConfirmation(String txnRef, Duration timeout) throws InterruptedException;

    /**
     * @return the next sequence number the chain expects from {@code account}
     */
    long accountSequenceNumber(String account);
}
