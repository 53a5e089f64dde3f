package tap.java.funder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.error.FailureKind;
import tap.core.error.SubmissionFailedException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Sole owner of the funding account's next sequence number.
 *
 * Assignment and submission happen together under one lock: the number is
 * taken, the transaction built and handed to the chain, and the counter only
 * moves past it once the chain has accepted. Numbers therefore reach the
 * chain in order and without gaps. Waiting for confirmation happens outside
 * the lock.
 *
 * Thread-safety: all state is guarded by a single ReentrantLock.
 */
public final class Sequencer {
    private static final Logger log = LoggerFactory.getLogger(Sequencer.class);

    private final ChainClient chain;
    private final String account;
    private final ReentrantLock lock = new ReentrantLock();

    private long next;
    private boolean initialized;

    public Sequencer(ChainClient chain, String account) {
        if (chain == null) throw new IllegalArgumentException("chain cannot be null");
        if (account == null || account.isBlank()) throw new IllegalArgumentException("account cannot be blank");
        this.chain = chain;
        this.account = account;
    }

    /**
     * Seeds the counter from the chain. Called lazily by the first submit if
     * not called explicitly.
     */
    public void initialize() {
        lock.lock();
        try {
            next = Math.max(next, chain.accountSequenceNumber(account));
            initialized = true;
            log.info("Sequencer for {} starts at {}", account, next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds and submits the transaction for the next sequence number.
     *
     * @param builder turns a sequence number into a transaction
     * @return the accepted submission
     * @throws SubmissionFailedException if the chain refused it; on
     *         SEQUENCE_MISMATCH the counter has already been resynced
     * @throws tap.core.error.SubmissionFatalException if the chain will never accept it
     */
    public Submission submit(LongFunction<Transaction> builder) {
        if (builder == null) throw new IllegalArgumentException("builder cannot be null");

        lock.lock();
        try {
            if (!initialized) {
                initialize();
            }
            long seq = next;
            Transaction tx = builder.apply(seq);
            if (tx.sequenceNumber() != seq) {
                throw new IllegalStateException("builder used sequence " + tx.sequenceNumber() + ", expected " + seq);
            }

            String txnRef;
            try {
                txnRef = chain.submit(tx);
            } catch (SubmissionFailedException e) {
                if (e.getKind() == FailureKind.SEQUENCE_MISMATCH) {
                    resyncLocked();
                }
                throw e;
            }
            next = seq + 1;
            return new Submission(seq, txnRef, tx);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the counter forward to the chain's view if the chain is ahead,
     * e.g. after someone else used the account.
     *
     * @return the counter after resync
     */
    public long resync() {
        lock.lock();
        try {
            return resyncLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands {@code sequenceNumber} out again after a failure that did not
     * consume it. Only possible while no later number has been handed out.
     *
     * @return true if the counter moved back
     */
    public boolean rewind(long sequenceNumber) {
        lock.lock();
        try {
            if (next == sequenceNumber + 1) {
                next = sequenceNumber;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the counter back to the chain's view when a transaction at
     * {@code stuckSequence} will never execute, e.g. because it expired or
     * the node dropped it. Every number handed out after it waits behind the
     * gap, so the chain's number is handed out again.
     *
     * @param stuckSequence sequence number of the transaction known to be dead
     * @return true if the counter moved back
     */
    public boolean resetIfStuck(long stuckSequence) {
        lock.lock();
        try {
            long onChain = chain.accountSequenceNumber(account);
            if (onChain > stuckSequence || next <= onChain) {
                return false;
            }
            log.warn("Sequence for {} reset from {} to {}: transaction at {} will never execute",
                account, next, onChain, stuckSequence);
            next = onChain;
            initialized = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public long peekNext() {
        lock.lock();
        try {
            return next;
        } finally {
            lock.unlock();
        }
    }

    public String account() {
        return account;
    }

    private long resyncLocked() {
        long onChain = chain.accountSequenceNumber(account);
        if (onChain > next) {
            log.warn("Sequence for {} resynced from {} to {}", account, next, onChain);
            next = onChain;
        }
        initialized = true;
        return next;
    }
}
