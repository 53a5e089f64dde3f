package tap.java.funder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.clock.Clock;
import tap.core.error.FailureKind;
import tap.core.error.SubmissionFailedException;
import tap.core.error.SubmissionFatalException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process chain for development and tests.
 *
 * Each account has a balance and a sequence number. A transaction executes
 * once the sender's sequence number reaches it; later numbers are parked
 * until the gap closes, or dropped as failed once they expire. Execution debits the sender, credits the receiver and
 * advances the sender's sequence number. A transaction that cannot be paid
 * for at execution time fails and still consumes its sequence number.
 *
 * Thread-safety: all state is guarded by one lock.
 */
public final class LocalChainClient implements ChainClient {
    private static final Logger log = LoggerFactory.getLogger(LocalChainClient.class);

    private enum TxnState { PENDING, CONFIRMED, FAILED }

    private static final class Entry {
        final Transaction transaction;
        TxnState state = TxnState.PENDING;
        FailureKind failureKind;
        String detail;

        Entry(Transaction transaction) {
            this.transaction = transaction;
        }
    }

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, Long> balances = new HashMap<>();
    private final Map<String, Long> sequences = new HashMap<>();
    private final Map<String, TreeMap<Long, String>> parked = new HashMap<>();
    private final Map<String, Entry> transactions = new HashMap<>();
    private long txnCounter;

    public LocalChainClient(Clock clock) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        this.clock = clock;
    }

    public void fund(String account, long amount) {
        lock.lock();
        try {
            balances.merge(account, amount, Long::sum);
        } finally {
            lock.unlock();
        }
    }

    public long balanceOf(String account) {
        lock.lock();
        try {
            return balances.getOrDefault(account, 0L);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Spends one sequence number of {@code account} outside this process,
     * as another wallet sharing the key would.
     */
    public void advanceSequenceExternally(String account) {
        lock.lock();
        try {
            sequences.merge(account, 1L, Long::sum);
            executeReady(account);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String submit(Transaction transaction) {
        if (transaction == null) throw new IllegalArgumentException("transaction cannot be null");

        lock.lock();
        try {
            String sender = transaction.sender();
            long expected = sequences.getOrDefault(sender, 0L);
            if (transaction.sequenceNumber() < expected) {
                throw new SubmissionFailedException(FailureKind.SEQUENCE_MISMATCH,
                    "sequence number " + transaction.sequenceNumber() + " is old, account is at " + expected);
            }
            long nowSecs = TimeUnit.NANOSECONDS.toSeconds(clock.nowNanos());
            if (transaction.expirationTimestampSecs() <= nowSecs) {
                throw new SubmissionFatalException(FailureKind.MALFORMED, "transaction already expired");
            }
            if (balances.getOrDefault(sender, 0L) < transaction.amount()) {
                throw new SubmissionFatalException(FailureKind.INSUFFICIENT_BALANCE,
                    "account " + sender + " cannot cover " + transaction.amount());
            }

            dropExpired(sender, nowSecs);
            String txnRef = String.format("0x%016x", ++txnCounter);
            transactions.put(txnRef, new Entry(transaction));
            parked.computeIfAbsent(sender, s -> new TreeMap<>()).put(transaction.sequenceNumber(), txnRef);
            executeReady(sender);
            return txnRef;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Confirmation awaitConfirmation(String txnRef, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            Entry entry = transactions.get(txnRef);
            if (entry == null) {
                return Confirmation.failed(FailureKind.MALFORMED, "unknown transaction " + txnRef);
            }
            String sender = entry.transaction.sender();
            dropExpired(sender, TimeUnit.NANOSECONDS.toSeconds(clock.nowNanos()));
            while (entry.state == TxnState.PENDING) {
                if (remaining <= 0) {
                    return Confirmation.timeout();
                }
                remaining = changed.awaitNanos(remaining);
                dropExpired(sender, TimeUnit.NANOSECONDS.toSeconds(clock.nowNanos()));
            }
            return entry.state == TxnState.CONFIRMED
                ? Confirmation.confirmed()
                : Confirmation.failed(entry.failureKind, entry.detail);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long accountSequenceNumber(String account) {
        lock.lock();
        try {
            return sequences.getOrDefault(account, 0L);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails parked transactions whose expiration has passed. Their sequence
     * numbers stay unused.
     */
    private void dropExpired(String sender, long nowSecs) {
        TreeMap<Long, String> queue = parked.get(sender);
        if (queue == null) {
            return;
        }
        boolean any = false;
        Iterator<String> it = queue.values().iterator();
        while (it.hasNext()) {
            Entry entry = transactions.get(it.next());
            if (entry.transaction.expirationTimestampSecs() > nowSecs) {
                continue;
            }
            it.remove();
            entry.state = TxnState.FAILED;
            entry.failureKind = FailureKind.TRANSIENT;
            entry.detail = "expired before execution";
            log.trace("Dropped expired seq {} of {}", entry.transaction.sequenceNumber(), sender);
            any = true;
        }
        if (any) {
            changed.signalAll();
        }
    }

    private void executeReady(String sender) {
        TreeMap<Long, String> queue = parked.get(sender);
        if (queue == null) {
            return;
        }
        long expected = sequences.getOrDefault(sender, 0L);
        boolean any = false;

        Map<Long, String> overtaken = queue.headMap(expected);
        for (String txnRef : overtaken.values()) {
            Entry entry = transactions.get(txnRef);
            entry.state = TxnState.FAILED;
            entry.failureKind = FailureKind.SEQUENCE_MISMATCH;
            entry.detail = "sequence number used by another transaction";
            any = true;
        }
        overtaken.clear();

        for (String txnRef; (txnRef = queue.remove(expected)) != null; expected++) {
            Entry entry = transactions.get(txnRef);
            Transaction tx = entry.transaction;
            long balance = balances.getOrDefault(sender, 0L);
            if (balance < tx.amount()) {
                entry.state = TxnState.FAILED;
                entry.failureKind = FailureKind.EXECUTION_FAILED;
                entry.detail = "insufficient balance at execution";
            } else {
                balances.put(sender, balance - tx.amount());
                balances.merge(tx.receiver(), tx.amount(), Long::sum);
                entry.state = TxnState.CONFIRMED;
            }
            log.trace("Executed {} seq {} -> {}", txnRef, tx.sequenceNumber(), entry.state);
            any = true;
        }
        sequences.put(sender, expected);
        if (any) {
            changed.signalAll();
        }
    }
}
