package tap.java.funder;

import org.junit.jupiter.api.Test;
import tap.core.error.FailureKind;
import tap.core.error.SubmissionFailedException;
import tap.core.error.SubmissionFatalException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SequencerTest {

    private static final String ACCOUNT = "0xfaucet";

    private static Transaction tx(long seq) {
        return new Transaction(ACCOUNT, seq, "0xr", 1, Long.MAX_VALUE);
    }

    @Test
    void testStartsAtChainSequence() {
        ScriptedChainClient chain = new ScriptedChainClient();
        chain.setAccountSequence(42);
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);

        Submission first = sequencer.submit(SequencerTest::tx);

        assertEquals(42, first.sequenceNumber());
        assertEquals(43, sequencer.peekNext());
    }

    @Test
    void testRefusedSubmissionDoesNotAdvance() {
        ScriptedChainClient chain = new ScriptedChainClient();
        chain.failNextSubmit(new SubmissionFailedException(FailureKind.TRANSIENT, "busy"));
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);

        assertThrows(SubmissionFailedException.class, () -> sequencer.submit(SequencerTest::tx));
        assertEquals(0, sequencer.peekNext());

        chain.failNextSubmit(new SubmissionFatalException(FailureKind.MALFORMED, "bad"));
        assertThrows(SubmissionFatalException.class, () -> sequencer.submit(SequencerTest::tx));
        assertEquals(0, sequencer.peekNext());
    }

    @Test
    void testMismatchResyncsBeforeRethrowing() {
        ScriptedChainClient chain = new ScriptedChainClient();
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);
        sequencer.initialize();
        chain.setAccountSequence(9);
        chain.failNextSubmit(new SubmissionFailedException(FailureKind.SEQUENCE_MISMATCH, "old"));

        assertThrows(SubmissionFailedException.class, () -> sequencer.submit(SequencerTest::tx));

        assertEquals(9, sequencer.peekNext());
    }

    @Test
    void testResyncNeverMovesBackwards() {
        ScriptedChainClient chain = new ScriptedChainClient();
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);
        sequencer.submit(SequencerTest::tx);
        sequencer.submit(SequencerTest::tx);

        assertEquals(2, sequencer.resync(), "Chain still reports 0, local counter is ahead");
    }

    @Test
    void testRewindOnlyForLatestNumber() {
        ScriptedChainClient chain = new ScriptedChainClient();
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);
        Submission first = sequencer.submit(SequencerTest::tx);
        Submission second = sequencer.submit(SequencerTest::tx);

        assertFalse(sequencer.rewind(first.sequenceNumber()));
        assertTrue(sequencer.rewind(second.sequenceNumber()));
        assertEquals(1, sequencer.peekNext());
    }

    @Test
    void testResetIfStuckReturnsToChainNumber() {
        ScriptedChainClient chain = new ScriptedChainClient();
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);
        Submission dropped = sequencer.submit(SequencerTest::tx);
        sequencer.submit(SequencerTest::tx);
        sequencer.submit(SequencerTest::tx);

        assertTrue(sequencer.resetIfStuck(dropped.sequenceNumber()));
        assertEquals(0, sequencer.peekNext());
        assertEquals(0, sequencer.submit(SequencerTest::tx).sequenceNumber());
    }

    @Test
    void testResetIfStuckIgnoresConsumedNumbers() {
        ScriptedChainClient chain = new ScriptedChainClient();
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);
        sequencer.submit(SequencerTest::tx);
        sequencer.submit(SequencerTest::tx);
        chain.setAccountSequence(1);

        assertFalse(sequencer.resetIfStuck(0), "Chain already moved past 0, nothing is stuck behind it");
        assertEquals(2, sequencer.peekNext());
    }

    @Test
    void testBuilderMustUseOfferedNumber() {
        Sequencer sequencer = new Sequencer(new ScriptedChainClient(), ACCOUNT);

        assertThrows(IllegalStateException.class, () -> sequencer.submit(seq -> tx(seq + 1)));
        assertEquals(0, sequencer.peekNext());
    }

    @Test
    void testConcurrentSubmissionsAreGapFreeAndInOrder() throws InterruptedException {
        ScriptedChainClient chain = new ScriptedChainClient();
        Sequencer sequencer = new Sequencer(chain, ACCOUNT);

        int numThreads = 8;
        int perThread = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        List<Long> assigned = Collections.synchronizedList(new ArrayList<>());

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < perThread; i++) {
                        assigned.add(sequencer.submit(SequencerTest::tx).sequenceNumber());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        List<Long> reachedChain = chain.accepted().stream().map(Transaction::sequenceNumber).toList();
        assertEquals(numThreads * perThread, reachedChain.size());
        for (int i = 0; i < reachedChain.size(); i++) {
            assertEquals(i, reachedChain.get(i), "Chain must see sequence numbers in order without gaps");
        }
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Sequencer(null, ACCOUNT));
        assertThrows(IllegalArgumentException.class, () -> new Sequencer(new ScriptedChainClient(), " "));
        assertThrows(IllegalArgumentException.class,
            () -> new Sequencer(new ScriptedChainClient(), ACCOUNT).submit(null));
    }
}
