package tap.java.funder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tap.core.clock.ManualClock;
import tap.core.error.FailureKind;
import tap.core.error.SubmissionFailedException;
import tap.core.error.SubmissionFatalException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LocalChainClientTest {

    private static final long SECOND = 1_000_000_000L;
    private static final String FAUCET = "0xfaucet";
    private static final Duration SHORT = Duration.ofMillis(50);

    private ManualClock clock;
    private LocalChainClient chain;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(100 * SECOND);
        chain = new LocalChainClient(clock);
        chain.fund(FAUCET, 1_000);
    }

    private Transaction tx(long seq, long amount) {
        return new Transaction(FAUCET, seq, "0xr", amount, 130);
    }

    @Test
    void testInOrderTransactionExecutesImmediately() throws InterruptedException {
        String ref = chain.submit(tx(0, 100));

        assertEquals(ConfirmationStatus.CONFIRMED, chain.awaitConfirmation(ref, SHORT).status());
        assertEquals(900, chain.balanceOf(FAUCET));
        assertEquals(100, chain.balanceOf("0xr"));
        assertEquals(1, chain.accountSequenceNumber(FAUCET));
    }

    @Test
    void testGapParksTransactionUntilClosed() throws InterruptedException {
        String later = chain.submit(tx(1, 10));
        assertEquals(ConfirmationStatus.TIMEOUT, chain.awaitConfirmation(later, SHORT).status());

        String first = chain.submit(tx(0, 10));

        assertEquals(ConfirmationStatus.CONFIRMED, chain.awaitConfirmation(first, SHORT).status());
        assertEquals(ConfirmationStatus.CONFIRMED, chain.awaitConfirmation(later, SHORT).status());
        assertEquals(2, chain.accountSequenceNumber(FAUCET));
    }

    @Test
    void testParkedTransactionFailsOnceExpired() throws InterruptedException {
        String parked = chain.submit(tx(1, 10));
        clock.advanceSeconds(31);

        Confirmation confirmation = chain.awaitConfirmation(parked, SHORT);
        assertEquals(ConfirmationStatus.FAILED, confirmation.status());
        assertEquals(FailureKind.TRANSIENT, confirmation.failureKind());
        assertEquals(0, chain.accountSequenceNumber(FAUCET), "Expired transaction must not consume its number");

        String first = chain.submit(new Transaction(FAUCET, 0, "0xr", 10, 200));
        assertEquals(ConfirmationStatus.CONFIRMED, chain.awaitConfirmation(first, SHORT).status());
        assertEquals(1, chain.accountSequenceNumber(FAUCET), "Dropped transaction must not execute later");
        assertEquals(10, chain.balanceOf("0xr"));
    }

    @Test
    void testOldSequenceIsRefused() {
        chain.submit(tx(0, 10));

        SubmissionFailedException e = assertThrows(SubmissionFailedException.class, () -> chain.submit(tx(0, 10)));
        assertEquals(FailureKind.SEQUENCE_MISMATCH, e.getKind());
    }

    @Test
    void testExternalUseMakesLocalNumberStale() {
        chain.advanceSequenceExternally(FAUCET);

        SubmissionFailedException e = assertThrows(SubmissionFailedException.class, () -> chain.submit(tx(0, 10)));
        assertEquals(FailureKind.SEQUENCE_MISMATCH, e.getKind());
        assertEquals(1, chain.accountSequenceNumber(FAUCET));
    }

    @Test
    void testUnaffordableOrExpiredTransactionIsFatal() {
        SubmissionFatalException broke = assertThrows(SubmissionFatalException.class,
            () -> chain.submit(tx(0, 5_000)));
        assertEquals(FailureKind.INSUFFICIENT_BALANCE, broke.getKind());

        clock.advanceSeconds(60);
        SubmissionFatalException expired = assertThrows(SubmissionFatalException.class,
            () -> chain.submit(tx(0, 10)));
        assertEquals(FailureKind.MALFORMED, expired.getKind());
        assertEquals(0, chain.accountSequenceNumber(FAUCET));
    }

    @Test
    void testBalanceShortfallAtExecutionSpendsSequence() throws InterruptedException {
        String parked = chain.submit(tx(1, 900));
        String first = chain.submit(tx(0, 200));

        assertEquals(ConfirmationStatus.CONFIRMED, chain.awaitConfirmation(first, SHORT).status());
        Confirmation second = chain.awaitConfirmation(parked, SHORT);
        assertEquals(FailureKind.EXECUTION_FAILED, second.failureKind());
        assertEquals(2, chain.accountSequenceNumber(FAUCET));
        assertEquals(800, chain.balanceOf(FAUCET));
    }

    @Test
    void testUnknownReference() throws InterruptedException {
        assertEquals(ConfirmationStatus.FAILED, chain.awaitConfirmation("0xnope", SHORT).status());
    }
}
