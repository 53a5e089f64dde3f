package tap.java.funder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tap.core.clock.ManualClock;
import tap.core.error.ErrorCode;
import tap.core.error.FailureKind;
import tap.core.error.SubmissionFailedException;
import tap.core.error.SubmissionFatalException;
import tap.core.model.AttemptStatus;
import tap.core.model.FundingAttempt;
import tap.core.model.FundingOutcome;
import tap.core.model.FundingRequest;
import tap.core.model.Identity;
import tap.core.model.OutcomeStatus;
import tap.core.quota.ReservationToken;
import tap.core.quota.Resolution;
import tap.java.engine.QuotaEngine;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FundingEngine against a scripted chain.
 *
 * Coverage:
 * - Sequence mismatch recovery
 * - Fatal and non-retryable failures release reservations
 * - Timeouts hold reservations for reconciliation
 * - Retry budget exhaustion
 */
class FundingEngineTest {

    private static final long SECOND = 1_000_000_000L;
    private static final long WINDOW = 60 * SECOND;
    private static final String FAUCET = "0xfaucet";
    private static final Identity RECEIVER = Identity.receiver("0xr");

    private ManualClock clock;
    private ScriptedChainClient chain;
    private QuotaEngine store;
    private FundingEngine engine;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000 * SECOND);
        chain = new ScriptedChainClient();
        store = QuotaEngine.inMemory(600 * SECOND);
        FunderConfig config = new FunderConfig(FAUCET, Duration.ofSeconds(5), RetryPolicy.immediate(3),
            Duration.ofSeconds(30));
        engine = FundingEngine.create(chain, store, config, clock);
    }

    private FundingRequest request(long amount) {
        return FundingRequest.of(RECEIVER.value(), "10.0.0.1", amount, clock.nowNanos());
    }

    private ReservationToken reserve(long amount) {
        return store.checkAndReserve(RECEIVER, amount, 100, WINDOW, clock.nowNanos()).token();
    }

    // ========== SUCCESS ==========

    @Test
    void testConfirmedCommitsReservation() {
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.CONFIRMED, outcome.status());
        assertEquals("ref-1", outcome.txnRef());
        assertEquals(1, outcome.attempts().size());
        assertEquals(5, store.usage(RECEIVER).committed());
        assertEquals(0, engine.ledger().pendingCount());
    }

    @Test
    void testTransactionCarriesRequestAndExpiry() {
        engine.fund("req-1", request(7), List.of());

        Transaction tx = chain.submitted().get(0);
        assertEquals(FAUCET, tx.sender());
        assertEquals(RECEIVER.value(), tx.receiver());
        assertEquals(7, tx.amount());
        assertEquals(0, tx.sequenceNumber());
        assertEquals(1_000 + 30, tx.expirationTimestampSecs());
    }

    // ========== SEQUENCE MISMATCH ==========

    @Test
    void testSequenceMismatchAtSubmissionRetriesWithNewNumberAndCommitsOnce() {
        chain.setAccountSequence(4);
        engine.sequencer().initialize();
        chain.setAccountSequence(6);
        chain.failNextSubmit(new SubmissionFailedException(FailureKind.SEQUENCE_MISMATCH, "old sequence"));
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.CONFIRMED, outcome.status());
        assertEquals(List.of(4L, 6L), chain.submittedSequences());
        assertEquals(6, outcome.attempts().get(0).sequenceNumber());
        assertEquals(5, store.usage(RECEIVER).committed());
        assertFalse(store.resolve(token, Resolution.COMMIT), "Reservation must already be committed");
        assertEquals(7, engine.sequencer().peekNext());
    }

    @Test
    void testSequenceMismatchOnConfirmationIsRetried() {
        chain.thenConfirm(Confirmation.failed(FailureKind.SEQUENCE_MISMATCH, "overtaken"));
        chain.setAccountSequence(0);
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.CONFIRMED, outcome.status());
        List<AttemptStatus> statuses = outcome.attempts().stream().map(FundingAttempt::status).toList();
        assertEquals(List.of(AttemptStatus.FAILED, AttemptStatus.CONFIRMED), statuses);
        assertEquals(5, store.usage(RECEIVER).committed());
    }

    // ========== FAILURES ==========

    @Test
    void testFatalSubmissionReleasesReservation() {
        chain.failNextSubmit(new SubmissionFatalException(FailureKind.INSUFFICIENT_BALANCE, "broke"));
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertEquals(ErrorCode.SUBMISSION_FATAL, outcome.errorCode());
        assertTrue(outcome.detail().contains("INSUFFICIENT_BALANCE"));
        assertEquals(0, store.usage(RECEIVER).used());
        assertEquals(1, chain.submitted().size(), "Fatal failures must not be retried");
    }

    @Test
    void testUnexpectedSubmissionErrorReleasesReservation() {
        chain.failNextSubmit(new IllegalStateException("node exploded"));
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertEquals(0, store.usage(RECEIVER).used());
    }

    @Test
    void testExecutionFailureIsNotRetriedAndKeepsSequenceSpent() {
        chain.thenConfirm(Confirmation.failed(FailureKind.EXECUTION_FAILED, "aborted"));
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertEquals(1, chain.submitted().size());
        assertEquals(1, engine.sequencer().peekNext());
        assertEquals(0, store.usage(RECEIVER).used());
    }

    @Test
    void testTransientFailuresExhaustBudget() {
        for (int i = 0; i < 3; i++) {
            chain.thenConfirm(Confirmation.failed(FailureKind.TRANSIENT, "node busy"));
        }
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertTrue(outcome.detail().contains("exhausted"), outcome.detail());
        assertEquals(3, outcome.attempts().size());
        assertEquals(List.of(0L, 0L, 0L), chain.submittedSequences(),
            "Failures that do not consume the sequence number hand it out again");
        assertEquals(0, store.usage(RECEIVER).used());
    }

    @Test
    void testTransientSubmissionFailureThenSuccess() {
        chain.failNextSubmit(new SubmissionFailedException(FailureKind.TRANSIENT, "connection reset"));
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.CONFIRMED, outcome.status());
        assertEquals(List.of(0L, 0L), chain.submittedSequences());
    }

    // ========== TIMEOUT ==========

    @Test
    void testTimeoutHoldsReservationAndIsNotRetried() {
        chain.thenConfirm(Confirmation.timeout());
        ReservationToken token = reserve(5);

        FundingOutcome outcome = engine.fund("req-1", request(5), List.of(token));

        assertEquals(OutcomeStatus.TIMED_OUT, outcome.status());
        assertEquals(ErrorCode.CONFIRMATION_TIMED_OUT, outcome.errorCode());
        assertEquals("ref-1", outcome.txnRef());
        assertEquals(1, chain.submitted().size());
        assertEquals(5, store.usage(RECEIVER).held());
        assertEquals(1, engine.ledger().ambiguousCount());
        assertEquals(0, engine.ledger().pendingCount());
    }

    // ========== BYPASS ==========

    @Test
    void testFundingWithoutReservations() {
        FundingOutcome outcome = engine.fund("req-1", request(5), List.of());

        assertTrue(outcome.isConfirmed());
        assertEquals(0, store.size());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> engine.fund(null, request(1), List.of()));
        assertThrows(IllegalArgumentException.class, () -> engine.fund("r", null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> engine.fund("r", request(1), null));
    }
}
