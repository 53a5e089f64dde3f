package tap.java.funder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.clock.Clock;
import tap.core.error.ErrorCode;
import tap.core.error.FailureKind;
import tap.core.error.StorageException;
import tap.core.error.SubmissionFailedException;
import tap.core.error.SubmissionFatalException;
import tap.core.model.AttemptStatus;
import tap.core.model.FundingAttempt;
import tap.core.model.FundingOutcome;
import tap.core.model.FundingRequest;
import tap.core.quota.QuotaStore;
import tap.core.quota.ReservationToken;
import tap.core.quota.Resolution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Turns an admitted request into a confirmed transfer from the funding
 * account, and settles the request's reservations accordingly.
 *
 * Per attempt:
 * 1. The {@link Sequencer} assigns the next sequence number and submits
 * 2. The attempt is recorded as PENDING in the {@link AttemptLedger}
 * 3. The engine waits for confirmation with no lock held
 * 4. The outcome decides what happens to the reservations:
 *    - CONFIRMED: commit, return CONFIRMED
 *    - FAILED and retryable with budget left: back off, go to 1
 *    - FAILED otherwise: release, return FAILED
 *    - TIMEOUT: hold, leave the attempt for the reconciler, return TIMED_OUT
 *
 * A confirmation timeout is never retried: the transaction may still land,
 * and a second one would pay twice.
 *
 * Thread-safety: safe for concurrent calls; the sequencer is the only
 * serialized section.
 */
public final class FundingEngine {
    private static final Logger log = LoggerFactory.getLogger(FundingEngine.class);

    private final ChainClient chain;
    private final Sequencer sequencer;
    private final AttemptLedger ledger;
    private final QuotaStore store;
    private final FunderConfig config;
    private final Clock clock;

    public FundingEngine(ChainClient chain, Sequencer sequencer, AttemptLedger ledger, QuotaStore store,
                         FunderConfig config, Clock clock) {
        if (chain == null) throw new IllegalArgumentException("chain cannot be null");
        if (sequencer == null) throw new IllegalArgumentException("sequencer cannot be null");
        if (ledger == null) throw new IllegalArgumentException("ledger cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        this.chain = chain;
        this.sequencer = sequencer;
        this.ledger = ledger;
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    public static FundingEngine create(ChainClient chain, QuotaStore store, FunderConfig config, Clock clock) {
        return new FundingEngine(chain, new Sequencer(chain, config.fundingAccount()), new AttemptLedger(),
            store, config, clock);
    }

    /**
     * Funds a request.
     *
     * @param requestId id for logs and the attempt ledger
     * @param request the admitted request
     * @param reservations reservations taken at admission; empty for bypassed requests
     * @return CONFIRMED, FAILED or TIMED_OUT; never REJECTED
     */
    public FundingOutcome fund(String requestId, FundingRequest request, List<ReservationToken> reservations) {
        if (requestId == null) throw new IllegalArgumentException("requestId cannot be null");
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        if (reservations == null) throw new IllegalArgumentException("reservations cannot be null");

        List<FundingAttempt> attempts = new ArrayList<>();
        int maxAttempts = config.retry().maxAttempts();
        String lastFailure = "no attempt made";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Submission submission;
            try {
                submission = sequencer.submit(seq -> buildTransaction(seq, request));
            } catch (SubmissionFailedException e) {
                lastFailure = e.getKind() + ": " + e.getMessage();
                log.warn("Request {} attempt {}/{} refused at submission: {}",
                    requestId, attempt, maxAttempts, lastFailure);
                if (attempt < maxAttempts && backoff(requestId, attempt)) {
                    continue;
                }
                break;
            } catch (SubmissionFatalException e) {
                log.warn("Request {} attempt {}/{} rejected by chain: {}",
                    requestId, attempt, maxAttempts, e.getMessage());
                return fail(requestId, reservations, e.getKind() + ": " + e.getMessage(), attempts);
            } catch (RuntimeException e) {
                log.error("Request {} attempt {}/{} failed before submission", requestId, attempt, maxAttempts, e);
                return fail(requestId, reservations, "unexpected error before submission: " + e.getMessage(),
                    attempts);
            }

            FundingAttempt pending = FundingAttempt.pending(requestId, attempt, submission.sequenceNumber(),
                submission.txnRef(), clock.nowNanos());
            ledger.recordPending(pending);

            Confirmation confirmation = await(requestId, submission.txnRef());
            switch (confirmation.status()) {
                case CONFIRMED -> {
                    attempts.add(pending.withStatus(AttemptStatus.CONFIRMED));
                    ledger.complete(requestId);
                    resolveAll(reservations, Resolution.COMMIT);
                    log.debug("Request {} confirmed as {} (seq {})", requestId, submission.txnRef(),
                        submission.sequenceNumber());
                    return FundingOutcome.confirmed(submission.txnRef(), attempts);
                }
                case TIMEOUT -> {
                    FundingAttempt timedOut = pending.withStatus(AttemptStatus.TIMED_OUT);
                    attempts.add(timedOut);
                    resolveAll(reservations, Resolution.HOLD);
                    ledger.markAmbiguous(timedOut, reservations, submission.transaction().expirationTimestampSecs());
                    log.warn("Request {} transaction {} not confirmed within {}, outcome unknown",
                        requestId, submission.txnRef(), config.confirmationTimeout());
                    return FundingOutcome.timedOut(submission.txnRef(), attempts);
                }
                case FAILED -> {
                    attempts.add(pending.withStatus(AttemptStatus.FAILED));
                    ledger.complete(requestId);
                    FailureKind kind = confirmation.failureKind();
                    lastFailure = kind + ": " + confirmation.detail();
                    if (kind == FailureKind.SEQUENCE_MISMATCH) {
                        sequencer.resync();
                    } else if (!kind.consumesSequence()) {
                        sequencer.rewind(submission.sequenceNumber());
                    }
                    log.warn("Request {} attempt {}/{} failed on chain: {}",
                        requestId, attempt, maxAttempts, lastFailure);
                    if (!kind.isRetryable()) {
                        return fail(requestId, reservations, lastFailure, attempts);
                    }
                    if (attempt < maxAttempts && backoff(requestId, attempt)) {
                        continue;
                    }
                    if (attempt < maxAttempts) {
                        return fail(requestId, reservations, "interrupted while backing off", attempts);
                    }
                }
            }
        }

        return fail(requestId, reservations,
            "retry budget of " + maxAttempts + " attempts exhausted, last failure " + lastFailure, attempts);
    }

    public Sequencer sequencer() {
        return sequencer;
    }

    public AttemptLedger ledger() {
        return ledger;
    }

    private Transaction buildTransaction(long sequenceNumber, FundingRequest request) {
        long nowSecs = TimeUnit.NANOSECONDS.toSeconds(clock.nowNanos());
        return new Transaction(
            config.fundingAccount(),
            sequenceNumber,
            request.receiver(),
            request.amount(),
            nowSecs + config.transactionTtl().toSeconds()
        );
    }

    /**
     * An accepted transaction may land no matter what happens here, so any
     * failure to observe the outcome counts as a timeout.
     */
    private Confirmation await(String requestId, String txnRef) {
        try {
            return chain.awaitConfirmation(txnRef, config.confirmationTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Request {} interrupted while awaiting {}", requestId, txnRef);
            return Confirmation.timeout();
        } catch (RuntimeException e) {
            log.warn("Request {} lost track of {}", requestId, txnRef, e);
            return Confirmation.timeout();
        }
    }

    /**
     * @return false if interrupted, in which case no further attempt is made
     */
    private boolean backoff(String requestId, int attempt) {
        Duration delay = config.retry().backoff(attempt);
        if (delay.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        log.debug("Request {} retrying in {} ms", requestId, delay.toMillis());
        try {
            TimeUnit.NANOSECONDS.sleep(delay.toNanos());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private FundingOutcome fail(String requestId, List<ReservationToken> reservations, String detail,
                                List<FundingAttempt> attempts) {
        resolveAll(reservations, Resolution.RELEASE);
        log.warn("Request {} failed after {} attempt(s): {}", requestId, attempts.size(), detail);
        return FundingOutcome.failed(ErrorCode.SUBMISSION_FATAL, detail, attempts);
    }

    /**
     * The chain outcome is already final here, so a storage failure on one
     * reservation is logged and does not change the outcome. The reservation
     * stays pending and its lease returns it.
     */
    private void resolveAll(List<ReservationToken> reservations, Resolution resolution) {
        for (ReservationToken token : reservations) {
            try {
                if (!store.resolve(token, resolution)) {
                    log.warn("Reservation {} for {} could not be moved to {}; it had already expired",
                        token.id(), token.identity(), resolution);
                }
            } catch (StorageException e) {
                log.error("Reservation {} for {} could not be moved to {}", token.id(), token.identity(),
                    resolution, e);
            }
        }
    }
}
