package tap.java.funder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.clock.Clock;
import tap.core.quota.QuotaStore;
import tap.core.quota.ReservationToken;
import tap.core.quota.Resolution;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Settles attempts left ambiguous by a confirmation timeout.
 *
 * Each pass asks the chain again, with a short deadline, about every
 * ambiguous transaction, lowest sequence number first:
 * - CONFIRMED: commit the held reservations
 * - FAILED: release them
 * - no answer and the transaction has expired: release them, it can no
 *   longer execute
 * - no answer otherwise: wait for the next pass
 *
 * A failed or expired transaction that did not consume its sequence number
 * leaves a gap every later number waits behind, so the sequencer is reset to
 * the chain's number.
 */
public final class FundingReconciler {
    private static final Logger log = LoggerFactory.getLogger(FundingReconciler.class);

    private final ChainClient chain;
    private final QuotaStore store;
    private final AttemptLedger ledger;
    private final Sequencer sequencer;
    private final Clock clock;
    private final Duration recheckTimeout;

    public FundingReconciler(ChainClient chain, QuotaStore store, AttemptLedger ledger, Sequencer sequencer,
                             Clock clock, Duration recheckTimeout) {
        if (chain == null) throw new IllegalArgumentException("chain cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (ledger == null) throw new IllegalArgumentException("ledger cannot be null");
        if (sequencer == null) throw new IllegalArgumentException("sequencer cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (recheckTimeout == null || recheckTimeout.isNegative()) {
            throw new IllegalArgumentException("recheckTimeout must be >= 0");
        }
        this.chain = chain;
        this.store = store;
        this.ledger = ledger;
        this.sequencer = sequencer;
        this.clock = clock;
        this.recheckTimeout = recheckTimeout;
    }

    public static FundingReconciler forEngine(ChainClient chain, QuotaStore store, FundingEngine engine,
                                              Clock clock, Duration recheckTimeout) {
        return new FundingReconciler(chain, store, engine.ledger(), engine.sequencer(), clock, recheckTimeout);
    }

    public ReconcileReport reconcileOnce() {
        int confirmed = 0;
        int failed = 0;
        int expired = 0;
        int stillPending = 0;

        for (AmbiguousAttempt ambiguous : ledger.ambiguous()) {
            String txnRef = ambiguous.attempt().txnRef();
            Confirmation confirmation;
            try {
                confirmation = chain.awaitConfirmation(txnRef, recheckTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stillPending = ledger.ambiguousCount();
                break;
            } catch (RuntimeException e) {
                log.warn("Could not reconcile {}, will retry on the next pass", txnRef, e);
                stillPending++;
                continue;
            }

            switch (confirmation.status()) {
                case CONFIRMED -> {
                    settle(ambiguous, Resolution.COMMIT);
                    confirmed++;
                    log.info("Ambiguous transaction {} for request {} confirmed",
                        txnRef, ambiguous.attempt().requestId());
                }
                case FAILED -> {
                    if (!confirmation.failureKind().consumesSequence()) {
                        sequencer.resetIfStuck(ambiguous.attempt().sequenceNumber());
                    }
                    settle(ambiguous, Resolution.RELEASE);
                    failed++;
                    log.info("Ambiguous transaction {} for request {} failed: {} {}",
                        txnRef, ambiguous.attempt().requestId(), confirmation.failureKind(), confirmation.detail());
                }
                case TIMEOUT -> {
                    long nowSecs = TimeUnit.NANOSECONDS.toSeconds(clock.nowNanos());
                    if (!ambiguous.isExpired(nowSecs)) {
                        stillPending++;
                        continue;
                    }
                    sequencer.resetIfStuck(ambiguous.attempt().sequenceNumber());
                    settle(ambiguous, Resolution.RELEASE);
                    expired++;
                    log.warn("Ambiguous transaction {} for request {} expired at {} without an answer, "
                            + "reservations released",
                        txnRef, ambiguous.attempt().requestId(), ambiguous.expirationTimestampSecs());
                }
            }
        }

        ReconcileReport report = new ReconcileReport(confirmed, failed, expired, stillPending);
        if (report.examined() > 0) {
            log.debug("Reconciliation pass: {}", report);
        }
        return report;
    }

    private void settle(AmbiguousAttempt ambiguous, Resolution resolution) {
        if (ledger.settle(ambiguous.attempt().txnRef()) == null) {
            return;
        }
        for (ReservationToken token : ambiguous.reservations()) {
            store.resolve(token, resolution);
        }
    }
}
