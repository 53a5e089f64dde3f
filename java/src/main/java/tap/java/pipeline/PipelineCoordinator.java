package tap.java.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.bypass.BypassDecision;
import tap.core.bypass.BypassEvaluator;
import tap.core.checkers.Admission;
import tap.core.checkers.CheckerChain;
import tap.core.error.ErrorCode;
import tap.core.error.StorageException;
import tap.core.model.FundingOutcome;
import tap.core.model.FundingRequest;
import tap.core.quota.ReservationToken;
import tap.java.funder.FundingEngine;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a request through bypass evaluation, the checker chain and funding.
 *
 * State machine per request:
 * <pre>
 * RECEIVED -> BYPASS_CHECK -> ADMITTED (bypassed)
 *                          -> CHECKING -> ADMITTED | REJECTED
 * ADMITTED -> FUNDING -> CONFIRMED | FAILED | TIMED_OUT
 * any state before FUNDING -> CANCELLED
 * </pre>
 *
 * Every reservation taken by the chain is committed or released exactly
 * once, except after TIMED_OUT, where it is held for reconciliation.
 *
 * Thread-safety: safe for concurrent use. {@link #submit} runs requests on
 * the coordinator's worker pool; {@link #process} runs on the caller's thread.
 */
public final class PipelineCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final BypassEvaluator bypassEvaluator;
    private final CheckerChain checkerChain;
    private final FundingEngine fundingEngine;
    private final ExecutorService workers;

    public PipelineCoordinator(BypassEvaluator bypassEvaluator, CheckerChain checkerChain,
                               FundingEngine fundingEngine, ExecutorService workers) {
        if (bypassEvaluator == null) throw new IllegalArgumentException("bypassEvaluator cannot be null");
        if (checkerChain == null) throw new IllegalArgumentException("checkerChain cannot be null");
        if (fundingEngine == null) throw new IllegalArgumentException("fundingEngine cannot be null");
        if (workers == null) throw new IllegalArgumentException("workers cannot be null");
        this.bypassEvaluator = bypassEvaluator;
        this.checkerChain = checkerChain;
        this.fundingEngine = fundingEngine;
        this.workers = workers;
    }

    /**
     * Runs a request to completion on the calling thread.
     */
    public FundingOutcome process(FundingRequest request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        FundingTicket ticket = new FundingTicket(newRequestId());
        run(ticket, request);
        return ticket.outcome().join();
    }

    /**
     * Queues a request on the worker pool.
     *
     * @return a ticket that can be awaited or cancelled before funding starts
     * @throws RejectedExecutionException if the coordinator is closed
     */
    public FundingTicket submit(FundingRequest request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        FundingTicket ticket = new FundingTicket(newRequestId());
        workers.execute(() -> run(ticket, request));
        return ticket;
    }

    /**
     * Runs bypass rules and every check without reserving or funding anything.
     */
    public Eligibility checkEligibility(FundingRequest request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        if (bypassEvaluator.evaluate(request) == BypassDecision.BYPASS) {
            return Eligibility.viaBypass();
        }
        Admission admission = checkerChain.dryRun(request);
        return admission.admitted() ? Eligibility.admitted() : Eligibility.rejected(admission.reason());
    }

    private void run(FundingTicket ticket, FundingRequest request) {
        String requestId = ticket.requestId();
        try {
            ticket.finish(execute(ticket, request));
        } catch (StorageException e) {
            log.error("Request {} failed on quota storage", requestId, e);
            ticket.finish(FundingOutcome.failed(ErrorCode.STORAGE_ERROR, e.getMessage(), List.of()));
        } catch (RuntimeException e) {
            log.error("Request {} failed unexpectedly", requestId, e);
            ticket.finish(FundingOutcome.failed(ErrorCode.INTERNAL_ERROR, e.getMessage(), List.of()));
        }
    }

    private FundingOutcome execute(FundingTicket ticket, FundingRequest request) {
        if (!ticket.advance(RequestState.RECEIVED, RequestState.BYPASS_CHECK)) {
            return FundingOutcome.cancelled();
        }

        boolean bypassed = bypassEvaluator.evaluate(request) == BypassDecision.BYPASS;
        List<ReservationToken> reservations;
        if (bypassed) {
            if (!ticket.advance(RequestState.BYPASS_CHECK, RequestState.ADMITTED)) {
                return FundingOutcome.cancelled();
            }
            reservations = List.of();
        } else {
            if (!ticket.advance(RequestState.BYPASS_CHECK, RequestState.CHECKING)) {
                return FundingOutcome.cancelled();
            }
            Admission admission = checkerChain.admit(request);
            if (!admission.admitted()) {
                log.debug("Request {} rejected: {}", ticket.requestId(), admission.reason().message());
                return FundingOutcome.rejected(admission.reason());
            }
            reservations = admission.reservations();
            if (!ticket.advance(RequestState.CHECKING, RequestState.ADMITTED)) {
                checkerChain.releaseAll(reservations);
                return FundingOutcome.cancelled();
            }
        }

        if (!ticket.advance(RequestState.ADMITTED, RequestState.FUNDING)) {
            checkerChain.releaseAll(reservations);
            log.debug("Request {} cancelled before funding", ticket.requestId());
            return FundingOutcome.cancelled();
        }

        FundingOutcome outcome = fundingEngine.fund(ticket.requestId(), request, reservations);
        return bypassed ? outcome.markBypassed() : outcome;
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stops accepting work and waits briefly for queued requests to finish.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Pipeline workers did not finish within 10s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
