package tap.java.pipeline;

import tap.core.model.FundingOutcome;
import tap.core.model.OutcomeStatus;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on a request submitted to the coordinator.
 *
 * The state only moves forward. {@link #cancel()} wins only if it gets in
 * before the request reaches FUNDING; after that the request runs to a
 * terminal state.
 */
public final class FundingTicket {
    private final String requestId;
    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.RECEIVED);
    private final CompletableFuture<FundingOutcome> outcome = new CompletableFuture<>();

    FundingTicket(String requestId) {
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }

    public RequestState state() {
        return state.get();
    }

    /**
     * Completes when the request reaches a terminal state.
     */
    public CompletableFuture<FundingOutcome> outcome() {
        return outcome;
    }

    /**
     * Cancels the request if funding has not started.
     *
     * @return true if the request is now cancelled
     */
    public boolean cancel() {
        while (true) {
            RequestState current = state.get();
            if (current == RequestState.CANCELLED) {
                return true;
            }
            if (!current.isCancellable()) {
                return false;
            }
            if (state.compareAndSet(current, RequestState.CANCELLED)) {
                outcome.complete(FundingOutcome.cancelled());
                return true;
            }
        }
    }

    boolean advance(RequestState from, RequestState to) {
        return state.compareAndSet(from, to);
    }

    void finish(FundingOutcome result) {
        RequestState terminal = switch (result.status()) {
            case CONFIRMED -> RequestState.CONFIRMED;
            case REJECTED -> RequestState.REJECTED;
            case FAILED -> RequestState.FAILED;
            case TIMED_OUT -> RequestState.TIMED_OUT;
            case CANCELLED -> RequestState.CANCELLED;
        };
        RequestState current = state.get();
        if (result.status() == OutcomeStatus.CANCELLED || !current.isTerminal()) {
            state.set(terminal);
        }
        outcome.complete(result);
    }
}
