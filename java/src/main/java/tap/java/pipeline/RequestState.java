package tap.java.pipeline;

/**
 * Where a request is in the pipeline.
 */
public enum RequestState {
    RECEIVED(false, true),
    BYPASS_CHECK(false, true),
    CHECKING(false, true),
    ADMITTED(false, true),
    FUNDING(false, false),
    CONFIRMED(true, false),
    REJECTED(true, false),
    FAILED(true, false),
    TIMED_OUT(true, false),
    CANCELLED(true, false);

    private final boolean terminal;
    private final boolean cancellable;

    RequestState(boolean terminal, boolean cancellable) {
        this.terminal = terminal;
        this.cancellable = cancellable;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * @return true while nothing has been submitted to the chain
     */
    public boolean isCancellable() {
        return cancellable;
    }
}
