package tap.core.quota;

/**
 * Fixed-window counter for one identity. Not thread-safe: callers serialize
 * access per identity.
 *
 * {@code used} counts everything reserved in the window, pending or not.
 * {@code settled} is the part that is committed or held and therefore
 * survives a restart.
 */
public final class QuotaWindow {
    private long windowStart;
    private long windowNanos;
    private long used;
    private long settled;

    public QuotaWindow(long windowStart, long windowNanos) {
        if (windowNanos <= 0) throw new IllegalArgumentException("windowNanos must be > 0");
        this.windowStart = windowStart;
        this.windowNanos = windowNanos;
    }

    /**
     * Rebuilds a window from its durable state.
     */
    public static QuotaWindow restore(long windowStart, long windowNanos, long settled) {
        if (settled < 0) throw new IllegalArgumentException("settled must be >= 0");
        QuotaWindow window = new QuotaWindow(windowStart, windowNanos);
        window.used = settled;
        window.settled = settled;
        return window;
    }

    /**
     * Starts a fresh window at {@code now} if the current one has run out.
     * The new window begins at the request time, not at a multiple of the
     * window length.
     *
     * @return true if the window rolled over
     */
    public boolean rollIfDue(long now, long windowNanos) {
        if (windowNanos <= 0) throw new IllegalArgumentException("windowNanos must be > 0");
        this.windowNanos = windowNanos;
        if (now - windowStart < windowNanos) {
            return false;
        }
        windowStart = now;
        used = 0;
        settled = 0;
        return true;
    }

    public boolean fits(long amount, long limit) {
        return used + amount <= limit;
    }

    public boolean tryReserve(long amount, long limit) {
        if (amount <= 0) throw new IllegalArgumentException("amount must be > 0");
        if (!fits(amount, limit)) {
            return false;
        }
        used += amount;
        return true;
    }

    /**
     * @return nanoseconds until the window rolls over, or 0 when the amount
     *         can never fit under the limit
     */
    public long retryAfterNanos(long now, long amount, long limit) {
        if (amount > limit) {
            return 0L;
        }
        return Math.max(0L, windowStart + windowNanos - now);
    }

    /** Pending amount becomes committed or held. */
    public void settle(long amount) {
        settled += amount;
    }

    /** Pending amount is given back. */
    public void giveBack(long amount) {
        used = Math.max(0L, used - amount);
    }

    /** A held amount turned out not to be spent. */
    public void unsettle(long amount) {
        settled = Math.max(0L, settled - amount);
        giveBack(amount);
    }

    public boolean isCurrent(long tokenWindowStart) {
        return tokenWindowStart == windowStart;
    }

    public boolean isExpired(long now) {
        return now - windowStart >= windowNanos;
    }

    public long windowStart() {
        return windowStart;
    }

    public long windowNanos() {
        return windowNanos;
    }

    public long used() {
        return used;
    }

    public long settled() {
        return settled;
    }
}
