package tap.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to. Safe to share between threads.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceSeconds(long seconds) {
        advanceNanos(seconds * 1_000_000_000L);
    }

    public void setNanos(long value) {
        now.set(value);
    }
}
