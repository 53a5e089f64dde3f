package tap.core.clock;

import java.time.Instant;

/**
 * Real wall clock, in nanoseconds since the epoch.
 * Quota windows are journaled and reloaded after a restart, so this cannot be System.nanoTime().
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}
