package tap.core.clock;

/**
 * Source of time for everything that reasons about windows, leases and deadlines.
 * Implementations return nanoseconds since the Unix epoch.
 */
public interface Clock {
    long nowNanos();
}
