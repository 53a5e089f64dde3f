package tap.java.engine;

import tap.core.quota.QuotaWindow;
import tap.core.quota.ReservationToken;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Window, outstanding reservations and lock for one identity.
 *
 * Thread-safety:
 * - Every field except the lock is guarded by the lock.
 * - {@code retired} is set by the reaper, under the lock, just before the
 *   entry leaves the map. A thread that finds it set after locking must look
 *   the identity up again.
 */
final class QuotaEntry {

    /**
     * Reservation waiting for an outcome.
     */
    record Lease(ReservationToken token, long deadlineNanos) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final QuotaWindow window;
    private final Map<Long, Lease> pending = new LinkedHashMap<>();
    private final Map<Long, ReservationToken> held = new LinkedHashMap<>();
    private boolean retired;

    QuotaEntry(QuotaWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        this.window = window;
    }

    ReentrantLock getLock() {
        return lock;
    }

    QuotaWindow window() {
        return window;
    }

    Map<Long, Lease> pending() {
        return pending;
    }

    Map<Long, ReservationToken> held() {
        return held;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    boolean isIdle() {
        return pending.isEmpty() && held.isEmpty();
    }
}
