package tap.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.clock.Clock;
import tap.core.clock.SystemClock;
import tap.core.model.Identity;
import tap.core.quota.QuotaStore;
import tap.core.quota.QuotaUsage;
import tap.core.quota.QuotaWindow;
import tap.core.quota.ReservationToken;
import tap.core.quota.ReserveResult;
import tap.core.quota.Resolution;
import tap.java.storage.QuotaJournal;
import tap.java.storage.QuotaRecord;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe, journaled quota store.
 *
 * Features:
 * - ConcurrentHashMap of per-identity entries, each with its own ReentrantLock
 * - Check-and-reserve runs entirely under the identity's lock, so concurrent
 *   requests for one identity cannot overshoot the limit
 * - Reservations carry a lease; one left unresolved past its lease is given
 *   back the next time the identity is touched, or by {@link #reap(long)}
 * - Windows follow the caller's request time; leases follow the engine's
 *   clock, so a request that sat in a queue still gets a full lease
 * - HELD reservations have no lease and wait for reconciliation
 * - Committed and held amounts are written to a {@link QuotaJournal} before
 *   the call returns; pending reservations are not
 * - Check-and-reserve never writes to the journal. A rollover is not
 *   recorded: the stored window start already marks the old window expired
 *
 * Architecture:
 * - QuotaEntry bundles QuotaWindow + lock + outstanding reservations
 * - Per-identity locks: different identities never contend
 * - The journal is the only shared resource, and only resolve and reap
 *   touch it
 *
 * Memory management:
 * - {@link #reap(long)} drops identities whose window has run out and that
 *   hold no reservation; the server calls it on a schedule
 *
 * Usage example:
 * <pre>
 * QuotaEngine engine = new QuotaEngine(journal, TimeUnit.MINUTES.toNanos(5), SystemClock.instance());
 * ReserveResult r = engine.checkAndReserve(Identity.receiver("0xabc"), 100, 1_000, windowNanos, now);
 * if (r.allowed()) {
 *     // fund, then
 *     engine.resolve(r.token(), Resolution.COMMIT);
 * }
 * </pre>
 */
public final class QuotaEngine implements QuotaStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QuotaEngine.class);

    private final QuotaJournal journal;
    private final long reservationLeaseNanos;
    private final Clock clock;
    private final Map<Identity, QuotaEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    /**
     * Creates the engine and loads durable state from the journal.
     *
     * @param journal where committed state goes; {@link QuotaJournal#NOOP} for memory only
     * @param reservationLeaseNanos how long a reservation may stay pending
     * @param clock source of lease deadlines
     * @throws IllegalArgumentException if any parameter is invalid
     * @throws tap.core.error.StorageException if recovery fails
     */
    public QuotaEngine(QuotaJournal journal, long reservationLeaseNanos, Clock clock) {
        if (journal == null) {
            throw new IllegalArgumentException("journal cannot be null");
        }
        if (reservationLeaseNanos <= 0) {
            throw new IllegalArgumentException("reservationLeaseNanos must be > 0");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.journal = journal;
        this.reservationLeaseNanos = reservationLeaseNanos;
        this.clock = clock;

        for (QuotaRecord r : journal.recover().values()) {
            entries.put(r.identity(), new QuotaEntry(
                QuotaWindow.restore(r.windowStartNanos(), r.windowNanos(), r.committed())));
        }
        if (!entries.isEmpty()) {
            log.info("Quota engine restored {} identities", entries.size());
        }
    }

    public QuotaEngine(QuotaJournal journal, long reservationLeaseNanos) {
        this(journal, reservationLeaseNanos, SystemClock.instance());
    }

    /**
     * Memory-only engine.
     */
    public static QuotaEngine inMemory(long reservationLeaseNanos) {
        return new QuotaEngine(QuotaJournal.NOOP, reservationLeaseNanos, SystemClock.instance());
    }

    public static QuotaEngine inMemory(long reservationLeaseNanos, Clock clock) {
        return new QuotaEngine(QuotaJournal.NOOP, reservationLeaseNanos, clock);
    }

    /**
     * Atomically rolls, checks and reserves.
     *
     * This method:
     * 1. Retrieves or creates the identity's entry
     * 2. Acquires the per-identity lock
     * 3. Gives back reservations whose lease has run out by the engine's clock
     * 4. Rolls the window if it has expired
     * 5. Reserves if {@code used + amount <= limit}
     * 6. Releases the lock
     *
     * @throws IllegalArgumentException if identity is null or a number is not positive
     */
    @Override
    public ReserveResult checkAndReserve(Identity identity, long amount, long limit, long windowNanos,
                                         long nowNanos) {
        validate(identity, amount, limit, windowNanos);

        while (true) {
            QuotaEntry entry = getOrCreateEntry(identity, nowNanos, windowNanos);
            entry.getLock().lock();
            try {
                if (entry.isRetired()) {
                    continue;
                }
                long leaseNow = clock.nowNanos();
                expireLeases(identity, entry, leaseNow);
                entry.window().rollIfDue(nowNanos, windowNanos);

                QuotaWindow window = entry.window();
                if (!window.tryReserve(amount, limit)) {
                    return ReserveResult.reject(window.retryAfterNanos(nowNanos, amount, limit));
                }

                ReservationToken token = new ReservationToken(
                    identity, ids.incrementAndGet(), amount, window.windowStart());
                entry.pending().put(token.id(), new QuotaEntry.Lease(token, leaseNow + reservationLeaseNanos));
                return ReserveResult.allow(token);
            } finally {
                entry.getLock().unlock();
            }
        }
    }

    /**
     * Answers as {@link #checkAndReserve} would, without changing anything.
     */
    @Override
    public ReserveResult peek(Identity identity, long amount, long limit, long windowNanos, long nowNanos) {
        validate(identity, amount, limit, windowNanos);

        QuotaEntry entry = entries.get(identity);
        if (entry == null) {
            return amount <= limit ? ReserveResult.allow(null) : ReserveResult.reject(0L);
        }

        entry.getLock().lock();
        try {
            QuotaWindow window = entry.window();
            if (entry.isRetired() || nowNanos - window.windowStart() >= windowNanos) {
                return amount <= limit ? ReserveResult.allow(null) : ReserveResult.reject(0L);
            }

            long leaseNow = clock.nowNanos();
            long expired = 0;
            for (QuotaEntry.Lease lease : entry.pending().values()) {
                if (lease.deadlineNanos() <= leaseNow && window.isCurrent(lease.token().windowStartNanos())) {
                    expired += lease.token().amount();
                }
            }
            if (window.used() - expired + amount <= limit) {
                return ReserveResult.allow(null);
            }
            if (amount > limit) {
                return ReserveResult.reject(0L);
            }
            return ReserveResult.reject(window.windowStart() + windowNanos - nowNanos);
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * Ends a reservation exactly once.
     *
     * - COMMIT: pending or held amount becomes permanent
     * - RELEASE: pending or held amount goes back to its window, if that
     *   window is still current
     * - HOLD: pending amount is kept and its lease dropped
     *
     * @return true if this call performed the transition
     * @throws tap.core.error.StorageException if the journal write fails;
     *         the reservation is then left as it was
     */
    @Override
    public boolean resolve(ReservationToken token, Resolution resolution) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (resolution == null) {
            throw new IllegalArgumentException("resolution cannot be null");
        }

        Identity identity = token.identity();
        QuotaEntry entry = entries.get(identity);
        if (entry == null) {
            log.debug("Reservation {} for {} not found, identity already reaped", token.id(), identity);
            return false;
        }

        entry.getLock().lock();
        try {
            if (entry.isRetired()) {
                return false;
            }
            QuotaWindow window = entry.window();
            boolean current = window.isCurrent(token.windowStartNanos());

            QuotaEntry.Lease lease = entry.pending().get(token.id());
            if (lease != null) {
                if (current && resolution != Resolution.RELEASE) {
                    persist(identity, window, window.settled() + token.amount());
                    window.settle(token.amount());
                }
                entry.pending().remove(token.id());
                switch (resolution) {
                    case RELEASE -> {
                        if (current) {
                            window.giveBack(token.amount());
                        }
                    }
                    case HOLD -> entry.held().put(token.id(), token);
                    case COMMIT -> { }
                }
                return true;
            }

            if (resolution != Resolution.HOLD && entry.held().containsKey(token.id())) {
                if (resolution == Resolution.RELEASE && current) {
                    persist(identity, window, Math.max(0L, window.settled() - token.amount()));
                    window.unsettle(token.amount());
                }
                entry.held().remove(token.id());
                return true;
            }

            log.debug("Reservation {} for {} already resolved or expired, ignoring {}",
                token.id(), identity, resolution);
            return false;
        } finally {
            entry.getLock().unlock();
        }
    }

    @Override
    public QuotaUsage usage(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        QuotaEntry entry = entries.get(identity);
        if (entry == null) {
            return QuotaUsage.empty(identity);
        }

        entry.getLock().lock();
        try {
            QuotaWindow window = entry.window();
            long pending = 0;
            for (QuotaEntry.Lease lease : entry.pending().values()) {
                if (window.isCurrent(lease.token().windowStartNanos())) {
                    pending += lease.token().amount();
                }
            }
            long held = 0;
            for (ReservationToken token : entry.held().values()) {
                if (window.isCurrent(token.windowStartNanos())) {
                    held += token.amount();
                }
            }
            return new QuotaUsage(identity, window.windowStart(), window.used(), pending, held);
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * Gives back overdue reservations and drops identities whose window has
     * run out and that hold nothing. Entries that are busy are skipped and
     * picked up on the next pass.
     *
     * @param nowNanos current time, used for window expiry
     * @return number of identities dropped
     */
    public int reap(long nowNanos) {
        long leaseNow = clock.nowNanos();
        AtomicInteger removed = new AtomicInteger();
        for (Identity identity : entries.keySet()) {
            entries.computeIfPresent(identity, (id, entry) -> {
                if (!entry.getLock().tryLock()) {
                    return entry;
                }
                try {
                    expireLeases(id, entry, leaseNow);
                    if (!entry.isIdle() || !entry.window().isExpired(nowNanos)) {
                        return entry;
                    }
                    journal.forget(id);
                    entry.retire();
                    removed.incrementAndGet();
                    return null;
                } finally {
                    entry.getLock().unlock();
                }
            });
        }
        if (removed.get() > 0) {
            log.debug("Reaped {} idle quota windows, {} remain", removed.get(), entries.size());
        }
        return removed.get();
    }

    /**
     * Returns the number of tracked identities.
     */
    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        journal.close();
    }

    /**
     * Retrieves or creates the entry for an identity with putIfAbsent
     * semantics, so only one lock ever exists per live identity.
     */
    private QuotaEntry getOrCreateEntry(Identity identity, long nowNanos, long windowNanos) {
        QuotaEntry entry = entries.get(identity);
        if (entry != null) {
            return entry;
        }
        QuotaEntry created = new QuotaEntry(new QuotaWindow(nowNanos, windowNanos));
        QuotaEntry existing = entries.putIfAbsent(identity, created);
        return existing != null ? existing : created;
    }

    private void expireLeases(Identity identity, QuotaEntry entry, long leaseNow) {
        Iterator<QuotaEntry.Lease> it = entry.pending().values().iterator();
        while (it.hasNext()) {
            QuotaEntry.Lease lease = it.next();
            if (lease.deadlineNanos() > leaseNow) {
                continue;
            }
            it.remove();
            if (entry.window().isCurrent(lease.token().windowStartNanos())) {
                entry.window().giveBack(lease.token().amount());
            }
            log.warn("Reservation {} for {} expired unresolved, {} returned",
                lease.token().id(), identity, lease.token().amount());
        }
    }

    private void persist(Identity identity, QuotaWindow window, long committed) {
        journal.record(identity, window.windowStart(), window.windowNanos(), committed);
    }

    private static void validate(Identity identity, long amount, long limit, long windowNanos) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (windowNanos <= 0) {
            throw new IllegalArgumentException("windowNanos must be > 0");
        }
    }
}
