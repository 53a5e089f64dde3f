package tap.java.engine;

import org.junit.jupiter.api.Test;
import tap.core.model.Identity;
import tap.core.quota.ReserveResult;
import tap.core.quota.Resolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for QuotaEngine.
 *
 * Focus:
 * - No overshoot of the limit under contention on one identity
 * - Independent identities do not interfere
 * - Racing resolutions of the same token apply once
 */
class QuotaEngineConcurrencyTest {

    private static final long WINDOW = 60_000_000_000L;
    private static final long LEASE = 10_000_000_000L;

    @Test
    void testConcurrent_twoRequestsOverLimitExactlyOneAdmitted() throws InterruptedException {
        QuotaEngine engine = QuotaEngine.inMemory(LEASE);
        Identity b = Identity.receiver("0xb");

        int numThreads = 2;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger allowCount = new AtomicInteger(0);
        AtomicInteger rejectCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ReserveResult r = engine.checkAndReserve(b, 3, 5, WINDOW, 0);
                    if (r.allowed()) {
                        allowCount.incrementAndGet();
                    } else {
                        rejectCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        assertEquals(1, allowCount.get());
        assertEquals(1, rejectCount.get());
        assertEquals(3, engine.usage(b).used());
    }

    @Test
    void testConcurrent_randomAmountsNeverOvershoot() throws InterruptedException {
        QuotaEngine engine = QuotaEngine.inMemory(LEASE);
        Identity id = Identity.sourceIp("10.0.0.1");
        long limit = 1_000;

        int numThreads = 16;
        int requestsPerThread = 200;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicLong committed = new AtomicLong();
        AtomicLong maxSeen = new AtomicLong();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int t = 0; t < numThreads; t++) {
            long seed = t;
            executor.submit(() -> {
                Random random = new Random(seed);
                try {
                    startLatch.await();
                    for (int i = 0; i < requestsPerThread; i++) {
                        long amount = 1 + random.nextInt(40);
                        ReserveResult r = engine.checkAndReserve(id, amount, limit, WINDOW, 0);
                        if (!r.allowed()) {
                            continue;
                        }
                        maxSeen.accumulateAndGet(engine.usage(id).used(), Math::max);
                        // Roughly a third of the funding attempts fail
                        if (random.nextInt(3) == 0) {
                            engine.resolve(r.token(), Resolution.RELEASE);
                        } else {
                            engine.resolve(r.token(), Resolution.COMMIT);
                            committed.addAndGet(amount);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        assertTrue(maxSeen.get() <= limit, "Usage overshot the limit: " + maxSeen.get());
        assertTrue(committed.get() <= limit, "Committed overshot the limit: " + committed.get());
        assertEquals(committed.get(), engine.usage(id).committed());
        assertEquals(0, engine.usage(id).pending());
    }

    @Test
    void testConcurrent_multipleIdentitiesDoNotInterfere() throws InterruptedException {
        QuotaEngine engine = QuotaEngine.inMemory(LEASE);
        int identities = 50;

        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < identities; i++) {
            Identity id = Identity.receiver("0x" + i);
            futures.add(executor.submit(() -> {
                int allowed = 0;
                for (int j = 0; j < 10; j++) {
                    if (engine.checkAndReserve(id, 1, 5, WINDOW, 0).allowed()) {
                        allowed++;
                    }
                }
                return allowed;
            }));
        }

        for (Future<Integer> f : futures) {
            try {
                assertEquals(5, f.get(5, TimeUnit.SECONDS));
            } catch (ExecutionException | TimeoutException e) {
                fail("Worker failed: " + e);
            }
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(identities, engine.size());
    }

    @Test
    void testConcurrent_racingResolutionsApplyOnce() throws InterruptedException {
        QuotaEngine engine = QuotaEngine.inMemory(LEASE);
        Identity id = Identity.receiver("0xrace");
        ReserveResult r = engine.checkAndReserve(id, 4, 10, WINDOW, 0);

        int numThreads = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger applied = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            Resolution resolution = i % 2 == 0 ? Resolution.COMMIT : Resolution.RELEASE;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (engine.resolve(r.token(), resolution)) {
                        applied.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, applied.get());
        long used = engine.usage(id).used();
        assertTrue(used == 0 || used == 4, "Usage must reflect exactly one resolution: " + used);
    }

    @Test
    void testConcurrent_reapRacingReservationsLosesNothing() throws InterruptedException {
        QuotaEngine engine = QuotaEngine.inMemory(LEASE);
        Identity id = Identity.receiver("0xreap");
        long now = WINDOW * 2;
        // An expired window the reaper wants to drop
        engine.checkAndReserve(id, 1, 100, WINDOW, 0);

        int numThreads = 4;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads + 1);
        AtomicInteger allowed = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads + 1);
        executor.submit(() -> {
            try {
                startLatch.await();
                for (int i = 0; i < 100; i++) {
                    engine.reap(now);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                doneLatch.countDown();
            }
        });
        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < 25; i++) {
                        ReserveResult r = engine.checkAndReserve(id, 1, 100, WINDOW, now);
                        if (r.allowed()) {
                            allowed.incrementAndGet();
                            engine.resolve(r.token(), Resolution.COMMIT);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(100, allowed.get());
        assertEquals(100, engine.usage(id).committed(),
            "Commits in the live window must not be lost to the reaper");
    }
}
