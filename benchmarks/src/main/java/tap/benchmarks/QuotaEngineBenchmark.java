package tap.benchmarks;

import org.openjdk.jmh.annotations.*;
import tap.core.clock.SystemClock;
import tap.core.model.Identity;
import tap.core.quota.ReserveResult;
import tap.core.quota.Resolution;
import tap.java.engine.QuotaEngine;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for QuotaEngine (reserve, then commit) without a journal.
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - singleIdentity: every reservation on the same identity
 * - multiIdentity: rotating through 1000 identities (low contention)
 * - parallel: 8 threads with high contention on one identity
 * - peek: dry-run check on a populated identity
 *
 * Run:
 *   mvn -pl benchmarks -am package -DskipTests
 *   mvn -pl benchmarks exec:java -Dexec.mainClass=org.openjdk.jmh.Main -Dexec.args=QuotaEngine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class QuotaEngineBenchmark {

    private static final long LIMIT = Long.MAX_VALUE / 4;
    private static final long WINDOW = TimeUnit.HOURS.toNanos(1);

    private final SystemClock clock = SystemClock.instance();
    private final Identity hot = Identity.receiver("0xhot");
    private QuotaEngine engine;
    private Identity[] identities;

    @Setup
    public void setup() {
        engine = QuotaEngine.inMemory(TimeUnit.MINUTES.toNanos(5));
        identities = new Identity[1000];
        for (int i = 0; i < identities.length; i++) {
            identities[i] = Identity.receiver("0x" + i);
        }
    }

    private boolean reserveAndCommit(Identity identity) {
        ReserveResult r = engine.checkAndReserve(identity, 1, LIMIT, WINDOW, clock.nowNanos());
        return r.allowed() && engine.resolve(r.token(), Resolution.COMMIT);
    }

    /**
     * Single identity throughput.
     */
    @Benchmark
    public boolean singleIdentity() {
        return reserveAndCommit(hot);
    }

    /**
     * Multi-identity throughput (rotating through 1000 identities, low contention).
     */
    @Benchmark
    public boolean multiIdentity() {
        return reserveAndCommit(identities[ThreadLocalRandom.current().nextInt(identities.length)]);
    }

    /**
     * Parallel throughput with 8 threads on one identity (high contention).
     */
    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return reserveAndCommit(hot);
    }

    @Benchmark
    public boolean peek() {
        return engine.peek(hot, 1, LIMIT, WINDOW, clock.nowNanos()).allowed();
    }
}
