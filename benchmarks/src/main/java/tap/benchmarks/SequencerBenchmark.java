package tap.benchmarks;

import org.openjdk.jmh.annotations.*;
import tap.core.clock.SystemClock;
import tap.java.funder.LocalChainClient;
import tap.java.funder.Sequencer;
import tap.java.funder.Submission;
import tap.java.funder.Transaction;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the sequencer's serialized submit path against the
 * in-process chain.
 *
 * - submit: one thread
 * - contended: 8 threads sharing the funding account
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class SequencerBenchmark {

    private static final String FAUCET = "0xfaucet";

    private Sequencer sequencer;

    @Setup(Level.Iteration)
    public void setup() {
        LocalChainClient chain = new LocalChainClient(SystemClock.instance());
        chain.fund(FAUCET, Long.MAX_VALUE / 2);
        sequencer = new Sequencer(chain, FAUCET);
        sequencer.initialize();
    }

    private static Transaction transfer(long seq) {
        return new Transaction(FAUCET, seq, "0xreceiver", 1, Long.MAX_VALUE / 1_000_000_000L);
    }

    @Benchmark
    public Submission submit() {
        return sequencer.submit(SequencerBenchmark::transfer);
    }

    @Benchmark
    @Threads(8)
    public Submission contended() {
        return sequencer.submit(SequencerBenchmark::transfer);
    }
}
