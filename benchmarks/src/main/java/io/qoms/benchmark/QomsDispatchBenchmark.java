package io.qoms.benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import io.qoms.Priority;
import io.qoms.Qoms;
import io.qoms.QomsConfig;
import io.qoms.spi.ResourceSampler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Measures scheduling overhead for trivial operations: the inline fast path, and a batch
 * that queues behind saturated resources and is drained once they free up.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar QomsDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
@Threads(1)
public class QomsDispatchBenchmark {

    private static final Priority[] TIERS = {Priority.HIGH, Priority.MEDIUM, Priority.LOW};

    private final SwitchableSampler sampler = new SwitchableSampler();
    private Qoms qoms;

    @Param({"10", "100"})
    private int batchSize;

    @Setup(Level.Trial)
    public void setup() {
        qoms = Qoms.builder()
                .config(QomsConfig.builder()
                        .checkIntervalMs(1)
                        .metricsCacheMs(0)
                        .interItemDelayMs(0)
                        .queueHighWaterMark(Integer.MAX_VALUE)
                        .build())
                .sampler(sampler)
                .build();
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        qoms.close();
    }

    @Benchmark
    public Integer fastPath() throws Exception {
        return qoms.medium(() -> 42).get(5, TimeUnit.SECONDS);
    }

    @Benchmark
    public void queuedBatch() throws Exception {
        sampler.saturated = true;
        CompletableFuture<?>[] futures = new CompletableFuture<?>[batchSize];
        for (int i = 0; i < batchSize; i++) {
            int value = i;
            futures[i] = qoms.enqueue(() -> value, TIERS[i % TIERS.length]);
        }
        sampler.saturated = false;
        CompletableFuture.allOf(futures).get(30, TimeUnit.SECONDS);
    }

    /** Reports an idle host, or a host with full memory while {@code saturated}. */
    static final class SwitchableSampler implements ResourceSampler {
        private static final long TOTAL = 1L << 30;

        volatile boolean saturated;
        private long ticks;

        @Override
        public synchronized Reading read() {
            ticks += 100;
            long free = saturated ? 0L : TOTAL;
            return new Reading(0L, ticks, TOTAL, free, 0.0);
        }
    }
}
