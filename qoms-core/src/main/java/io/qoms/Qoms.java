package io.qoms;

import io.qoms.dead.DeadLetterEntry;
import io.qoms.dead.DeadLetterQueue;
import io.qoms.dispatch.Dispatcher;
import io.qoms.dispatch.QueueItem;
import io.qoms.dispatch.RetryPolicy;
import io.qoms.resource.AdmissionPolicy;
import io.qoms.resource.ResourceMonitor;
import io.qoms.resource.SystemResourceSampler;
import io.qoms.spi.MetricsExporter;
import io.qoms.spi.ResourceSampler;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resource-gated, priority-ordered operation queue.
 *
 * <p>Operations submitted with {@link #enqueue(Operation, Priority)} run one at a time,
 * highest tier first and FIFO within a tier, and only while the host stays below the
 * configured CPU/RAM ceilings. Failures are retried with exponential backoff; after
 * {@code maxRetries} failed attempts the operation is recorded in the dead-letter queue
 * and its future fails with {@link RetriesExhaustedException}.
 *
 * <p>When nothing is queued or running and resources allow, an operation runs inline on
 * the submitting thread. Inline failures are not retried.
 *
 * <pre>{@code
 * try (Qoms qoms = Qoms.builder()
 *         .config(QomsConfig.fromEnvironment(System.getenv()))
 *         .build()) {
 *     CompletableFuture<float[]> vector = qoms.low(() -> embedder.embed(text));
 * }
 * }</pre>
 *
 * <p>This class is thread-safe. Create instances via {@link #builder()}.
 */
public final class Qoms implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Qoms.class.getName());

    private final QomsConfig config;
    private final Clock clock;
    private final AdmissionPolicy admission;
    private final DeadLetterQueue deadLetters;
    private final Dispatcher dispatcher;
    private final AtomicLong idCounter = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Qoms(Builder builder) {
        this.config = builder.config != null ? builder.config : QomsConfig.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        ResourceSampler sampler = builder.sampler != null ? builder.sampler : new SystemResourceSampler();

        ResourceMonitor monitor = new ResourceMonitor(sampler, config.metricsCacheMs(), clock);
        // first sample only establishes the CPU tick baseline
        monitor.sample();
        this.admission = new AdmissionPolicy(
                monitor, config.maxCpuPercent(), config.maxRamPercent(), config.checkIntervalMs());
        this.deadLetters = new DeadLetterQueue(config.dlqMaxSize(), config.dlqRetentionMs(), clock);
        this.dispatcher = Dispatcher.builder()
                .config(config)
                .monitor(monitor)
                .admission(admission)
                .deadLetters(deadLetters)
                .retryPolicy(builder.retryPolicy)
                .metrics(builder.metrics != null ? builder.metrics : MetricsExporter.NOOP)
                .clock(clock)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Submits an operation at {@link Priority#MEDIUM}.
     *
     * @param operation the work to run
     * @param <T>       the result type
     * @return a future completed with the operation's result
     */
    public <T> CompletableFuture<T> enqueue(Operation<T> operation) {
        return enqueue(operation, Priority.MEDIUM);
    }

    /**
     * Submits an operation.
     *
     * <p>Never throws for queuing reasons: every failure, including submission after
     * {@link #close()}, surfaces through the returned future.
     *
     * @param operation the work to run
     * @param priority  the tier to queue it at
     * @param <T>       the result type
     * @return a future completed with the operation's result, or failed with the
     *     operation's own exception (inline run), {@link RetriesExhaustedException} or
     *     {@link QueueClearedException}
     * @throws NullPointerException if {@code operation} or {@code priority} is null
     */
    public <T> CompletableFuture<T> enqueue(Operation<T> operation, Priority priority) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(priority, "priority");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Qoms is closed"));
        }
        String id = nextId();
        if (dispatcher.tryReserveInline(priority)) {
            return runInline(id, operation);
        }
        QueueItem<T> item = new QueueItem<>(id, priority, operation, clock.millis());
        if (!dispatcher.submit(item)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Qoms is closed"));
        }
        return item.future();
    }

    private <T> CompletableFuture<T> runInline(String id, Operation<T> operation) {
        boolean succeeded = false;
        try {
            T result = operation.execute();
            succeeded = true;
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Ran " + id + " inline");
            }
            return CompletableFuture.completedFuture(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(e);
        } catch (Exception e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Inline operation " + id + " failed", e);
            }
            return CompletableFuture.failedFuture(e);
        } finally {
            dispatcher.finishInline(succeeded);
        }
    }

    private String nextId() {
        return "qoms_" + idCounter.incrementAndGet() + "_" + clock.millis();
    }

    public <T> CompletableFuture<T> critical(Operation<T> operation) {
        return enqueue(operation, Priority.CRITICAL);
    }

    public <T> CompletableFuture<T> high(Operation<T> operation) {
        return enqueue(operation, Priority.HIGH);
    }

    public <T> CompletableFuture<T> medium(Operation<T> operation) {
        return enqueue(operation, Priority.MEDIUM);
    }

    public <T> CompletableFuture<T> low(Operation<T> operation) {
        return enqueue(operation, Priority.LOW);
    }

    public <T> CompletableFuture<T> idle(Operation<T> operation) {
        return enqueue(operation, Priority.IDLE);
    }

    /**
     * Whether work of {@code priority} would be admitted right now.
     *
     * @param priority the tier to check
     * @return the admission decision
     */
    public boolean canExecute(Priority priority) {
        return admission.canExecute(priority);
    }

    /**
     * Returns queue lengths, counters, the latest resource snapshot and the active
     * configuration.
     *
     * @return the current statistics
     */
    public QueueStats getStats() {
        return dispatcher.stats();
    }

    /**
     * Rejects every pending operation with {@link QueueClearedException}. Running
     * operations are not affected.
     *
     * @return the number of rejected operations
     */
    public int clearQueue() {
        return dispatcher.clearQueue();
    }

    /**
     * Returns the dead-letter entries still within the retention window, oldest first.
     *
     * @return the dead letters
     */
    public List<DeadLetterEntry> getDeadLetters() {
        return deadLetters.entries();
    }

    /**
     * Removes every dead-letter entry.
     *
     * @return the number of entries removed
     */
    public int clearDeadLetters() {
        int count = deadLetters.clear();
        if (count > 0) {
            logger.info("Dead-letter queue cleared: " + count + " entries");
        }
        return count;
    }

    /**
     * Removes a single dead-letter entry, typically after the caller resubmitted the
     * operation itself.
     *
     * @param id the item id reported by {@link RetriesExhaustedException#itemId()}
     * @return {@code true} if the entry was present
     */
    public boolean removeDeadLetter(String id) {
        return deadLetters.remove(id);
    }

    public QomsConfig config() {
        return config;
    }

    /**
     * Stops accepting operations, rejects pending ones with {@link QueueClearedException}
     * and shuts the dispatcher down within the configured drain timeout.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        dispatcher.close();
    }

    /** Builder for {@link Qoms}. */
    public static final class Builder {
        private QomsConfig config;
        private ResourceSampler sampler;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {}

        /**
         * Sets the configuration. Optional. Defaults to {@link QomsConfig#defaults()}.
         *
         * @param config the configuration
         * @return this builder
         */
        public Builder config(QomsConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the resource sampler. Optional. Defaults to {@link SystemResourceSampler}.
         *
         * @param sampler the sampler
         * @return this builder
         */
        public Builder sampler(ResourceSampler sampler) {
            this.sampler = sampler;
            return this;
        }

        /**
         * Sets the retry policy. Optional. Defaults to exponential backoff between the
         * configured base and maximum delay.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the metrics exporter. Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock for timestamps. Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Qoms build() {
            return new Qoms(this);
        }
    }
}
