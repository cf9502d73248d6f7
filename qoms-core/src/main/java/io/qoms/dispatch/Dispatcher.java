package io.qoms.dispatch;

import io.qoms.Priority;
import io.qoms.QomsConfig;
import io.qoms.QueueClearedException;
import io.qoms.QueueStats;
import io.qoms.RetriesExhaustedException;
import io.qoms.dead.DeadLetterEntry;
import io.qoms.dead.DeadLetterQueue;
import io.qoms.model.ItemStatus;
import io.qoms.resource.AdmissionPolicy;
import io.qoms.resource.ResourceMonitor;
import io.qoms.spi.MetricsExporter;
import io.qoms.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-loop dispatcher that drains the {@link PriorityLanes} under resource admission
 * and applies the ACK/NACK protocol to each outcome.
 *
 * <p>At most one loop runs at a time, guarded by an {@link AtomicBoolean}. The loop sweeps
 * expired leases, ages and selects the next item, and waits for its admission one check
 * interval at a time, re-selecting in between so that a higher tier arriving meanwhile
 * goes first. An item refused admission for {@code maxWaitMs} is NACKed with a
 * {@link ResourceTimeoutException}. An admitted item runs as a separate task on the
 * operation executor, awaited for at most the lease. An attempt that outlives its lease is interrupted and NACKed with a
 * {@link LeaseTimeoutException}. Operations therefore execute one at a time.
 *
 * <p>The loop stops when no item is ready. If only retry-delayed items remain, a wake-up is
 * scheduled at the earliest retry time; a submission re-arms the loop immediately.
 *
 * <p>All lane, in-flight and counter state is guarded by a single lock. Callers' futures
 * are completed outside that lock. Create instances via {@link #builder()}.
 */
public final class Dispatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final Object lock = new Object();
    private final PriorityLanes lanes = new PriorityLanes();

    private final QomsConfig config;
    private final AdmissionPolicy admission;
    private final ResourceMonitor monitor;
    private final InFlightTracker inFlight;
    private final RetryPolicy retryPolicy;
    private final DeadLetterQueue deadLetters;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final ScheduledExecutorService loopExecutor;
    private final ExecutorService operationExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    // guarded by lock
    private ScheduledFuture<?> wakeup;
    private long wakeupAt;
    private int inlineRuns;
    private long totalRetries;
    private long totalProcessed;
    private long totalQueuedProcessed;
    private long totalWaitTimeMs;

    private Dispatcher(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.monitor = Objects.requireNonNull(builder.monitor, "monitor");
        this.admission = Objects.requireNonNull(builder.admission, "admission");
        this.deadLetters = Objects.requireNonNull(builder.deadLetters, "deadLetters");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.inFlight = builder.inFlightTracker != null
                ? builder.inFlightTracker : new DefaultInFlightTracker();
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy
                : new ExponentialBackoffRetryPolicy(config.baseRetryDelayMs(), config.maxRetryDelayMs());
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.loopExecutor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("qoms-dispatcher-"));
        this.operationExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("qoms-operation-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reserves the fast path for an inline execution on the caller's thread.
     *
     * <p>Succeeds only while every lane and the in-flight set are empty, no other inline
     * run holds the reservation, and {@code priority} is admitted right now. The check and
     * the reservation are atomic, so a concurrent submission cannot slip past it. A
     * successful reservation must be released with {@link #finishInline(boolean)}.
     *
     * @param priority the tier of the operation
     * @return {@code true} if the caller may run the operation inline
     */
    public boolean tryReserveInline(Priority priority) {
        synchronized (lock) {
            if (!accepting.get() || inlineRuns > 0 || !lanes.isEmpty() || inFlight.size() > 0) {
                return false;
            }
            if (!admission.canExecute(priority)) {
                return false;
            }
            inlineRuns++;
            return true;
        }
    }

    /**
     * Releases a fast-path reservation and wakes the loop for anything queued meanwhile.
     *
     * @param succeeded whether the inline operation completed normally
     */
    public void finishInline(boolean succeeded) {
        synchronized (lock) {
            inlineRuns--;
            if (succeeded) {
                totalProcessed++;
            }
        }
        if (succeeded) {
            metrics.incrementFastPath();
        }
        rearm();
    }

    /**
     * Appends an item to its lane and makes sure the loop is running.
     *
     * @param item a new pending item
     * @return {@code false} if the dispatcher is closed; the item is then left untouched
     */
    public boolean submit(QueueItem<?> item) {
        int queued;
        int processing;
        synchronized (lock) {
            if (!accepting.get()) {
                return false;
            }
            lanes.add(item);
            queued = lanes.pendingCount();
            processing = inFlight.size() + inlineRuns;
        }
        metrics.incrementEnqueued(item.originalPriority());
        metrics.recordDepths(queued, processing);
        if (queued > config.queueHighWaterMark()) {
            logger.warning("Queue high water mark exceeded: " + queued + " > " + config.queueHighWaterMark());
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Enqueued " + item.id() + " at " + item.priority() + " (queued=" + queued + ")");
        }
        ensureRunning();
        return true;
    }

    private void ensureRunning() {
        if (!accepting.get() || !running.compareAndSet(false, true)) {
            return;
        }
        try {
            loopExecutor.execute(this::drainLoop);
        } catch (RejectedExecutionException e) {
            running.set(false);
        }
    }

    private void drainLoop() {
        QueueItem<?> blocked = null;
        long blockedSinceNanos = 0L;
        try {
            while (accepting.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    QueueItem<?> item = selectNext();
                    if (item == null) {
                        break;
                    }
                    if (item != blocked) {
                        blocked = item;
                        blockedSinceNanos = System.nanoTime();
                    }
                    if (!admission.canExecute(item.priority())) {
                        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - blockedSinceNanos);
                        long remainingMs = config.maxWaitMs() - waitedMs;
                        if (remainingMs <= 0) {
                            blocked = null;
                            rejectAdmission(item);
                        } else {
                            admission.waitForResources(item.priority(), Math.min(config.checkIntervalMs(), remainingMs));
                        }
                        // re-select: a higher tier may have arrived while this one waited
                        continue;
                    }
                    blocked = null;
                    dispatch(item);
                    if (config.interItemDelayMs() > 0) {
                        Thread.sleep(config.interItemDelayMs());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Throwable t) {
                    logger.log(Level.SEVERE, "Dispatcher loop error", t);
                }
            }
        } finally {
            running.set(false);
        }
        rearm();
    }

    private QueueItem<?> selectNext() {
        List<Reclaimed> reclaimed = new ArrayList<>();
        QueueItem<?> next;
        int promoted;
        synchronized (lock) {
            long now = clock.millis();
            for (QueueItem<?> expired : inFlight.expired(now)) {
                logger.warning("Lease expired for " + expired.id() + "; reclaiming");
                LeaseTimeoutException error = new LeaseTimeoutException(expired.id(), config.leaseTimeoutMs());
                reclaimed.add(new Reclaimed(expired, error, nack(expired, error)));
            }
            long promotedBefore = lanes.promotions();
            next = lanes.nextItem(now, config.agePromotionMs());
            promoted = (int) (lanes.promotions() - promotedBefore);
        }
        for (int i = 0; i < promoted; i++) {
            metrics.incrementPromoted();
        }
        for (Reclaimed r : reclaimed) {
            settleNack(r.item(), r.error(), r.outcome());
        }
        return next;
    }

    private void rearm() {
        boolean ready;
        synchronized (lock) {
            if (!accepting.get()) {
                return;
            }
            long now = clock.millis();
            ready = lanes.hasReady(now);
            if (!ready) {
                long earliest = lanes.earliestRetryAt();
                if (earliest != 0) {
                    scheduleWakeup(earliest, now);
                }
            }
        }
        if (ready) {
            ensureRunning();
        }
    }

    // requires lock
    private void scheduleWakeup(long at, long now) {
        if (wakeup != null && !wakeup.isDone() && wakeupAt <= at) {
            return;
        }
        if (wakeup != null) {
            wakeup.cancel(false);
        }
        long delay = Math.max(0L, at - now);
        try {
            wakeup = loopExecutor.schedule(this::ensureRunning, delay, TimeUnit.MILLISECONDS);
            wakeupAt = at;
        } catch (RejectedExecutionException e) {
            wakeup = null;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Retry wake-up scheduled in " + delay + "ms");
        }
    }

    private void rejectAdmission(QueueItem<?> item) {
        ResourceTimeoutException error = new ResourceTimeoutException(config.maxWaitMs());
        NackOutcome outcome;
        synchronized (lock) {
            if (!isStillQueued(item)) {
                return;
            }
            outcome = nack(item, error);
        }
        logger.warning("Resource timeout for " + item.id() + " after " + config.maxWaitMs() + "ms");
        settleNack(item, error, outcome);
    }

    private <T> void dispatch(QueueItem<T> item) throws InterruptedException {
        synchronized (lock) {
            if (!isStillQueued(item)) {
                return;
            }
            long now = clock.millis();
            item.markProcessing(now, now + config.leaseTimeoutMs());
            inFlight.tryAcquire(item);
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Dispatching " + item.id() + " priority=" + item.priority()
                    + " retryCount=" + item.retryCount()
                    + " queuedForMs=" + (item.startedAt() - item.enqueuedAt()));
        }
        runAttempt(item);
    }

    // requires lock; false once the item was cleared while waiting for admission
    private boolean isStillQueued(QueueItem<?> item) {
        return item.status() == ItemStatus.PENDING && lanes.contains(item);
    }

    private <T> void runAttempt(QueueItem<T> item) throws InterruptedException {
        long startNanos = System.nanoTime();
        Future<T> task;
        try {
            task = operationExecutor.submit(() -> item.operation().execute());
        } catch (RejectedExecutionException e) {
            failInFlight(item, new QueueClearedException("Scheduler closed"));
            return;
        }

        T result = null;
        Throwable failure = null;
        try {
            result = task.get(config.leaseTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            failure = new LeaseTimeoutException(item.id(), config.leaseTimeoutMs());
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            failure = e;
        } catch (InterruptedException e) {
            task.cancel(true);
            failInFlight(item, new QueueClearedException("Scheduler closed while operation " + item.id() + " was running"));
            throw e;
        }
        metrics.recordExecutionMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));

        if (failure == null) {
            ack(item, result);
            return;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Operation " + item.id() + " failed", failure);
        }
        NackOutcome outcome;
        synchronized (lock) {
            outcome = nack(item, failure);
        }
        settleNack(item, failure, outcome);
    }

    /**
     * Acknowledges a successful attempt: removes the item from the in-flight set and its
     * lane and completes the caller's future with {@code result}.
     *
     * @param item   the item that ran
     * @param result the operation's result
     * @param <T>    the result type
     * @return {@code false} if the item was no longer in flight (its lease was reclaimed)
     */
    <T> boolean ack(QueueItem<T> item, T result) {
        long waitMs;
        int queued;
        int processing;
        synchronized (lock) {
            if (!inFlight.release(item.id())) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("ACK ignored for " + item.id() + ": not in flight");
                }
                return false;
            }
            lanes.remove(item);
            item.markCompleted();
            waitMs = Math.max(0L, clock.millis() - item.enqueuedAt());
            totalProcessed++;
            totalQueuedProcessed++;
            totalWaitTimeMs += waitMs;
            queued = lanes.pendingCount();
            processing = inFlight.size() + inlineRuns;
        }
        metrics.incrementDispatchSuccess();
        metrics.recordWaitMs(waitMs);
        metrics.recordDepths(queued, processing);
        item.future().complete(result);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("ACK " + item.id() + " after " + waitMs + "ms");
        }
        return true;
    }

    /**
     * Negatively acknowledges an attempt. Increments the retry count and either schedules a
     * backoff or, once {@code maxRetries} is reached, moves the item to the dead-letter
     * queue. After close the item is dropped and reported as {@link NackOutcome#CLOSED}.
     * Requires the lock; the caller completes the future via
     * {@link #settleNack(QueueItem, Throwable, NackOutcome)} after releasing it.
     */
    private NackOutcome nack(QueueItem<?> item, Throwable error) {
        inFlight.release(item.id());
        if (item.status() == ItemStatus.COMPLETED || item.status() == ItemStatus.DLQ) {
            return NackOutcome.NOT_FOUND;
        }
        long now = clock.millis();
        item.recordFailure(error);
        totalRetries++;

        if (item.retryCount() >= config.maxRetries()) {
            item.markDead();
            lanes.remove(item);
            deadLetters.add(new DeadLetterEntry(
                    item.id(),
                    item.originalPriority(),
                    item.enqueuedAt(),
                    now,
                    item.retryCount(),
                    item.lastError()));
            return NackOutcome.DEAD;
        }

        if (!accepting.get()) {
            // no loop will pick a retry up after close
            lanes.remove(item);
            return NackOutcome.CLOSED;
        }

        long delayMs = retryPolicy.computeDelayMs(item.retryCount());
        item.scheduleRetry(now + delayMs);
        if (!lanes.contains(item)) {
            // slot dropped by a clear while the attempt was running
            lanes.add(item);
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("NACK " + item.id() + " retryCount=" + item.retryCount()
                    + " retryInMs=" + delayMs + " error=" + item.lastError());
        }
        return NackOutcome.RETRY;
    }

    private void settleNack(QueueItem<?> item, Throwable error, NackOutcome outcome) {
        switch (outcome) {
            case RETRY -> metrics.incrementDispatchFailure();
            case DEAD -> {
                metrics.incrementDispatchDead();
                logger.log(Level.WARNING, "Operation " + item.id() + " moved to dead-letter queue after "
                        + item.retryCount() + " failed attempts", error);
                item.future().completeExceptionally(
                        new RetriesExhaustedException(item.id(), item.retryCount(), error));
            }
            case CLOSED -> {
                metrics.incrementDispatchFailure();
                QueueClearedException closed = new QueueClearedException("Scheduler closed");
                closed.addSuppressed(error);
                item.future().completeExceptionally(closed);
            }
            case NOT_FOUND -> {
            }
        }
    }

    private void failInFlight(QueueItem<?> item, RuntimeException error) {
        synchronized (lock) {
            inFlight.release(item.id());
            lanes.remove(item);
        }
        item.future().completeExceptionally(error);
    }

    /**
     * Rejects every pending item with a {@link QueueClearedException} and removes it from
     * its lane. Items in flight are not affected.
     *
     * @return the number of rejected items
     */
    public int clearQueue() {
        return rejectPending("Queue cleared");
    }

    private int rejectPending(String reason) {
        List<QueueItem<?>> drained;
        synchronized (lock) {
            drained = lanes.drainPending();
            if (wakeup != null) {
                wakeup.cancel(false);
                wakeup = null;
            }
        }
        for (QueueItem<?> item : drained) {
            item.future().completeExceptionally(new QueueClearedException(reason));
        }
        if (!drained.isEmpty()) {
            metrics.incrementCleared(drained.size());
            logger.info(reason + ": rejected " + drained.size() + " pending operations");
        }
        return drained.size();
    }

    /**
     * Returns a consistent snapshot of queue statistics.
     *
     * @return the current statistics
     */
    public QueueStats stats() {
        synchronized (lock) {
            Map<Priority, Integer> lengths = new EnumMap<>(Priority.class);
            for (Priority priority : Priority.values()) {
                lengths.put(priority, lanes.pendingCount(priority));
            }
            return new QueueStats(
                    lengths,
                    lanes.pendingCount(),
                    inFlight.size() + inlineRuns,
                    lanes.awaitingRetryCount(),
                    totalRetries,
                    totalProcessed,
                    deadLetters.size(),
                    running.get(),
                    totalQueuedProcessed > 0 ? (double) totalWaitTimeMs / totalQueuedProcessed : 0.0,
                    monitor.latest(),
                    config);
        }
    }

    /**
     * Stops accepting work, rejects pending items, and waits up to the drain timeout for the
     * running operation before interrupting it.
     */
    @Override
    public void close() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        rejectPending("Scheduler closed");
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(config.drainTimeoutMs(), TimeUnit.MILLISECONDS)) {
                logger.warning("Drain timeout exceeded; interrupting " + inFlight.size() + " running operation(s)");
                loopExecutor.shutdownNow();
                loopExecutor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            operationExecutor.shutdownNow();
        }
    }

    private record Reclaimed(QueueItem<?> item, Throwable error, NackOutcome outcome) {
    }

    /** Builder for {@link Dispatcher}. */
    public static final class Builder {
        private QomsConfig config;
        private ResourceMonitor monitor;
        private AdmissionPolicy admission;
        private DeadLetterQueue deadLetters;
        private InFlightTracker inFlightTracker;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {}

        /**
         * Sets the configuration. <b>Required.</b>
         *
         * @param config the scheduler configuration
         * @return this builder
         */
        public Builder config(QomsConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the resource monitor whose latest snapshot is reported in stats.
         * <b>Required.</b>
         *
         * @param monitor the monitor
         * @return this builder
         */
        public Builder monitor(ResourceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        /**
         * Sets the admission policy gating each dispatch. <b>Required.</b>
         *
         * @param admission the admission policy
         * @return this builder
         */
        public Builder admission(AdmissionPolicy admission) {
            this.admission = admission;
            return this;
        }

        /**
         * Sets the dead-letter queue receiving exhausted items. <b>Required.</b>
         *
         * @param deadLetters the dead-letter queue
         * @return this builder
         */
        public Builder deadLetters(DeadLetterQueue deadLetters) {
            this.deadLetters = deadLetters;
            return this;
        }

        /**
         * Sets a custom in-flight tracker. Optional. Defaults to {@link DefaultInFlightTracker}.
         *
         * @param inFlightTracker the tracker implementation
         * @return this builder
         */
        public Builder inFlightTracker(InFlightTracker inFlightTracker) {
            this.inFlightTracker = inFlightTracker;
            return this;
        }

        /**
         * Sets the retry policy. Optional. Defaults to {@link ExponentialBackoffRetryPolicy}
         * with the configured base and maximum delay.
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
         * Sets the clock used for enqueue, lease, retry and aging timestamps.
         * Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the dispatcher. The loop thread is started lazily on the first submission.
         *
         * @return a new {@link Dispatcher}
         * @throws NullPointerException if {@code config}, {@code monitor}, {@code admission}
         *     or {@code deadLetters} is null
         */
        public Dispatcher build() {
            return new Dispatcher(this);
        }
    }
}
