package io.qoms.spi;

import io.qoms.Priority;

/**
 * Observability hook for exporting scheduler counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of operations appended to a lane.
     *
     * @param priority the tier the operation was submitted with
     */
    void incrementEnqueued(Priority priority);

    /**
     * Increments the count of operations run inline because the scheduler was idle.
     */
    void incrementFastPath();

    /**
     * Increments the count of queued operations that completed successfully.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of failed attempts that were scheduled for retry.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of operations moved to the dead-letter queue.
     */
    void incrementDispatchDead();

    /**
     * Adds to the count of pending operations rejected by a queue clear.
     *
     * @param count number of rejected operations
     */
    default void incrementCleared(int count) {
    }

    /**
     * Increments the count of aging promotions.
     */
    default void incrementPromoted() {
    }

    /**
     * Records the number of pending operations and the number in flight.
     *
     * @param queued   pending operations across all lanes
     * @param inFlight operations currently executing
     */
    void recordDepths(int queued, int inFlight);

    /**
     * Records the time from first enqueue to completion of an acknowledged operation.
     *
     * @param waitMs wait in milliseconds (always non-negative)
     */
    default void recordWaitMs(long waitMs) {
    }

    /**
     * Records how long one execution attempt took.
     *
     * @param durationMs execution time in milliseconds (always non-negative)
     */
    default void recordExecutionMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued(Priority priority) {
        }

        @Override
        public void incrementFastPath() {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchDead() {
        }

        @Override
        public void recordDepths(int queued, int inFlight) {
        }
    }
}
