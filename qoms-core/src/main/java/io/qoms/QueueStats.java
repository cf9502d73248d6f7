package io.qoms;

import io.qoms.model.ResourceSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time statistics of a {@link Qoms} instance.
 *
 * @param queueLengths    pending items per tier
 * @param totalQueued     pending items across all tiers
 * @param processing      operations currently executing, fast path included
 * @param pendingRetries  pending items that already failed at least once
 * @param totalRetries    failed attempts since startup
 * @param totalProcessed  operations completed successfully since startup
 * @param dlqSize         entries in the dead-letter queue
 * @param dispatcherRunning whether the dispatch loop is active
 * @param avgWaitTimeMs   average enqueue-to-completion time of queued operations
 * @param resources       latest resource snapshot
 * @param config          active configuration
 */
public record QueueStats(
        Map<Priority, Integer> queueLengths,
        int totalQueued,
        int processing,
        int pendingRetries,
        long totalRetries,
        long totalProcessed,
        int dlqSize,
        boolean dispatcherRunning,
        double avgWaitTimeMs,
        ResourceSnapshot resources,
        QomsConfig config) {

    public QueueStats {
        queueLengths = Collections.unmodifiableMap(new EnumMap<>(queueLengths));
    }
}
