package io.qoms.spi;

/**
 * Source of raw host resource readings.
 *
 * <p>The scheduler turns consecutive readings into a {@link io.qoms.model.ResourceSnapshot}:
 * CPU utilization is derived from the tick delta between two readings, so implementations
 * report cumulative counters rather than a percentage.
 *
 * @see io.qoms.resource.SystemResourceSampler
 */
public interface ResourceSampler {

    /**
     * Takes a reading.
     *
     * @return the current counters
     * @throws Exception if the platform cannot be sampled; the scheduler then admits work
     *     as if the host were idle
     */
    Reading read() throws Exception;

    /**
     * Raw counters of one reading.
     *
     * @param cpuBusyTicks     cumulative non-idle CPU ticks across all cores
     * @param cpuTotalTicks    cumulative CPU ticks across all cores
     * @param totalMemoryBytes total physical memory
     * @param freeMemoryBytes  memory available to new work
     * @param loadAvg1m        one-minute load average, {@code 0} if unknown
     */
    record Reading(
            long cpuBusyTicks,
            long cpuTotalTicks,
            long totalMemoryBytes,
            long freeMemoryBytes,
            double loadAvg1m) {
    }
}
