package io.qoms.model;

/**
 * Point-in-time view of host resource utilization.
 *
 * @param cpuPercent  CPU busy share since the previous sample, {@code 0..100}
 * @param ramPercent  used memory share, {@code 0..100}
 * @param freeRamMb   free memory in megabytes
 * @param totalRamMb  total memory in megabytes
 * @param loadAvg1m   one-minute load average, {@code 0} where the platform has none
 * @param sampledAtMs epoch millis at which the snapshot was taken
 */
public record ResourceSnapshot(
        int cpuPercent,
        int ramPercent,
        long freeRamMb,
        long totalRamMb,
        double loadAvg1m,
        long sampledAtMs) {

    /**
     * Snapshot used when sampling is unavailable; admits every tier.
     *
     * @param sampledAtMs epoch millis of the failed sample
     * @return an all-zero snapshot
     */
    public static ResourceSnapshot unavailable(long sampledAtMs) {
        return new ResourceSnapshot(0, 0, 0L, 0L, 0.0, sampledAtMs);
    }
}
