package io.qoms.resource;

import io.qoms.model.ResourceSnapshot;
import io.qoms.spi.ResourceSampler;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns raw {@link ResourceSampler} readings into cached {@link ResourceSnapshot}s.
 *
 * <p>CPU utilization is the busy share of the tick delta against the previous reading.
 * The very first sample, or one whose baseline is older than a second, reports 0% and
 * re-baselines. Snapshots are reused for {@code cacheMs} so that admission checks in a
 * tight loop do not hit the platform on every call. A failing sampler yields {@link ResourceSnapshot#unavailable(long)}.
 *
 * <p>This class is thread-safe.
 */
public final class ResourceMonitor {
    private static final Logger logger = Logger.getLogger(ResourceMonitor.class.getName());
    private static final long BYTES_PER_MB = 1024L * 1024L;
    static final long MAX_BASELINE_AGE_MS = 1000L;

    private final ResourceSampler sampler;
    private final long cacheMs;
    private final Clock clock;

    private ResourceSampler.Reading previous;
    private long previousAtMs;
    private ResourceSnapshot cached;
    private boolean failureLogged;

    public ResourceMonitor(ResourceSampler sampler, long cacheMs, Clock clock) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (cacheMs < 0) {
            throw new IllegalArgumentException("cacheMs must be >= 0, got: " + cacheMs);
        }
        this.cacheMs = cacheMs;
    }

    /**
     * Returns the current snapshot, sampling the platform if the cached one has expired.
     *
     * @return the snapshot, never null
     */
    public synchronized ResourceSnapshot sample() {
        long now = clock.millis();
        if (cached != null && cacheMs > 0 && now - cached.sampledAtMs() < cacheMs) {
            return cached;
        }
        ResourceSampler.Reading reading;
        try {
            reading = sampler.read();
        } catch (Exception e) {
            if (!failureLogged) {
                logger.log(Level.WARNING, "Resource sampling failed; admitting all work until it recovers", e);
                failureLogged = true;
            }
            cached = ResourceSnapshot.unavailable(now);
            return cached;
        }
        failureLogged = false;
        ResourceSampler.Reading baseline = previous != null && now - previousAtMs <= MAX_BASELINE_AGE_MS
                ? previous
                : null;
        cached = toSnapshot(reading, baseline, now);
        previous = reading;
        previousAtMs = now;
        return cached;
    }

    /**
     * Returns the most recent snapshot without sampling, or samples if there is none yet.
     *
     * @return the latest snapshot
     */
    public synchronized ResourceSnapshot latest() {
        return cached != null ? cached : sample();
    }

    static ResourceSnapshot toSnapshot(ResourceSampler.Reading reading,
                                       ResourceSampler.Reading previous, long now) {
        int cpuPercent = 0;
        if (previous != null) {
            long totalDelta = reading.cpuTotalTicks() - previous.cpuTotalTicks();
            long busyDelta = reading.cpuBusyTicks() - previous.cpuBusyTicks();
            if (totalDelta > 0) {
                cpuPercent = clampPercent(Math.round(busyDelta * 100.0 / totalDelta));
            }
        }
        long total = reading.totalMemoryBytes();
        long free = Math.max(0L, Math.min(total, reading.freeMemoryBytes()));
        int ramPercent = total > 0 ? clampPercent(Math.round((total - free) * 100.0 / total)) : 0;
        return new ResourceSnapshot(
                cpuPercent,
                ramPercent,
                Math.round((double) free / BYTES_PER_MB),
                Math.round((double) total / BYTES_PER_MB),
                Math.max(0.0, reading.loadAvg1m()),
                now);
    }

    private static int clampPercent(long value) {
        return (int) Math.max(0L, Math.min(100L, value));
    }
}
