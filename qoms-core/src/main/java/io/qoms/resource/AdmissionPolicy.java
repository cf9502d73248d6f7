package io.qoms.resource;

import io.qoms.Priority;
import io.qoms.model.ResourceSnapshot;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether work of a given tier may start under the current resource snapshot.
 *
 * <ul>
 *   <li>{@code CRITICAL} is always admitted.</li>
 *   <li>Other tiers are held back while CPU or RAM exceeds its ceiling.</li>
 *   <li>{@code IDLE} additionally needs CPU below 5% and RAM below 15%.</li>
 * </ul>
 */
public final class AdmissionPolicy {
    private static final Logger logger = Logger.getLogger(AdmissionPolicy.class.getName());

    static final int IDLE_MAX_CPU_PERCENT = 5;
    static final int IDLE_MAX_RAM_PERCENT = 15;

    private final ResourceMonitor monitor;
    private final int maxCpuPercent;
    private final int maxRamPercent;
    private final long checkIntervalMs;

    public AdmissionPolicy(ResourceMonitor monitor, int maxCpuPercent, int maxRamPercent, long checkIntervalMs) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be > 0, got: " + checkIntervalMs);
        }
        this.maxCpuPercent = maxCpuPercent;
        this.maxRamPercent = maxRamPercent;
        this.checkIntervalMs = checkIntervalMs;
    }

    /**
     * Checks admission against a fresh (or cached) snapshot.
     *
     * @param priority the tier asking to run
     * @return {@code true} if work of this tier may start now
     */
    public boolean canExecute(Priority priority) {
        if (priority == Priority.CRITICAL) {
            return true;
        }
        return admits(priority, monitor.sample());
    }

    boolean admits(Priority priority, ResourceSnapshot snapshot) {
        if (priority == Priority.CRITICAL) {
            return true;
        }
        if (snapshot.cpuPercent() > maxCpuPercent) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("CPU ceiling exceeded: " + snapshot.cpuPercent() + "% > " + maxCpuPercent + "%");
            }
            return false;
        }
        if (snapshot.ramPercent() > maxRamPercent) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("RAM ceiling exceeded: " + snapshot.ramPercent() + "% > " + maxRamPercent + "%");
            }
            return false;
        }
        if (priority == Priority.IDLE) {
            return snapshot.cpuPercent() < IDLE_MAX_CPU_PERCENT
                    && snapshot.ramPercent() < IDLE_MAX_RAM_PERCENT;
        }
        return true;
    }

    /**
     * Polls {@link #canExecute(Priority)} every check interval until it holds or
     * {@code maxWaitMs} elapses.
     *
     * @param priority  the tier asking to run
     * @param maxWaitMs longest time to wait in milliseconds
     * @return {@code true} if admitted, {@code false} on timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean waitForResources(Priority priority, long maxWaitMs) throws InterruptedException {
        long deadline = System.nanoTime() + maxWaitMs * 1_000_000L;
        while (true) {
            if (canExecute(priority)) {
                return true;
            }
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return false;
            }
            Thread.sleep(Math.min(checkIntervalMs, remainingMs));
        }
    }
}
