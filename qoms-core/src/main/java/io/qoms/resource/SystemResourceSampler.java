package io.qoms.resource;

import io.qoms.spi.ResourceSampler;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Default {@link ResourceSampler} for the local host.
 *
 * <p>On Linux, CPU ticks come from the aggregate {@code cpu} line of {@code /proc/stat}
 * and memory from {@code /proc/meminfo} ({@code MemAvailable}, else {@code MemFree}).
 * Elsewhere the sampler falls back to {@code com.sun.management.OperatingSystemMXBean},
 * converting its instantaneous CPU load into synthetic cumulative ticks.
 */
public final class SystemResourceSampler implements ResourceSampler {
    private static final Path PROC_STAT = Path.of("/proc/stat");
    private static final Path PROC_MEMINFO = Path.of("/proc/meminfo");
    private static final long SYNTHETIC_TICKS_PER_READ = 1000L;

    private final Path procStat;
    private final Path procMeminfo;
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    private long syntheticBusy;
    private long syntheticTotal;

    public SystemResourceSampler() {
        this(PROC_STAT, PROC_MEMINFO);
    }

    SystemResourceSampler(Path procStat, Path procMeminfo) {
        this.procStat = procStat;
        this.procMeminfo = procMeminfo;
    }

    @Override
    public synchronized Reading read() throws IOException {
        long[] ticks = Files.isReadable(procStat) ? readProcStat(procStat) : syntheticTicks();
        long[] memory = Files.isReadable(procMeminfo) ? readMeminfo(procMeminfo) : mxBeanMemory();
        double load = osBean.getSystemLoadAverage();
        return new Reading(ticks[0], ticks[1], memory[0], memory[1], load < 0 ? 0.0 : load);
    }

    static long[] readProcStat(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.US_ASCII);
        for (String line : lines) {
            if (!line.startsWith("cpu ")) {
                continue;
            }
            String[] fields = line.trim().split("\\s+");
            long total = 0L;
            long idle = 0L;
            for (int i = 1; i < fields.length; i++) {
                long value = Long.parseLong(fields[i]);
                // user nice system idle iowait irq softirq steal guest guest_nice
                if (i == 9 || i == 10) {
                    continue; // guest time is already counted in user/nice
                }
                total += value;
                if (i == 4 || i == 5) {
                    idle += value;
                }
            }
            return new long[] {total - idle, total};
        }
        throw new IOException("No aggregate cpu line in " + path);
    }

    static long[] readMeminfo(Path path) throws IOException {
        long total = -1L;
        long available = -1L;
        long free = -1L;
        for (String line : Files.readAllLines(path, StandardCharsets.US_ASCII)) {
            if (line.startsWith("MemTotal:")) {
                total = parseKb(line);
            } else if (line.startsWith("MemAvailable:")) {
                available = parseKb(line);
            } else if (line.startsWith("MemFree:")) {
                free = parseKb(line);
            }
        }
        if (total < 0) {
            throw new IOException("No MemTotal in " + path);
        }
        long usable = available >= 0 ? available : Math.max(free, 0L);
        return new long[] {total, usable};
    }

    private static long parseKb(String line) {
        String[] fields = line.trim().split("\\s+");
        return Long.parseLong(fields[1]) * 1024L;
    }

    private long[] syntheticTicks() throws IOException {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean sunBean)) {
            throw new IOException("CPU load is not available on this JVM");
        }
        double load = sunBean.getCpuLoad();
        if (load < 0) {
            throw new IOException("CPU load is not yet available");
        }
        syntheticTotal += SYNTHETIC_TICKS_PER_READ;
        syntheticBusy += Math.round(load * SYNTHETIC_TICKS_PER_READ);
        return new long[] {syntheticBusy, syntheticTotal};
    }

    private long[] mxBeanMemory() throws IOException {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean sunBean)) {
            throw new IOException("Memory figures are not available on this JVM");
        }
        return new long[] {sunBean.getTotalMemorySize(), sunBean.getFreeMemorySize()};
    }
}
