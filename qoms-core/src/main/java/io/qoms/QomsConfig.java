package io.qoms;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * Immutable scheduler configuration, fixed when a {@link Qoms} instance is built.
 *
 * <p>Create instances via {@link #builder()}, or overlay {@code QOMS_*} environment
 * variables on the defaults with {@link #fromEnvironment(Map)}.
 */
public final class QomsConfig {
    private static final Logger logger = Logger.getLogger(QomsConfig.class.getName());

    private final int maxCpuPercent;
    private final int maxRamPercent;
    private final long checkIntervalMs;
    private final long maxWaitMs;
    private final int queueHighWaterMark;
    private final int maxRetries;
    private final long baseRetryDelayMs;
    private final long maxRetryDelayMs;
    private final long leaseTimeoutMs;
    private final long agePromotionMs;
    private final int dlqMaxSize;
    private final long dlqRetentionMs;
    private final long metricsCacheMs;
    private final long interItemDelayMs;
    private final long drainTimeoutMs;

    private QomsConfig(Builder b) {
        if (b.maxCpuPercent <= 0 || b.maxCpuPercent > 100) {
            throw new IllegalArgumentException("maxCpuPercent must be in (0, 100], got: " + b.maxCpuPercent);
        }
        if (b.maxRamPercent <= 0 || b.maxRamPercent > 100) {
            throw new IllegalArgumentException("maxRamPercent must be in (0, 100], got: " + b.maxRamPercent);
        }
        requirePositive("checkIntervalMs", b.checkIntervalMs);
        requirePositive("maxWaitMs", b.maxWaitMs);
        requirePositive("queueHighWaterMark", b.queueHighWaterMark);
        requirePositive("maxRetries", b.maxRetries);
        requirePositive("baseRetryDelayMs", b.baseRetryDelayMs);
        requirePositive("leaseTimeoutMs", b.leaseTimeoutMs);
        requirePositive("agePromotionMs", b.agePromotionMs);
        requirePositive("dlqMaxSize", b.dlqMaxSize);
        requirePositive("dlqRetentionMs", b.dlqRetentionMs);
        requireNonNegative("metricsCacheMs", b.metricsCacheMs);
        requireNonNegative("interItemDelayMs", b.interItemDelayMs);
        requireNonNegative("drainTimeoutMs", b.drainTimeoutMs);
        if (b.maxRetryDelayMs < b.baseRetryDelayMs) {
            throw new IllegalArgumentException("maxRetryDelayMs must be >= baseRetryDelayMs");
        }
        this.maxCpuPercent = b.maxCpuPercent;
        this.maxRamPercent = b.maxRamPercent;
        this.checkIntervalMs = b.checkIntervalMs;
        this.maxWaitMs = b.maxWaitMs;
        this.queueHighWaterMark = b.queueHighWaterMark;
        this.maxRetries = b.maxRetries;
        this.baseRetryDelayMs = b.baseRetryDelayMs;
        this.maxRetryDelayMs = b.maxRetryDelayMs;
        this.leaseTimeoutMs = b.leaseTimeoutMs;
        this.agePromotionMs = b.agePromotionMs;
        this.dlqMaxSize = b.dlqMaxSize;
        this.dlqRetentionMs = b.dlqRetentionMs;
        this.metricsCacheMs = b.metricsCacheMs;
        this.interItemDelayMs = b.interItemDelayMs;
        this.drainTimeoutMs = b.drainTimeoutMs;
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     *
     * @return a configuration with every setting at its default
     */
    public static QomsConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a configuration from the defaults overlaid with {@code QOMS_*} variables,
     * e.g. {@code QOMS_MAX_WAIT_MS=60000} or {@code QOMS_MAX_CPU_PERCENT=50}.
     *
     * <p>Values that are not positive integers, and percentages above 100, are ignored with
     * a warning.
     *
     * @param env environment variables, typically {@code System.getenv()}
     * @return the resulting configuration
     */
    public static QomsConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder b = builder();
        overlay(env, "QOMS_MAX_CPU_PERCENT", (bb, v) -> bb.maxCpuPercent(v.intValue()), b);
        overlay(env, "QOMS_MAX_RAM_PERCENT", (bb, v) -> bb.maxRamPercent(v.intValue()), b);
        overlay(env, "QOMS_CHECK_INTERVAL_MS", Builder::checkIntervalMs, b);
        overlay(env, "QOMS_MAX_WAIT_MS", Builder::maxWaitMs, b);
        overlay(env, "QOMS_QUEUE_HIGH_WATER_MARK", (bb, v) -> bb.queueHighWaterMark(v.intValue()), b);
        overlay(env, "QOMS_MAX_RETRIES", (bb, v) -> bb.maxRetries(v.intValue()), b);
        overlay(env, "QOMS_BASE_RETRY_DELAY_MS", Builder::baseRetryDelayMs, b);
        overlay(env, "QOMS_MAX_RETRY_DELAY_MS", Builder::maxRetryDelayMs, b);
        overlay(env, "QOMS_LEASE_TIMEOUT_MS", Builder::leaseTimeoutMs, b);
        overlay(env, "QOMS_AGE_PROMOTION_MS", Builder::agePromotionMs, b);
        overlay(env, "QOMS_DLQ_MAX_SIZE", (bb, v) -> bb.dlqMaxSize(v.intValue()), b);
        overlay(env, "QOMS_DLQ_RETENTION_MS", Builder::dlqRetentionMs, b);
        overlay(env, "QOMS_METRICS_CACHE_MS", Builder::metricsCacheMs, b);
        return b.build();
    }

    private static void overlay(Map<String, String> env, String key,
                                BiConsumer<Builder, Long> setter, Builder builder) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            long upperBound = key.endsWith("_PERCENT") ? 100L
                    : key.endsWith("_MS") ? Long.MAX_VALUE : Integer.MAX_VALUE;
            if (value <= 0 || value > upperBound) {
                logger.warning("Ignoring out-of-range " + key + "=" + raw);
                return;
            }
            setter.accept(builder, value);
        } catch (NumberFormatException e) {
            logger.warning("Ignoring non-numeric " + key + "=" + raw);
        }
    }

    /** CPU ceiling in percent above which non-critical work is held back. */
    public int maxCpuPercent() {
        return maxCpuPercent;
    }

    /** RAM ceiling in percent above which non-critical work is held back. */
    public int maxRamPercent() {
        return maxRamPercent;
    }

    public long checkIntervalMs() {
        return checkIntervalMs;
    }

    public long maxWaitMs() {
        return maxWaitMs;
    }

    public int queueHighWaterMark() {
        return queueHighWaterMark;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long baseRetryDelayMs() {
        return baseRetryDelayMs;
    }

    public long maxRetryDelayMs() {
        return maxRetryDelayMs;
    }

    public long leaseTimeoutMs() {
        return leaseTimeoutMs;
    }

    public long agePromotionMs() {
        return agePromotionMs;
    }

    public int dlqMaxSize() {
        return dlqMaxSize;
    }

    public long dlqRetentionMs() {
        return dlqRetentionMs;
    }

    public long metricsCacheMs() {
        return metricsCacheMs;
    }

    public long interItemDelayMs() {
        return interItemDelayMs;
    }

    public long drainTimeoutMs() {
        return drainTimeoutMs;
    }

    @Override
    public String toString() {
        return "QomsConfig{maxCpuPercent=" + maxCpuPercent
                + ", maxRamPercent=" + maxRamPercent
                + ", checkIntervalMs=" + checkIntervalMs
                + ", maxWaitMs=" + maxWaitMs
                + ", queueHighWaterMark=" + queueHighWaterMark
                + ", maxRetries=" + maxRetries
                + ", baseRetryDelayMs=" + baseRetryDelayMs
                + ", maxRetryDelayMs=" + maxRetryDelayMs
                + ", leaseTimeoutMs=" + leaseTimeoutMs
                + ", agePromotionMs=" + agePromotionMs
                + ", dlqMaxSize=" + dlqMaxSize
                + ", dlqRetentionMs=" + dlqRetentionMs
                + ", metricsCacheMs=" + metricsCacheMs
                + ", interItemDelayMs=" + interItemDelayMs
                + ", drainTimeoutMs=" + drainTimeoutMs + '}';
    }

    /** Builder for {@link QomsConfig}. */
    public static final class Builder {
        private int maxCpuPercent = 75;
        private int maxRamPercent = 60;
        private long checkIntervalMs = 100;
        private long maxWaitMs = 300_000;
        private int queueHighWaterMark = 100;
        private int maxRetries = 3;
        private long baseRetryDelayMs = 1000;
        private long maxRetryDelayMs = 30_000;
        private long leaseTimeoutMs = 60_000;
        private long agePromotionMs = 30_000;
        private int dlqMaxSize = 1000;
        private long dlqRetentionMs = 3_600_000;
        private long metricsCacheMs = 500;
        private long interItemDelayMs = 10;
        private long drainTimeoutMs = 5000;

        private Builder() {}

        /**
         * Sets the CPU ceiling. Optional. Defaults to {@code 75}.
         *
         * @param maxCpuPercent ceiling in percent, {@code 1..100}
         * @return this builder
         */
        public Builder maxCpuPercent(int maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
            return this;
        }

        /**
         * Sets the RAM ceiling. Optional. Defaults to {@code 60}.
         *
         * @param maxRamPercent ceiling in percent, {@code 1..100}
         * @return this builder
         */
        public Builder maxRamPercent(int maxRamPercent) {
            this.maxRamPercent = maxRamPercent;
            return this;
        }

        /**
         * Sets how often admission is re-checked while an item waits for resources.
         * Optional. Defaults to {@code 100} ms.
         *
         * @param checkIntervalMs poll interval in milliseconds
         * @return this builder
         */
        public Builder checkIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
            return this;
        }

        /**
         * Sets the longest an item waits for admission before it is NACKed with a
         * resource timeout. Optional. Defaults to {@code 300000} ms.
         *
         * @param maxWaitMs wait limit in milliseconds
         * @return this builder
         */
        public Builder maxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
            return this;
        }

        /**
         * Sets the queue length above which a warning is logged on enqueue.
         * Optional. Defaults to {@code 100}.
         *
         * @param queueHighWaterMark warning threshold
         * @return this builder
         */
        public Builder queueHighWaterMark(int queueHighWaterMark) {
            this.queueHighWaterMark = queueHighWaterMark;
            return this;
        }

        /**
         * Sets the number of failed attempts after which an item moves to the DLQ.
         * Optional. Defaults to {@code 3}.
         *
         * @param maxRetries failed attempts allowed
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseRetryDelayMs(long baseRetryDelayMs) {
            this.baseRetryDelayMs = baseRetryDelayMs;
            return this;
        }

        public Builder maxRetryDelayMs(long maxRetryDelayMs) {
            this.maxRetryDelayMs = maxRetryDelayMs;
            return this;
        }

        /**
         * Sets the time budget of a dispatched operation. Optional. Defaults to
         * {@code 60000} ms.
         *
         * @param leaseTimeoutMs lease in milliseconds
         * @return this builder
         */
        public Builder leaseTimeoutMs(long leaseTimeoutMs) {
            this.leaseTimeoutMs = leaseTimeoutMs;
            return this;
        }

        /**
         * Sets how long a pending item waits before it is promoted one tier.
         * Optional. Defaults to {@code 30000} ms.
         *
         * @param agePromotionMs promotion threshold in milliseconds
         * @return this builder
         */
        public Builder agePromotionMs(long agePromotionMs) {
            this.agePromotionMs = agePromotionMs;
            return this;
        }

        public Builder dlqMaxSize(int dlqMaxSize) {
            this.dlqMaxSize = dlqMaxSize;
            return this;
        }

        public Builder dlqRetentionMs(long dlqRetentionMs) {
            this.dlqRetentionMs = dlqRetentionMs;
            return this;
        }

        /**
         * Sets how long a resource snapshot is reused. {@code 0} samples on every check.
         * Optional. Defaults to {@code 500} ms.
         *
         * @param metricsCacheMs cache lifetime in milliseconds
         * @return this builder
         */
        public Builder metricsCacheMs(long metricsCacheMs) {
            this.metricsCacheMs = metricsCacheMs;
            return this;
        }

        /**
         * Sets the pause the dispatcher takes between two items. Optional. Defaults to
         * {@code 10} ms.
         *
         * @param interItemDelayMs pause in milliseconds
         * @return this builder
         */
        public Builder interItemDelayMs(long interItemDelayMs) {
            this.interItemDelayMs = interItemDelayMs;
            return this;
        }

        /**
         * Sets how long {@link Qoms#close()} waits for the running operation.
         * Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return a new {@link QomsConfig}
         * @throws IllegalArgumentException if a ceiling is outside {@code (0, 100]}, a size
         *     or interval is not positive, or {@code maxRetryDelayMs < baseRetryDelayMs}
         */
        public QomsConfig build() {
            return new QomsConfig(this);
        }
    }
}
