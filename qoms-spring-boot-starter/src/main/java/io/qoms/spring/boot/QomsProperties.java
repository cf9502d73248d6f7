package io.qoms.spring.boot;

import io.qoms.QomsConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the QOMS scheduler.
 *
 * @see QomsAutoConfiguration
 */
@ConfigurationProperties(prefix = "qoms")
public class QomsProperties {

    /**
     * Whether to create the {@code Qoms} bean.
     */
    private boolean enabled = true;

    private final Resources resources = new Resources();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Resources getResources() {
        return resources;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Converts the bound properties into a validated scheduler configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public QomsConfig toConfig() {
        return QomsConfig.builder()
                .maxCpuPercent(resources.getMaxCpuPercent())
                .maxRamPercent(resources.getMaxRamPercent())
                .checkIntervalMs(resources.getCheckIntervalMs())
                .maxWaitMs(resources.getMaxWaitMs())
                .metricsCacheMs(resources.getMetricsCacheMs())
                .queueHighWaterMark(dispatcher.getQueueHighWaterMark())
                .leaseTimeoutMs(dispatcher.getLeaseTimeoutMs())
                .agePromotionMs(dispatcher.getAgePromotionMs())
                .interItemDelayMs(dispatcher.getInterItemDelayMs())
                .drainTimeoutMs(dispatcher.getDrainTimeoutMs())
                .maxRetries(retry.getMaxRetries())
                .baseRetryDelayMs(retry.getBaseDelayMs())
                .maxRetryDelayMs(retry.getMaxDelayMs())
                .dlqMaxSize(deadLetter.getMaxSize())
                .dlqRetentionMs(deadLetter.getRetentionMs())
                .build();
    }

    public static class Resources {
        private int maxCpuPercent = 75;
        private int maxRamPercent = 60;
        private long checkIntervalMs = 100;
        private long maxWaitMs = 300_000;
        private long metricsCacheMs = 500;

        public int getMaxCpuPercent() {
            return maxCpuPercent;
        }

        public void setMaxCpuPercent(int maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
        }

        public int getMaxRamPercent() {
            return maxRamPercent;
        }

        public void setMaxRamPercent(int maxRamPercent) {
            this.maxRamPercent = maxRamPercent;
        }

        public long getCheckIntervalMs() {
            return checkIntervalMs;
        }

        public void setCheckIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
        }

        public long getMaxWaitMs() {
            return maxWaitMs;
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
        }

        public long getMetricsCacheMs() {
            return metricsCacheMs;
        }

        public void setMetricsCacheMs(long metricsCacheMs) {
            this.metricsCacheMs = metricsCacheMs;
        }
    }

    public static class Dispatcher {
        private int queueHighWaterMark = 100;
        private long leaseTimeoutMs = 60_000;
        private long agePromotionMs = 30_000;
        private long interItemDelayMs = 10;
        private long drainTimeoutMs = 5000;

        public int getQueueHighWaterMark() {
            return queueHighWaterMark;
        }

        public void setQueueHighWaterMark(int queueHighWaterMark) {
            this.queueHighWaterMark = queueHighWaterMark;
        }

        public long getLeaseTimeoutMs() {
            return leaseTimeoutMs;
        }

        public void setLeaseTimeoutMs(long leaseTimeoutMs) {
            this.leaseTimeoutMs = leaseTimeoutMs;
        }

        public long getAgePromotionMs() {
            return agePromotionMs;
        }

        public void setAgePromotionMs(long agePromotionMs) {
            this.agePromotionMs = agePromotionMs;
        }

        public long getInterItemDelayMs() {
            return interItemDelayMs;
        }

        public void setInterItemDelayMs(long interItemDelayMs) {
            this.interItemDelayMs = interItemDelayMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30_000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class DeadLetter {
        private int maxSize = 1000;
        private long retentionMs = 3_600_000;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public long getRetentionMs() {
            return retentionMs;
        }

        public void setRetentionMs(long retentionMs) {
            this.retentionMs = retentionMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "qoms";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
