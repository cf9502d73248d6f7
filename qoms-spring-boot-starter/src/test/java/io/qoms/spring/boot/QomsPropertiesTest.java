package io.qoms.spring.boot;

import io.qoms.QomsConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QomsPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(QomsProperties.class);
            assertTrue(props.isEnabled());
            assertEquals(75, props.getResources().getMaxCpuPercent());
            assertEquals(60, props.getResources().getMaxRamPercent());
            assertEquals(100, props.getResources().getCheckIntervalMs());
            assertEquals(300_000, props.getResources().getMaxWaitMs());
            assertEquals(500, props.getResources().getMetricsCacheMs());
            assertEquals(100, props.getDispatcher().getQueueHighWaterMark());
            assertEquals(60_000, props.getDispatcher().getLeaseTimeoutMs());
            assertEquals(30_000, props.getDispatcher().getAgePromotionMs());
            assertEquals(10, props.getDispatcher().getInterItemDelayMs());
            assertEquals(5000, props.getDispatcher().getDrainTimeoutMs());
            assertEquals(3, props.getRetry().getMaxRetries());
            assertEquals(1000, props.getRetry().getBaseDelayMs());
            assertEquals(30_000, props.getRetry().getMaxDelayMs());
            assertEquals(1000, props.getDeadLetter().getMaxSize());
            assertEquals(3_600_000, props.getDeadLetter().getRetentionMs());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("qoms", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void defaultsConvertToDefaultConfig() {
        assertEquals(QomsConfig.defaults().toString(), new QomsProperties().toConfig().toString());
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "qoms.enabled=false",
                "qoms.resources.max-cpu-percent=50",
                "qoms.resources.max-ram-percent=40",
                "qoms.resources.check-interval-ms=250",
                "qoms.resources.max-wait-ms=60000",
                "qoms.resources.metrics-cache-ms=0",
                "qoms.dispatcher.queue-high-water-mark=20",
                "qoms.dispatcher.lease-timeout-ms=5000",
                "qoms.dispatcher.age-promotion-ms=1000",
                "qoms.dispatcher.inter-item-delay-ms=0",
                "qoms.dispatcher.drain-timeout-ms=100",
                "qoms.retry.max-retries=5",
                "qoms.retry.base-delay-ms=100",
                "qoms.retry.max-delay-ms=2000",
                "qoms.dead-letter.max-size=50",
                "qoms.dead-letter.retention-ms=60000",
                "qoms.metrics.enabled=false",
                "qoms.metrics.name-prefix=embeddings.qoms"
        ).run(ctx -> {
            var props = ctx.getBean(QomsProperties.class);
            assertFalse(props.isEnabled());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("embeddings.qoms", props.getMetrics().getNamePrefix());

            QomsConfig config = props.toConfig();
            assertEquals(50, config.maxCpuPercent());
            assertEquals(40, config.maxRamPercent());
            assertEquals(250, config.checkIntervalMs());
            assertEquals(60_000, config.maxWaitMs());
            assertEquals(0, config.metricsCacheMs());
            assertEquals(20, config.queueHighWaterMark());
            assertEquals(5000, config.leaseTimeoutMs());
            assertEquals(1000, config.agePromotionMs());
            assertEquals(0, config.interItemDelayMs());
            assertEquals(100, config.drainTimeoutMs());
            assertEquals(5, config.maxRetries());
            assertEquals(100, config.baseRetryDelayMs());
            assertEquals(2000, config.maxRetryDelayMs());
            assertEquals(50, config.dlqMaxSize());
            assertEquals(60_000, config.dlqRetentionMs());
        });
    }

    @Test
    void invalidValuesAreRejectedOnConversion() {
        QomsProperties props = new QomsProperties();
        props.getRetry().setMaxRetries(0);

        assertThrows(IllegalArgumentException.class, props::toConfig);
    }

    @Configuration
    @EnableConfigurationProperties(QomsProperties.class)
    static class PropsConfig {
    }
}
