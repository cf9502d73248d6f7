package io.qoms.spring.boot;

import io.qoms.Qoms;
import io.qoms.QomsConfig;
import io.qoms.dispatch.RetryPolicy;
import io.qoms.spi.MetricsExporter;
import io.qoms.spi.ResourceSampler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the QOMS scheduler.
 *
 * <p>Builds a {@link Qoms} from {@link QomsProperties}. Optional {@link ResourceSampler},
 * {@link RetryPolicy} and {@link MetricsExporter} beans are picked up when present.
 * Set {@code qoms.enabled=false} to turn it off.
 *
 * @see QomsProperties
 * @see QomsMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Qoms.class)
@ConditionalOnProperty(prefix = "qoms", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(QomsProperties.class)
public class QomsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public QomsConfig qomsConfig(QomsProperties props) {
        return props.toConfig();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Qoms qoms(QomsConfig config,
                     ObjectProvider<ResourceSampler> samplerProvider,
                     ObjectProvider<RetryPolicy> retryPolicyProvider,
                     ObjectProvider<MetricsExporter> metricsProvider) {
        return Qoms.builder()
                .config(config)
                .sampler(samplerProvider.getIfAvailable())
                .retryPolicy(retryPolicyProvider.getIfAvailable())
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }
}
