package io.qoms.spring.boot;

import io.qoms.Priority;
import io.qoms.Qoms;
import io.qoms.QomsConfig;
import io.qoms.dispatch.RetryPolicy;
import io.qoms.spi.MetricsExporter;
import io.qoms.spi.ResourceSampler;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QomsAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(QomsAutoConfiguration.class))
      .withUserConfiguration(QuietHostConfig.class);

  @Test
  void createsSchedulerWithDefaults() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("qoms"));
      assertTrue(ctx.containsBean("qomsConfig"));
      Qoms qoms = ctx.getBean(Qoms.class);
      assertEquals(75, qoms.config().maxCpuPercent());
      assertEquals(3, qoms.config().maxRetries());
    });
  }

  @Test
  void schedulerRunsOperations() {
    runner.run(ctx -> {
      Qoms qoms = ctx.getBean(Qoms.class);
      assertEquals("ok", qoms.enqueue(() -> "ok", Priority.LOW).get(5, TimeUnit.SECONDS));
      assertTrue(qoms.canExecute(Priority.IDLE));
    });
  }

  @Test
  void bindsPropertiesIntoConfig() {
    runner.withPropertyValues(
        "qoms.resources.max-cpu-percent=50",
        "qoms.retry.max-retries=5",
        "qoms.dead-letter.max-size=10").run(ctx -> {
          QomsConfig config = ctx.getBean(Qoms.class).config();
          assertEquals(50, config.maxCpuPercent());
          assertEquals(5, config.maxRetries());
          assertEquals(10, config.dlqMaxSize());
        });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("qoms.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("qoms"));
      assertFalse(ctx.containsBean("qomsConfig"));
    });
  }

  @Test
  void invalidPropertiesFailStartup() {
    runner.withPropertyValues("qoms.resources.max-cpu-percent=150").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, rootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void usesCustomConfigBean() {
    runner.withUserConfiguration(CustomConfig.class).run(ctx -> {
      assertEquals(7, ctx.getBean(Qoms.class).config().maxRetries());
    });
  }

  @Test
  void usesCustomRetryPolicyAndMetrics() {
    runner.withUserConfiguration(CustomCollaboratorsConfig.class).run(ctx -> {
      Qoms qoms = ctx.getBean(Qoms.class);
      assertEquals("ok", qoms.medium(() -> "ok").get(5, TimeUnit.SECONDS));
      assertNotNull(ctx.getBean(RetryPolicy.class));
    });
  }

  @Test
  void backsOffWhenSchedulerDefined() {
    runner.withUserConfiguration(CustomSchedulerConfig.class).run(ctx -> {
      assertEquals(1, ctx.getBeansOfType(Qoms.class).size());
      assertTrue(ctx.containsBean("customQoms"));
      assertFalse(ctx.containsBean("qoms"));
    });
  }

  private static Throwable rootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class QuietHostConfig {
    @Bean
    ResourceSampler quietHost() {
      return () -> new ResourceSampler.Reading(0, 0, 1000, 990, 0.0);
    }
  }

  @Configuration
  static class CustomConfig {
    @Bean
    QomsConfig customQomsConfig() {
      return QomsConfig.builder().maxRetries(7).build();
    }
  }

  @Configuration
  static class CustomCollaboratorsConfig {
    @Bean
    RetryPolicy fixedRetryPolicy() {
      return retryCount -> 50L;
    }

    @Bean
    MetricsExporter metricsExporter() {
      return MetricsExporter.NOOP;
    }
  }

  @Configuration
  static class CustomSchedulerConfig {
    @Bean(destroyMethod = "close")
    Qoms customQoms() {
      return Qoms.builder().sampler(() -> new ResourceSampler.Reading(0, 0, 1000, 990, 0.0)).build();
    }
  }
}
