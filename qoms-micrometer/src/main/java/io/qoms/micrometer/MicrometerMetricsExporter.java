package io.qoms.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.qoms.Priority;
import io.qoms.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and distribution summaries with a {@link MeterRegistry}
 * for export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code qoms.enqueue} operations appended to a lane, tagged {@code priority}</li>
 *   <li>{@code qoms.enqueue.fast} operations run inline on the caller's thread</li>
 *   <li>{@code qoms.dispatch.success} queued operations completed</li>
 *   <li>{@code qoms.dispatch.failure} failed attempts scheduled for retry</li>
 *   <li>{@code qoms.dispatch.dead} operations moved to the dead-letter queue</li>
 *   <li>{@code qoms.queue.cleared} pending operations rejected by a clear</li>
 *   <li>{@code qoms.aging.promoted} aging promotions</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code qoms.queue.depth} pending operations</li>
 *   <li>{@code qoms.inflight.depth} operations executing</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code qoms.wait.ms} enqueue-to-completion time of queued operations</li>
 *   <li>{@code qoms.execution.ms} duration of each attempt</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<Priority, Counter> enqueued = new EnumMap<>(Priority.class);
  private final Counter fastPath;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter dispatchDead;
  private final Counter cleared;
  private final Counter promoted;
  private final Gauge queueDepthGauge;
  private final Gauge inFlightDepthGauge;
  private final DistributionSummary waitMs;
  private final DistributionSummary executionMs;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger inFlightDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "qoms"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "qoms");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "embeddings.qoms"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (Priority priority : Priority.values()) {
      enqueued.put(priority, Counter.builder(namePrefix + ".enqueue")
          .description("Operations appended to a priority lane")
          .tag("priority", priority.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.fastPath = Counter.builder(namePrefix + ".enqueue.fast")
        .description("Operations run inline while the scheduler was idle")
        .register(registry);
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Queued operations completed successfully")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Failed attempts (will retry)")
        .register(registry);
    this.dispatchDead = Counter.builder(namePrefix + ".dispatch.dead")
        .description("Operations moved to the dead-letter queue")
        .register(registry);
    this.cleared = Counter.builder(namePrefix + ".queue.cleared")
        .description("Pending operations rejected by a queue clear")
        .register(registry);
    this.promoted = Counter.builder(namePrefix + ".aging.promoted")
        .description("Pending operations promoted one tier by aging")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.inFlightDepthGauge = Gauge.builder(namePrefix + ".inflight.depth", inFlightDepth, AtomicInteger::get)
        .register(registry);

    this.waitMs = DistributionSummary.builder(namePrefix + ".wait.ms")
        .description("Time from enqueue to completion of queued operations")
        .baseUnit("milliseconds")
        .register(registry);
    this.executionMs = DistributionSummary.builder(namePrefix + ".execution.ms")
        .description("Duration of each execution attempt")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementEnqueued(Priority priority) {
    if (closed) return;
    enqueued.get(priority).increment();
  }

  @Override
  public void incrementFastPath() {
    if (closed) return;
    fastPath.increment();
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementDispatchDead() {
    if (closed) return;
    dispatchDead.increment();
  }

  @Override
  public void incrementCleared(int count) {
    if (closed || count <= 0) return;
    cleared.increment(count);
  }

  @Override
  public void incrementPromoted() {
    if (closed) return;
    promoted.increment();
  }

  @Override
  public void recordDepths(int queued, int inFlight) {
    if (closed) return;
    this.queueDepth.set(queued);
    this.inFlightDepth.set(inFlight);
  }

  @Override
  public void recordWaitMs(long waitMs) {
    if (closed) return;
    this.waitMs.record(waitMs);
  }

  @Override
  public void recordExecutionMs(long durationMs) {
    if (closed) return;
    this.executionMs.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link io.qoms.Qoms} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(enqueued.values());
    meters.addAll(List.of(fastPath, dispatchSuccess, dispatchFailure, dispatchDead,
        cleared, promoted, queueDepthGauge, inFlightDepthGauge, waitMs, executionMs));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
