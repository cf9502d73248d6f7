/**
 * Micrometer metrics bridge for the scheduler.
 *
 * <p>Wire {@link io.qoms.micrometer.MicrometerMetricsExporter} into
 * {@link io.qoms.Qoms.Builder#metrics(io.qoms.spi.MetricsExporter)} to publish queue
 * depth, dispatch outcomes and timing to any {@code MeterRegistry}.
 */
package io.qoms.micrometer;
