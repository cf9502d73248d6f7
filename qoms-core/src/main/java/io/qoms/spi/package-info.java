/**
 * Service provider interfaces for plugging the scheduler into its host.
 *
 * <p>{@link io.qoms.spi.ResourceSampler} supplies CPU/RAM readings for admission control;
 * {@link io.qoms.spi.MetricsExporter} receives counters and gauges.
 */
package io.qoms.spi;
