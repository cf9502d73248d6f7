/**
 * Spring Boot auto-configuration for the QOMS scheduler.
 *
 * <p>{@link io.qoms.spring.boot.QomsAutoConfiguration} wires an {@link io.qoms.Qoms}
 * instance from {@code qoms.*} application properties, and
 * {@link io.qoms.spring.boot.QomsMicrometerAutoConfiguration} publishes its metrics to the
 * application's {@code MeterRegistry}.
 *
 * @see io.qoms.spring.boot.QomsAutoConfiguration
 * @see io.qoms.spring.boot.QomsProperties
 */
package io.qoms.spring.boot;
