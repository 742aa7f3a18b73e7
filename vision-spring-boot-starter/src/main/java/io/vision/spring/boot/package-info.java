/**
 * Spring Boot auto-configuration for the vision runtime.
 *
 * <p>{@link io.vision.spring.boot.VisionAutoConfiguration} exposes a {@link io.vision.Vision}
 * bean configured from {@code vision.*} properties, with every {@link io.vision.sink.Sink}
 * bean registered. {@link io.vision.spring.boot.VisionMicrometerAutoConfiguration} bridges
 * the runtime's metrics into Micrometer when a {@code MeterRegistry} is present.
 *
 * @see io.vision.spring.boot.VisionProperties
 */
package io.vision.spring.boot;
