/**
 * Micrometer bridge for the runtime's own metrics.
 *
 * <p>{@link io.vision.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.vision.spi.MetricsExporter} SPI with Micrometer counters and a queue-depth gauge.
 */
package io.vision.micrometer;
