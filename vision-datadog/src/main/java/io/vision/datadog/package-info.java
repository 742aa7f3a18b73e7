/**
 * Datadog export for observed units.
 *
 * <p>{@link io.vision.datadog.DatadogSink} is the entry point: it converts units with
 * {@link io.vision.datadog.DatadogTransformer}, batches them with the core
 * {@link io.vision.batch.DeliveryBatcher} and sends them through
 * {@link io.vision.datadog.DatadogHttpClient} over the JDK HTTP client.
 *
 * @see io.vision.datadog.DatadogConfig
 */
package io.vision.datadog;
