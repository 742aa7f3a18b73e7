/**
 * Bounded, retrying batch delivery for sinks that ship units over the network.
 *
 * <p>A {@link io.vision.batch.DeliveryBatcher} collects {@link io.vision.batch.QueueItem}s and
 * hands them to a {@link io.vision.batch.DeliveryFunction} by size or by time. Retryable
 * failures are re-queued with exponential backoff; exhausted items are dropped and logged.
 */
package io.vision.batch;
