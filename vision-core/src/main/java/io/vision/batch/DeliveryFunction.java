package io.vision.batch;

import java.util.List;

/**
 * Ships one batch of queued items to its destination.
 *
 * <p>Throw a {@link DeliveryException} to tell the batcher whether the batch may be retried;
 * any other exception is treated as retryable.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface DeliveryFunction<T> {
  void deliver(List<QueueItem<T>> batch) throws Exception;
}
