package io.vision.batch;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Payload waiting in a {@link DeliveryBatcher}, with the bookkeeping the batcher needs to
 * retry it.
 *
 * @param id unique item id
 * @param enqueuedAt when the item was first enqueued
 * @param retryCount delivery attempts that already failed
 * @param kind caller-defined category, e.g. the endpoint the payload belongs to
 * @param payload the value to deliver
 */
public record QueueItem<T>(String id, Instant enqueuedAt, int retryCount, String kind, T payload) {

  public QueueItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    Objects.requireNonNull(kind, "kind");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
  }

  /**
   * Creates a fresh item with a new id, the current time and no retries.
   *
   * @param kind the item category
   * @param payload the value to deliver
   * @return a new item
   */
  public static <T> QueueItem<T> of(String kind, T payload) {
    return new QueueItem<>(UlidCreator.getMonotonicUlid().toString(), Instant.now(), 0, kind, payload);
  }

  /**
   * @return a copy with {@code retryCount + 1}
   */
  public QueueItem<T> withRetry() {
    return new QueueItem<>(id, enqueuedAt, retryCount + 1, kind, payload);
  }
}
