package io.vision.spi;

/**
 * Observability hook for exporting the runtime's own counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of units whose work completed normally.
   */
  void incrementUnitSuccess();

  /**
   * Increments the count of units whose work failed.
   */
  void incrementUnitFailure();

  /**
   * Increments the count of sink {@code before}/{@code after}/{@code onError} hooks that threw.
   */
  void incrementSinkHookFailure();

  /**
   * Increments the count of sink {@code success}/{@code error} deliveries that threw.
   */
  void incrementSinkDeliveryFailure();

  /**
   * Records items delivered by a delivery batcher.
   *
   * @param count number of items in the delivered batch
   */
  default void incrementBatchDelivered(int count) {
  }

  /**
   * Records items re-queued for another delivery attempt.
   *
   * @param count number of items re-queued
   */
  default void incrementBatchRetried(int count) {
  }

  /**
   * Records items dropped after exhausting their retries or failing permanently.
   *
   * @param count number of items dropped
   */
  default void incrementBatchDropped(int count) {
  }

  /**
   * Records the current depth of a delivery batcher queue.
   *
   * @param depth number of queued items
   */
  default void recordQueueDepth(int depth) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementUnitSuccess() {
    }

    @Override
    public void incrementUnitFailure() {
    }

    @Override
    public void incrementSinkHookFailure() {
    }

    @Override
    public void incrementSinkDeliveryFailure() {
    }
  }
}
