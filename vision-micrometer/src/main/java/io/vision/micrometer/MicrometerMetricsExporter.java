package io.vision.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vision.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code vision.unit.success}: units whose work completed normally</li>
 *   <li>{@code vision.unit.failure}: units whose work failed</li>
 *   <li>{@code vision.sink.hook.failure}: sink lifecycle hooks that threw</li>
 *   <li>{@code vision.sink.delivery.failure}: sink success/error deliveries that threw</li>
 *   <li>{@code vision.batch.delivered}: batcher items delivered</li>
 *   <li>{@code vision.batch.retried}: batcher items re-queued after a failure</li>
 *   <li>{@code vision.batch.dropped}: batcher items given up on</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code vision.batch.queue.depth}: last reported batcher queue depth</li>
 * </ul>
 *
 * <p>Several batchers sharing one exporter report into the same gauge; give each runtime
 * its own prefix when they need to be told apart.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter unitSuccess;
  private final Counter unitFailure;
  private final Counter sinkHookFailure;
  private final Counter sinkDeliveryFailure;
  private final Counter batchDelivered;
  private final Counter batchRetried;
  private final Counter batchDropped;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "vision"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "vision");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "checkout.vision"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.unitSuccess = Counter.builder(namePrefix + ".unit.success")
        .description("Units whose work completed normally")
        .register(registry);
    this.unitFailure = Counter.builder(namePrefix + ".unit.failure")
        .description("Units whose work failed")
        .register(registry);
    this.sinkHookFailure = Counter.builder(namePrefix + ".sink.hook.failure")
        .description("Sink before/after/onError hooks that threw")
        .register(registry);
    this.sinkDeliveryFailure = Counter.builder(namePrefix + ".sink.delivery.failure")
        .description("Sink success/error deliveries that threw")
        .register(registry);
    this.batchDelivered = Counter.builder(namePrefix + ".batch.delivered")
        .description("Batcher items delivered")
        .register(registry);
    this.batchRetried = Counter.builder(namePrefix + ".batch.retried")
        .description("Batcher items re-queued for another attempt")
        .register(registry);
    this.batchDropped = Counter.builder(namePrefix + ".batch.dropped")
        .description("Batcher items dropped")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".batch.queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementUnitSuccess() {
    if (closed) return;
    unitSuccess.increment();
  }

  @Override
  public void incrementUnitFailure() {
    if (closed) return;
    unitFailure.increment();
  }

  @Override
  public void incrementSinkHookFailure() {
    if (closed) return;
    sinkHookFailure.increment();
  }

  @Override
  public void incrementSinkDeliveryFailure() {
    if (closed) return;
    sinkDeliveryFailure.increment();
  }

  @Override
  public void incrementBatchDelivered(int count) {
    if (closed) return;
    batchDelivered.increment(count);
  }

  @Override
  public void incrementBatchRetried(int count) {
    if (closed) return;
    batchRetried.increment(count);
  }

  @Override
  public void incrementBatchDropped(int count) {
    if (closed) return;
    batchDropped.increment(count);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.vision.Vision#close()} calls this when the exporter was handed to the
   * runtime, so a closed runtime leaves no stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(unitSuccess, unitFailure, sinkHookFailure, sinkDeliveryFailure,
        batchDelivered, batchRetried, batchDropped, queueDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
