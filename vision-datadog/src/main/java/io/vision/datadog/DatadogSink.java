package io.vision.datadog;

import io.vision.Unit;
import io.vision.batch.DeliveryBatcher;
import io.vision.batch.QueueItem;
import io.vision.sink.Sink;
import io.vision.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Sink that exports every finished unit to Datadog.
 *
 * <p>Units are converted by a {@link DatadogTransformer} according to the configured
 * {@link ExportMode} and queued in a {@link DeliveryBatcher}; batches go out when
 * {@code batchSize} is reached or every {@code flushInterval}. Failed batches are retried
 * {@code retries} times, one second apart and doubling. The runtime never waits on the
 * network: {@link #success} and {@link #error} only enqueue.
 *
 * <pre>{@code
 * Vision vision = Vision.builder()
 *     .sink(new DatadogSink(DatadogConfig.builder(apiKey, "checkout").env("prod").build()))
 *     .build();
 * }</pre>
 *
 * <p>Closing the sink (or the {@link io.vision.Vision} it is registered with) delivers what
 * is still queued and stops the batcher.
 */
public final class DatadogSink implements Sink, AutoCloseable {
  public static final String NAME = "datadog";

  static final long RETRY_DELAY_MS = 1000;

  private final DatadogConfig config;
  private final DatadogTransformer transformer;
  private final DatadogHttpClient client;
  private final DeliveryBatcher<Map<String, Object>> batcher;
  private volatile boolean closed;

  public DatadogSink(DatadogConfig config) {
    this(config, MetricsExporter.NOOP);
  }

  public DatadogSink(DatadogConfig config, MetricsExporter metrics) {
    this(config, new DatadogTransformer(config), new DatadogHttpClient(config), metrics, RETRY_DELAY_MS);
  }

  DatadogSink(DatadogConfig config, DatadogTransformer transformer, DatadogHttpClient client,
      MetricsExporter metrics, long retryDelayMs) {
    this.config = Objects.requireNonNull(config, "config");
    this.transformer = Objects.requireNonNull(transformer, "transformer");
    this.client = Objects.requireNonNull(client, "client");
    this.batcher = DeliveryBatcher.<Map<String, Object>>builder(this::deliver)
        .name(NAME)
        .maxSize(config.batchSize())
        .maxWaitMs(config.flushInterval().toMillis())
        .retryAttempts(config.retries())
        .retryDelayMs(retryDelayMs)
        .drainTimeoutMs(config.timeout().toMillis())
        .metrics(metrics)
        .build();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void before(Unit unit) {
    if (closed) return;
    transformer.recordStart(unit);
  }

  @Override
  public void success(Unit unit) {
    enqueue(unit, null);
  }

  @Override
  public void error(Unit unit, Throwable error) {
    enqueue(unit, error);
  }

  private void enqueue(Unit unit, Throwable error) {
    if (closed) return;
    batcher.add(config.exportMode().kind(), transformer.transform(unit, error));
  }

  private void deliver(List<QueueItem<Map<String, Object>>> batch) throws InterruptedException {
    Map<ExportMode, List<Map<String, Object>>> byMode = new LinkedHashMap<>();
    for (QueueItem<Map<String, Object>> item : batch) {
      byMode.computeIfAbsent(ExportMode.fromKind(item.kind()), mode -> new ArrayList<>()).add(item.payload());
    }
    for (Map.Entry<ExportMode, List<Map<String, Object>>> entry : byMode.entrySet()) {
      switch (entry.getKey()) {
        case METRIC:
          client.sendMetrics(entry.getValue());
          break;
        case LOG:
          client.sendLogs(entry.getValue());
          break;
        case EVENT:
          client.sendEvents(entry.getValue());
          break;
        case TRACE:
        default:
          client.sendTraces(entry.getValue());
      }
    }
  }

  /**
   * Sends what is queued now, without waiting for the batch to fill.
   *
   * @return a future completed when the delivery cycle has ended; already complete once the
   *     sink is closed
   */
  public CompletableFuture<Void> flush() {
    if (closed) {
      return CompletableFuture.completedFuture(null);
    }
    return batcher.flush();
  }

  public Stats stats() {
    return new Stats(batcher.queueSize(), batcher.isProcessing(), client.circuitState());
  }

  /**
   * Stops accepting units and drains the queue, waiting at most the configured timeout.
   */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    batcher.close();
  }

  /**
   * Point-in-time view of the sink.
   *
   * @param queueSize payloads waiting to be sent
   * @param processing whether a batch is being sent right now
   * @param circuitState state of the intake circuit breaker
   */
  public record Stats(int queueSize, boolean processing, CircuitBreaker.State circuitState) {
  }
}
