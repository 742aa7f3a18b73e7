package io.vision.batch;

import io.vision.spi.MetricsExporter;
import io.vision.util.DaemonThreadFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, retrying queue that hands items to a {@link DeliveryFunction} in batches.
 *
 * <p>A batch is delivered when the queue reaches {@code maxSize}, when the
 * {@code maxWaitMs} timer fires, or on an explicit {@link #flush()}. At most one delivery
 * cycle runs at a time, on the batcher's own daemon thread. When delivery fails, items
 * that still have retries left wait {@code retryDelayMs * 2^retryCount}, go back to the
 * front of the queue and are delivered again within the same cycle; the rest are dropped
 * and logged. Failures never propagate to producers.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DeliveryBatcher<Map<String, Object>> batcher = DeliveryBatcher.<Map<String, Object>>builder(
 *         batch -> client.send(batch))
 *     .maxSize(100)
 *     .maxWaitMs(5000)
 *     .retryAttempts(3)
 *     .build();
 * batcher.add("logs", payload);
 * batcher.close(); // drains what is left
 * }</pre>
 *
 * @param <T> the payload type
 */
public final class DeliveryBatcher<T> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryBatcher.class.getName());

  private static final CompletableFuture<Void> COMPLETED = CompletableFuture.completedFuture(null);

  private final DeliveryFunction<T> deliveryFunction;
  private final String name;
  private final int maxSize;
  private final long maxWaitMs;
  private final int retryAttempts;
  private final long retryDelayMs;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;
  private final ScheduledExecutorService executor;

  private final Object lock = new Object();
  private final Deque<QueueItem<T>> queue = new ArrayDeque<>();
  private boolean accepting = true;
  private boolean processing;
  private CompletableFuture<Void> inFlight = COMPLETED;
  private ScheduledFuture<?> timer;

  private DeliveryBatcher(Builder<T> builder) {
    this.deliveryFunction = Objects.requireNonNull(builder.deliveryFunction, "deliveryFunction");
    this.name = Objects.requireNonNull(builder.name, "name");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxSize < 1) {
      throw new IllegalArgumentException("maxSize must be >= 1");
    }
    if (builder.maxWaitMs <= 0) {
      throw new IllegalArgumentException("maxWaitMs must be > 0");
    }
    if (builder.retryAttempts < 0) {
      throw new IllegalArgumentException("retryAttempts must be >= 0");
    }
    if (builder.retryDelayMs < 0) {
      throw new IllegalArgumentException("retryDelayMs must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.maxSize = builder.maxSize;
    this.maxWaitMs = builder.maxWaitMs;
    this.retryAttempts = builder.retryAttempts;
    this.retryDelayMs = builder.retryDelayMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.executor = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("vision-batcher-" + name + "-"));
    synchronized (lock) {
      armTimer();
    }
  }

  public static <T> Builder<T> builder(DeliveryFunction<T> deliveryFunction) {
    return new Builder<>(deliveryFunction);
  }

  /**
   * Enqueues a new item built from {@code kind} and {@code payload}.
   *
   * @return {@code false} if the batcher is closed
   * @see #add(QueueItem)
   */
  public boolean add(String kind, T payload) {
    return add(QueueItem.of(kind, payload));
  }

  /**
   * Appends an item to the back of the queue. Reaching {@code maxSize} triggers a flush.
   *
   * @param item the item to enqueue
   * @return {@code false} if the batcher is closed and the item was discarded
   */
  public boolean add(QueueItem<T> item) {
    Objects.requireNonNull(item, "item");
    boolean full;
    int depth;
    synchronized (lock) {
      if (!accepting) {
        return false;
      }
      queue.addLast(item);
      depth = queue.size();
      full = depth >= maxSize;
    }
    metrics.recordQueueDepth(depth);
    if (full) {
      flush();
    }
    return true;
  }

  /**
   * Starts a delivery cycle for up to {@code maxSize} items from the front of the queue.
   *
   * <p>Does nothing when the queue is empty or a cycle is already running; in the latter
   * case the running cycle's future is returned.
   *
   * @return a future completed when the cycle, retries included, has ended
   */
  public CompletableFuture<Void> flush() {
    List<QueueItem<T>> batch;
    CompletableFuture<Void> cycle;
    synchronized (lock) {
      if (processing) {
        return inFlight;
      }
      if (queue.isEmpty()) {
        return COMPLETED;
      }
      processing = true;
      cancelTimer();
      batch = take();
      cycle = new CompletableFuture<>();
      inFlight = cycle;
    }
    try {
      executor.execute(() -> runCycle(batch, cycle));
    } catch (RejectedExecutionException e) {
      runCycle(batch, cycle);
    }
    return cycle;
  }

  private void runCycle(List<QueueItem<T>> batch, CompletableFuture<Void> cycle) {
    List<QueueItem<T>> pending = batch;
    try {
      while (!pending.isEmpty()) {
        try {
          deliveryFunction.deliver(Collections.unmodifiableList(pending));
          int delivered = pending.size();
          metrics.incrementBatchDelivered(delivered);
          logger.fine(() -> "Batcher '" + name + "' delivered " + delivered + " item(s)");
          pending = List.of();
        } catch (Exception e) {
          pending = handleFailure(pending, e);
        }
      }
    } catch (Throwable t) {
      metrics.incrementBatchDropped(pending.size());
      logger.log(Level.SEVERE, "Batcher '" + name + "' delivery cycle aborted; dropped "
          + pending.size() + " item(s)", t);
    } finally {
      boolean again;
      int depth;
      synchronized (lock) {
        processing = false;
        again = accepting && queue.size() >= maxSize;
        depth = queue.size();
        armTimer();
      }
      metrics.recordQueueDepth(depth);
      cycle.complete(null);
      if (again) {
        flush();
      }
    }
  }

  private List<QueueItem<T>> handleFailure(List<QueueItem<T>> failed, Exception failure) {
    boolean retryable = DeliveryException.isRetryable(failure);
    List<QueueItem<T>> retry = new ArrayList<>();
    int dropped = 0;
    int maxRetryCount = 0;
    for (QueueItem<T> item : failed) {
      if (retryable && item.retryCount() < retryAttempts) {
        maxRetryCount = Math.max(maxRetryCount, item.retryCount());
        retry.add(item.withRetry());
      } else {
        dropped++;
      }
    }
    if (dropped > 0) {
      metrics.incrementBatchDropped(dropped);
      logger.log(Level.SEVERE, "Batcher '" + name + "' dropped " + dropped + " item(s) after "
          + (retryable ? "exhausting retries" : "a permanent failure"), failure);
    }
    if (retry.isEmpty()) {
      return List.of();
    }

    metrics.incrementBatchRetried(retry.size());
    long delayMs = retryDelayMs << Math.min(maxRetryCount, 20);
    logger.log(Level.FINE, "Batcher '" + name + "' retrying " + retry.size()
        + " item(s) in " + delayMs + "ms", failure);
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incrementBatchDropped(retry.size());
      logger.log(Level.WARNING, "Batcher '" + name + "' interrupted during retry backoff; dropped "
          + retry.size() + " item(s)", failure);
      return List.of();
    }

    synchronized (lock) {
      for (int i = retry.size() - 1; i >= 0; i--) {
        queue.addFirst(retry.get(i));
      }
      return take();
    }
  }

  // Caller must hold lock.
  private List<QueueItem<T>> take() {
    int count = Math.min(maxSize, queue.size());
    List<QueueItem<T>> batch = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      batch.add(queue.pollFirst());
    }
    return batch;
  }

  // Caller must hold lock.
  private void armTimer() {
    if (!accepting || (timer != null && !timer.isDone())) {
      return;
    }
    try {
      timer = executor.schedule(this::onTimer, maxWaitMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      timer = null;
    }
  }

  // Caller must hold lock.
  private void cancelTimer() {
    if (timer != null) {
      timer.cancel(false);
      timer = null;
    }
  }

  private void onTimer() {
    synchronized (lock) {
      timer = null;
    }
    flush();
    synchronized (lock) {
      armTimer();
    }
  }

  /**
   * @return the number of items waiting, excluding those in the running cycle
   */
  public int queueSize() {
    synchronized (lock) {
      return queue.size();
    }
  }

  /**
   * @return {@code true} while a delivery cycle is running
   */
  public boolean isProcessing() {
    synchronized (lock) {
      return processing;
    }
  }

  /**
   * Stops accepting items, delivers everything still queued, waits up to
   * {@code drainTimeoutMs} for the running cycle, then stops the worker thread. Items
   * still queued when the timeout expires are dropped. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (!accepting) {
        return;
      }
      accepting = false;
      cancelTimer();
    }
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
    try {
      while (true) {
        CompletableFuture<Void> cycle = flush();
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0 && !cycle.isDone()) {
          throw new TimeoutException();
        }
        cycle.get(Math.max(remainingNanos, 0), TimeUnit.NANOSECONDS);
        synchronized (lock) {
          if (queue.isEmpty() && !processing) {
            break;
          }
        }
      }
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Batcher '" + name + "' drain timeout exceeded; forcing shutdown. "
          + "Remaining: " + queueSize());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Batcher '" + name + "' drain failed", e.getCause());
    } finally {
      executor.shutdownNow();
      int abandoned;
      synchronized (lock) {
        abandoned = queue.size();
        queue.clear();
      }
      if (abandoned > 0) {
        metrics.incrementBatchDropped(abandoned);
        logger.log(Level.WARNING, "Batcher '" + name + "' dropped " + abandoned + " undelivered item(s) on close");
      }
      metrics.recordQueueDepth(0);
    }
  }

  /** Builder for {@link DeliveryBatcher}. */
  public static final class Builder<T> {
    private final DeliveryFunction<T> deliveryFunction;
    private String name = "default";
    private int maxSize = 100;
    private long maxWaitMs = 5000;
    private int retryAttempts = 3;
    private long retryDelayMs = 1000;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;

    private Builder(DeliveryFunction<T> deliveryFunction) {
      this.deliveryFunction = deliveryFunction;
    }

    /**
     * Sets the name used in worker thread names and log messages.
     *
     * <p>Optional. Defaults to {@code "default"}.
     */
    public Builder<T> name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the batch size: the queue length that triggers a flush, and the most items handed
     * to one delivery call.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &ge; 1.
     */
    public Builder<T> maxSize(int maxSize) {
      this.maxSize = maxSize;
      return this;
    }

    /**
     * Sets the timer interval after which queued items are flushed regardless of size.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     */
    public Builder<T> maxWaitMs(long maxWaitMs) {
      this.maxWaitMs = maxWaitMs;
      return this;
    }

    /**
     * Sets how many times a failed item is re-delivered before it is dropped.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder<T> retryAttempts(int retryAttempts) {
      this.retryAttempts = retryAttempts;
      return this;
    }

    /**
     * Sets the base retry delay, doubled for each retry an item has already used.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Must be &ge; 0.
     */
    public Builder<T> retryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
      return this;
    }

    /**
     * Sets the maximum time {@link DeliveryBatcher#close()} waits for queued items.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder<T> drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the metrics exporter for delivered, retried and dropped counts.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<T> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the batcher and arms its flush timer.
     *
     * @throws NullPointerException if {@code deliveryFunction} or {@code name} is null
     * @throws IllegalArgumentException if any size or duration is out of range
     */
    public DeliveryBatcher<T> build() {
      return new DeliveryBatcher<>(this);
    }
  }
}
