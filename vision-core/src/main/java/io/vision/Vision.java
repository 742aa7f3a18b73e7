package io.vision;

import io.vision.normalize.NormalizationConfig;
import io.vision.sink.ConsoleSink;
import io.vision.sink.DefaultSinkRegistry;
import io.vision.sink.NormalizingSink;
import io.vision.sink.Sink;
import io.vision.sink.SinkRegistry;
import io.vision.spi.MetricsExporter;
import io.vision.store.ThreadLocalUnitStore;
import io.vision.store.UnitStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime entry point: observes units of work and fans completed units out to sinks.
 *
 * <p>A {@code Vision} instance owns a {@link UnitStore}, a {@link SinkRegistry} and a
 * {@link MetricsExporter}. It is an ordinary object; applications create one at startup
 * (or let the Spring Boot starter do it) and share it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Vision vision = Vision.builder()
 *     .sink(new ConsoleSink())
 *     .build()) {
 *
 *   Order order = vision.observe(UnitConfig.builder("order.place").scope("http").build(), unit -> {
 *     unit.set("order.id", orderId);
 *     vision.push("steps", "validated");
 *     return orders.place(orderId);
 *   });
 * }
 * }</pre>
 *
 * <p>The mutation methods ({@link #set}, {@link #get}, {@link #push}, {@link #merge})
 * resolve the current unit through the store and throw {@link NoActiveUnitException}
 * outside an observed extent.
 *
 * @see Unit
 * @see Sink
 */
public final class Vision implements AutoCloseable {

  private final UnitStore store;
  private final SinkRegistry registry;
  private final MetricsExporter metrics;
  private final NormalizationConfig normalization;
  private final UnitLifecycle lifecycle;
  private final AtomicBoolean closed = new AtomicBoolean();

  private Vision(Builder builder) {
    this.store = builder.store != null ? builder.store : new ThreadLocalUnitStore();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.normalization = builder.normalization != null
        ? builder.normalization : NormalizationConfig.DISABLED;
    this.registry = new DefaultSinkRegistry();
    List<Sink> sinks = new ArrayList<>(builder.sinks);
    if (sinks.isEmpty() && builder.defaultSink) {
      sinks.add(new ConsoleSink());
    }
    for (Sink sink : sinks) {
      registry.register(decorate(sink));
    }
    this.lifecycle = new UnitLifecycle(store, registry, metrics);
  }

  /**
   * Creates a runtime with a thread-local store, no metrics and the {@link ConsoleSink}.
   *
   * @return a new runtime
   */
  public static Vision create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Lifecycle ───────────────────────────────────────────────

  /**
   * Observes synchronous work as a unit named {@code name}.
   *
   * @see #observe(UnitConfig, UnitWork)
   */
  public <T> T observe(String name, UnitWork<T> work) throws Exception {
    return observe(UnitConfig.of(name), work);
  }

  /**
   * Creates a unit, binds it for the extent of {@code work}, and fans it out to every
   * registered sink when the work finishes.
   *
   * <p>On success the sinks receive {@link Sink#success} and the result is returned. On
   * failure they receive {@link Sink#error} and the original exception is rethrown
   * unchanged. Sink failures never alter the outcome.
   *
   * @param config the unit description
   * @param work the work to observe
   * @return the result of {@code work}
   * @throws Exception whatever {@code work} throws
   */
  public <T> T observe(UnitConfig config, UnitWork<T> work) throws Exception {
    Objects.requireNonNull(config, "config");
    return lifecycle.run(config, work);
  }

  /**
   * Observes asynchronous work as a unit named {@code name}.
   *
   * @see #observeAsync(UnitConfig, AsyncUnitWork)
   */
  public <T> CompletableFuture<T> observeAsync(String name, AsyncUnitWork<T> work) {
    return observeAsync(UnitConfig.of(name), work);
  }

  /**
   * Asynchronous variant of {@link #observe(UnitConfig, UnitWork)}. The unit stays open
   * until the stage returned by {@code work} completes; sinks receive it before the
   * returned future completes. Cancelling the returned future reports the unit as failed
   * with a {@link java.util.concurrent.CancellationException}.
   *
   * @param config the unit description
   * @param work the work to observe
   * @return a future completed with the work's result or its original failure
   */
  public <T> CompletableFuture<T> observeAsync(UnitConfig config, AsyncUnitWork<T> work) {
    Objects.requireNonNull(config, "config");
    return lifecycle.runAsync(config, work);
  }

  // ── Mutation API ────────────────────────────────────────────

  /**
   * @return the unit current in the calling continuation
   * @throws NoActiveUnitException outside an observed extent
   */
  public Unit current() {
    return store.current();
  }

  public boolean isActive() {
    return store.isActive();
  }

  /** Sets {@code key} on the current unit. */
  public void set(String key, Object value) {
    store.current().set(key, value);
  }

  /** Reads {@code key} from the current unit; {@code null} when absent. */
  public Object get(String key) {
    return store.current().get(key);
  }

  public <T> T get(String key, Class<T> type) {
    return store.current().get(key, type);
  }

  /** Appends to the list under {@code key} on the current unit. */
  public void push(String key, Object value) {
    store.current().push(key, value);
  }

  /** Shallow-merges {@code partial} into the map under {@code key} on the current unit. */
  public void merge(String key, Map<String, ?> partial) {
    store.current().merge(key, partial);
  }

  /**
   * Returns an executor whose tasks see the unit that was current when they were
   * submitted.
   *
   * @param executor the executor to decorate
   * @return the propagating executor
   */
  public Executor executor(Executor executor) {
    return store.wrap(executor);
  }

  // ── Sinks ───────────────────────────────────────────────────

  /**
   * Appends a sink. Units bound from now on are delivered to it.
   *
   * @param sink the sink to add
   * @return this runtime for chaining
   */
  public Vision registerSink(Sink sink) {
    registry.register(decorate(Objects.requireNonNull(sink, "sink")));
    return this;
  }

  /**
   * Removes every sink named {@code name}.
   *
   * @param name the sink name
   * @return the number of sinks removed
   */
  public int unregisterSink(String name) {
    return registry.unregister(name);
  }

  public List<Sink> sinks() {
    return registry.sinks();
  }

  public SinkRegistry registry() {
    return registry;
  }

  public UnitStore store() {
    return store;
  }

  public NormalizationConfig normalization() {
    return normalization;
  }

  private Sink decorate(Sink sink) {
    return normalization.isActive() ? new NormalizingSink(sink, normalization) : sink;
  }

  /**
   * Closes every registered sink that is {@link AutoCloseable}, in registration order, then
   * the metrics exporter if it is closeable. All are attempted; the first failure is thrown
   * with later ones suppressed. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    for (Sink sink : registry.sinks()) {
      if (sink instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
          if (first == null) first = re; else first.addSuppressed(re);
        }
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Vision}. */
  public static final class Builder {
    private final List<Sink> sinks = new ArrayList<>();
    private boolean defaultSink = true;
    private UnitStore store;
    private MetricsExporter metrics;
    private NormalizationConfig normalization;

    private Builder() {}

    /**
     * Appends a sink.
     *
     * <p>Optional. When no sink is added the runtime starts with a {@link ConsoleSink}
     * unless {@link #defaultSink(boolean)} is {@code false}.
     *
     * @param sink the sink
     * @return this builder
     */
    public Builder sink(Sink sink) {
      this.sinks.add(Objects.requireNonNull(sink, "sink"));
      return this;
    }

    public Builder sinks(List<? extends Sink> sinks) {
      sinks.forEach(this::sink);
      return this;
    }

    /**
     * Whether a {@link ConsoleSink} is installed when no sink was added.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param defaultSink {@code false} to start with an empty registry
     * @return this builder
     */
    public Builder defaultSink(boolean defaultSink) {
      this.defaultSink = defaultSink;
      return this;
    }

    /**
     * Sets the store that tracks the current unit.
     *
     * <p>Optional. Defaults to {@link ThreadLocalUnitStore}.
     *
     * @param store the unit store
     * @return this builder
     */
    public Builder unitStore(UnitStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the metrics exporter for unit and sink counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the key normalization applied to units before they reach sinks. When active,
     * every sink (including ones registered later) is wrapped in a {@link NormalizingSink}.
     *
     * <p>Optional. Defaults to {@link NormalizationConfig#DISABLED}.
     *
     * @param normalization the normalization settings
     * @return this builder
     */
    public Builder normalization(NormalizationConfig normalization) {
      this.normalization = normalization;
      return this;
    }

    public Vision build() {
      return new Vision(this);
    }
  }
}
