package io.vision.sink;

import io.vision.Unit;

import java.util.Objects;

/**
 * Consumer of completed units.
 *
 * <p>For every observed unit the lifecycle pipeline calls, per sink:
 * <ol>
 *   <li>{@link #before} once the unit is bound, before the work runs</li>
 *   <li>{@link #after} on success, or {@link #onError} on failure</li>
 *   <li>{@link #success} or {@link #error}, exactly one of them, with the sealed unit</li>
 * </ol>
 *
 * <p>Every call is isolated: an exception thrown by one sink is logged and counted but
 * never reaches other sinks or the observed work. Only {@link #name()} and
 * {@link #success} are required; {@link #error} defaults to {@link #success} and the
 * hooks default to no-ops.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Sink audit = Sink.builder("audit")
 *     .success(unit -> log.info(unit.name() + " ok"))
 *     .error((unit, error) -> log.warn(unit.name() + " failed: " + error))
 *     .build();
 * }</pre>
 *
 * @see SinkRegistry
 */
public interface Sink {

  /**
   * Name used for lookup in {@link SinkRegistry#unregister(String)} and in log messages.
   *
   * @return the sink name
   */
  String name();

  /**
   * Receives a unit whose work completed normally.
   *
   * @param unit the sealed unit
   * @throws Exception on delivery failure; logged and isolated by the pipeline
   */
  void success(Unit unit) throws Exception;

  /**
   * Receives a unit whose work failed. Defaults to {@link #success(Unit)}.
   *
   * @param unit the sealed unit
   * @param error the failure raised by the work
   * @throws Exception on delivery failure; logged and isolated by the pipeline
   */
  default void error(Unit unit, Throwable error) throws Exception {
    success(unit);
  }

  /**
   * Called after the unit is bound and before its work runs. The unit is still mutable.
   */
  default void before(Unit unit) throws Exception {
  }

  /**
   * Called after the work completed normally, before {@link #success}.
   */
  default void after(Unit unit) throws Exception {
  }

  /**
   * Called after the work failed, before {@link #error}.
   */
  default void onError(Unit unit, Throwable error) throws Exception {
  }

  /**
   * Creates a sink that handles both outcomes with {@code success}.
   *
   * @param name the sink name
   * @param success the delivery callback
   * @return a new sink
   */
  static Sink of(String name, UnitHandler success) {
    return builder(name).success(success).build();
  }

  static Builder builder(String name) {
    return new Builder(name);
  }

  @FunctionalInterface
  interface UnitHandler {
    void accept(Unit unit) throws Exception;
  }

  @FunctionalInterface
  interface ErrorHandler {
    void accept(Unit unit, Throwable error) throws Exception;
  }

  /** Builds a {@link Sink} from callbacks. Unset callbacks fall back to the interface defaults. */
  final class Builder {
    private final String name;
    private UnitHandler success;
    private ErrorHandler error;
    private UnitHandler before;
    private UnitHandler after;
    private ErrorHandler onError;

    private Builder(String name) {
      this.name = name;
    }

    public Builder success(UnitHandler success) {
      this.success = success;
      return this;
    }

    public Builder error(ErrorHandler error) {
      this.error = error;
      return this;
    }

    public Builder before(UnitHandler before) {
      this.before = before;
      return this;
    }

    public Builder after(UnitHandler after) {
      this.after = after;
      return this;
    }

    public Builder onError(ErrorHandler onError) {
      this.onError = onError;
      return this;
    }

    /**
     * @return a new sink
     * @throws NullPointerException if {@code name} or the success callback is null
     * @throws IllegalArgumentException if {@code name} is empty
     */
    public Sink build() {
      return new CallbackSink(this);
    }
  }

  /** Sink assembled by {@link Builder}. */
  final class CallbackSink implements Sink {
    private final String name;
    private final UnitHandler success;
    private final ErrorHandler error;
    private final UnitHandler before;
    private final UnitHandler after;
    private final ErrorHandler onError;

    private CallbackSink(Builder builder) {
      this.name = Objects.requireNonNull(builder.name, "name");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("name cannot be empty");
      }
      this.success = Objects.requireNonNull(builder.success, "success");
      this.error = builder.error;
      this.before = builder.before;
      this.after = builder.after;
      this.onError = builder.onError;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public void success(Unit unit) throws Exception {
      success.accept(unit);
    }

    @Override
    public void error(Unit unit, Throwable failure) throws Exception {
      if (error != null) {
        error.accept(unit, failure);
      } else {
        success.accept(unit);
      }
    }

    @Override
    public void before(Unit unit) throws Exception {
      if (before != null) {
        before.accept(unit);
      }
    }

    @Override
    public void after(Unit unit) throws Exception {
      if (after != null) {
        after.accept(unit);
      }
    }

    @Override
    public void onError(Unit unit, Throwable failure) throws Exception {
      if (onError != null) {
        onError.accept(unit, failure);
      }
    }

    @Override
    public String toString() {
      return "Sink{" + name + "}";
    }
  }
}
