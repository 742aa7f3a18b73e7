package io.vision.sink;

import io.vision.Unit;
import io.vision.normalize.NormalizationConfig;

import java.util.Objects;

/**
 * Decorator that hands its delegate a key-normalized copy of each finished unit.
 *
 * <p>Only {@link #success} and {@link #error} see the normalized copy; the hooks receive
 * the live unit, which the producer may still be mutating. The producer's unit itself is
 * never rewritten. If the delegate is {@link AutoCloseable}, closing this sink closes it.
 */
public final class NormalizingSink implements Sink, AutoCloseable {
  private final Sink delegate;
  private final NormalizationConfig config;

  public NormalizingSink(Sink delegate, NormalizationConfig config) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.config = Objects.requireNonNull(config, "config");
  }

  public Sink delegate() {
    return delegate;
  }

  @Override
  public String name() {
    return delegate.name();
  }

  @Override
  public void success(Unit unit) throws Exception {
    delegate.success(unit.normalized(config));
  }

  @Override
  public void error(Unit unit, Throwable error) throws Exception {
    delegate.error(unit.normalized(config), error);
  }

  @Override
  public void before(Unit unit) throws Exception {
    delegate.before(unit);
  }

  @Override
  public void after(Unit unit) throws Exception {
    delegate.after(unit);
  }

  @Override
  public void onError(Unit unit, Throwable error) throws Exception {
    delegate.onError(unit, error);
  }

  @Override
  public void close() throws Exception {
    if (delegate instanceof AutoCloseable closeable) {
      closeable.close();
    }
  }
}
