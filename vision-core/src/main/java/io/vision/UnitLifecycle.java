package io.vision;

import io.vision.sink.Sink;
import io.vision.sink.SinkRegistry;
import io.vision.spi.MetricsExporter;
import io.vision.store.UnitStore;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one unit from creation to export: bind, {@code before} hooks, work,
 * {@code after}/{@code onError} hooks, seal, fan-out, unbind.
 *
 * <p>Sinks are snapshotted once per unit, right after binding. Every sink call is
 * isolated, so a throwing sink is logged and counted but never affects other sinks or
 * the outcome returned to the caller.
 */
final class UnitLifecycle {
  private static final Logger logger = Logger.getLogger(UnitLifecycle.class.getName());

  private final UnitStore store;
  private final SinkRegistry registry;
  private final MetricsExporter metrics;

  UnitLifecycle(UnitStore store, SinkRegistry registry, MetricsExporter metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  <T> T run(UnitConfig config, UnitWork<T> work) throws Exception {
    Objects.requireNonNull(work, "work");
    Unit unit = Unit.create(config);
    return store.bind(unit, () -> {
      List<Sink> sinks = open(unit);
      T result;
      try {
        result = work.execute(unit);
      } catch (Throwable failure) {
        fail(sinks, unit, failure);
        throw failure;
      }
      succeed(sinks, unit);
      return result;
    });
  }

  <T> CompletableFuture<T> runAsync(UnitConfig config, AsyncUnitWork<T> work) {
    Objects.requireNonNull(work, "work");
    Unit unit = Unit.create(config);
    CompletableFuture<T> result = new CompletableFuture<>();
    AtomicBoolean finished = new AtomicBoolean();
    try {
      store.bind(unit, () -> {
        List<Sink> sinks = open(unit);
        UnitStore.Snapshot snapshot = store.capture();

        result.whenComplete((value, error) -> {
          if (error instanceof CancellationException && finished.compareAndSet(false, true)) {
            snapshot.run(() -> fail(sinks, unit, error));
          }
        });

        CompletionStage<T> stage;
        try {
          stage = Objects.requireNonNull(work.start(unit), "work returned a null stage");
        } catch (Throwable failure) {
          if (finished.compareAndSet(false, true)) {
            fail(sinks, unit, failure);
          }
          result.completeExceptionally(failure);
          return null;
        }

        stage.whenComplete((value, error) -> {
          Throwable failure = unwrap(error);
          try {
            if (finished.compareAndSet(false, true)) {
              snapshot.run(() -> {
                if (failure == null) {
                  succeed(sinks, unit);
                } else {
                  fail(sinks, unit, failure);
                }
              });
            }
          } finally {
            if (failure == null) {
              result.complete(value);
            } else {
              result.completeExceptionally(failure);
            }
          }
        });
        return null;
      });
    } catch (Exception e) {
      result.completeExceptionally(e);
    }
    return result;
  }

  private List<Sink> open(Unit unit) {
    unit.transition(UnitState.BOUND);
    List<Sink> sinks = registry.sinks();
    for (Sink sink : sinks) {
      try {
        sink.before(unit);
      } catch (Throwable e) {
        hookFailed("before", sink, unit, e);
      }
    }
    unit.transition(UnitState.RUNNING);
    return sinks;
  }

  private void succeed(List<Sink> sinks, Unit unit) {
    for (Sink sink : sinks) {
      try {
        sink.after(unit);
      } catch (Throwable e) {
        hookFailed("after", sink, unit, e);
      }
    }
    unit.transition(UnitState.SUCCEEDED);
    metrics.incrementUnitSuccess();
    for (Sink sink : sinks) {
      try {
        sink.success(unit);
      } catch (Throwable e) {
        deliveryFailed(sink, unit, e);
      }
    }
    unit.transition(UnitState.EXPORTED);
  }

  private void fail(List<Sink> sinks, Unit unit, Throwable failure) {
    for (Sink sink : sinks) {
      try {
        sink.onError(unit, failure);
      } catch (Throwable e) {
        hookFailed("onError", sink, unit, e);
      }
    }
    unit.transition(UnitState.FAILED);
    metrics.incrementUnitFailure();
    for (Sink sink : sinks) {
      try {
        sink.error(unit, failure);
      } catch (Throwable e) {
        deliveryFailed(sink, unit, e);
      }
    }
    unit.transition(UnitState.EXPORTED);
  }

  private void hookFailed(String hook, Sink sink, Unit unit, Throwable e) {
    metrics.incrementSinkHookFailure();
    logger.log(Level.WARNING, hook + " hook failed in sink '" + sink.name()
        + "' for unit " + unit.name() + " (" + unit.id() + ")", e);
  }

  private void deliveryFailed(Sink sink, Unit unit, Throwable e) {
    metrics.incrementSinkDeliveryFailure();
    logger.log(Level.SEVERE, "Sink '" + sink.name() + "' failed to deliver unit "
        + unit.name() + " (" + unit.id() + ")", e);
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
