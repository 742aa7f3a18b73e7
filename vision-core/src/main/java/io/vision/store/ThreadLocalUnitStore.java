package io.vision.store;

import io.vision.NoActiveUnitException;
import io.vision.Unit;
import io.vision.UnitState;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * {@link UnitStore} backed by a {@link ThreadLocal}.
 *
 * <p>Each thread holds its own binding, saved and restored around every {@link #bind}
 * and snapshot replay, so nested units follow stack discipline and unrelated call trees
 * never observe each other. Continuations that run on other threads see a unit only
 * when scheduled through a {@link Snapshot} or one of the {@code wrap} methods.
 */
public final class ThreadLocalUnitStore implements UnitStore {
  private final ThreadLocal<Unit> current = new ThreadLocal<>();

  @Override
  public <T> T bind(Unit unit, Callable<T> work) throws Exception {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(work, "work");
    Unit previous = current.get();
    current.set(unit);
    try {
      return work.call();
    } finally {
      restore(previous);
    }
  }

  @Override
  public Unit current() {
    Unit unit = current.get();
    if (unit == null) {
      throw new NoActiveUnitException();
    }
    if (unit.state() == UnitState.EXPORTED) {
      throw new NoActiveUnitException("Unit '" + unit.name() + "' has already been exported");
    }
    return unit;
  }

  @Override
  public boolean isActive() {
    Unit unit = current.get();
    return unit != null && unit.state() != UnitState.EXPORTED;
  }

  @Override
  public Snapshot capture() {
    return new ThreadLocalSnapshot(current.get());
  }

  private void restore(Unit unit) {
    if (unit == null) {
      current.remove();
    } else {
      current.set(unit);
    }
  }

  private final class ThreadLocalSnapshot implements Snapshot {
    private final Unit unit;

    private ThreadLocalSnapshot(Unit unit) {
      this.unit = unit;
    }

    @Override
    public Unit unit() {
      return unit;
    }

    @Override
    public <T> T call(Callable<T> task) throws Exception {
      Unit previous = current.get();
      restore(unit);
      try {
        return task.call();
      } finally {
        restore(previous);
      }
    }

    @Override
    public void run(Runnable task) {
      Unit previous = current.get();
      restore(unit);
      try {
        task.run();
      } finally {
        restore(previous);
      }
    }
  }
}
