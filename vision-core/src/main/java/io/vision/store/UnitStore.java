package io.vision.store;

import io.vision.NoActiveUnitException;
import io.vision.Unit;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * Continuation-scoped holder of the current {@link Unit}.
 *
 * <p>A unit bound with {@link #bind} is current for the full dynamic extent of the bound
 * work and nowhere else. Work that hops threads carries the binding with it through a
 * {@link Snapshot}: capture on the scheduling side, replay on the executing side.
 * The {@code wrap} methods do both automatically.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Executor executor = store.wrap(ForkJoinPool.commonPool());
 * store.bind(unit, () -> CompletableFuture
 *     .supplyAsync(() -> { store.current().set("step", "async"); return 1; }, executor)
 *     .join());
 * }</pre>
 *
 * @see ThreadLocalUnitStore
 */
public interface UnitStore {

  /**
   * Runs {@code work} with {@code unit} current, restoring the previously current unit
   * (or none) afterwards, whether {@code work} returns or throws.
   *
   * @param unit the unit to bind
   * @param work the work to run
   * @return the result of {@code work}
   * @throws Exception whatever {@code work} throws
   */
  <T> T bind(Unit unit, Callable<T> work) throws Exception;

  /**
   * Returns the current unit.
   *
   * @return the unit bound to the running continuation
   * @throws NoActiveUnitException if no unit is bound, or the bound unit was already exported
   */
  Unit current();

  /**
   * @return {@code true} if {@link #current()} would return a unit
   */
  boolean isActive();

  /**
   * Captures the binding of the calling continuation for replay elsewhere.
   *
   * @return a snapshot of the current binding, possibly empty
   */
  Snapshot capture();

  default Runnable wrap(Runnable task) {
    Objects.requireNonNull(task, "task");
    Snapshot snapshot = capture();
    return () -> snapshot.run(task);
  }

  default <T> Callable<T> wrap(Callable<T> task) {
    Objects.requireNonNull(task, "task");
    Snapshot snapshot = capture();
    return () -> snapshot.call(task);
  }

  /**
   * Returns an executor that captures the binding at submission time and replays it
   * around each task.
   *
   * @param executor the executor to decorate
   * @return the propagating executor
   */
  default Executor wrap(Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return task -> executor.execute(wrap(task));
  }

  /**
   * A captured binding. Replaying installs the captured unit for the extent of the task
   * and then restores whatever the executing thread had bound before.
   */
  interface Snapshot {

    /** @return the captured unit, or {@code null} for an empty snapshot */
    Unit unit();

    <T> T call(Callable<T> task) throws Exception;

    void run(Runnable task);
  }
}
