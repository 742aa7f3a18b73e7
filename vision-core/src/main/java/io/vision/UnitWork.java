package io.vision;

/**
 * Synchronous work observed as a unit. The unit is passed explicitly and is also
 * current in the {@link io.vision.store.UnitStore} while the work runs.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface UnitWork<T> {
  T execute(Unit unit) throws Exception;
}
