package io.vision;

/**
 * Lifecycle states of a {@link Unit}.
 *
 * <p>States advance strictly forward:
 * {@code CREATED -> BOUND -> RUNNING -> (SUCCEEDED | FAILED) -> EXPORTED}.
 */
public enum UnitState {
  CREATED,
  BOUND,
  RUNNING,
  SUCCEEDED,
  FAILED,
  EXPORTED;

  /**
   * Returns {@code true} once fan-out has started and the unit no longer accepts mutations.
   *
   * @return whether the unit is sealed in this state
   */
  public boolean isSealed() {
    return this == SUCCEEDED || this == FAILED || this == EXPORTED;
  }
}
