package io.vision;

/**
 * Thrown when the mutation API is used outside the extent of an observed unit.
 */
public class NoActiveUnitException extends IllegalStateException {

  public NoActiveUnitException() {
    super("No active vision unit");
  }

  public NoActiveUnitException(String message) {
    super(message);
  }
}
