package io.vision.batch;

/**
 * Failure raised by a {@link DeliveryFunction}, classified as retryable or permanent.
 *
 * <p>The batcher re-queues the items of a retryable failure until they exhaust their
 * retry budget, and drops the items of a permanent failure straight away. Exceptions of
 * any other type are treated as retryable.
 */
public class DeliveryException extends RuntimeException {

  private final boolean retryable;

  /**
   * @param message   detail message
   * @param retryable whether another attempt may succeed
   */
  public DeliveryException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  /**
   * @param message   detail message
   * @param cause     the underlying cause
   * @param retryable whether another attempt may succeed
   */
  public DeliveryException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  /**
   * Returns whether the batcher should attempt delivery again.
   *
   * @return {@code true} for transient failures
   */
  public boolean retryable() {
    return retryable;
  }

  /**
   * Classifies an arbitrary delivery failure.
   *
   * @param failure the failure thrown by a delivery function
   * @return {@code false} only for a non-retryable {@link DeliveryException}
   */
  public static boolean isRetryable(Throwable failure) {
    return !(failure instanceof DeliveryException de) || de.retryable();
  }
}
