package io.vision.datadog;

import io.vision.batch.DeliveryException;

/**
 * Failure to hand a batch to the Datadog intake API.
 *
 * <p>Retryable failures (rate limiting, 5xx gateway errors, network errors) are re-queued by
 * the sink's batcher; the rest are dropped.
 */
public class DatadogExportException extends DeliveryException {

  /**
   * Why the export failed.
   */
  public enum Reason {
    /** The intake answered with a non-2xx status. */
    HTTP_ERROR,
    /** The request could not be sent or the response could not be read. */
    NETWORK_ERROR,
    /** The circuit breaker refused the request without sending it. */
    CIRCUIT_OPEN
  }

  private final Reason reason;
  private final int statusCode;

  /**
   * @param message    detail message
   * @param reason     failure category
   * @param statusCode HTTP status, or {@code -1} when no response was received
   * @param retryable  whether another attempt may succeed
   */
  public DatadogExportException(String message, Reason reason, int statusCode, boolean retryable) {
    super(message, retryable);
    this.reason = reason;
    this.statusCode = statusCode;
  }

  /**
   * Network failure, always retryable.
   *
   * @param message detail message
   * @param cause   the I/O failure
   */
  public DatadogExportException(String message, Throwable cause) {
    super(message, cause, true);
    this.reason = Reason.NETWORK_ERROR;
    this.statusCode = -1;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * @return the HTTP status, or {@code -1} when no response was received
   */
  public int statusCode() {
    return statusCode;
  }
}
