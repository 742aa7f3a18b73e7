package io.vision.datadog;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Consecutive-failure circuit breaker guarding the Datadog intake.
 *
 * <p>After {@code failureThreshold} failures in a row the breaker opens and refuses requests.
 * Once {@code recoveryTimeout} has passed since the last failure it lets requests through
 * again (half-open); the next success closes it, the next failure opens it again.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  static final int DEFAULT_FAILURE_THRESHOLD = 5;
  static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);

  public enum State { CLOSED, OPEN, HALF_OPEN }

  private final int failureThreshold;
  private final long recoveryTimeoutMs;
  private final Clock clock;

  private State state = State.CLOSED;
  private int failureCount;
  private long lastFailureTime;

  public CircuitBreaker() {
    this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, Clock.systemUTC());
  }

  public CircuitBreaker(int failureThreshold, Duration recoveryTimeout, Clock clock) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    this.failureThreshold = failureThreshold;
    this.recoveryTimeoutMs = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout").toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @return {@code true} if a request may be sent now; moves an expired open breaker to
   *     half-open
   */
  public synchronized boolean allowRequest() {
    if (state == State.OPEN) {
      if (clock.millis() - lastFailureTime < recoveryTimeoutMs) {
        return false;
      }
      state = State.HALF_OPEN;
    }
    return true;
  }

  public synchronized void recordSuccess() {
    failureCount = 0;
    state = State.CLOSED;
  }

  public synchronized void recordFailure() {
    failureCount++;
    lastFailureTime = clock.millis();
    if (state != State.OPEN && (state == State.HALF_OPEN || failureCount >= failureThreshold)) {
      state = State.OPEN;
      logger.warning("Datadog circuit breaker opened after " + failureCount + " consecutive failure(s)");
    }
  }

  public synchronized State state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  /**
   * @return epoch millis of the most recent failure, or {@code 0} if none
   */
  public synchronized long lastFailureTime() {
    return lastFailureTime;
  }
}
