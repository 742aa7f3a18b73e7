package io.vision;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous work observed as a unit. The unit stays open until the returned stage
 * completes. Continuations that need the unit through the store must be scheduled on an
 * executor from {@link Vision#executor(java.util.concurrent.Executor)}; the explicit
 * {@code unit} parameter works everywhere.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncUnitWork<T> {
  CompletionStage<T> start(Unit unit) throws Exception;
}
