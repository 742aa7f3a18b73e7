package io.vision.sink;

import java.util.List;

/**
 * Ordered, mutable set of sinks receiving completed units.
 *
 * <p>The lifecycle pipeline takes a {@link #sinks()} snapshot when a unit is bound; changes
 * made afterwards affect only units bound later.
 *
 * @see DefaultSinkRegistry
 */
public interface SinkRegistry {

  /**
   * Appends a sink. Names are not deduplicated.
   *
   * @param sink the sink to add
   * @return this registry for chaining
   */
  SinkRegistry register(Sink sink);

  /**
   * Removes every sink with the given name.
   *
   * @param name the sink name
   * @return the number of sinks removed
   */
  int unregister(String name);

  /**
   * @return an immutable snapshot of the sinks in registration order
   */
  List<Sink> sinks();

  /**
   * Replaces the whole sink list.
   *
   * @param sinks the new sinks, in order
   */
  void replaceAll(List<? extends Sink> sinks);

  /** Removes every sink. */
  void clear();
}
