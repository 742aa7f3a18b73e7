package io.vision.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Thread-safe {@link SinkRegistry} that publishes an immutable list on every change.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SinkRegistry registry = new DefaultSinkRegistry()
 *     .register(new ConsoleSink())
 *     .register(Sink.of("audit", unit -> audit.record(unit)));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Writers are serialized; readers never lock and always see a complete list, including
 * while {@link #replaceAll} runs.
 */
public final class DefaultSinkRegistry implements SinkRegistry {
  private final Object lock = new Object();
  private volatile List<Sink> sinks = Collections.emptyList();

  public DefaultSinkRegistry() {
  }

  public DefaultSinkRegistry(List<? extends Sink> initial) {
    replaceAll(initial);
  }

  @Override
  public DefaultSinkRegistry register(Sink sink) {
    Objects.requireNonNull(sink, "sink");
    synchronized (lock) {
      List<Sink> next = new ArrayList<>(sinks);
      next.add(sink);
      sinks = Collections.unmodifiableList(next);
    }
    return this;
  }

  @Override
  public int unregister(String name) {
    Objects.requireNonNull(name, "name");
    synchronized (lock) {
      List<Sink> next = new ArrayList<>(sinks.size());
      for (Sink sink : sinks) {
        if (!name.equals(sink.name())) {
          next.add(sink);
        }
      }
      int removed = sinks.size() - next.size();
      if (removed > 0) {
        sinks = Collections.unmodifiableList(next);
      }
      return removed;
    }
  }

  @Override
  public List<Sink> sinks() {
    return sinks;
  }

  @Override
  public void replaceAll(List<? extends Sink> replacement) {
    Objects.requireNonNull(replacement, "sinks");
    List<Sink> next = new ArrayList<>(replacement.size());
    for (Sink sink : replacement) {
      next.add(Objects.requireNonNull(sink, "sink"));
    }
    synchronized (lock) {
      sinks = Collections.unmodifiableList(next);
    }
  }

  @Override
  public void clear() {
    synchronized (lock) {
      sinks = Collections.emptyList();
    }
  }
}
