package io.vision.sink;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSinkRegistryTest {

  private final DefaultSinkRegistry registry = new DefaultSinkRegistry();

  @Test
  void registerAppendsInOrderWithoutDeduplication() {
    Sink a = Sink.of("a", unit -> { });
    Sink b = Sink.of("b", unit -> { });
    Sink a2 = Sink.of("a", unit -> { });

    registry.register(a).register(b).register(a2);

    assertEquals(List.of(a, b, a2), registry.sinks());
  }

  @Test
  void unregisterRemovesEveryMatchingName() {
    Sink b = Sink.of("b", unit -> { });
    registry.register(Sink.of("a", unit -> { })).register(b).register(Sink.of("a", unit -> { }));

    assertEquals(2, registry.unregister("a"));
    assertEquals(List.of(b), registry.sinks());
    assertEquals(0, registry.unregister("missing"));
  }

  @Test
  void sinksReturnsImmutableSnapshot() {
    registry.register(Sink.of("a", unit -> { }));
    List<Sink> snapshot = registry.sinks();

    registry.register(Sink.of("b", unit -> { }));

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Sink.of("c", unit -> { })));
  }

  @Test
  void replaceAllAndClear() {
    Sink x = Sink.of("x", unit -> { });
    registry.register(Sink.of("a", unit -> { }));

    registry.replaceAll(List.of(x));
    assertEquals(1, registry.sinks().size());
    assertSame(x, registry.sinks().get(0));

    registry.clear();
    assertTrue(registry.sinks().isEmpty());
  }

  @Test
  void rejectsNullSinks() {
    assertThrows(NullPointerException.class, () -> registry.register(null));
    assertThrows(NullPointerException.class, () -> registry.unregister(null));
  }

  @Test
  void sinkBuilderValidatesRequiredParts() {
    assertThrows(NullPointerException.class, () -> Sink.builder("s").build());
    assertThrows(IllegalArgumentException.class, () -> Sink.of("", unit -> { }));
  }
}
