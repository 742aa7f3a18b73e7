package io.vision.store;

import io.vision.NoActiveUnitException;
import io.vision.Unit;
import io.vision.UnitConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadLocalUnitStoreTest {

  private final ThreadLocalUnitStore store = new ThreadLocalUnitStore();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void currentThrowsWhenNothingBound() {
    assertFalse(store.isActive());
    assertThrows(NoActiveUnitException.class, store::current);
  }

  @Test
  void bindMakesUnitCurrentOnlyForItsExtent() throws Exception {
    Unit unit = unit("a");

    Unit seen = store.bind(unit, store::current);

    assertSame(unit, seen);
    assertFalse(store.isActive());
  }

  @Test
  void bindRestoresPreviousUnitAfterFailure() throws Exception {
    Unit outer = unit("outer");
    Unit inner = unit("inner");

    store.bind(outer, () -> {
      assertThrows(IllegalStateException.class, () -> store.bind(inner, () -> {
        throw new IllegalStateException("boom");
      }));
      assertSame(outer, store.current());
      return null;
    });

    assertFalse(store.isActive());
  }

  @Test
  void wrappedExecutorCarriesBindingToAnotherThread() throws Exception {
    Unit unit = unit("async");

    CompletableFuture<Unit> seen = store.bind(unit, () ->
        CompletableFuture.supplyAsync(store::current, store.wrap(executor)));

    assertSame(unit, seen.get(5, TimeUnit.SECONDS));
  }

  @Test
  void replayRestoresExecutingThreadsOwnBinding() throws Exception {
    Unit captured = unit("captured");
    Unit local = unit("local");
    UnitStore.Snapshot snapshot = store.bind(captured, store::capture);

    store.bind(local, () -> {
      snapshot.run(() -> assertSame(captured, store.current()));
      assertSame(local, store.current());
      return null;
    });
  }

  @Test
  void emptySnapshotClearsBindingDuringReplay() throws Exception {
    UnitStore.Snapshot empty = store.capture();
    assertNull(empty.unit());

    store.bind(unit("bound"), () -> {
      Callable<Boolean> active = store::isActive;
      assertFalse(empty.call(active));
      assertTrue(store.isActive());
      return null;
    });
  }

  @Test
  void wrappedRunnableSeesCapturedUnit() throws Exception {
    Unit unit = unit("task");
    String[] name = new String[1];

    Runnable body = () -> name[0] = store.current().name();
    Runnable task = store.bind(unit, () -> store.wrap(body));
    executor.submit(task).get(5, TimeUnit.SECONDS);

    assertEquals("task", name[0]);
  }

  private static Unit unit(String name) {
    return Unit.create(UnitConfig.of(name));
  }
}
