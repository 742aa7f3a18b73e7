package io.vision;

import io.vision.normalize.KeyCasing;
import io.vision.normalize.NormalizationConfig;
import io.vision.sink.ConsoleSink;
import io.vision.sink.NormalizingSink;
import io.vision.sink.Sink;
import io.vision.spi.MetricsExporter;
import io.vision.store.UnitStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VisionTest {

  private RecordingSink sink;
  private Vision vision;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    sink = new RecordingSink("recording");
    vision = Vision.builder().sink(sink).build();
    pool = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  // ── Success and failure paths ─────────────────────────────────

  @Test
  void observeReturnsResultAndDeliversSuccess() throws Exception {
    String result = vision.observe("checkout", unit -> {
      unit.set("cart.size", 3);
      return "done";
    });

    assertEquals("done", result);
    assertEquals(List.of("before", "after", "success"), sink.calls());
    Unit unit = sink.units().get(0);
    assertEquals("checkout", unit.name());
    assertEquals(3, unit.get("cart.size"));
    assertEquals(UnitState.EXPORTED, unit.state());
  }

  @Test
  void observeRethrowsOriginalFailureAfterErrorFanOut() {
    IOException failure = new IOException("disk full");

    IOException thrown = assertThrows(IOException.class, () ->
        vision.observe("write", unit -> {
          unit.set("bytes", 512);
          throw failure;
        }));

    assertSame(failure, thrown);
    assertEquals(List.of("before", "onError", "error"), sink.calls());
    assertSame(failure, sink.errors().get(0));
    assertEquals(512, sink.units().get(0).get("bytes"));
  }

  @Test
  void configCarriesScopeSourceAndInitialData() throws Exception {
    UnitConfig config = UnitConfig.builder("order.place")
        .scope("http")
        .source("orders-service")
        .initial("tenant", "acme")
        .build();

    vision.observe(config, unit -> {
      unit.set("order.id", "o-1");
      return null;
    });

    Unit unit = sink.units().get(0);
    assertEquals("http", unit.scope());
    assertEquals("orders-service", unit.source());
    assertEquals(Map.of("tenant", "acme", "order.id", "o-1"), unit.data());
    assertEquals(List.of("tenant", "order.id"), new ArrayList<>(unit.data().keySet()));
  }

  @Test
  void emptyNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> vision.observe("", unit -> null));
    assertTrue(sink.calls().isEmpty());
  }

  // ── Mutation API ──────────────────────────────────────────────

  @Test
  void mutationApiResolvesCurrentUnit() throws Exception {
    vision.observe("op", unit -> {
      vision.set("user", "u-1");
      vision.set("user", "u-2");
      vision.push("events", "start");
      vision.push("events", "end");
      vision.merge("http", Map.of("method", "GET", "status", 200));
      vision.merge("http", Map.of("status", 404));
      assertEquals("u-2", vision.get("user"));
      assertEquals("u-2", vision.get("user", String.class));
      assertNull(vision.get("missing"));
      assertSame(unit, vision.current());
      return null;
    });

    Unit unit = sink.units().get(0);
    assertEquals(List.of("start", "end"), unit.get("events"));
    assertEquals(Map.of("method", "GET", "status", 404), unit.get("http"));
  }

  @Test
  void mutationOutsideScopeThrows() {
    assertFalse(vision.isActive());
    assertThrows(NoActiveUnitException.class, () -> vision.set("k", "v"));
    assertThrows(NoActiveUnitException.class, () -> vision.get("k"));
    assertThrows(NoActiveUnitException.class, () -> vision.push("k", "v"));
    assertThrows(NoActiveUnitException.class, () -> vision.merge("k", Map.of()));
    assertThrows(NoActiveUnitException.class, () -> vision.current());
  }

  @Test
  void nestedUnitsShadowAndRestore() throws Exception {
    vision.observe("outer", outer -> {
      vision.set("a", 1);
      vision.observe("inner", inner -> {
        assertNull(vision.get("a"));
        vision.set("b", 2);
        return null;
      });
      assertSame(outer, vision.current());
      assertNull(vision.get("b"));
      vision.set("c", 3);
      return null;
    });

    assertEquals("inner", sink.units().get(0).name());
    assertEquals(Map.of("b", 2), sink.units().get(0).data());
    assertEquals("outer", sink.units().get(1).name());
    assertEquals(Map.of("a", 1, "c", 3), sink.units().get(1).data());
    assertFalse(vision.isActive());
  }

  @Test
  void concurrentUnitsDoNotObserveEachOther() throws Exception {
    CountDownLatch bothSet = new CountDownLatch(2);
    List<Future<Object>> futures = new ArrayList<>();
    for (String name : List.of("first", "second")) {
      futures.add(pool.submit(() -> vision.observe(name, unit -> {
        vision.set("who", name);
        bothSet.countDown();
        assertTrue(bothSet.await(5, TimeUnit.SECONDS));
        return vision.get("who");
      })));
    }

    assertEquals("first", futures.get(0).get(5, TimeUnit.SECONDS));
    assertEquals("second", futures.get(1).get(5, TimeUnit.SECONDS));
    for (Unit unit : sink.units()) {
      assertEquals(unit.name(), unit.get("who"));
    }
  }

  // ── Sink isolation ────────────────────────────────────────────

  @Test
  void hookFailuresAreIsolated() throws Exception {
    Sink failingHooks = new Sink() {
      @Override
      public String name() {
        return "failing-hooks";
      }

      @Override
      public void success(Unit unit) {
      }

      @Override
      public void before(Unit unit) {
        throw new IllegalStateException("before");
      }

      @Override
      public void after(Unit unit) {
        throw new IllegalStateException("after");
      }
    };
    CountingMetrics metrics = new CountingMetrics();
    RecordingSink recording = new RecordingSink("recording");
    Vision runtime = Vision.builder().sink(failingHooks).sink(recording).metrics(metrics).build();

    int result = runtime.observe("op", unit -> 7);

    assertEquals(7, result);
    assertEquals(List.of("before", "after", "success"), recording.calls());
    assertEquals(2, metrics.hookFailures.get());
  }

  @Test
  void deliveryFailureInOneSinkDoesNotBlockOthers() throws Exception {
    CountingMetrics metrics = new CountingMetrics();
    RecordingSink recording = new RecordingSink("recording");
    Vision runtime = Vision.builder()
        .sink(Sink.of("broken", unit -> {
          throw new IOException("network down");
        }))
        .sink(recording)
        .metrics(metrics)
        .build();

    assertEquals("ok", runtime.observe("op", unit -> "ok"));
    assertEquals(1, recording.units().size());
    assertEquals(1, metrics.deliveryFailures.get());
    assertEquals(1, metrics.successes.get());
  }

  @Test
  void sinkThrowingErrorDoesNotChangeOutcome() throws Exception {
    CountingMetrics metrics = new CountingMetrics();
    RecordingSink recording = new RecordingSink("recording");
    Vision runtime = Vision.builder()
        .sink(Sink.builder("linkage")
            .before(unit -> {
              throw new AssertionError("before");
            })
            .success(unit -> {
              throw new NoClassDefFoundError("optional/Dep");
            })
            .build())
        .sink(recording)
        .metrics(metrics)
        .build();

    assertEquals("ok", runtime.observe("op", unit -> "ok"));
    assertEquals(List.of("before", "after", "success"), recording.calls());
    assertEquals(UnitState.EXPORTED, recording.units().get(0).state());
    assertEquals(1, metrics.hookFailures.get());
    assertEquals(1, metrics.deliveryFailures.get());
  }

  @Test
  void observeAsyncCompletesWhenSinkThrowsError() throws Exception {
    RecordingSink recording = new RecordingSink("recording");
    Vision runtime = Vision.builder()
        .sink(Sink.of("linkage", unit -> {
          throw new NoClassDefFoundError("optional/Dep");
        }))
        .sink(recording)
        .build();

    CompletableFuture<String> future = runtime.observeAsync("async",
        unit -> CompletableFuture.completedFuture("done"));

    assertEquals("done", future.get(2, TimeUnit.SECONDS));
    assertEquals(List.of("before", "after", "success"), recording.calls());
  }

  @Test
  void errorDefaultsToSuccessCallback() {
    List<Unit> received = new ArrayList<>();
    Vision runtime = Vision.builder().sink(Sink.of("simple", received::add)).build();

    assertThrows(IllegalArgumentException.class, () -> runtime.observe("op", unit -> {
      throw new IllegalArgumentException("bad input");
    }));

    assertEquals(1, received.size());
    assertEquals(UnitState.EXPORTED, received.get(0).state());
  }

  @Test
  void unitIsSealedDuringFanOut() throws Exception {
    AtomicReference<Throwable> mutation = new AtomicReference<>();
    Vision runtime = Vision.builder().sink(Sink.of("mutating", unit -> {
      try {
        unit.set("late", true);
      } catch (IllegalStateException e) {
        mutation.set(e);
      }
    })).build();

    runtime.observe("op", unit -> {
      unit.push("items", 1);
      return null;
    });

    assertInstanceOf(IllegalStateException.class, mutation.get());
  }

  @Test
  void afterHookMayStillMutate() throws Exception {
    Vision runtime = Vision.builder()
        .sink(Sink.builder("timing")
            .after(unit -> unit.set("finished", true))
            .success(unit -> { })
            .build())
        .sink(sink)
        .build();

    runtime.observe("op", unit -> null);

    assertEquals(true, sink.units().get(0).get("finished"));
  }

  @Test
  void capturedUnitIsNotCurrentAfterExport() throws Exception {
    AtomicReference<UnitStore.Snapshot> snapshot = new AtomicReference<>();
    vision.observe("op", unit -> {
      snapshot.set(vision.store().capture());
      return null;
    });

    AtomicBoolean threw = new AtomicBoolean();
    snapshot.get().run(() -> threw.set(!vision.isActive()));
    assertTrue(threw.get());
  }

  // ── Registry ──────────────────────────────────────────────────

  @Test
  void sinksAreSnapshottedWhenUnitIsBound() throws Exception {
    RecordingSink late = new RecordingSink("late");

    vision.observe("first", unit -> {
      vision.registerSink(late);
      return null;
    });
    vision.observe("second", unit -> null);

    assertEquals(1, late.units().size());
    assertEquals("second", late.units().get(0).name());
    assertEquals(2, sink.units().size());
  }

  @Test
  void unregisterSinkRemovesEverySinkWithThatName() throws Exception {
    RecordingSink duplicate = new RecordingSink("recording");
    vision.registerSink(duplicate);

    assertEquals(2, vision.unregisterSink("recording"));
    assertTrue(vision.sinks().isEmpty());

    vision.observe("op", unit -> null);
    assertTrue(sink.units().isEmpty());
    assertTrue(duplicate.units().isEmpty());
  }

  @Test
  void defaultRuntimeStartsWithConsoleSink() {
    Vision runtime = Vision.create();

    assertEquals(1, runtime.sinks().size());
    assertInstanceOf(ConsoleSink.class, runtime.sinks().get(0));
  }

  @Test
  void defaultSinkCanBeDisabled() {
    Vision runtime = Vision.builder().defaultSink(false).build();

    assertTrue(runtime.sinks().isEmpty());
  }

  @Test
  void normalizationWrapsEverySink() throws Exception {
    Vision runtime = Vision.builder()
        .sink(sink)
        .normalization(NormalizationConfig.of(KeyCasing.SNAKE_CASE))
        .build();
    RecordingSink later = new RecordingSink("later");
    runtime.registerSink(later);

    runtime.observe("op", unit -> {
      unit.set("userId", 42);
      assertEquals(42, unit.get("userId"));
      return null;
    });

    assertInstanceOf(NormalizingSink.class, runtime.sinks().get(0));
    assertEquals("recording", runtime.sinks().get(0).name());
    assertEquals(Map.of("user_id", 42), sink.units().get(0).data());
    assertEquals(Map.of("user_id", 42), later.units().get(0).data());
  }

  // ── Async ─────────────────────────────────────────────────────

  @Test
  void observeAsyncPropagatesUnitThroughWrappedExecutor() throws Exception {
    CompletableFuture<Integer> future = vision.observeAsync("async", unit ->
        CompletableFuture.supplyAsync(() -> {
          vision.set("thread", Thread.currentThread().getName());
          return 42;
        }, vision.executor(pool)));

    assertEquals(42, future.get(5, TimeUnit.SECONDS));
    assertEquals(List.of("before", "after", "success"), sink.calls());
    String thread = sink.units().get(0).get("thread", String.class);
    assertTrue(thread.startsWith("pool-"));
    assertFalse(vision.isActive());
  }

  @Test
  void unwrappedExecutorDoesNotSeeUnit() throws Exception {
    CompletableFuture<Boolean> future = vision.observeAsync("async", unit ->
        CompletableFuture.supplyAsync(vision::isActive, pool));

    assertFalse(future.get(5, TimeUnit.SECONDS));
  }

  @Test
  void observeAsyncReportsFailure() {
    CompletableFuture<Integer> future = vision.observeAsync("async", unit ->
        CompletableFuture.supplyAsync(() -> {
          throw new IllegalStateException("boom");
        }, vision.executor(pool)));

    ExecutionException thrown = assertThrows(ExecutionException.class,
        () -> future.get(5, TimeUnit.SECONDS));
    assertInstanceOf(IllegalStateException.class, thrown.getCause());
    assertEquals("boom", thrown.getCause().getMessage());
    assertEquals(List.of("before", "onError", "error"), sink.calls());
    assertInstanceOf(IllegalStateException.class, sink.errors().get(0));
  }

  @Test
  void observeAsyncReportsSynchronousStartFailure() {
    CompletableFuture<Object> future = vision.observeAsync("async", unit -> {
      throw new IOException("cannot start");
    });

    assertTrue(future.isCompletedExceptionally());
    assertInstanceOf(IOException.class, sink.errors().get(0));
  }

  @Test
  void cancellingObserveAsyncReportsUnitOnce() {
    CompletableFuture<String> pending = new CompletableFuture<>();
    CompletableFuture<String> future = vision.observeAsync("slow", unit -> pending);

    assertTrue(future.cancel(true));
    pending.complete("late");

    assertEquals(List.of("before", "onError", "error"), sink.calls());
    assertInstanceOf(CancellationException.class, sink.errors().get(0));
  }

  // ── Close ─────────────────────────────────────────────────────

  @Test
  void closeClosesCloseableSinksAndAggregatesFailures() {
    AtomicInteger closed = new AtomicInteger();
    Vision runtime = Vision.builder()
        .sink(new CloseableSink("one", closed, null))
        .sink(new CloseableSink("two", closed, new IllegalStateException("first")))
        .sink(new CloseableSink("three", closed, new IllegalStateException("second")))
        .build();

    IllegalStateException thrown = assertThrows(IllegalStateException.class, runtime::close);

    assertEquals(3, closed.get());
    assertEquals("first", thrown.getMessage());
    assertEquals(1, thrown.getSuppressed().length);

    runtime.close();
    assertEquals(3, closed.get());
  }

  // ── Test fixtures ─────────────────────────────────────────────

  static final class CloseableSink implements Sink, AutoCloseable {
    private final String name;
    private final AtomicInteger closed;
    private final RuntimeException failure;

    CloseableSink(String name, AtomicInteger closed, RuntimeException failure) {
      this.name = name;
      this.closed = closed;
      this.failure = failure;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public void success(Unit unit) {
    }

    @Override
    public void close() {
      closed.incrementAndGet();
      if (failure != null) {
        throw failure;
      }
    }
  }

  static final class CountingMetrics implements MetricsExporter {
    final AtomicInteger successes = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final AtomicInteger hookFailures = new AtomicInteger();
    final AtomicInteger deliveryFailures = new AtomicInteger();

    @Override
    public void incrementUnitSuccess() {
      successes.incrementAndGet();
    }

    @Override
    public void incrementUnitFailure() {
      failures.incrementAndGet();
    }

    @Override
    public void incrementSinkHookFailure() {
      hookFailures.incrementAndGet();
    }

    @Override
    public void incrementSinkDeliveryFailure() {
      deliveryFailures.incrementAndGet();
    }
  }
}
