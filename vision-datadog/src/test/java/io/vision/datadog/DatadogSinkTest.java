package io.vision.datadog;

import io.vision.Unit;
import io.vision.UnitConfig;
import io.vision.Vision;
import io.vision.spi.MetricsExporter;
import io.vision.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DatadogSinkTest {

  private FakeIntake intake;

  @BeforeEach
  void setUp() throws Exception {
    intake = new FakeIntake();
  }

  @AfterEach
  void tearDown() {
    intake.close();
  }

  private DatadogConfig.Builder config() {
    return DatadogConfig.builder("api-key", "checkout")
        .baseUri(intake.uri())
        .flushInterval(Duration.ofMinutes(1))
        .timeout(Duration.ofSeconds(5));
  }

  private static DatadogSink sink(DatadogConfig config) {
    return new DatadogSink(config, new DatadogTransformer(config), new DatadogHttpClient(config),
        MetricsExporter.NOOP, 1);
  }

  @Test
  void observedUnitsAreSentAsSpans() throws Exception {
    DatadogSink sink = sink(config().build());
    try (Vision vision = Vision.builder().sink(sink).build()) {
      vision.observe(UnitConfig.builder("order.place").scope("http").build(), unit -> {
        unit.set("order_id", "o-1");
        return null;
      });
      assertThrows(IllegalStateException.class, () -> vision.observe("order.cancel", unit -> {
        throw new IllegalStateException("already shipped");
      }));

      assertEquals(2, sink.stats().queueSize());
      sink.flush().get(5, TimeUnit.SECONDS);
    }

    assertEquals(1, intake.requests().size());
    FakeIntake.Request request = intake.requests().get(0);
    assertEquals("/api/v0.2/traces", request.path());
    List<?> traces = (List<?>) JsonCodec.getDefault().parse(request.body());
    assertEquals(2, traces.size());
    Map<?, ?> first = (Map<?, ?>) ((List<?>) traces.get(0)).get(0);
    Map<?, ?> second = (Map<?, ?>) ((List<?>) traces.get(1)).get(0);
    assertEquals("order.place", first.get("name"));
    assertEquals("o-1", ((Map<?, ?>) first.get("meta")).get("vision.data.order_id"));
    assertEquals(0L, first.get("error"));
    assertEquals(1L, second.get("error"));
  }

  @Test
  void batchSizeTriggersDelivery() throws Exception {
    DatadogSink sink = sink(config().exportMode(ExportMode.LOG).batchSize(2).build());
    try (Vision vision = Vision.builder().sink(sink).build()) {
      vision.observe("a", unit -> null);
      vision.observe("b", unit -> null);
      sink.flush().get(5, TimeUnit.SECONDS);

      assertEquals(1, intake.requests().size());
      assertEquals("/api/v1/logs", intake.requests().get(0).path());
      assertEquals(2, ((List<?>) JsonCodec.getDefault().parse(intake.requests().get(0).body())).size());
    }
  }

  @Test
  void retryableFailureIsRetriedByBatcher() throws Exception {
    DatadogSink sink = sink(config().exportMode(ExportMode.EVENT).retries(2).build());
    intake.respondWith(503);
    try (Vision vision = Vision.builder().sink(sink).build()) {
      vision.observe("deploy", unit -> null);
      sink.flush().get(5, TimeUnit.SECONDS);
    }

    assertEquals(3, intake.requests().size());
    assertEquals(CircuitBreaker.State.CLOSED, sink.stats().circuitState());
  }

  @Test
  void closeDrainsQueueAndIgnoresLaterUnits() throws Exception {
    DatadogSink sink = sink(config().exportMode(ExportMode.METRIC).build());
    Vision vision = Vision.builder().sink(sink).build();
    vision.observe("a", unit -> null);

    vision.close();

    assertEquals(1, intake.requests().size());
    assertEquals("/api/v1/series", intake.requests().get(0).path());
    sink.success(Unit.create(UnitConfig.of("late")));
    assertEquals(0, sink.stats().queueSize());
    assertTrue(sink.flush().isDone());
    assertEquals(DatadogSink.NAME, sink.name());
  }
}
