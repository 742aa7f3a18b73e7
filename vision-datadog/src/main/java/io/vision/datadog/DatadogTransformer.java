package io.vision.datadog;

import io.vision.Unit;
import io.vision.util.ErrorSerializer;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts finished units into Datadog payloads: spans, logs, metric series and events.
 *
 * <p>Durations come from {@link #recordStart(Unit)}, called from the sink's {@code before}
 * hook; a unit whose start was never recorded reports a duration of zero. Each start is
 * consumed by the first conversion of that unit. Nested maps in unit data are flattened
 * into dotted keys ({@code user.address.city}); lists are kept as values.
 */
public final class DatadogTransformer {
  static final String DURATION_METRIC = "vision.context.duration";
  private static final String LIBRARY_VERSION = "1.0.0";

  private final DatadogConfig config;
  private final Clock clock;
  private final Map<String, Long> startTimes = new ConcurrentHashMap<>();

  public DatadogTransformer(DatadogConfig config) {
    this(config, Clock.systemUTC());
  }

  public DatadogTransformer(DatadogConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void recordStart(Unit unit) {
    startTimes.put(unit.id(), clock.millis());
  }

  /**
   * Converts a unit according to the configured {@link ExportMode}.
   *
   * @param unit the finished unit
   * @param error the failure, or {@code null} on success
   */
  public Map<String, Object> transform(Unit unit, Throwable error) {
    switch (config.exportMode()) {
      case METRIC:
        return toMetric(unit, error);
      case LOG:
        return toLog(unit, error);
      case EVENT:
        return toEvent(unit, error);
      case TRACE:
      default:
        return toSpan(unit, error);
    }
  }

  /**
   * @return a span for the {@code /api/v0.2/traces} intake; {@code start} and
   *     {@code duration} in nanoseconds
   */
  public Map<String, Object> toSpan(Unit unit, Throwable error) {
    long durationMs = consumeDuration(unit);
    long startMs = clock.millis() - durationMs;

    Map<String, String> meta = new LinkedHashMap<>();
    meta.put("vision.context.id", unit.id());
    meta.put("vision.context.name", unit.name());
    meta.put("otel.library.name", "vision");
    meta.put("otel.library.version", LIBRARY_VERSION);
    if (unit.scope() != null) {
      meta.put("vision.context.scope", unit.scope());
      meta.put("span.kind", spanKind(unit.scope()));
    }
    if (unit.source() != null) {
      meta.put("vision.context.source", unit.source());
      meta.put("service.name", unit.source());
    }
    if (config.env() != null) {
      meta.put("env", config.env());
    }
    if (config.version() != null) {
      meta.put("version", config.version());
    }
    if (config.includeContextData()) {
      flatten(unit).forEach((key, value) -> {
        if (value != null) {
          meta.put("vision.data." + key, String.valueOf(value));
        }
      });
    }
    if (error != null && config.includeErrorDetails()) {
      meta.put("vision.error", "true");
      meta.put("vision.error.name", error.getClass().getSimpleName());
      meta.put("vision.error.message", String.valueOf(error.getMessage()));
    }

    Map<String, Object> span = new LinkedHashMap<>();
    span.put("trace_id", traceId(unit.id()));
    span.put("span_id", spanId(unit.id()));
    span.put("name", unit.name());
    span.put("resource", unit.scope() != null ? unit.scope() + ":" + unit.name() : unit.name());
    span.put("service", config.service());
    span.put("type", unit.scope() != null ? unit.scope() : "vision");
    span.put("start", startMs * 1_000_000L);
    span.put("duration", durationMs * 1_000_000L);
    span.put("meta", meta);
    span.put("error", error != null ? 1 : 0);
    return span;
  }

  /**
   * @return a log record for the {@code /api/v1/logs} intake
   */
  public Map<String, Object> toLog(Unit unit, Throwable error) {
    long durationMs = consumeDuration(unit);

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("contextId", unit.id());
    attributes.put("contextName", unit.name());
    attributes.put("contextScope", unit.scope());
    attributes.put("contextSource", unit.source());
    attributes.put("timestamp", unit.createdAt().toEpochMilli());
    if (config.includeContextData()) {
      attributes.putAll(flatten(unit));
    }
    if (config.includeTiming()) {
      attributes.put("duration", durationMs);
    }
    if (error != null && config.includeErrorDetails()) {
      attributes.put("errorName", error.getClass().getSimpleName());
      attributes.put("errorMessage", error.getMessage());
      attributes.put("errorStack", ErrorSerializer.stackOf(error));
    }

    Map<String, Object> log = new LinkedHashMap<>();
    log.put("message", error == null
        ? "Vision context '" + unit.name() + "' completed"
        : "Vision context '" + unit.name() + "' failed: " + error.getMessage());
    log.put("timestamp", clock.millis() / 1000);
    log.put("level", error == null ? "info" : "error");
    log.put("service", config.service());
    putIfPresent(log, "hostname", config.hostname());
    log.put("ddsource", "vision");
    log.put("ddtags", String.join(",", tags(unit, error)));
    log.put("attributes", attributes);
    return log;
  }

  /**
   * @return one {@code vision.context.duration} series for the {@code /api/v1/series} intake
   */
  public Map<String, Object> toMetric(Unit unit, Throwable error) {
    long durationMs = consumeDuration(unit);
    List<String> tags = tags(unit, error);
    if (config.includeContextData()) {
      flatten(unit).forEach((key, value) -> {
        if (value != null) {
          tags.add("vision.data." + key + ":" + value);
        }
      });
    }

    Map<String, Object> metric = new LinkedHashMap<>();
    metric.put("metric", DURATION_METRIC);
    metric.put("points", List.of(List.of(clock.millis() / 1000.0, durationMs)));
    metric.put("tags", tags);
    putIfPresent(metric, "host", config.hostname());
    metric.put("type", "histogram");
    return metric;
  }

  /**
   * @return an event for the {@code /api/v1/events} intake
   */
  public Map<String, Object> toEvent(Unit unit, Throwable error) {
    consumeDuration(unit);

    Map<String, Object> event = new LinkedHashMap<>();
    if (error == null) {
      event.put("title", "Vision Context: " + unit.name());
      event.put("text", "Vision context '" + unit.name() + "' completed successfully");
    } else {
      event.put("title", "Vision Context Error: " + unit.name());
      event.put("text", "Vision context '" + unit.name() + "' failed: " + error.getMessage());
    }
    event.put("date_happened", clock.millis() / 1000);
    event.put("priority", "normal");
    putIfPresent(event, "host", config.hostname());
    event.put("tags", tags(unit, error));
    event.put("alert_type", error == null ? "info" : "error");
    event.put("aggregation_key", "vision." + unit.name());
    event.put("source_type_name", "vision");
    return event;
  }

  private long consumeDuration(Unit unit) {
    Long start = startTimes.remove(unit.id());
    return start == null ? 0 : Math.max(0, clock.millis() - start);
  }

  private List<String> tags(Unit unit, Throwable error) {
    List<String> tags = new ArrayList<>();
    tags.add("vision.context.name:" + unit.name());
    tags.add("vision.context.id:" + unit.id());
    if (unit.scope() != null) {
      tags.add("vision.context.scope:" + unit.scope());
    }
    if (unit.source() != null) {
      tags.add("vision.context.source:" + unit.source());
    }
    tags.addAll(config.globalTags());
    if (error != null) {
      tags.add("vision.context.error:true");
      tags.add("vision.error.type:" + error.getClass().getSimpleName());
    }
    return tags;
  }

  static Map<String, Object> flatten(Unit unit) {
    Map<String, Object> result = new LinkedHashMap<>();
    unit.data().forEach((key, value) -> flattenInto(result, key, value));
    return result;
  }

  private static void flattenInto(Map<String, Object> result, String key, Object value) {
    if (value instanceof Map<?, ?> nested) {
      nested.forEach((k, v) -> flattenInto(result, key + "." + k, v));
    } else {
      result.put(key, value);
    }
  }

  private static void putIfPresent(Map<String, Object> target, String key, Object value) {
    if (value != null) {
      target.put(key, value);
    }
  }

  /**
   * Maps a unit scope to an OpenTelemetry span kind by keyword; the more specific
   * outbound keywords win over the inbound ones.
   */
  static String spanKind(String scope) {
    String s = scope.toLowerCase(Locale.ROOT);
    if (s.contains("client") || s.contains("fetch") || s.contains("call")) {
      return "client";
    }
    if (s.contains("producer") || s.contains("publish")) {
      return "producer";
    }
    if (s.contains("consumer") || s.contains("subscribe")) {
      return "consumer";
    }
    if (s.contains("http") || s.contains("api") || s.contains("request")) {
      return "server";
    }
    return "internal";
  }

  static long traceId(String unitId) {
    return hash64(unitId);
  }

  static long spanId(String unitId) {
    return hash64(unitId + "-span");
  }

  // 32-bit FNV-1a widened to 63 bits so ids are stable per unit and never negative.
  static long hash64(String value) {
    int hash = 0x811c9dc5;
    for (int i = 0; i < value.length(); i++) {
      hash ^= value.charAt(i);
      hash *= 0x01000193;
    }
    long unsigned = hash & 0xffffffffL;
    long high = unsigned ^ (unsigned >>> 16);
    long low = unsigned ^ (unsigned >>> 8);
    return ((high << 32) | low) & Long.MAX_VALUE;
  }
}
