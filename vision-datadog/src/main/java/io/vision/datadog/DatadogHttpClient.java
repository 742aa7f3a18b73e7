package io.vision.datadog;

import io.vision.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Sends payload batches to the Datadog intake endpoints under {@link DatadogConfig#baseUri()}.
 *
 * <p>Each call makes exactly one attempt per request; re-delivery is left to the caller
 * (normally the {@link DatadogSink}'s batcher), guided by
 * {@link DatadogExportException#retryable()}. All requests pass through a shared
 * {@link CircuitBreaker}.
 */
public final class DatadogHttpClient {
  private static final Logger logger = Logger.getLogger(DatadogHttpClient.class.getName());

  static final String SERIES_PATH = "/api/v1/series";
  static final String LOGS_PATH = "/api/v1/logs";
  static final String TRACES_PATH = "/api/v0.2/traces";
  static final String EVENTS_PATH = "/api/v1/events";

  private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

  private final DatadogConfig config;
  private final HttpClient httpClient;
  private final JsonCodec codec;
  private final CircuitBreaker circuitBreaker;

  public DatadogHttpClient(DatadogConfig config) {
    this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build(),
        JsonCodec.getDefault(), new CircuitBreaker());
  }

  public DatadogHttpClient(DatadogConfig config, HttpClient httpClient, JsonCodec codec,
      CircuitBreaker circuitBreaker) {
    this.config = Objects.requireNonNull(config, "config");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
  }

  public void sendMetrics(List<Map<String, Object>> series) throws InterruptedException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("series", series);
    send("POST", SERIES_PATH, body);
  }

  public void sendLogs(List<Map<String, Object>> logs) throws InterruptedException {
    send("POST", LOGS_PATH, logs);
  }

  /**
   * Sends spans grouped into one trace per {@code trace_id}.
   */
  public void sendTraces(List<Map<String, Object>> spans) throws InterruptedException {
    Map<Object, List<Map<String, Object>>> traces = new LinkedHashMap<>();
    for (Map<String, Object> span : spans) {
      traces.computeIfAbsent(span.get("trace_id"), id -> new ArrayList<>()).add(span);
    }
    send("PUT", TRACES_PATH, new ArrayList<>(traces.values()));
  }

  /**
   * Sends events one request at a time; the events endpoint takes a single event per call.
   * Stops at the first failure.
   */
  public void sendEvents(List<Map<String, Object>> events) throws InterruptedException {
    for (Map<String, Object> event : events) {
      send("POST", EVENTS_PATH, event);
    }
  }

  public CircuitBreaker.State circuitState() {
    return circuitBreaker.state();
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  private void send(String method, String path, Object payload) throws InterruptedException {
    if (!circuitBreaker.allowRequest()) {
      throw new DatadogExportException("Circuit breaker is open", DatadogExportException.Reason.CIRCUIT_OPEN,
          -1, false);
    }

    HttpRequest.Builder request = HttpRequest.newBuilder(resolve(path))
        .timeout(config.timeout())
        .header("Content-Type", "application/json")
        .header("DD-API-KEY", config.apiKey())
        .method(method, HttpRequest.BodyPublishers.ofString(codec.toJson(payload)));
    if (config.appKey() != null) {
      request.header("DD-APPLICATION-KEY", config.appKey());
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      circuitBreaker.recordFailure();
      throw new DatadogExportException(method + " " + path + " failed: " + e.getMessage(), e);
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      circuitBreaker.recordSuccess();
      return;
    }
    circuitBreaker.recordFailure();
    boolean retryable = RETRYABLE_STATUSES.contains(status);
    logger.log(Level.FINE, () -> method + " " + path + " returned HTTP " + status);
    throw new DatadogExportException("HTTP " + status + ": " + errorMessage(response.body()),
        DatadogExportException.Reason.HTTP_ERROR, status, retryable);
  }

  /**
   * Extracts the reason from an intake error body: {@code error}, {@code message} or the
   * joined {@code errors} array of a JSON object, otherwise the raw body.
   */
  String errorMessage(String body) {
    if (body == null || body.isBlank()) {
      return "no response body";
    }
    Object parsed;
    try {
      parsed = codec.parse(body);
    } catch (IllegalArgumentException e) {
      return body;
    }
    if (parsed instanceof Map<?, ?> object) {
      if (object.get("error") != null) {
        return String.valueOf(object.get("error"));
      }
      if (object.get("message") != null) {
        return String.valueOf(object.get("message"));
      }
      if (object.get("errors") instanceof List<?> errors && !errors.isEmpty()) {
        return errors.stream().map(String::valueOf).collect(Collectors.joining("; "));
      }
    }
    return body;
  }

  private URI resolve(String path) {
    String base = config.baseUri().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }
}
