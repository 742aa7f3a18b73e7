package io.vision.sink;

import io.vision.Unit;
import io.vision.util.ErrorSerializer;
import io.vision.util.JsonCodec;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes one JSON line per unit: successes to standard output prefixed with
 * {@code [vision] success}, failures to standard error prefixed with {@code [vision] error}.
 *
 * <p>This is the sink a {@link io.vision.Vision} runtime starts with when none is configured.
 */
public final class ConsoleSink implements Sink {
  public static final String NAME = "console";

  private final PrintStream out;
  private final PrintStream err;
  private final JsonCodec codec;

  public ConsoleSink() {
    this(System.out, System.err, JsonCodec.getDefault());
  }

  public ConsoleSink(PrintStream out, PrintStream err, JsonCodec codec) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void success(Unit unit) {
    out.println("[vision] success " + codec.toJson(describe(unit)));
  }

  @Override
  public void error(Unit unit, Throwable error) {
    Map<String, Object> payload = describe(unit);
    payload.put("error", ErrorSerializer.serialize(error));
    err.println("[vision] error " + codec.toJson(payload));
  }

  private static Map<String, Object> describe(Unit unit) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("id", unit.id());
    payload.put("name", unit.name());
    payload.put("scope", unit.scope());
    payload.put("source", unit.source());
    payload.put("timestamp", unit.createdAt().toString());
    payload.put("data", unit.data());
    return payload;
  }
}
