package io.vision.datadog;

import java.util.Locale;

/**
 * What a {@link DatadogSink} turns each unit into.
 */
public enum ExportMode {
  /** One APM span per unit, data as span meta. */
  TRACE,
  /** One {@code vision.context.duration} histogram point per unit, data as tags. */
  METRIC,
  /** One log record per unit, data as attributes. */
  LOG,
  /** One event per unit. */
  EVENT;

  /**
   * @return the lower-case name used as the batch item kind
   */
  public String kind() {
    return name().toLowerCase(Locale.ROOT);
  }

  static ExportMode fromKind(String kind) {
    return valueOf(kind.toUpperCase(Locale.ROOT));
  }
}
