package io.vision.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts a {@link Throwable} into a plain, JSON-friendly map.
 *
 * <p>The map holds {@code name} (simple class name), {@code message}, {@code errorType}
 * (fully qualified class name), {@code stack} and, when present, a nested {@code cause}.
 * Cause chains that loop back on themselves stop at the first repeated throwable.
 */
public final class ErrorSerializer {

  private ErrorSerializer() {
  }

  public static Map<String, Object> serialize(Throwable error) {
    return serialize(error, true);
  }

  /**
   * @param error the throwable to convert
   * @param includeStack whether {@code stack} entries are included
   * @return an insertion-ordered map, or an empty map for {@code null}
   */
  public static Map<String, Object> serialize(Throwable error, boolean includeStack) {
    if (error == null) {
      return new LinkedHashMap<>();
    }
    return serialize(error, includeStack, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private static Map<String, Object> serialize(Throwable error, boolean includeStack, Set<Throwable> seen) {
    seen.add(error);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("name", error.getClass().getSimpleName());
    result.put("message", error.getMessage());
    result.put("errorType", error.getClass().getName());
    if (includeStack) {
      result.put("stack", stackOf(error));
    }
    Throwable cause = error.getCause();
    if (cause != null && !seen.contains(cause)) {
      result.put("cause", serialize(cause, includeStack, seen));
    }
    return result;
  }

  /**
   * Renders the throwable and its own frames in the familiar {@code printStackTrace} shape,
   * without the cause chain.
   *
   * @param error the throwable
   * @return the stack text
   */
  public static String stackOf(Throwable error) {
    StringBuilder sb = new StringBuilder(error.toString());
    for (StackTraceElement frame : error.getStackTrace()) {
      sb.append("\n\tat ").append(frame);
    }
    return sb.toString();
  }
}
