package io.vision.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites map keys into a target {@link KeyCasing}, recursively through nested maps,
 * lists and object arrays.
 *
 * <p>Word splitting is deliberately simple: keys are split on runs of {@code -},
 * {@code _} and whitespace, then before every ASCII uppercase letter. Acronyms are
 * therefore split letter by letter ({@code XMLHttpRequest} becomes
 * {@code x_m_l_http_request} in snake case) and the transformation is lossy.
 *
 * <p>Only {@link Map}, {@link List} and {@code Object[]} values are traversed; every other
 * value, including other collections, passes through by reference. A container reached
 * again while it is still being traversed is returned as-is, so cyclic structures
 * terminate and keep their cycle.
 */
public final class KeyNormalizer {
  private static final Pattern SEPARATORS = Pattern.compile("[-_\\s]+");
  private static final Pattern UPPERCASE_BOUNDARY = Pattern.compile("(?=[A-Z])");

  private KeyNormalizer() {
  }

  /**
   * Rewrites one key.
   *
   * @param key the key to rewrite
   * @param casing the target casing
   * @return the rewritten key; {@code key} itself for {@link KeyCasing#NONE}
   */
  public static String transformKey(String key, KeyCasing casing) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(casing, "casing");
    if (casing == KeyCasing.NONE) {
      return key;
    }
    List<String> words = splitIntoWords(key);
    StringBuilder sb = new StringBuilder(key.length() + words.size());
    switch (casing) {
      case CAMEL_CASE:
        sb.append(words.get(0).toLowerCase(Locale.ROOT));
        for (int i = 1; i < words.size(); i++) {
          sb.append(capitalize(words.get(i)));
        }
        break;
      case PASCAL_CASE:
        for (String word : words) {
          sb.append(capitalize(word));
        }
        break;
      case SNAKE_CASE:
        return join(words, '_');
      case KEBAB_CASE:
        return join(words, '-');
      default:
        throw new IllegalArgumentException("Unsupported casing: " + casing);
    }
    return sb.toString();
  }

  /**
   * Deeply normalizes the keys of {@code value}.
   *
   * @param value any value; maps, lists and object arrays are rebuilt
   * @param casing the target casing
   * @return the normalized value, or {@code value} itself when nothing is rebuilt
   */
  public static Object normalize(Object value, KeyCasing casing) {
    Objects.requireNonNull(casing, "casing");
    if (casing == KeyCasing.NONE) {
      return value;
    }
    return normalize(value, casing, newIdentitySet());
  }

  /**
   * Normalizes the keys of a data map. With {@code deep == false} only the top-level keys
   * are rewritten and values are kept as they are.
   *
   * @param data the map to normalize
   * @param casing the target casing
   * @param deep whether nested containers are normalized too
   * @return a new insertion-ordered map; colliding keys keep the last value
   */
  public static Map<String, Object> normalizeKeys(Map<String, ?> data, KeyCasing casing, boolean deep) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(casing, "casing");
    Set<Object> inProgress = newIdentitySet();
    inProgress.add(data);
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : data.entrySet()) {
      Object value = deep ? normalize(entry.getValue(), casing, inProgress) : entry.getValue();
      result.put(transformKey(entry.getKey(), casing), value);
    }
    return result;
  }

  private static Object normalize(Object value, KeyCasing casing, Set<Object> inProgress) {
    if (value instanceof Map<?, ?> map) {
      if (!inProgress.add(map)) {
        return map;
      }
      try {
        Map<Object, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
          Object key = entry.getKey() instanceof String s ? transformKey(s, casing) : entry.getKey();
          result.put(key, normalize(entry.getValue(), casing, inProgress));
        }
        return result;
      } finally {
        inProgress.remove(map);
      }
    }
    if (value instanceof List<?> list) {
      if (!inProgress.add(list)) {
        return list;
      }
      try {
        List<Object> result = new ArrayList<>(list.size());
        for (Object element : list) {
          result.add(normalize(element, casing, inProgress));
        }
        return result;
      } finally {
        inProgress.remove(list);
      }
    }
    if (value instanceof Object[] array) {
      if (!inProgress.add(array)) {
        return array;
      }
      try {
        List<Object> result = new ArrayList<>(array.length);
        for (Object element : array) {
          result.add(normalize(element, casing, inProgress));
        }
        return result;
      } finally {
        inProgress.remove(array);
      }
    }
    return value;
  }

  static List<String> splitIntoWords(String key) {
    if (key.length() <= 1) {
      return List.of(key);
    }
    List<String> words = new ArrayList<>();
    for (String part : SEPARATORS.split(key)) {
      if (part.isEmpty()) {
        continue;
      }
      for (String word : UPPERCASE_BOUNDARY.split(part)) {
        if (!word.isEmpty()) {
          words.add(word);
        }
      }
    }
    return words.isEmpty() ? List.of(key) : words;
  }

  private static String capitalize(String word) {
    if (word.isEmpty()) {
      return word;
    }
    return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
  }

  private static String join(List<String> words, char separator) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < words.size(); i++) {
      if (i > 0) {
        sb.append(separator);
      }
      sb.append(words.get(i).toLowerCase(Locale.ROOT));
    }
    return sb.toString();
  }

  private static Set<Object> newIdentitySet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}
