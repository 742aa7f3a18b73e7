package io.vision.normalize;

import java.util.Objects;

/**
 * Target key casing styles understood by {@link KeyNormalizer}.
 */
public enum KeyCasing {
  CAMEL_CASE("camelCase"),
  SNAKE_CASE("snake_case"),
  KEBAB_CASE("kebab-case"),
  PASCAL_CASE("PascalCase"),
  NONE("none");

  private final String style;

  KeyCasing(String style) {
    this.style = style;
  }

  /**
   * Returns the conventional spelling of this style, e.g. {@code "snake_case"}.
   *
   * @return the style name
   */
  public String style() {
    return style;
  }

  /**
   * Rewrites a single key in this style.
   *
   * @param key the key to rewrite
   * @return the rewritten key
   * @see KeyNormalizer#transformKey(String, KeyCasing)
   */
  public String transform(String key) {
    return KeyNormalizer.transformKey(key, this);
  }

  /**
   * Resolves a casing from either its style spelling ({@code "kebab-case"}) or its
   * constant name ({@code "KEBAB_CASE"}), ignoring case.
   *
   * @param value the style or constant name
   * @return the matching casing
   * @throws IllegalArgumentException if nothing matches
   */
  public static KeyCasing fromStyle(String value) {
    Objects.requireNonNull(value, "value");
    for (KeyCasing casing : values()) {
      if (casing.style.equalsIgnoreCase(value) || casing.name().equalsIgnoreCase(value)) {
        return casing;
      }
    }
    throw new IllegalArgumentException("Unknown key casing: " + value);
  }
}
