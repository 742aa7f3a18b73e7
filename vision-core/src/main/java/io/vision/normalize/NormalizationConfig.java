package io.vision.normalize;

import java.util.Objects;

/**
 * Settings for consumer-side key normalization.
 *
 * @param enabled whether normalization is applied at all
 * @param keyCasing the target casing
 * @param deep whether nested maps and lists are normalized, or only top-level keys
 */
public record NormalizationConfig(boolean enabled, KeyCasing keyCasing, boolean deep) {

  /** Normalization switched off. */
  public static final NormalizationConfig DISABLED = new NormalizationConfig(false, KeyCasing.NONE, true);

  public NormalizationConfig {
    Objects.requireNonNull(keyCasing, "keyCasing");
  }

  /**
   * Enabled, deep normalization into {@code keyCasing}.
   *
   * @param keyCasing the target casing
   * @return a new config
   */
  public static NormalizationConfig of(KeyCasing keyCasing) {
    return new NormalizationConfig(true, keyCasing, true);
  }

  /**
   * @return {@code true} when keys would actually be rewritten
   */
  public boolean isActive() {
    return enabled && keyCasing != KeyCasing.NONE;
  }
}
