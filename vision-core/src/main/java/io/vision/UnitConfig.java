package io.vision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a unit to open: its name, classification and initial data.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * UnitConfig config = UnitConfig.builder("checkout")
 *     .scope("http")
 *     .source("orders-service")
 *     .initial("cart.size", 3)
 *     .build();
 * }</pre>
 */
public final class UnitConfig {
  private final String name;
  private final String scope;
  private final String source;
  private final Map<String, Object> initial;

  private UnitConfig(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    this.scope = builder.scope;
    this.source = builder.source;
    this.initial = Collections.unmodifiableMap(new LinkedHashMap<>(builder.initial));
  }

  /**
   * Creates a config with only a name.
   *
   * @param name the logical operation name
   * @return a new config
   */
  public static UnitConfig of(String name) {
    return builder(name).build();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  /** @return the scope, or {@code null} when unset */
  public String scope() {
    return scope;
  }

  /** @return the source, or {@code null} when unset */
  public String source() {
    return source;
  }

  public Map<String, Object> initial() {
    return initial;
  }

  /** Builder for {@link UnitConfig}. */
  public static final class Builder {
    private final String name;
    private String scope;
    private String source;
    private final Map<String, Object> initial = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder scope(String scope) {
      this.scope = scope;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    /**
     * Adds one initial data entry. Later entries with the same key win.
     *
     * @param key the data key
     * @param value the value, may be {@code null}
     * @return this builder
     */
    public Builder initial(String key, Object value) {
      this.initial.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder initial(Map<String, ?> initial) {
      Objects.requireNonNull(initial, "initial");
      initial.forEach(this::initial);
      return this;
    }

    /**
     * @return a new {@link UnitConfig}
     * @throws NullPointerException if {@code name} is null
     * @throws IllegalArgumentException if {@code name} is empty
     */
    public UnitConfig build() {
      return new UnitConfig(this);
    }
  }
}
