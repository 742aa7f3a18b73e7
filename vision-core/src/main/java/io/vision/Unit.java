package io.vision;

import com.github.f4b6a3.ulid.UlidCreator;
import io.vision.normalize.KeyNormalizer;
import io.vision.normalize.NormalizationConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One observed operation: identity, classification and the data attached while it runs.
 *
 * <p>A unit is mutable only while its work executes. Once fan-out to sinks begins the
 * unit is sealed: {@link #data()} returns a frozen snapshot and every mutation throws
 * {@link IllegalStateException}. Nested maps, lists and sets are copied when the unit is
 * sealed, so changes to a collection passed to {@link #set} do not reach sinks.
 *
 * <p>Mutations within one call tree are expected to be sequential. A unit is not
 * safe for concurrent mutation from parallel branches.
 *
 * @see Vision#observe(UnitConfig, UnitWork)
 */
public final class Unit {
  private final String id;
  private final Instant createdAt;
  private final String name;
  private final String scope;
  private final String source;
  private final Map<String, Object> data;
  private volatile UnitState state;
  private volatile Map<String, Object> sealedData;

  private Unit(UnitConfig config) {
    this.id = UlidCreator.getMonotonicUlid().toString();
    this.createdAt = Instant.now();
    this.name = config.name();
    this.scope = config.scope();
    this.source = config.source();
    this.data = new LinkedHashMap<>(config.initial());
    this.state = UnitState.CREATED;
  }

  private Unit(Unit origin, Map<String, Object> data) {
    this.id = origin.id;
    this.createdAt = origin.createdAt;
    this.name = origin.name;
    this.scope = origin.scope;
    this.source = origin.source;
    this.data = data;
    this.state = origin.state;
    this.sealedData = freeze(data);
  }

  /**
   * Creates a new unit in state {@link UnitState#CREATED}. Normally called by the
   * lifecycle pipeline; adapters and tests may create detached units directly.
   *
   * @param config the unit description
   * @return a new unit
   */
  public static Unit create(UnitConfig config) {
    return new Unit(Objects.requireNonNull(config, "config"));
  }

  public String id() {
    return id;
  }

  public Instant createdAt() {
    return createdAt;
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

  public UnitState state() {
    return state;
  }

  /**
   * Returns the unit's data in insertion order. While running this is a read-only
   * view of the live map; once sealed it is an immutable snapshot.
   *
   * @return the data map (never {@code null})
   */
  public Map<String, Object> data() {
    Map<String, Object> sealed = sealedData;
    return sealed != null ? sealed : Collections.unmodifiableMap(data);
  }

  /**
   * Stores a value, overwriting any previous value for the key.
   *
   * @param key the data key
   * @param value the value, may be {@code null}
   */
  public void set(String key, Object value) {
    checkMutable();
    data.put(Objects.requireNonNull(key, "key"), value);
  }

  /**
   * @param key the data key
   * @return the current value, or {@code null} when absent
   */
  public Object get(String key) {
    return data().get(key);
  }

  /**
   * Typed variant of {@link #get(String)}.
   *
   * @throws ClassCastException if the value is not of the requested type
   */
  public <T> T get(String key, Class<T> type) {
    return type.cast(get(key));
  }

  /**
   * Appends a value to the list stored under {@code key}, creating the list when absent.
   *
   * @param key the data key
   * @param value the value to append, may be {@code null}
   * @throws IllegalStateException if the key holds a value that is not a list
   */
  public void push(String key, Object value) {
    checkMutable();
    Objects.requireNonNull(key, "key");
    Object existing = data.get(key);
    if (existing instanceof PushList list) {
      list.add(value);
      return;
    }
    PushList list;
    if (existing == null) {
      list = new PushList();
    } else if (existing instanceof List<?> values) {
      list = new PushList(values);
    } else {
      throw new IllegalStateException("Cannot push onto '" + key + "': existing value is a "
          + existing.getClass().getName() + ", not a list");
    }
    list.add(value);
    data.put(key, list);
  }

  /**
   * Shallow-merges {@code partial} into the map stored under {@code key}. Entries of
   * {@code partial} win. An absent key, or one holding a non-map value, is replaced by
   * a copy of {@code partial}.
   *
   * @param key the data key
   * @param partial the entries to merge
   */
  public void merge(String key, Map<String, ?> partial) {
    checkMutable();
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(partial, "partial");
    Map<Object, Object> merged = new LinkedHashMap<>();
    if (data.get(key) instanceof Map<?, ?> existing) {
      merged.putAll(existing);
    }
    merged.putAll(partial);
    data.put(key, merged);
  }

  /**
   * Returns a sealed copy of this unit whose data keys were rewritten by the key
   * normalizer. Returns {@code this} when normalization is disabled.
   *
   * @param config the normalization settings
   * @return the normalized unit
   */
  public Unit normalized(NormalizationConfig config) {
    Objects.requireNonNull(config, "config");
    if (!config.isActive()) {
      return this;
    }
    return new Unit(this, KeyNormalizer.normalizeKeys(data(), config.keyCasing(), config.deep()));
  }

  void transition(UnitState next) {
    if (next.isSealed() && sealedData == null) {
      sealedData = freeze(data);
    }
    state = next;
  }

  private void checkMutable() {
    if (sealedData != null) {
      throw new IllegalStateException("Unit '" + name + "' (" + id + ") is sealed in state " + state);
    }
  }

  private static Map<String, Object> freeze(Map<String, Object> source) {
    Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      copy.put(entry.getKey(), freezeValue(entry.getValue(), inProgress));
    }
    return Collections.unmodifiableMap(copy);
  }

  // A container already being copied is kept by reference, which stops at cycles.
  private static Object freezeValue(Object value, Set<Object> inProgress) {
    if (!(value instanceof Map<?, ?> || value instanceof Collection<?>) || !inProgress.add(value)) {
      return value;
    }
    try {
      if (value instanceof Map<?, ?> map) {
        Map<Object, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, freezeValue(v, inProgress)));
        return Collections.unmodifiableMap(copy);
      }
      Collection<?> values = (Collection<?>) value;
      if (values instanceof Set<?>) {
        Set<Object> copy = new LinkedHashSet<>();
        values.forEach(v -> copy.add(freezeValue(v, inProgress)));
        return Collections.unmodifiableSet(copy);
      }
      List<Object> copy = new ArrayList<>(values.size());
      values.forEach(v -> copy.add(freezeValue(v, inProgress)));
      return Collections.unmodifiableList(copy);
    } finally {
      inProgress.remove(value);
    }
  }

  @Override
  public String toString() {
    return "Unit{id=" + id + ", name=" + name + ", scope=" + scope + ", state=" + state + "}";
  }

  /** Marks lists owned by the unit, which {@link #push} may append to in place. */
  private static final class PushList extends ArrayList<Object> {
    private static final long serialVersionUID = 1L;

    PushList() {
    }

    PushList(Collection<?> values) {
      super(values);
    }
  }
}
