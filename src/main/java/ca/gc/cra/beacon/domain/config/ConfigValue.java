package ca.gc.cra.beacon.domain.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Tagged configuration value with the closed variant set
 * {@link Kind#SCALAR}, {@link Kind#SEQUENCE}, {@link Kind#MAPPING} and {@link Kind#CALLABLE}.
 * <p><strong>Why:</strong> The merge engine and validators dispatch on {@link #kind()} instead of inspecting
 * arbitrary Java objects at every step; the shape of a raw value is decided once by {@link ConfigValues#parse}.</p>
 * <p><strong>Thread-safety:</strong> All variants are deeply immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface ConfigValue
    permits ConfigValue.Scalar, ConfigValue.Sequence, ConfigValue.Mapping, ConfigValue.Callable {

  /** Variant tag. */
  enum Kind {
    SCALAR,
    SEQUENCE,
    MAPPING,
    CALLABLE
  }

  /**
   * Returns the variant tag.
   *
   * @return tag; never {@code null}
   */
  Kind kind();

  /**
   * Converts the value back to plain Java objects ({@link Map}, {@link List}, boxed scalars, hook instances).
   *
   * @return unmodifiable plain representation; {@code null} for the null scalar
   */
  Object toPlain();

  /**
   * String, number, boolean or {@code null}. The {@code null} scalar marks an undefined value.
   *
   * @param value scalar payload
   */
  record Scalar(Object value) implements ConfigValue {
    /** Undefined-equivalent sentinel. */
    public static final Scalar NULL = new Scalar(null);

    public Scalar {
      if (value != null
          && !(value instanceof String)
          && !(value instanceof Number)
          && !(value instanceof Boolean)) {
        throw new IllegalArgumentException("Unsupported scalar type " + value.getClass().getName());
      }
    }

    public static Scalar of(Object value) {
      return value == null ? NULL : new Scalar(value);
    }

    @Override
    public Kind kind() {
      return Kind.SCALAR;
    }

    @Override
    public Object toPlain() {
      return value;
    }

    public boolean isNull() {
      return value == null;
    }

    public Optional<String> asString() {
      return value instanceof String s ? Optional.of(s) : Optional.empty();
    }
  }

  /**
   * Ordered sequence of values.
   *
   * @param items elements in declaration order
   */
  record Sequence(List<ConfigValue> items) implements ConfigValue {
    public Sequence {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public static Sequence of(List<? extends ConfigValue> items) {
      return new Sequence(List.copyOf(items));
    }

    public static Sequence ofStrings(List<String> values) {
      List<ConfigValue> items = new ArrayList<>(values.size());
      for (String value : values) {
        items.add(Scalar.of(value));
      }
      return new Sequence(items);
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENCE;
    }

    @Override
    public Object toPlain() {
      List<Object> plain = new ArrayList<>(items.size());
      for (ConfigValue item : items) {
        plain.add(item.toPlain());
      }
      return Collections.unmodifiableList(plain);
    }

    public int size() {
      return items.size();
    }
  }

  /**
   * String-keyed structural record. Insertion order is preserved.
   *
   * @param entries key/value pairs
   */
  record Mapping(Map<String, ConfigValue> entries) implements ConfigValue {
    private static final Mapping EMPTY = new Mapping(Map.of());

    public Mapping {
      Objects.requireNonNull(entries, "entries");
      Map<String, ConfigValue> copy = new LinkedHashMap<>();
      for (Map.Entry<String, ConfigValue> entry : entries.entrySet()) {
        copy.put(
            Objects.requireNonNull(entry.getKey(), "key"),
            Objects.requireNonNull(entry.getValue(), "value"));
      }
      entries = Collections.unmodifiableMap(copy);
    }

    public static Mapping empty() {
      return EMPTY;
    }

    @Override
    public Kind kind() {
      return Kind.MAPPING;
    }

    @Override
    public Object toPlain() {
      Map<String, Object> plain = new LinkedHashMap<>();
      for (Map.Entry<String, ConfigValue> entry : entries.entrySet()) {
        plain.put(entry.getKey(), entry.getValue().toPlain());
      }
      return Collections.unmodifiableMap(plain);
    }

    public Optional<ConfigValue> get(String key) {
      return Optional.ofNullable(entries.get(key));
    }

    public boolean has(String key) {
      return entries.containsKey(key);
    }

    public Set<String> keys() {
      return entries.keySet();
    }

    public int size() {
      return entries.size();
    }

    public boolean isEmpty() {
      return entries.isEmpty();
    }

    /**
     * Returns a copy with {@code key} set to {@code value}; an existing key keeps its position.
     *
     * @param key entry key
     * @param value new value
     * @return new mapping
     */
    public Mapping with(String key, ConfigValue value) {
      Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
      copy.put(key, value);
      return new Mapping(copy);
    }

    /**
     * Returns a copy without {@code key}.
     *
     * @param key entry key
     * @return new mapping, or this mapping when the key is absent
     */
    public Mapping without(String key) {
      if (!entries.containsKey(key)) {
        return this;
      }
      Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
      copy.remove(key);
      return new Mapping(copy);
    }
  }

  /**
   * Executable hook such as a {@link ConfigFactory} or a {@link BuildIdGenerator}.
   *
   * @param target hook instance
   */
  record Callable(Object target) implements ConfigValue {
    public Callable {
      Objects.requireNonNull(target, "target");
      if (!(target instanceof ConfigFactory) && !(target instanceof BuildIdGenerator)) {
        throw new IllegalArgumentException("Unsupported hook type " + target.getClass().getName());
      }
    }

    @Override
    public Kind kind() {
      return Kind.CALLABLE;
    }

    @Override
    public Object toPlain() {
      return target;
    }
  }
}
