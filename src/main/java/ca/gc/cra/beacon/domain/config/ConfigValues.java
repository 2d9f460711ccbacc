package ca.gc.cra.beacon.domain.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts plain Java objects into {@link ConfigValue} trees and describes values for diagnostics.
 *
 * @since 0.1.0
 */
public final class ConfigValues {
  private ConfigValues() {}

  /**
   * Parses a raw value once into its tagged form.
   *
   * <p>{@code null} becomes {@link ConfigValue.Scalar#NULL}; {@link Map}s become mappings (keys must be strings);
   * {@link Iterable}s and object arrays become sequences; strings, numbers and booleans become scalars; hook
   * instances become callables. An existing {@link ConfigValue} is returned unchanged.</p>
   *
   * @param raw value produced by a loader, a factory or a caller
   * @return tagged value
   * @throws ConfigException of kind {@link ErrorKind#TYPE_MISMATCH} for any other object
   */
  public static ConfigValue parse(Object raw) {
    if (raw == null) {
      return ConfigValue.Scalar.NULL;
    }
    if (raw instanceof ConfigValue value) {
      return value;
    }
    if (raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
      return new ConfigValue.Scalar(raw);
    }
    if (raw instanceof Character c) {
      return new ConfigValue.Scalar(String.valueOf(c));
    }
    if (raw instanceof Map<?, ?> map) {
      Map<String, ConfigValue> entries = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new ConfigException(
              ErrorKind.TYPE_MISMATCH, "Configuration keys must be strings, found " + entry.getKey());
        }
        entries.put(key, parse(entry.getValue()));
      }
      return new ConfigValue.Mapping(entries);
    }
    if (raw instanceof Iterable<?> iterable) {
      List<ConfigValue> items = new ArrayList<>();
      for (Object item : iterable) {
        items.add(parse(item));
      }
      return new ConfigValue.Sequence(items);
    }
    if (raw instanceof Object[] array) {
      List<ConfigValue> items = new ArrayList<>(array.length);
      for (Object item : array) {
        items.add(parse(item));
      }
      return new ConfigValue.Sequence(items);
    }
    if (raw instanceof ConfigFactory || raw instanceof BuildIdGenerator) {
      return new ConfigValue.Callable(raw);
    }
    throw new ConfigException(
        ErrorKind.TYPE_MISMATCH, "Unsupported configuration value of type " + raw.getClass().getName());
  }

  /**
   * Parses a plain map into a mapping.
   *
   * @param raw plain map; {@code null} yields an empty mapping
   * @return tagged mapping
   */
  public static ConfigValue.Mapping parseMapping(Map<String, ?> raw) {
    if (raw == null) {
      return ConfigValue.Mapping.empty();
    }
    return (ConfigValue.Mapping) parse(raw);
  }

  /**
   * Names the value's type the way configuration authors think about it.
   *
   * @param value tagged value
   * @return one of {@code string}, {@code number}, {@code boolean}, {@code null}, {@code array},
   *     {@code object} or {@code function}
   */
  public static String typeName(ConfigValue value) {
    return switch (value.kind()) {
      case SEQUENCE -> "array";
      case MAPPING -> "object";
      case CALLABLE -> "function";
      case SCALAR -> {
        Object scalar = ((ConfigValue.Scalar) value).value();
        if (scalar == null) {
          yield "null";
        } else if (scalar instanceof String) {
          yield "string";
        } else if (scalar instanceof Boolean) {
          yield "boolean";
        } else {
          yield "number";
        }
      }
    };
  }

  /**
   * Renders a value for inclusion in an error message.
   *
   * @param value tagged value
   * @return short text form
   */
  public static String describe(ConfigValue value) {
    return switch (value.kind()) {
      case SCALAR -> String.valueOf(value.toPlain());
      case CALLABLE -> "[hook " + value.toPlain().getClass().getName() + "]";
      case SEQUENCE, MAPPING -> String.valueOf(value.toPlain());
    };
  }

  /**
   * Returns the string payload when the value is a string scalar.
   *
   * @param value tagged value; may be {@code null}
   * @return string or {@code null}
   */
  public static String stringOrNull(ConfigValue value) {
    if (value instanceof ConfigValue.Scalar scalar && scalar.value() instanceof String s) {
      return s;
    }
    return null;
  }

  /**
   * Indicates whether the value is absent or the null scalar.
   *
   * @param value tagged value; may be {@code null}
   * @return {@code true} for missing or undefined values
   */
  public static boolean isAbsent(ConfigValue value) {
    return value == null || (value instanceof ConfigValue.Scalar scalar && scalar.isNull());
  }
}
