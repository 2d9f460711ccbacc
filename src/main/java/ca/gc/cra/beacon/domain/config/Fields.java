package ca.gc.cra.beacon.domain.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed field readers used when binding a validated tree to the configuration records.
 */
final class Fields {
  private Fields() {}

  static ConfigValue require(ConfigValue.Mapping source, String key, String path) {
    ConfigValue value = source.entries().get(key);
    if (value == null) {
      throw mismatch(path, "a value", "undefined");
    }
    return value;
  }

  static boolean defined(ConfigValue.Mapping source, String key) {
    return !ConfigValues.isAbsent(source.entries().get(key));
  }

  static String string(ConfigValue.Mapping source, String key, String path) {
    ConfigValue value = require(source, key, path);
    String s = ConfigValues.stringOrNull(value);
    if (s == null) {
      throw mismatch(path, "a string", ConfigValues.typeName(value));
    }
    return s;
  }

  static boolean bool(ConfigValue.Mapping source, String key, String path) {
    ConfigValue value = require(source, key, path);
    if (value instanceof ConfigValue.Scalar scalar && scalar.value() instanceof Boolean b) {
      return b;
    }
    throw mismatch(path, "a boolean", ConfigValues.typeName(value));
  }

  static int integer(ConfigValue.Mapping source, String key, String path) {
    return toInt(require(source, key, path), path);
  }

  static long longValue(ConfigValue.Mapping source, String key, String path) {
    ConfigValue value = require(source, key, path);
    Number number = wholeNumber(value);
    if (number == null) {
      throw mismatch(path, "a whole number", ConfigValues.typeName(value));
    }
    return number.longValue();
  }

  static ConfigValue.Mapping mapping(ConfigValue.Mapping source, String key, String path) {
    ConfigValue value = require(source, key, path);
    if (value instanceof ConfigValue.Mapping mapping) {
      return mapping;
    }
    throw mismatch(path, "an object", ConfigValues.typeName(value));
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> plainMap(ConfigValue.Mapping source, String key, String path) {
    return (Map<String, Object>) mapping(source, key, path).toPlain();
  }

  static ConfigValue.Sequence sequence(ConfigValue.Mapping source, String key, String path) {
    ConfigValue value = require(source, key, path);
    if (value instanceof ConfigValue.Sequence sequence) {
      return sequence;
    }
    throw mismatch(path, "an array", ConfigValues.typeName(value));
  }

  static List<String> stringList(ConfigValue.Mapping source, String key, String path) {
    List<String> result = new ArrayList<>();
    for (ConfigValue item : sequence(source, key, path).items()) {
      String s = ConfigValues.stringOrNull(item);
      if (s == null) {
        throw mismatch(path, "an array of strings", "an element of type " + ConfigValues.typeName(item));
      }
      result.add(s);
    }
    return List.copyOf(result);
  }

  static List<Number> numberList(ConfigValue.Mapping source, String key, String path) {
    List<Number> result = new ArrayList<>();
    for (ConfigValue item : sequence(source, key, path).items()) {
      if (!(item instanceof ConfigValue.Scalar scalar) || !(scalar.value() instanceof Number number)) {
        throw mismatch(path, "an array of numbers", "an element of type " + ConfigValues.typeName(item));
      }
      result.add(number);
    }
    return List.copyOf(result);
  }

  /**
   * Collects entries whose keys are not part of the schema, preserving their order.
   */
  static Map<String, Object> extras(ConfigValue.Mapping source, Set<String> known) {
    Map<String, Object> extras = new LinkedHashMap<>();
    for (Map.Entry<String, ConfigValue> entry : source.entries().entrySet()) {
      if (!known.contains(entry.getKey())) {
        extras.put(entry.getKey(), entry.getValue().toPlain());
      }
    }
    return Collections.unmodifiableMap(extras);
  }

  static void putExtras(Map<String, ConfigValue> target, Map<String, Object> extras) {
    for (Map.Entry<String, Object> entry : extras.entrySet()) {
      target.putIfAbsent(entry.getKey(), ConfigValues.parse(entry.getValue()));
    }
  }

  static Map<String, Object> copyOf(Map<String, Object> source) {
    return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  static ConfigValue.Sequence numbers(List<Number> values) {
    List<ConfigValue> items = new ArrayList<>(values.size());
    for (Number value : values) {
      items.add(ConfigValue.Scalar.of(value));
    }
    return new ConfigValue.Sequence(items);
  }

  private static int toInt(ConfigValue value, String path) {
    Number number = wholeNumber(value);
    if (number == null || number.longValue() > Integer.MAX_VALUE || number.longValue() < Integer.MIN_VALUE) {
      throw mismatch(path, "a whole number", ConfigValues.typeName(value));
    }
    return number.intValue();
  }

  private static Number wholeNumber(ConfigValue value) {
    if (value instanceof ConfigValue.Scalar scalar && scalar.value() instanceof Number number) {
      double d = number.doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return number;
      }
    }
    return null;
  }

  private static ConfigException mismatch(String path, String expected, String found) {
    return new ConfigException(
        ErrorKind.TYPE_MISMATCH, "Specified " + path + " should be " + expected + ", found " + found);
  }
}
