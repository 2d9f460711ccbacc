package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import java.util.Optional;

/** Lookup helpers shared by the passes. */
final class Trees {
  private Trees() {}

  /** Returns the value at {@code key} unless it is absent or null. */
  static Optional<ConfigValue> defined(ConfigValue.Mapping config, String key) {
    ConfigValue value = config.entries().get(key);
    return ConfigValues.isAbsent(value) ? Optional.empty() : Optional.of(value);
  }

  /** Returns the mapping at {@code key} when the value there is a mapping. */
  static Optional<ConfigValue.Mapping> mapping(ConfigValue.Mapping config, String key) {
    return config.entries().get(key) instanceof ConfigValue.Mapping nested
        ? Optional.of(nested)
        : Optional.empty();
  }

  /** Returns the string at {@code key} when the value there is a string scalar. */
  static Optional<String> string(ConfigValue.Mapping config, String key) {
    return Optional.ofNullable(ConfigValues.stringOrNull(config.entries().get(key)));
  }

  static boolean isNonEmptyString(ConfigValue value) {
    String text = ConfigValues.stringOrNull(value);
    return text != null && !text.isEmpty();
  }

  static boolean isStringSequence(ConfigValue value) {
    if (!(value instanceof ConfigValue.Sequence sequence)) {
      return false;
    }
    for (ConfigValue item : sequence.items()) {
      if (ConfigValues.stringOrNull(item) == null) {
        return false;
      }
    }
    return true;
  }
}
