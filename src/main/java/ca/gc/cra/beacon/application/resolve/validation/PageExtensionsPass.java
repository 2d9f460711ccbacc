package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;

/** Checks {@code pageExtensions}: a non-empty sequence of strings. */
final class PageExtensionsPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue value = config.entries().get("pageExtensions");
    if (value == null) {
      return config;
    }
    if (!(value instanceof ConfigValue.Sequence extensions)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified pageExtensions is not an array of strings, found \"" + ConfigValues.describe(value)
              + "\". Please update this config or remove it.");
    }
    if (extensions.size() == 0) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Specified pageExtensions is an empty array. Please update it with the relevant extensions or remove it.");
    }
    for (ConfigValue extension : extensions.items()) {
      if (ConfigValues.stringOrNull(extension) == null) {
        throw new ConfigException(
            ErrorKind.TYPE_MISMATCH,
            "Specified pageExtensions is not an array of strings, found \"" + ConfigValues.describe(extension)
                + "\" of type \"" + ConfigValues.typeName(extension) + "\". Please update this config or remove it.");
      }
    }
    return config;
  }
}
