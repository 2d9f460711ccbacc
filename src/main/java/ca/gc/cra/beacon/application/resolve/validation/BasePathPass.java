package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;

/**
 * Checks {@code basePath}: either empty, or a prefix that starts with {@code /} and does not end with one.
 */
final class BasePathPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue value = config.entries().get("basePath");
    if (value == null) {
      return config;
    }
    String basePath = ConfigValues.stringOrNull(value);
    if (basePath == null) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified basePath is not a string, found type \"" + ConfigValues.typeName(value) + "\"");
    }
    if (basePath.isEmpty()) {
      return config;
    }
    if ("/".equals(basePath)) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Specified basePath /. basePath has to be either an empty string or a path prefix");
    }
    if (!basePath.startsWith("/")) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Specified basePath has to start with a /, found \"" + basePath + "\"");
    }
    if (basePath.endsWith("/")) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Specified basePath should not end with /, found \"" + basePath + "\"");
    }
    return config;
  }
}
