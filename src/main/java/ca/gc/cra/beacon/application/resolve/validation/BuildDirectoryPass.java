package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;

/** Checks {@code distDir}: a string, not blank, and not the reserved {@code public} directory. */
final class BuildDirectoryPass implements ValidationPass {
  static final String RESERVED = "public";

  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue value = config.entries().get("distDir");
    if (value == null) {
      return config;
    }
    String distDir = ConfigValues.stringOrNull(value);
    if (distDir == null) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified distDir is not a string, found type \"" + ConfigValues.typeName(value) + "\"");
    }
    String trimmed = distDir.trim();
    if (RESERVED.equals(trimmed)) {
      throw new ConfigException(
          ErrorKind.RESERVED_VALUE,
          "The 'public' directory is reserved and can not be set as the 'distDir'. "
              + "Please choose another directory name.");
    }
    if (trimmed.isEmpty()) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Invalid distDir provided, distDir can not be an empty string. Please remove this config or set it to a "
              + "directory name.");
    }
    return config;
  }
}
