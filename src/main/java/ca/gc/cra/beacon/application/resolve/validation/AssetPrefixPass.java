package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;

/** Checks that {@code assetPrefix} is a string. */
final class AssetPrefixPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue value = config.entries().get("assetPrefix");
    if (value != null && ConfigValues.stringOrNull(value) == null) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified assetPrefix is not a string, found type \"" + ConfigValues.typeName(value) + "\"");
    }
    return config;
  }
}
