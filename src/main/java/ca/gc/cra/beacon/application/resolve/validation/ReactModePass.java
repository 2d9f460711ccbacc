package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import ca.gc.cra.beacon.domain.config.ReactMode;

/** Rejects an {@code experimental.reactMode} outside the {@link ReactMode} set. */
final class ReactModePass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    Trees.mapping(config, "experimental")
        .flatMap(experimental -> Trees.defined(experimental, "reactMode"))
        .ifPresent(value -> {
          String text = ConfigValues.stringOrNull(value);
          if (text == null || ReactMode.fromValue(text).isEmpty()) {
            throw new ConfigException(
                ErrorKind.ENUM_VIOLATION,
                "Specified React Mode is invalid. Provided: " + ConfigValues.describe(value)
                    + " should be one of " + ReactMode.allowedValues());
          }
        });
    return config;
  }
}
