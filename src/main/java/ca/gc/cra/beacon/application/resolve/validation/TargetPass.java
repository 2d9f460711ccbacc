package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import ca.gc.cra.beacon.domain.config.Target;

/** Rejects a {@code target} outside the {@link Target} set. */
final class TargetPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    Trees.defined(config, "target").ifPresent(value -> {
      String text = ConfigValues.stringOrNull(value);
      if (text == null || Target.fromValue(text).isEmpty()) {
        throw new ConfigException(
            ErrorKind.ENUM_VIOLATION,
            "Specified target is invalid. Provided: \"" + ConfigValues.describe(value) + "\" should be one of "
                + Target.allowedValues());
      }
    });
    return config;
  }
}
