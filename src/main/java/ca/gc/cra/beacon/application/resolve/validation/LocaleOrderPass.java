package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves {@code i18n.defaultLocale} to the front of {@code i18n.locales}.
 *
 * <p>The remaining locales keep their order; other occurrences of the default are dropped.</p>
 */
final class LocaleOrderPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue.Mapping experimental = Trees.mapping(config, "experimental").orElse(null);
    if (experimental == null) {
      return config;
    }
    ConfigValue.Mapping i18n = Trees.mapping(experimental, "i18n").orElse(null);
    if (i18n == null
        || !(i18n.entries().get("locales") instanceof ConfigValue.Sequence locales)) {
      return config;
    }
    String defaultLocale = Trees.string(i18n, "defaultLocale").orElse(null);
    if (defaultLocale == null) {
      return config;
    }
    List<ConfigValue> ordered = new ArrayList<>(locales.size());
    ordered.add(ConfigValue.Scalar.of(defaultLocale));
    for (ConfigValue locale : locales.items()) {
      if (!defaultLocale.equals(ConfigValues.stringOrNull(locale))) {
        ordered.add(locale);
      }
    }
    ConfigValue.Mapping reordered = i18n.with("locales", ConfigValue.Sequence.of(ordered));
    return config.with("experimental", experimental.with("i18n", reordered));
  }
}
