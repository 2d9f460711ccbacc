package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.application.json.JsonText;
import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Checks {@code experimental.i18n} when it is enabled.
 * <p><strong>Rules:</strong> the record must list locale strings, name a default locale that appears in the list,
 * and carry a boolean {@code localeDetection} when one is given. Each entry of {@code domains} must name a domain
 * and a default locale, and no locale may be claimed by two domains.</p>
 * <p>Every invalid domain entry is reported in a single error. A locale claimed twice also logs a warning naming
 * both domains, and both entries count as invalid.</p>
 *
 * @since 0.1.0
 */
final class I18nPass implements ValidationPass {
  private static final Logger log = LoggerFactory.getLogger(I18nPass.class);

  private static final String DOMAIN_FORMAT =
      "{ domain: 'example.fr', defaultLocale: 'fr', locales: ['fr'] }";

  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue.Mapping experimental = Trees.mapping(config, "experimental").orElse(null);
    if (experimental == null) {
      return config;
    }
    ConfigValue value = experimental.entries().get("i18n");
    if (!isEnabled(value)) {
      return config;
    }
    if (!(value instanceof ConfigValue.Mapping i18n)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified i18n should be an object received " + ConfigValues.typeName(value) + ".");
    }

    ConfigValue locales = i18n.entries().get("locales");
    if (!(locales instanceof ConfigValue.Sequence localeList)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified i18n.locales should be an Array received " + typeNameOf(locales) + ".");
    }
    if (!Trees.isStringSequence(localeList)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified i18n.locales contains invalid values, locales must be valid locale tags provided as strings "
              + "e.g. \"en-US\".");
    }
    if (localeList.size() == 0) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION, "Specified i18n.locales should contain at least one locale.");
    }

    ConfigValue defaultLocale = i18n.entries().get("defaultLocale");
    if (!Trees.isNonEmptyString(defaultLocale)) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Specified i18n.defaultLocale should be a non-empty string, received " + typeNameOf(defaultLocale) + ".");
    }

    Trees.defined(i18n, "domains").ifPresent(I18nPass::checkDomains);

    if (!localeList.items().contains(defaultLocale)) {
      throw new ConfigException(
          ErrorKind.STRUCTURAL_VIOLATION,
          "Specified i18n.defaultLocale (" + ConfigValues.stringOrNull(defaultLocale)
              + ") should be included in i18n.locales.");
    }

    Trees.defined(i18n, "localeDetection").ifPresent(detection -> {
      if (!(detection instanceof ConfigValue.Scalar scalar) || !(scalar.value() instanceof Boolean)) {
        throw new ConfigException(
            ErrorKind.TYPE_MISMATCH,
            "Specified i18n.localeDetection should be undefined or a boolean received "
                + ConfigValues.typeName(detection) + ".");
      }
    });
    return config;
  }

  private static boolean isEnabled(ConfigValue value) {
    if (ConfigValues.isAbsent(value)) {
      return false;
    }
    return !(value instanceof ConfigValue.Scalar scalar && Boolean.FALSE.equals(scalar.value()));
  }

  private static String typeNameOf(ConfigValue value) {
    return value == null ? "undefined" : ConfigValues.typeName(value);
  }

  private static void checkDomains(ConfigValue value) {
    if (!(value instanceof ConfigValue.Sequence domains)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified i18n.domains must be an array of domain objects e.g. [ " + DOMAIN_FORMAT + " ] received "
              + ConfigValues.typeName(value) + ".");
    }
    List<ConfigValue> invalid = new ArrayList<>();
    List<ConfigValue> items = domains.items();
    for (int index = 0; index < items.size(); index++) {
      if (!isValidDomain(items, index)) {
        invalid.add(items.get(index));
      }
    }
    if (invalid.isEmpty()) {
      return;
    }
    StringBuilder message = new StringBuilder("Invalid i18n.domains values:");
    for (ConfigValue item : invalid) {
      message.append('\n').append(JsonText.compact(item));
    }
    message.append("\n\ndomains value must follow format ").append(DOMAIN_FORMAT);
    throw new ConfigException(ErrorKind.STRUCTURAL_VIOLATION, message.toString());
  }

  private static boolean isValidDomain(List<ConfigValue> items, int index) {
    if (!(items.get(index) instanceof ConfigValue.Mapping item)) {
      return false;
    }
    if (!Trees.isNonEmptyString(item.entries().get("defaultLocale"))
        || !Trees.isNonEmptyString(item.entries().get("domain"))) {
      return false;
    }
    ConfigValue locales = item.entries().get("locales");
    if (ConfigValues.isAbsent(locales)) {
      return true;
    }
    if (!Trees.isStringSequence(locales)) {
      return false;
    }
    String domain = ConfigValues.stringOrNull(item.entries().get("domain"));
    for (ConfigValue locale : ((ConfigValue.Sequence) locales).items()) {
      for (int other = 0; other < items.size(); other++) {
        if (other == index || !(items.get(other) instanceof ConfigValue.Mapping otherItem)) {
          continue;
        }
        if (otherItem.entries().get("locales") instanceof ConfigValue.Sequence otherLocales
            && otherLocales.items().contains(locale)) {
          log.warn("Both {} and {} configured the locale ({}) but only one can. "
                  + "Remove it from one i18n.domains config to continue",
              domain, ConfigValues.describe(otherItem.entries().getOrDefault("domain", ConfigValue.Scalar.NULL)),
              ConfigValues.stringOrNull(locale));
          return false;
        }
      }
    }
    return true;
  }
}
