package ca.gc.cra.beacon.domain.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Internationalized routing settings found under {@code experimental.i18n}.
 *
 * @param locales supported locales; the default locale is always first after resolution
 * @param defaultLocale locale used when none is detected
 * @param domains domain-specific locale bindings
 * @param localeDetection whether the preferred locale is detected from the request, when configured
 * @param extras unrecognized keys, passed through
 */
public record I18nConfig(
    List<String> locales,
    String defaultLocale,
    List<DomainBinding> domains,
    Optional<Boolean> localeDetection,
    Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of("locales", "defaultLocale", "domains", "localeDetection");

  public I18nConfig {
    locales = List.copyOf(locales);
    domains = List.copyOf(domains);
    extras = Fields.copyOf(extras);
  }

  static I18nConfig fromMapping(ConfigValue.Mapping tree) {
    List<DomainBinding> domains = new ArrayList<>();
    if (Fields.defined(tree, "domains")) {
      for (ConfigValue item : Fields.sequence(tree, "domains", "i18n.domains").items()) {
        if (!(item instanceof ConfigValue.Mapping mapping)) {
          throw new ConfigException(
              ErrorKind.STRUCTURAL_VIOLATION, "Specified i18n.domains must contain domain objects");
        }
        domains.add(DomainBinding.fromMapping(mapping));
      }
    }
    Optional<Boolean> detection = Fields.defined(tree, "localeDetection")
        ? Optional.of(Fields.bool(tree, "localeDetection", "i18n.localeDetection"))
        : Optional.empty();
    return new I18nConfig(
        Fields.stringList(tree, "locales", "i18n.locales"),
        Fields.string(tree, "defaultLocale", "i18n.defaultLocale"),
        domains,
        detection,
        Fields.extras(tree, KNOWN));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("locales", ConfigValue.Sequence.ofStrings(locales));
    map.put("defaultLocale", ConfigValue.Scalar.of(defaultLocale));
    if (!domains.isEmpty()) {
      List<ConfigValue> items = new ArrayList<>(domains.size());
      for (DomainBinding binding : domains) {
        items.add(binding.toMapping());
      }
      map.put("domains", new ConfigValue.Sequence(items));
    }
    localeDetection.ifPresent(value -> map.put("localeDetection", ConfigValue.Scalar.of(value)));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
