package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds a host name to a default locale and the locales it serves exclusively.
 *
 * @param domain host name, e.g. {@code example.fr}
 * @param defaultLocale locale served when the request carries none
 * @param locales locales served only by this domain; empty when not declared
 */
public record DomainBinding(String domain, String defaultLocale, List<String> locales) {
  public DomainBinding {
    locales = List.copyOf(locales);
  }

  static DomainBinding fromMapping(ConfigValue.Mapping tree) {
    List<String> locales = Fields.defined(tree, "locales")
        ? Fields.stringList(tree, "locales", "i18n.domains.locales")
        : List.of();
    return new DomainBinding(
        Fields.string(tree, "domain", "i18n.domains.domain"),
        Fields.string(tree, "defaultLocale", "i18n.domains.defaultLocale"),
        locales);
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("domain", ConfigValue.Scalar.of(domain));
    map.put("defaultLocale", ConfigValue.Scalar.of(defaultLocale));
    if (!locales.isEmpty()) {
      map.put("locales", ConfigValue.Sequence.ofStrings(locales));
    }
    return new ConfigValue.Mapping(map);
  }
}
