package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * AMP settings.
 *
 * @param canonicalBase prefix for canonical AMP links; seeded from {@code basePath} when empty
 * @param extras unrecognized keys, passed through
 */
public record AmpConfig(String canonicalBase, Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of("canonicalBase");

  public AmpConfig {
    extras = Fields.copyOf(extras);
  }

  static AmpConfig fromMapping(ConfigValue.Mapping tree) {
    return new AmpConfig(Fields.string(tree, "canonicalBase", "amp.canonicalBase"), Fields.extras(tree, KNOWN));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("canonicalBase", ConfigValue.Scalar.of(canonicalBase));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
