package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Forward-compatible flags that will become defaults in a later release.
 *
 * @param excludeDefaultMomentLocales drop bundled date-library locales
 * @param extras unrecognized keys, passed through
 */
public record FutureConfig(boolean excludeDefaultMomentLocales, Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of("excludeDefaultMomentLocales");

  public FutureConfig {
    extras = Fields.copyOf(extras);
  }

  static FutureConfig fromMapping(ConfigValue.Mapping tree) {
    return new FutureConfig(
        Fields.bool(tree, "excludeDefaultMomentLocales", "future.excludeDefaultMomentLocales"),
        Fields.extras(tree, KNOWN));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("excludeDefaultMomentLocales", ConfigValue.Scalar.of(excludeDefaultMomentLocales));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
