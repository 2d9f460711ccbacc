package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Development overlay toggles.
 *
 * @param buildActivity show the build activity indicator
 * @param autoPrerender show the static-page indicator
 * @param extras unrecognized keys, passed through
 */
public record DevIndicatorsConfig(boolean buildActivity, boolean autoPrerender, Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of("buildActivity", "autoPrerender");

  public DevIndicatorsConfig {
    extras = Fields.copyOf(extras);
  }

  static DevIndicatorsConfig fromMapping(ConfigValue.Mapping tree) {
    return new DevIndicatorsConfig(
        Fields.bool(tree, "buildActivity", "devIndicators.buildActivity"),
        Fields.bool(tree, "autoPrerender", "devIndicators.autoPrerender"),
        Fields.extras(tree, KNOWN));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("buildActivity", ConfigValue.Scalar.of(buildActivity));
    map.put("autoPrerender", ConfigValue.Scalar.of(autoPrerender));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
