package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tuning for pages built on demand by the development server.
 *
 * @param maxInactiveAge milliseconds a built page is kept without being requested
 * @param pagesBufferLength number of pages kept in memory simultaneously
 * @param extras unrecognized keys, passed through
 */
public record OnDemandEntriesConfig(long maxInactiveAge, int pagesBufferLength, Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of("maxInactiveAge", "pagesBufferLength");

  public OnDemandEntriesConfig {
    extras = Fields.copyOf(extras);
  }

  static OnDemandEntriesConfig fromMapping(ConfigValue.Mapping tree) {
    return new OnDemandEntriesConfig(
        Fields.longValue(tree, "maxInactiveAge", "onDemandEntries.maxInactiveAge"),
        Fields.integer(tree, "pagesBufferLength", "onDemandEntries.pagesBufferLength"),
        Fields.extras(tree, KNOWN));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("maxInactiveAge", ConfigValue.Scalar.of(maxInactiveAge));
    map.put("pagesBufferLength", ConfigValue.Scalar.of(pagesBufferLength));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
