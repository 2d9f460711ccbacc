package ca.gc.cra.beacon.application.resolve;

import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a user configuration over the default registry.
 *
 * <p>Top-level keys whose value is undefined are treated as absent. A mapping value is overlaid one level deep on
 * the default mapping for the same key: its defined entries replace the default entries, and nested mappings inside
 * it replace the defaults wholesale. Scalars, sequences and hooks replace the default value. Keys known only to the
 * defaults keep their default value; keys known only to the user are appended.</p>
 */
public final class ConfigMerger {
  private static final Logger log = LoggerFactory.getLogger(ConfigMerger.class);

  static final String LEGACY_TRAILING_SLASH = "exportTrailingSlash";
  static final String TRAILING_SLASH = "trailingSlash";
  static final String EXPERIMENTAL = "experimental";

  private final OneTimeNotice experimentalNotice;

  /**
   * Creates a merger.
   *
   * @param experimentalNotice fired when the merged {@code experimental} value differs from the default
   */
  public ConfigMerger(OneTimeNotice experimentalNotice) {
    this.experimentalNotice = Objects.requireNonNull(experimentalNotice, "experimentalNotice");
  }

  /**
   * Produces the merged tree. Neither input is modified.
   *
   * @param user normalized user configuration
   * @param defaults default registry
   * @return merged tree containing every default key
   */
  public ConfigValue.Mapping merge(ConfigValue.Mapping user, ConfigValue.Mapping defaults) {
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(defaults, "defaults");
    ConfigValue.Mapping prepared = migrateLegacyKeys(withoutUndefined(user));

    Map<String, ConfigValue> result = new LinkedHashMap<>(defaults.entries());
    for (Map.Entry<String, ConfigValue> entry : prepared.entries().entrySet()) {
      String key = entry.getKey();
      ConfigValue defaultValue = defaults.entries().get(key);
      ConfigValue merged = mergeValue(defaultValue, entry.getValue());
      if (EXPERIMENTAL.equals(key) && !merged.equals(defaultValue)) {
        experimentalNotice.fire();
      }
      result.put(key, merged);
    }
    return new ConfigValue.Mapping(result);
  }

  static ConfigValue mergeValue(ConfigValue defaultValue, ConfigValue userValue) {
    return switch (userValue.kind()) {
      case MAPPING -> overlay(
          defaultValue instanceof ConfigValue.Mapping base ? base : ConfigValue.Mapping.empty(),
          (ConfigValue.Mapping) userValue);
      case SCALAR, SEQUENCE, CALLABLE -> userValue;
    };
  }

  private static ConfigValue.Mapping overlay(ConfigValue.Mapping base, ConfigValue.Mapping top) {
    Map<String, ConfigValue> entries = new LinkedHashMap<>(base.entries());
    for (Map.Entry<String, ConfigValue> entry : top.entries().entrySet()) {
      if (!ConfigValues.isAbsent(entry.getValue())) {
        entries.put(entry.getKey(), entry.getValue());
      }
    }
    return new ConfigValue.Mapping(entries);
  }

  private static ConfigValue.Mapping withoutUndefined(ConfigValue.Mapping user) {
    Map<String, ConfigValue> cleaned = new LinkedHashMap<>();
    for (Map.Entry<String, ConfigValue> entry : user.entries().entrySet()) {
      if (!ConfigValues.isAbsent(entry.getValue())) {
        cleaned.put(entry.getKey(), entry.getValue());
      }
    }
    return new ConfigValue.Mapping(cleaned);
  }

  private static ConfigValue.Mapping migrateLegacyKeys(ConfigValue.Mapping user) {
    if (!user.has(LEGACY_TRAILING_SLASH)) {
      return user;
    }
    log.warn("The \"{}\" option has been renamed to \"{}\". Please update your {}.",
        LEGACY_TRAILING_SLASH, TRAILING_SLASH, ConfigOrigins.CONFIG_FILE);
    ConfigValue.Mapping migrated = user;
    if (!user.has(TRAILING_SLASH)) {
      migrated = migrated.with(TRAILING_SLASH, user.entries().get(LEGACY_TRAILING_SLASH));
    }
    return migrated.without(LEGACY_TRAILING_SLASH);
  }
}
