package ca.gc.cra.beacon.application.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.testutil.FakeEnvironment;
import ca.gc.cra.beacon.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private final ConfigValue.Mapping defaults = DefaultRegistry.create(new FakeEnvironment(4));
  private final AtomicInteger notices = new AtomicInteger();
  private final ConfigMerger merger = new ConfigMerger(new OneTimeNotice(notices::incrementAndGet));

  @Test
  void undefinedUserKeysKeepDefaults() {
    Map<String, Object> user = new HashMap<>();
    user.put("distDir", null);
    user.put("trailingSlash", true);

    ConfigValue.Mapping merged = merger.merge(ConfigValues.parseMapping(user), defaults);

    assertEquals(ConfigValue.Scalar.of(".beacon"), merged.get("distDir").orElseThrow());
    assertEquals(ConfigValue.Scalar.of(true), merged.get("trailingSlash").orElseThrow());
    assertEquals(defaults.keys(), merged.keys());
  }

  @Test
  void nestedRecordsMergeOneLevelDeep() {
    ConfigValue.Mapping user = ConfigValues.parseMapping(Map.of(
        "images", Map.of("domains", List.of("cdn.example.com"))));

    ConfigValue.Mapping images = nested(merger.merge(user, defaults), "images");

    assertEquals(ConfigValue.Sequence.ofStrings(List.of("cdn.example.com")), images.get("domains").orElseThrow());
    assertEquals(nested(defaults, "images").get("deviceSizes"), images.get("deviceSizes"));
    assertEquals(ConfigValue.Scalar.of("/_beacon/image"), images.get("path").orElseThrow());
  }

  @Test
  void secondLevelRecordsAreReplacedWholesale() {
    ConfigValue.Mapping user = ConfigValues.parseMapping(Map.of(
        "experimental", Map.of("i18n", Map.of("locales", List.of("en"), "defaultLocale", "en"))));

    ConfigValue.Mapping experimental = nested(merger.merge(user, defaults), "experimental");

    ConfigValue.Mapping i18n = (ConfigValue.Mapping) experimental.get("i18n").orElseThrow();
    assertEquals(2, i18n.size());
    assertEquals(nested(defaults, "experimental").get("cpus"), experimental.get("cpus"));
  }

  @Test
  void nullEntriesInsideRecordsKeepDefaults() {
    Map<String, Object> amp = new HashMap<>();
    amp.put("canonicalBase", null);

    ConfigValue.Mapping merged = merger.merge(ConfigValues.parseMapping(Map.of("amp", amp)), defaults);

    assertEquals(ConfigValue.Scalar.of(""), nested(merged, "amp").get("canonicalBase").orElseThrow());
  }

  @Test
  void userOnlyKeysAreAppended() {
    ConfigValue.Mapping merged = merger.merge(ConfigValues.parseMapping(Map.of("customFlag", true)), defaults);

    List<String> keys = List.copyOf(merged.keys());
    assertEquals("customFlag", keys.get(keys.size() - 1));
    assertEquals(defaults.size() + 1, merged.size());
  }

  @Test
  void legacyTrailingSlashIsMigratedWithWarning() {
    try (LogCapture logs = LogCapture.of(ConfigMerger.class)) {
      ConfigValue.Mapping merged = merger.merge(
          ConfigValues.parseMapping(Map.of("exportTrailingSlash", true)), defaults);

      assertEquals(ConfigValue.Scalar.of(true), merged.get("trailingSlash").orElseThrow());
      assertFalse(merged.has("exportTrailingSlash"));
      assertEquals(1, logs.messages(Level.WARN).size());
    }
  }

  @Test
  void modernTrailingSlashWinsOverLegacy() {
    ConfigValue.Mapping merged = merger.merge(
        ConfigValues.parseMapping(Map.of("exportTrailingSlash", true, "trailingSlash", false)), defaults);

    assertEquals(ConfigValue.Scalar.of(false), merged.get("trailingSlash").orElseThrow());
    assertFalse(merged.has("exportTrailingSlash"));
  }

  @Test
  void experimentalNoticeFiresOnlyForRealDifferences() {
    ConfigValue sameCpus = nested(defaults, "experimental").get("cpus").orElseThrow();
    merger.merge(ConfigValue.Mapping.empty().with(
        "experimental", ConfigValue.Mapping.empty().with("cpus", sameCpus)), defaults);
    assertEquals(0, notices.get());

    ConfigValue.Mapping modern = ConfigValues.parseMapping(Map.of("experimental", Map.of("modern", true)));
    merger.merge(modern, defaults);
    merger.merge(modern, defaults);
    assertEquals(1, notices.get());
  }

  @Test
  void mergeLeavesInputsUntouched() {
    ConfigValue.Mapping user = ConfigValues.parseMapping(Map.of("images", Map.of("loader", "custom")));
    ConfigValue.Mapping defaultsBefore = defaults;

    merger.merge(user, defaults);

    assertEquals(1, nested(user, "images").size());
    assertEquals(DefaultRegistry.create(new FakeEnvironment(4)), defaultsBefore);
  }

  private static ConfigValue.Mapping nested(ConfigValue.Mapping tree, String key) {
    return (ConfigValue.Mapping) tree.get(key).orElseThrow();
  }
}
