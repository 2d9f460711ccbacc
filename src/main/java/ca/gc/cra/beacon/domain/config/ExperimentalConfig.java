package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Experimental feature flags. Enabling any of them triggers a one-time warning during resolution.
 *
 * @param cpus number of build workers
 * @param modern emit a separate modern-browser bundle
 * @param plugins enable the plugin system
 * @param profiling enable production profiling builds
 * @param sprFlushToDisk persist regenerated static pages to disk
 * @param reactMode rendering mode
 * @param workerThreads use worker threads instead of child processes
 * @param pageEnv expose page-level environment variables
 * @param productionBrowserSourceMaps publish browser source maps in production
 * @param optimizeFonts inline font stylesheets
 * @param optimizeImages optimize static images at build time
 * @param scrollRestoration restore scroll position on navigation
 * @param i18n internationalized routing; empty when the flag is disabled
 * @param extras unrecognized flags, passed through
 */
public record ExperimentalConfig(
    int cpus,
    boolean modern,
    boolean plugins,
    boolean profiling,
    boolean sprFlushToDisk,
    ReactMode reactMode,
    boolean workerThreads,
    boolean pageEnv,
    boolean productionBrowserSourceMaps,
    boolean optimizeFonts,
    boolean optimizeImages,
    boolean scrollRestoration,
    Optional<I18nConfig> i18n,
    Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of(
      "cpus", "modern", "plugins", "profiling", "sprFlushToDisk", "reactMode", "workerThreads", "pageEnv",
      "productionBrowserSourceMaps", "optimizeFonts", "optimizeImages", "scrollRestoration", "i18n");

  public ExperimentalConfig {
    extras = Fields.copyOf(extras);
  }

  static ExperimentalConfig fromMapping(ConfigValue.Mapping tree) {
    String mode = Fields.string(tree, "reactMode", "experimental.reactMode");
    ReactMode reactMode = ReactMode.fromValue(mode).orElseThrow(() -> new ConfigException(
        ErrorKind.ENUM_VIOLATION,
        "Specified React Mode is invalid. Provided: " + mode + " should be one of " + ReactMode.allowedValues()));
    return new ExperimentalConfig(
        Fields.integer(tree, "cpus", "experimental.cpus"),
        Fields.bool(tree, "modern", "experimental.modern"),
        Fields.bool(tree, "plugins", "experimental.plugins"),
        Fields.bool(tree, "profiling", "experimental.profiling"),
        Fields.bool(tree, "sprFlushToDisk", "experimental.sprFlushToDisk"),
        reactMode,
        Fields.bool(tree, "workerThreads", "experimental.workerThreads"),
        Fields.bool(tree, "pageEnv", "experimental.pageEnv"),
        Fields.bool(tree, "productionBrowserSourceMaps", "experimental.productionBrowserSourceMaps"),
        Fields.bool(tree, "optimizeFonts", "experimental.optimizeFonts"),
        Fields.bool(tree, "optimizeImages", "experimental.optimizeImages"),
        Fields.bool(tree, "scrollRestoration", "experimental.scrollRestoration"),
        bindI18n(tree.entries().get("i18n")),
        Fields.extras(tree, KNOWN));
  }

  private static Optional<I18nConfig> bindI18n(ConfigValue value) {
    if (ConfigValues.isAbsent(value)
        || (value instanceof ConfigValue.Scalar scalar && Boolean.FALSE.equals(scalar.value()))) {
      return Optional.empty();
    }
    if (value instanceof ConfigValue.Mapping mapping) {
      return Optional.of(I18nConfig.fromMapping(mapping));
    }
    throw new ConfigException(
        ErrorKind.TYPE_MISMATCH, "Specified i18n should be an object received " + ConfigValues.typeName(value));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("cpus", ConfigValue.Scalar.of(cpus));
    map.put("modern", ConfigValue.Scalar.of(modern));
    map.put("plugins", ConfigValue.Scalar.of(plugins));
    map.put("profiling", ConfigValue.Scalar.of(profiling));
    map.put("sprFlushToDisk", ConfigValue.Scalar.of(sprFlushToDisk));
    map.put("reactMode", ConfigValue.Scalar.of(reactMode.value()));
    map.put("workerThreads", ConfigValue.Scalar.of(workerThreads));
    map.put("pageEnv", ConfigValue.Scalar.of(pageEnv));
    map.put("productionBrowserSourceMaps", ConfigValue.Scalar.of(productionBrowserSourceMaps));
    map.put("optimizeFonts", ConfigValue.Scalar.of(optimizeFonts));
    map.put("optimizeImages", ConfigValue.Scalar.of(optimizeImages));
    map.put("scrollRestoration", ConfigValue.Scalar.of(scrollRestoration));
    map.put("i18n", i18n.<ConfigValue>map(I18nConfig::toMapping).orElse(ConfigValue.Scalar.of(false)));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
