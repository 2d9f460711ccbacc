package ca.gc.cra.beacon.application.resolve;

import ca.gc.cra.beacon.application.port.EnvironmentPort;
import ca.gc.cra.beacon.domain.config.BuildIdGenerator;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies the built-in default configuration tree.
 *
 * <p>The defaults remain the single source of truth for which keys a resolved configuration carries: merging never
 * removes a key that is present here. Two values are seeded from the environment: {@code experimental.cpus} from
 * {@value #WORKERS_ENV} (falling back to the processor count) and {@code analyticsId} from
 * {@value #ANALYTICS_ENV}.</p>
 */
public final class DefaultRegistry {
  private static final Logger log = LoggerFactory.getLogger(DefaultRegistry.class);

  /** Environment variable carrying a worker-count hint. */
  public static final String WORKERS_ENV = "BEACON_BUILD_WORKERS";
  /** Environment variable carrying the analytics identifier. */
  public static final String ANALYTICS_ENV = "BEACON_ANALYTICS_ID";

  private DefaultRegistry() {}

  /**
   * Builds the default tree, reading the environment once.
   *
   * @param environment environment accessor
   * @return immutable default tree
   */
  public static ConfigValue.Mapping create(EnvironmentPort environment) {
    Objects.requireNonNull(environment, "environment");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("env", Map.of());
    root.put("distDir", ".beacon");
    root.put("assetPrefix", "");
    root.put("configOrigin", ConfigOrigins.DEFAULT);
    root.put("useFileSystemPublicRoutes", true);
    root.put("generateBuildId", BuildIdGenerator.NONE);
    root.put("generateEtags", true);
    root.put("pageExtensions", List.of("tsx", "ts", "jsx", "js"));
    root.put("target", "server");
    root.put("poweredByHeader", true);
    root.put("compress", true);
    root.put("analyticsId", environment.variable(ANALYTICS_ENV).orElse(""));
    root.put("images", images());
    root.put("devIndicators", ordered("buildActivity", true, "autoPrerender", true));
    root.put("onDemandEntries", ordered("maxInactiveAge", 60_000L, "pagesBufferLength", 2));
    root.put("amp", ordered("canonicalBase", ""));
    root.put("basePath", "");
    root.put("sassOptions", Map.of());
    root.put("trailingSlash", false);
    root.put("experimental", experimental(environment));
    root.put("future", ordered("excludeDefaultMomentLocales", false));
    root.put("serverRuntimeConfig", Map.of());
    root.put("publicRuntimeConfig", Map.of());
    root.put("reactStrictMode", false);
    return ConfigValues.parseMapping(root);
  }

  static int workerCount(EnvironmentPort environment) {
    int base = hintedWorkers(environment.variable(WORKERS_ENV))
        .orElseGet(() -> Math.max(1, environment.availableProcessors()));
    return Math.max(1, base - 1);
  }

  private static Optional<Integer> hintedWorkers(Optional<String> raw) {
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      int parsed = Integer.parseInt(raw.get().trim());
      return parsed > 0 ? Optional.of(parsed) : Optional.empty();
    } catch (NumberFormatException ex) {
      log.warn("Ignoring non-numeric {} value '{}'", WORKERS_ENV, raw.get());
      return Optional.empty();
    }
  }

  private static Map<String, Object> images() {
    Map<String, Object> images = new LinkedHashMap<>();
    images.put("deviceSizes", List.of(320, 420, 768, 1024, 1200));
    images.put("imageSizes", List.of());
    images.put("domains", List.of());
    images.put("path", "/_beacon/image");
    images.put("loader", "default");
    return images;
  }

  private static Map<String, Object> experimental(EnvironmentPort environment) {
    Map<String, Object> experimental = new LinkedHashMap<>();
    experimental.put("cpus", workerCount(environment));
    experimental.put("modern", false);
    experimental.put("plugins", false);
    experimental.put("profiling", false);
    experimental.put("sprFlushToDisk", true);
    experimental.put("reactMode", "legacy");
    experimental.put("workerThreads", false);
    experimental.put("pageEnv", false);
    experimental.put("productionBrowserSourceMaps", false);
    experimental.put("optimizeFonts", false);
    experimental.put("optimizeImages", false);
    experimental.put("scrollRestoration", false);
    experimental.put("i18n", false);
    return experimental;
  }

  private static Map<String, Object> ordered(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }
}
