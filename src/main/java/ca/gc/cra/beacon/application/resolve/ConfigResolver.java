package ca.gc.cra.beacon.application.resolve;

import ca.gc.cra.beacon.application.port.ConfigFileLocator;
import ca.gc.cra.beacon.application.port.ConfigModuleLoader;
import ca.gc.cra.beacon.application.port.EnvironmentPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.resolve.validation.ValidatorChain;
import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import ca.gc.cra.beacon.domain.config.ResolvedConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Produces the {@link ResolvedConfig} for a project directory.
 * <p><strong>Flow:</strong></p>
 * <ol>
 *   <li>A caller-supplied override skips file discovery and is tagged with origin {@code server}.</li>
 *   <li>Otherwise {@code beacon.config.yaml} is searched for from the directory upwards, loaded, normalized and
 *   tagged with origin {@code beacon.config.yaml} and its absolute path.</li>
 *   <li>When no file exists, an unsupported variant ({@code .yml}, {@code .json} and others) is an error; with no
 *   variant either, the defaults are returned untouched.</li>
 * </ol>
 * <p>User values go through the pre-merge checks, the merge with defaults and the post-merge checks before they
 * are bound to the typed schema.</p>
 * <p><strong>Metrics:</strong> {@code config.resolve.requests}, {@code config.resolve.origin.<default|server|file>},
 * {@code config.resolve.failures}, {@code config.resolve.failures.<kind>} and
 * {@code config.resolve.latencyNanos}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the injected ports are.</p>
 *
 * @since 0.1.0
 */
public final class ConfigResolver {
  private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

  private final ConfigFileLocator locator;
  private final ConfigModuleLoader loader;
  private final MetricsPort metrics;
  private final ConfigValue.Mapping defaults;
  private final ConfigNormalizer normalizer;
  private final ConfigMerger merger;
  private final ValidatorChain preMerge = ValidatorChain.preMerge();
  private final ValidatorChain postMerge = ValidatorChain.postMerge();

  /**
   * Creates a resolver. The default registry is built once from {@code environment}.
   *
   * @param locator searches ancestor directories for configuration files
   * @param loader reads a configuration file into plain values
   * @param environment environment used for registry defaults
   * @param experimentalNotice fired the first time experimental settings differ from the defaults
   * @param metrics metrics sink
   */
  public ConfigResolver(
      ConfigFileLocator locator,
      ConfigModuleLoader loader,
      EnvironmentPort environment,
      OneTimeNotice experimentalNotice,
      MetricsPort metrics) {
    this.locator = Objects.requireNonNull(locator, "locator");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.defaults = DefaultRegistry.create(Objects.requireNonNull(environment, "environment"));
    this.normalizer = new ConfigNormalizer(defaults);
    this.merger = new ConfigMerger(experimentalNotice);
  }

  /**
   * Returns the default registry this resolver merges against.
   *
   * @return default registry
   */
  public ConfigValue.Mapping defaults() {
    return defaults;
  }

  /**
   * Resolves configuration from files under {@code dir}.
   *
   * @param phase opaque build phase identifier handed to configuration factories
   * @param dir directory where the upward search starts
   * @return resolved configuration
   * @throws IOException when the configuration file cannot be read
   * @throws ConfigException when the configuration is invalid
   */
  public ResolvedConfig resolve(String phase, Path dir) throws IOException {
    return resolve(phase, dir, null);
  }

  /**
   * Resolves configuration, preferring {@code override} over file discovery when it is non-null.
   *
   * @param phase opaque build phase identifier handed to configuration factories
   * @param dir directory where the upward search starts
   * @param override direct configuration; {@code null} to read from files. An empty map still counts as an override.
   * @return resolved configuration
   * @throws IOException when the configuration file cannot be read
   * @throws ConfigException when the configuration is invalid
   */
  public ResolvedConfig resolve(String phase, Path dir, Map<String, ?> override) throws IOException {
    metrics.increment("config.resolve.requests");
    long started = System.nanoTime();
    boolean succeeded = false;
    try {
      ResolvedConfig resolved = override != null
          ? resolveOverride(ConfigValues.parseMapping(override))
          : resolveFromFiles(phase, Objects.requireNonNull(dir, "dir"));
      transition(ResolutionState.RESOLVED);
      metrics.increment("config.resolve.origin." + originMetric(resolved.configOrigin()));
      succeeded = true;
      return resolved;
    } catch (ConfigException ex) {
      metrics.increment("config.resolve.failures." + ex.kind().name().toLowerCase(Locale.ROOT));
      throw ex;
    } finally {
      if (!succeeded) {
        transition(ResolutionState.FAILED);
        metrics.increment("config.resolve.failures");
      }
      metrics.observe("config.resolve.latencyNanos", System.nanoTime() - started);
    }
  }

  private ResolvedConfig resolveOverride(ConfigValue.Mapping override) {
    transition(ResolutionState.DIRECT_OVERRIDE);
    return mergeAndValidate(override, Map.of("configOrigin", ConfigOrigins.SERVER));
  }

  private ResolvedConfig resolveFromFiles(String phase, Path dir) throws IOException {
    transition(ResolutionState.FILE_DISCOVERY);
    Optional<Path> found = locator.findUp(dir, List.of(ConfigOrigins.CONFIG_FILE));
    if (found.isPresent()) {
      Path file = found.get().toAbsolutePath();
      log.debug("Loading configuration from {}", file);
      ConfigValue normalized = normalizer.normalize(phase, ConfigValues.parse(loader.load(file)));
      if (!(normalized instanceof ConfigValue.Mapping user)) {
        throw new ConfigException(
            ErrorKind.TYPE_MISMATCH,
            ConfigOrigins.CONFIG_FILE + " must export an object, found " + ConfigValues.typeName(normalized));
      }
      if (user.isEmpty()) {
        log.warn("Detected {}, no exported configuration found", ConfigOrigins.CONFIG_FILE);
      }
      Map<String, String> origin = new LinkedHashMap<>();
      origin.put("configOrigin", ConfigOrigins.CONFIG_FILE);
      origin.put("configFile", file.toString());
      return mergeAndValidate(user, origin);
    }

    transition(ResolutionState.NO_FILE_FALLBACK);
    Optional<Path> variant = locator.findUp(dir, ConfigOrigins.UNSUPPORTED_VARIANTS);
    if (variant.isPresent()) {
      throw new ConfigException(
          ErrorKind.UNSUPPORTED_SOURCE,
          "Configuring BEACON via '" + variant.get().getFileName() + "' is not supported. Please replace the file"
              + " with '" + ConfigOrigins.CONFIG_FILE + "'.");
    }
    return ResolvedConfig.fromMapping(defaults);
  }

  private ResolvedConfig mergeAndValidate(ConfigValue.Mapping user, Map<String, String> originTags) {
    ConfigValue.Mapping checked = preMerge.apply(user);
    Map<String, ConfigValue> tagged = new LinkedHashMap<>();
    originTags.forEach((key, value) -> tagged.put(key, ConfigValue.Scalar.of(value)));
    tagged.putAll(checked.entries());
    ConfigValue.Mapping merged = merger.merge(new ConfigValue.Mapping(tagged), defaults);
    return ResolvedConfig.fromMapping(postMerge.apply(merged));
  }

  private static String originMetric(String origin) {
    if (ConfigOrigins.DEFAULT.equals(origin)) {
      return "default";
    }
    if (ConfigOrigins.SERVER.equals(origin)) {
      return "server";
    }
    return "file";
  }

  private static void transition(ResolutionState state) {
    log.debug("Configuration resolution entered {}", state);
  }
}
