package ca.gc.cra.beacon.domain.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Merged and validated BEACON configuration handed to the build and serve pipelines.
 * <p><strong>Why:</strong> Gives consumers typed access to every known key while keeping unknown keys in
 * {@link #extras()} for forward compatibility.</p>
 * <p><strong>Role:</strong> Output of {@code ConfigResolver}; built from the validated tree by
 * {@link #fromMapping(ConfigValue.Mapping)} and convertible back with {@link #toMapping()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param env build-time environment values inlined into bundles
 * @param distDir build output directory, relative to the project
 * @param assetPrefix URL prefix for static assets
 * @param configOrigin {@code default}, {@code server} or the configuration file name
 * @param configFile absolute path of the configuration file when one was loaded
 * @param useFileSystemPublicRoutes route requests to files under the pages directory
 * @param generateBuildId build id hook
 * @param generateEtags emit ETag headers
 * @param pageExtensions file extensions recognized as pages, in priority order
 * @param target deployment target
 * @param poweredByHeader emit the {@code X-Powered-By} header
 * @param compress gzip responses
 * @param analyticsId analytics identifier; empty when disabled
 * @param images image-serving parameters
 * @param devIndicators development overlay toggles
 * @param onDemandEntries on-demand page building tuning
 * @param amp AMP settings
 * @param basePath URL path prefix for the whole application; empty for none
 * @param sassOptions options handed to the stylesheet compiler
 * @param trailingSlash redirect URLs to their trailing-slash form
 * @param experimental experimental feature flags
 * @param future forward-compatible flags
 * @param serverRuntimeConfig values exposed to server code only
 * @param publicRuntimeConfig values exposed to server and browser code
 * @param reactStrictMode render in strict mode
 * @param extras unrecognized top-level keys, passed through
 * @since 0.1.0
 */
public record ResolvedConfig(
    Map<String, Object> env,
    String distDir,
    String assetPrefix,
    String configOrigin,
    Optional<Path> configFile,
    boolean useFileSystemPublicRoutes,
    BuildIdGenerator generateBuildId,
    boolean generateEtags,
    List<String> pageExtensions,
    Target target,
    boolean poweredByHeader,
    boolean compress,
    String analyticsId,
    ImagesConfig images,
    DevIndicatorsConfig devIndicators,
    OnDemandEntriesConfig onDemandEntries,
    AmpConfig amp,
    String basePath,
    Map<String, Object> sassOptions,
    boolean trailingSlash,
    ExperimentalConfig experimental,
    FutureConfig future,
    Map<String, Object> serverRuntimeConfig,
    Map<String, Object> publicRuntimeConfig,
    boolean reactStrictMode,
    Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of(
      "env", "distDir", "assetPrefix", "configOrigin", "configFile", "useFileSystemPublicRoutes",
      "generateBuildId", "generateEtags", "pageExtensions", "target", "poweredByHeader", "compress",
      "analyticsId", "images", "devIndicators", "onDemandEntries", "amp", "basePath", "sassOptions",
      "trailingSlash", "experimental", "future", "serverRuntimeConfig", "publicRuntimeConfig",
      "reactStrictMode");

  public ResolvedConfig {
    env = Fields.copyOf(env);
    pageExtensions = List.copyOf(pageExtensions);
    sassOptions = Fields.copyOf(sassOptions);
    serverRuntimeConfig = Fields.copyOf(serverRuntimeConfig);
    publicRuntimeConfig = Fields.copyOf(publicRuntimeConfig);
    extras = Fields.copyOf(extras);
  }

  /**
   * Binds a merged, validated tree to the typed schema.
   *
   * @param tree merged configuration tree
   * @return typed configuration
   * @throws ConfigException when a known key carries a value of the wrong type
   */
  public static ResolvedConfig fromMapping(ConfigValue.Mapping tree) {
    Optional<Path> configFile = Fields.defined(tree, "configFile")
        ? Optional.of(Path.of(Fields.string(tree, "configFile", "configFile")))
        : Optional.empty();
    return new ResolvedConfig(
        Fields.plainMap(tree, "env", "env"),
        Fields.string(tree, "distDir", "distDir"),
        Fields.string(tree, "assetPrefix", "assetPrefix"),
        Fields.string(tree, "configOrigin", "configOrigin"),
        configFile,
        Fields.bool(tree, "useFileSystemPublicRoutes", "useFileSystemPublicRoutes"),
        buildIdGenerator(Fields.require(tree, "generateBuildId", "generateBuildId")),
        Fields.bool(tree, "generateEtags", "generateEtags"),
        Fields.stringList(tree, "pageExtensions", "pageExtensions"),
        target(Fields.string(tree, "target", "target")),
        Fields.bool(tree, "poweredByHeader", "poweredByHeader"),
        Fields.bool(tree, "compress", "compress"),
        Fields.string(tree, "analyticsId", "analyticsId"),
        ImagesConfig.fromMapping(Fields.mapping(tree, "images", "images")),
        DevIndicatorsConfig.fromMapping(Fields.mapping(tree, "devIndicators", "devIndicators")),
        OnDemandEntriesConfig.fromMapping(Fields.mapping(tree, "onDemandEntries", "onDemandEntries")),
        AmpConfig.fromMapping(Fields.mapping(tree, "amp", "amp")),
        Fields.string(tree, "basePath", "basePath"),
        Fields.plainMap(tree, "sassOptions", "sassOptions"),
        Fields.bool(tree, "trailingSlash", "trailingSlash"),
        ExperimentalConfig.fromMapping(Fields.mapping(tree, "experimental", "experimental")),
        FutureConfig.fromMapping(Fields.mapping(tree, "future", "future")),
        Fields.plainMap(tree, "serverRuntimeConfig", "serverRuntimeConfig"),
        Fields.plainMap(tree, "publicRuntimeConfig", "publicRuntimeConfig"),
        Fields.bool(tree, "reactStrictMode", "reactStrictMode"),
        Fields.extras(tree, KNOWN));
  }

  /**
   * Converts the configuration back into a tree that resolves to an equal configuration.
   *
   * @return configuration tree
   */
  public ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("env", ConfigValues.parse(env));
    map.put("distDir", ConfigValue.Scalar.of(distDir));
    map.put("assetPrefix", ConfigValue.Scalar.of(assetPrefix));
    map.put("configOrigin", ConfigValue.Scalar.of(configOrigin));
    configFile.ifPresent(path -> map.put("configFile", ConfigValue.Scalar.of(path.toString())));
    map.put("useFileSystemPublicRoutes", ConfigValue.Scalar.of(useFileSystemPublicRoutes));
    map.put("generateBuildId", new ConfigValue.Callable(generateBuildId));
    map.put("generateEtags", ConfigValue.Scalar.of(generateEtags));
    map.put("pageExtensions", ConfigValue.Sequence.ofStrings(pageExtensions));
    map.put("target", ConfigValue.Scalar.of(target.value()));
    map.put("poweredByHeader", ConfigValue.Scalar.of(poweredByHeader));
    map.put("compress", ConfigValue.Scalar.of(compress));
    map.put("analyticsId", ConfigValue.Scalar.of(analyticsId));
    map.put("images", images.toMapping());
    map.put("devIndicators", devIndicators.toMapping());
    map.put("onDemandEntries", onDemandEntries.toMapping());
    map.put("amp", amp.toMapping());
    map.put("basePath", ConfigValue.Scalar.of(basePath));
    map.put("sassOptions", ConfigValues.parse(sassOptions));
    map.put("trailingSlash", ConfigValue.Scalar.of(trailingSlash));
    map.put("experimental", experimental.toMapping());
    map.put("future", future.toMapping());
    map.put("serverRuntimeConfig", ConfigValues.parse(serverRuntimeConfig));
    map.put("publicRuntimeConfig", ConfigValues.parse(publicRuntimeConfig));
    map.put("reactStrictMode", ConfigValue.Scalar.of(reactStrictMode));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }

  private static BuildIdGenerator buildIdGenerator(ConfigValue value) {
    if (value instanceof ConfigValue.Callable callable && callable.target() instanceof BuildIdGenerator generator) {
      return generator;
    }
    throw new ConfigException(
        ErrorKind.TYPE_MISMATCH,
        "Specified generateBuildId should be a build id hook, found " + ConfigValues.typeName(value));
  }

  private static Target target(String raw) {
    return Target.fromValue(raw).orElseThrow(() -> new ConfigException(
        ErrorKind.ENUM_VIOLATION,
        "Specified target is invalid. Provided: \"" + raw + "\" should be one of " + Target.allowedValues()));
  }
}
