package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.application.port.EnvironmentPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.resolve.ConfigResolver;
import ca.gc.cra.beacon.application.resolve.OneTimeNotice;
import ca.gc.cra.beacon.infrastructure.env.SystemEnvironmentAdapter;
import ca.gc.cra.beacon.infrastructure.fs.AncestorFileLocator;
import ca.gc.cra.beacon.infrastructure.yaml.YamlConfigModuleLoader;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the configuration resolver to its adapters.
 * <p><strong>Role:</strong> Single place where ports meet their implementations: the ancestor file locator, the
 * SnakeYAML loader, the process environment and the supplied metrics sink.</p>
 * <p><strong>Thread-safety:</strong> Immutable. Resolvers created by one root share its experimental-features
 * notice, so the warning prints at most once per root.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.beacon.application.resolve.ConfigResolver
 */
public final class CompositionRoot {
  private final EnvironmentPort environment;
  private final MetricsPort metrics;
  private final OneTimeNotice experimentalNotice = OneTimeNotice.experimentalFeatures();

  /** Creates a root backed by the process environment with metrics disabled. */
  public CompositionRoot() {
    this(new SystemEnvironmentAdapter(), MetricsPort.NO_OP);
  }

  /**
   * Creates a root with explicit environment and metrics adapters.
   *
   * @param environment environment consulted for registry defaults
   * @param metrics metrics sink for resolution counters
   */
  public CompositionRoot(EnvironmentPort environment, MetricsPort metrics) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds a resolver wired to the file system and YAML adapters.
   *
   * @return new resolver
   */
  public ConfigResolver configResolver() {
    return new ConfigResolver(
        new AncestorFileLocator(),
        new YamlConfigModuleLoader(),
        environment,
        experimentalNotice,
        metrics);
  }

  /**
   * Returns the metrics sink handed to resolvers.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }
}
