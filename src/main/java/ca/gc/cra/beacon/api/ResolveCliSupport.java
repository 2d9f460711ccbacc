package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.json.JsonText;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.resolve.ConfigResolver;
import ca.gc.cra.beacon.config.CompositionRoot;
import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.Phases;
import ca.gc.cra.beacon.domain.config.ResolvedConfig;
import ca.gc.cra.beacon.infrastructure.env.SystemEnvironmentAdapter;
import ca.gc.cra.beacon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Shared argument handling and error mapping for the commands that resolve a project's configuration.
 */
final class ResolveCliSupport {
  static final Set<String> RESOLVE_KEYS = Set.of("dir", "phase", "override");

  private ResolveCliSupport() {}

  /** Arguments common to resolving commands. */
  record Request(String phase, Path dir, Optional<Path> overrideFile) {
    static Request from(Map<String, String> kv) {
      String phase = kv.getOrDefault("phase", Phases.DEVELOPMENT_SERVER);
      Path dir = Path.of(kv.getOrDefault("dir", "."));
      Optional<Path> override = Optional.ofNullable(kv.get("override")).map(Path::of);
      return new Request(phase, dir, override);
    }
  }

  /**
   * Runs a resolving command.
   *
   * @param args raw command arguments
   * @param log logger of the calling command
   * @param usage one-line usage printed on argument errors
   * @param helpText text printed for {@code --help}
   * @param extraKeys command-specific keys accepted in addition to the shared ones
   * @param validator checks command-specific values; throws {@link IllegalArgumentException} on bad input
   * @param command receives the parsed arguments and the resolved configuration
   * @return exit code
   */
  static ExitCode run(
      String[] args,
      Logger log,
      String usage,
      String helpText,
      Set<String> extraKeys,
      Consumer<Map<String, String>> validator,
      CommandBody command) {
    CliInput input;
    Map<String, String> kv;
    boolean metricsEnabled;
    try {
      input = CliInput.parse(args);
      Set<String> allowed = new HashSet<>(RESOLVE_KEYS);
      allowed.addAll(TelemetryConfigurator.KEYS);
      allowed.addAll(extraKeys);
      kv = CliArgsParser.toMap(input.keyValueArgs(), allowed);
      validator.accept(kv);
      metricsEnabled = TelemetryConfigurator.configureMetrics(kv, System.getenv("OTEL_METRICS_EXPORTER"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    OpenTelemetryMetricsAdapter otel = metricsEnabled ? new OpenTelemetryMetricsAdapter() : null;
    MetricsPort metrics = otel != null ? otel : MetricsPort.NO_OP;
    try {
      Request request = Request.from(kv);
      ConfigResolver resolver = new CompositionRoot(new SystemEnvironmentAdapter(), metrics).configResolver();
      ResolvedConfig resolved = resolve(resolver, request);
      return command.accept(kv, resolved);
    } catch (ConfigException ex) {
      log.error("Invalid configuration ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Unable to load configuration: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read project files: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Configuration resolution failed unexpectedly", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (otel != null) {
        otel.flush();
        otel.close();
      }
    }
  }

  static ResolvedConfig resolve(ConfigResolver resolver, Request request) throws IOException {
    if (request.overrideFile().isEmpty()) {
      return resolver.resolve(request.phase(), request.dir());
    }
    String json = Files.readString(request.overrideFile().get(), StandardCharsets.UTF_8);
    return resolver.resolve(request.phase(), request.dir(), JsonText.parseObject(json));
  }

  /** Renders the resolved configuration as indented JSON. */
  static void printJson(ResolvedConfig resolved, Consumer<String> out) {
    out.accept(JsonText.pretty(resolved.toMapping()));
  }

  /** Command-specific work after a successful resolution. */
  @FunctionalInterface
  interface CommandBody {
    ExitCode accept(Map<String, String> kv, ResolvedConfig resolved);
  }
}
