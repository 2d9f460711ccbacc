package ca.gc.cra.beacon.api;

import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a project's configuration without printing it; the exit code carries the verdict.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  private static final String SUMMARY_USAGE =
      "usage: beacon check [dir=PATH] [phase=PHASE] [override=FILE.json] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      BEACON check

      Usage:
        beacon check [options]

      Options:
        dir=PATH                   Directory where the search for beacon.config.yaml starts (default .)
        phase=PHASE                Build phase handed to configuration factories (default phase-development-server)
        override=FILE.json         Check this JSON object instead of searching for a configuration file
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit codes:
        0 valid, 2 invalid arguments, 3 unreadable files, 4 invalid configuration
      """;

  private CheckCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return ResolveCliSupport.run(
        args, log, SUMMARY_USAGE, HELP_TEXT, Set.of(), ignored -> { }, (kv, resolved) -> {
          CliPrinter.println("Configuration OK (origin: " + resolved.configOrigin() + ")");
          return ExitCode.SUCCESS;
        });
  }
}
