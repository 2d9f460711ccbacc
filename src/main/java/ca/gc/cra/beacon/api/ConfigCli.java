package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.domain.config.ExperimentalConfig;
import ca.gc.cra.beacon.domain.config.I18nConfig;
import ca.gc.cra.beacon.domain.config.ResolvedConfig;
import ca.gc.cra.beacon.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the resolved configuration of a project.
 *
 * @since 0.1.0
 */
public final class ConfigCli {
  private static final Logger log = LoggerFactory.getLogger(ConfigCli.class);
  private static final Set<String> FORMATS = Set.of("json", "summary");
  private static final String SUMMARY_USAGE =
      "usage: beacon config [dir=PATH] [phase=PHASE] [override=FILE.json] [format=json|summary] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      BEACON config

      Usage:
        beacon config [options]

      Options:
        dir=PATH                   Directory where the search for beacon.config.yaml starts (default .)
        phase=PHASE                Build phase handed to configuration factories (default phase-development-server)
        override=FILE.json         Resolve this JSON object instead of searching for a configuration file
        format=json|summary        Output format (default json)
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ConfigCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return ResolveCliSupport.run(args, log, SUMMARY_USAGE, HELP_TEXT, Set.of("format"), ConfigCli::format, ConfigCli::print);
  }

  private static void format(Map<String, String> kv) {
    kv.put("format", Strings.requireOneOf("format", kv.getOrDefault("format", "json"), FORMATS));
  }

  private static ExitCode print(Map<String, String> kv, ResolvedConfig resolved) {
    if ("summary".equals(kv.get("format"))) {
      CliPrinter.printLines(summary(resolved));
    } else {
      ResolveCliSupport.printJson(resolved, CliPrinter::println);
    }
    return ExitCode.SUCCESS;
  }

  static List<String> summary(ResolvedConfig resolved) {
    List<String> lines = new ArrayList<>();
    lines.add("origin: " + resolved.configOrigin());
    resolved.configFile().ifPresent(file -> lines.add("configFile: " + file));
    lines.add("target: " + resolved.target().value());
    lines.add("distDir: " + resolved.distDir());
    lines.add("basePath: " + display(resolved.basePath()));
    lines.add("assetPrefix: " + display(resolved.assetPrefix()));
    lines.add("trailingSlash: " + resolved.trailingSlash());
    lines.add("pageExtensions: " + String.join(", ", resolved.pageExtensions()));
    lines.add("images.path: " + resolved.images().path());
    ExperimentalConfig experimental = resolved.experimental();
    lines.add("experimental.cpus: " + experimental.cpus());
    lines.add("experimental.i18n: " + experimental.i18n().map(ConfigCli::describe).orElse("disabled"));
    return lines;
  }

  private static String describe(I18nConfig i18n) {
    return "locales=" + String.join(",", i18n.locales()) + " default=" + i18n.defaultLocale()
        + " domains=" + i18n.domains().size();
  }

  private static String display(String value) {
    return value.isEmpty() ? "(none)" : value;
  }
}
