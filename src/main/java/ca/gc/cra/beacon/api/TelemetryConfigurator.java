package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code metricsExporter} and {@code otelEndpoint} CLI settings as OpenTelemetry system properties.
 *
 * <p>Metrics stay off unless {@code metricsExporter=otlp} is passed or {@code OTEL_METRICS_EXPORTER=otlp} is set.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  static final Set<String> KEYS = Set.of("metricsExporter", "otelEndpoint");
  private static final Set<String> EXPORTERS = Set.of("otlp", "none");

  private TelemetryConfigurator() {}

  /**
   * Consumes telemetry keys from {@code args}.
   *
   * @param args parsed CLI arguments; telemetry keys are removed
   * @param environmentExporter value of {@code OTEL_METRICS_EXPORTER}; may be {@code null}
   * @return {@code true} when metrics should be exported
   * @throws IllegalArgumentException when a value is invalid
   */
  static boolean configureMetrics(Map<String, String> args, String environmentExporter) {
    String exporter = args.remove("metricsExporter");
    String endpoint = args.remove("otelEndpoint");
    String effective;
    if (exporter != null) {
      effective = Strings.requireOneOf("metricsExporter", exporter, EXPORTERS);
      System.setProperty("otel.metrics.exporter", effective);
      log.debug("Configuring OpenTelemetry metrics exporter: {}", effective);
    } else {
      effective = environmentExporter == null ? "none" : environmentExporter.trim().toLowerCase(Locale.ROOT);
    }
    if (endpoint != null) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
    }
    return "otlp".equals(effective);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
