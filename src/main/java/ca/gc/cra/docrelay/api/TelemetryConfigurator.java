package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry CLI arguments ({@code metricsExporter}, {@code otelEndpoint},
 * {@code otelResourceAttributes}) into the {@code otel.*} system properties read by the metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {
    // Utility
  }

  /**
   * Consumes telemetry arguments from {@code args} and applies them.
   *
   * @param args mutable parsed arguments; telemetry keys are removed
   * @throws IllegalArgumentException if a telemetry value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    String exporter = args.remove("metricsExporter");
    if (exporter != null) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null) {
      validateEndpoint(endpoint.trim());
      log.debug("Configuring OTLP endpoint: {}", endpoint.trim());
      System.setProperty("otel.exporter.otlp.endpoint", endpoint.trim());
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null) {
      String validated = Strings.requirePrintableAscii(
          "otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", validated);
    }
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
