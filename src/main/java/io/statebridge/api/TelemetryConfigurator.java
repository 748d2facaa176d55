package io.statebridge.api;

import io.statebridge.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry CLI options into the {@code otel.*} system properties read by the metrics
 * bootstrap. Recognized keys are removed from the argument map.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String METRICS_EXPORTER = "metricsExporter";
  static final String OTEL_ENDPOINT = "otelEndpoint";
  static final String OTEL_RESOURCE_ATTRIBUTES = "otelResourceAttributes";

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = args.remove(METRICS_EXPORTER);
    if (exporter != null) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = args.remove(OTEL_ENDPOINT);
    if (endpoint != null) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }

    String resourceAttributes = args.remove(OTEL_RESOURCE_ATTRIBUTES);
    if (resourceAttributes != null) {
      String trimmed = Strings.requirePrintableAscii(
          OTEL_RESOURCE_ATTRIBUTES, resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring resource attribute override");
      System.setProperty("otel.resource.attributes", trimmed);
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
