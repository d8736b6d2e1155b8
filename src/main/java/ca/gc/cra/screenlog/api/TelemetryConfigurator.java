package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry arguments ({@code metricsExporter}, {@code otelEndpoint}, {@code otelResourceAttributes}) out of
 * the argument map and into the system properties read by the OpenTelemetry bootstrap.
 *
 * @since 0.1.0
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies and removes the telemetry keys from {@code args}.
   *
   * @param args mutable argument map
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = trimmed(args.remove("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      System.setProperty("otel.metrics.exporter", normalized);
      log.debug("Metrics exporter set to {}", normalized);
    }

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      requireHttpEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("OTLP endpoint set to {}", endpoint);
    }

    String attributes = trimmed(args.remove("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
