package ca.gc.cra.screenlog.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void movesTelemetryKeysIntoSystemProperties() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "service.name=screenlog",
        "fps", "2"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("service.name=screenlog", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("fps", "2"), args);
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "prometheus"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    Map<String, String> args = new HashMap<>(Map.of("otelEndpoint", "ftp://collector"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
    assertNull(System.getProperty("otel.exporter.otlp.endpoint"));
  }
}
