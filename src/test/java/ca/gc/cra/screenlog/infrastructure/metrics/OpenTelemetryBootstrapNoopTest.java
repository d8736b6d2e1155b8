package ca.gc.cra.screenlog.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("recorder.frames");
      adapter.observe("memory.sample.latencyNanos", 5L);
    }
  }

  @Test
  void parsesResourceAttributesSkippingMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=dev, broken, team = capture ,=x");
    assertEquals(2, attributes.size());
    assertEquals("dev", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("capture", attributes.get(AttributeKey.stringKey("team")));
  }
}
