package ca.gc.cra.screenlog.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap = OpenTelemetryBootstrap.forTesting(reader);
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("recorder.chunks.completed");
    adapter.increment("recorder.chunks.completed");
    adapter.increment("recorder.chunks.completed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "recorder.chunks.completed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    AttributeKey<String> keyAttr = AttributeKey.stringKey("screenlog.metric.key");
    assertEquals("recorder.chunks.completed", point.getAttributes().get(keyAttr));

    assertEquals("screenlog", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramWithUnit() {
    adapter.observe("db.write.latencyNanos", 1_000L);
    adapter.observe("db.write.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "db.write.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());

    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum(), 1e-9);
  }

  @Test
  void sanitizesUnsupportedCharacters() {
    assertEquals("memory.alert.leak", OpenTelemetryMetricsAdapter.sanitizeName("memory.alert.leak"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitizeName("9 lives"));
    assertEquals("screenlog.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  @Test
  void unitsFollowKeySuffix() {
    assertEquals("By", OpenTelemetryMetricsAdapter.unitFor("retention.freedBytes"));
    assertEquals("ms", OpenTelemetryMetricsAdapter.unitFor("recorder.startMillis"));
    assertEquals("1", OpenTelemetryMetricsAdapter.unitFor("compression.multiplierPermille"));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
