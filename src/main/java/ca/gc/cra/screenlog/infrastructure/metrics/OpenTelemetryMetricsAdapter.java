package ca.gc.cra.screenlog.infrastructure.metrics;

import ca.gc.cra.screenlog.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards SCREENLOG counters and histograms to OpenTelemetry.
 *
 * <p>Histogram units are inferred from the key suffix: {@code *Nanos} records nanoseconds, {@code *Bytes} records
 * bytes, anything else is dimensionless.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("screenlog.metric.key");
  private static final String FALLBACK_METRIC_NAME = "screenlog.metric";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    bootstrap.close();
  }

  static String unitFor(String key) {
    if (key.endsWith("Nanos")) {
      return "ns";
    }
    if (key.endsWith("Bytes")) {
      return "By";
    }
    if (key.endsWith("Millis")) {
      return "ms";
    }
    return "1";
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private interface MetricsDelegate {
    void increment(String key);

    void observe(String key, long value);
  }

  private enum NoopDelegate implements MetricsDelegate {
    INSTANCE;

    @Override
    public void increment(String key) {}

    @Override
    public void observe(String key, long value) {}
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      Instrument<LongCounter> instrument =
          counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
      instrument.instrument().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      Instrument<LongHistogram> instrument =
          histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
      instrument.instrument().record(value, instrument.attributes());
    }

    private Instrument<LongCounter> createCounter(String key) {
      String name = sanitizeName(key);
      LongCounter counter = meter.counterBuilder(name)
          .setUnit("1")
          .setDescription("SCREENLOG counter for " + key)
          .build();
      logSanitized(key, name);
      return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private Instrument<LongHistogram> createHistogram(String key) {
      String name = sanitizeName(key);
      LongHistogram histogram = meter.histogramBuilder(name)
          .ofLongs()
          .setUnit(unitFor(key))
          .setDescription("SCREENLOG observation for " + key)
          .build();
      logSanitized(key, name);
      return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private static void logSanitized(String key, String name) {
      if (!name.equals(key)) {
        log.debug("Sanitized metric name '{}' -> '{}'", key, name);
      }
    }
  }

  private record Instrument<I>(I instrument, Attributes attributes) {}
}
