package ca.gc.cra.screenlog.config;

import ca.gc.cra.screenlog.application.compression.AdaptiveCompressionController;
import ca.gc.cra.screenlog.application.monitor.MemoryMonitor;
import ca.gc.cra.screenlog.application.monitor.MonitorSettings;
import ca.gc.cra.screenlog.application.pipeline.RecordingCoordinator;
import ca.gc.cra.screenlog.application.port.CaptureSource;
import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.EncoderPort;
import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.application.retention.RetentionService;
import ca.gc.cra.screenlog.domain.recording.RecordingState;
import ca.gc.cra.screenlog.infrastructure.buffer.FrameBufferPool;
import ca.gc.cra.screenlog.infrastructure.capture.SyntheticCaptureSource;
import ca.gc.cra.screenlog.infrastructure.encode.GzipFrameEncoder;
import ca.gc.cra.screenlog.infrastructure.memory.JvmMemoryProbe;
import ca.gc.cra.screenlog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceCoordinator;
import ca.gc.cra.screenlog.infrastructure.storage.LocalDiskSpaceAdapter;
import ca.gc.cra.screenlog.infrastructure.time.SystemClockAdapter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires SCREENLOG components to concrete adapters.
 * <p><strong>Why:</strong> Every component receives its collaborators here; nothing is a process-wide
 * singleton.</p>
 * <p><strong>Role:</strong> Adapter composition root used by the CLI commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the store once and share it between recorder, monitor and retention.</li>
 *   <li>Create components lazily so commands only pay for what they use.</li>
 *   <li>Close everything it created, in reverse creation order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use from a single startup thread; components it hands out are
 * thread-safe. {@link #close()} may also run from a shutdown hook and is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RecorderConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Deque<AutoCloseable> closeables = new ArrayDeque<>();

  private FrameBufferPool pool;
  private PersistenceCoordinator store;
  private MemoryMonitor monitor;
  private AdaptiveCompressionController compression;
  private CaptureSource captureSource;
  private RecordingCoordinator recorder;
  private RetentionService retention;

  /**
   * Creates a root that exports metrics through OpenTelemetry as configured by system properties.
   *
   * @param config process configuration
   */
  public CompositionRoot(RecorderConfig config) {
    this(config, new SystemClockAdapter(), new OpenTelemetryMetricsAdapter());
  }

  public CompositionRoot(RecorderConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (metrics instanceof AutoCloseable closeable) {
      closeables.push(closeable);
    }
  }

  public RecorderConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public FrameBufferPool framePool() {
    if (pool == null) {
      pool = new FrameBufferPool(config.bufferCapacity(), clock, metrics);
    }
    return pool;
  }

  /**
   * Opens the store on first use.
   *
   * @throws ca.gc.cra.screenlog.infrastructure.persistence.PersistenceException if the database cannot be opened
   */
  public PersistenceCoordinator store() {
    if (store == null) {
      store = PersistenceCoordinator.open(config.databaseFile(), config.readPoolSize(), clock, metrics);
      closeables.push(store);
    }
    return store;
  }

  public MemoryMonitor memoryMonitor() {
    if (monitor == null) {
      monitor = new MemoryMonitor(
          new JvmMemoryProbe(), framePool(), store(), clock, metrics, MonitorSettings.defaults());
      closeables.push(monitor);
    }
    return monitor;
  }

  public AdaptiveCompressionController compressionController() {
    if (compression == null) {
      compression = new AdaptiveCompressionController(config.compressionSettings(), clock, metrics);
    }
    return compression;
  }

  /** Capture source used by the recorder; the bundled build ships the synthetic source. */
  public CaptureSource captureSource() {
    if (captureSource == null) {
      captureSource = new SyntheticCaptureSource(config.width(), config.height(), clock, clock.nowMillis());
      closeables.push(captureSource);
    }
    return captureSource;
  }

  public RecordingCoordinator recorder() {
    if (recorder == null) {
      EncoderPort encoder = new GzipFrameEncoder(config.recordingsDirectory());
      recorder = new RecordingCoordinator(
          captureSource(),
          encoder,
          framePool(),
          store(),
          new LocalDiskSpaceAdapter(config.recordingsDirectory()),
          compressionController(),
          clock,
          metrics,
          config.recorderSettings());
      closeables.push(recorder);
    }
    return recorder;
  }

  public RetentionService retentionService() {
    if (retention == null) {
      retention = new RetentionService(store(), config.recordingsDirectory(), metrics);
      closeables.push(retention);
    }
    return retention;
  }

  /**
   * Starts the recorder when the previous process stopped while recording.
   *
   * @return the start future, or empty when recording was not active
   */
  public Optional<CompletableFuture<RecordingState>> resumeIfPreviouslyActive() {
    boolean wasActive = store().loadSetting(RecordingCoordinator.WAS_ACTIVE_KEY, Boolean.class, Boolean.FALSE);
    if (!wasActive) {
      return Optional.empty();
    }
    log.info("Recording was active when the previous session ended; resuming");
    return Optional.of(recorder().start());
  }

  /**
   * Closes every component created by this root, newest first. Failures are logged and do not stop the sweep.
   */
  @Override
  public synchronized void close() {
    while (!closeables.isEmpty()) {
      AutoCloseable closeable = closeables.pop();
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), ex);
      }
    }
  }
}
