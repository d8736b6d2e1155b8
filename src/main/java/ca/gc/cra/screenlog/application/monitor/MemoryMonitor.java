package ca.gc.cra.screenlog.application.monitor;

import ca.gc.cra.screenlog.application.port.ChunkStorePort;
import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.EventChannel;
import ca.gc.cra.screenlog.application.port.FramePoolPort;
import ca.gc.cra.screenlog.application.port.MemoryProbePort;
import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.domain.memory.AlertSeverity;
import ca.gc.cra.screenlog.domain.memory.MemoryAlert;
import ca.gc.cra.screenlog.domain.memory.MemorySnapshot;
import ca.gc.cra.screenlog.infrastructure.events.BroadcastChannel;
import ca.gc.cra.screenlog.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.screenlog.validation.Numbers;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Periodic memory sampler that raises threshold and leak alerts.
 * <p><strong>Why:</strong> Multi-hour recording must notice heap pressure and slow leaks before the process dies.</p>
 * <p><strong>Role:</strong> Application service; reads the frame pool and the chunk store through their ports and
 * owns no state shared with them.</p>
 * <p><strong>Thread-safety:</strong> Ticks run on the {@code screenlog-memory-monitor} thread. History and debounce
 * state sit behind one lock; alerts are published after the lock is released so handlers may call back in.</p>
 * <p><strong>Observability:</strong> Emits {@code memory.sample.latencyNanos}, {@code memory.alert.warning},
 * {@code memory.alert.critical} and {@code memory.alert.leak}.</p>
 *
 * @since 0.1.0
 */
public final class MemoryMonitor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MemoryMonitor.class);
  private static final String THREAD_NAME = "screenlog-memory-monitor";

  private final MemoryProbePort probe;
  private final FramePoolPort pool;
  private final ChunkStorePort store;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final MonitorSettings settings;
  private final BroadcastChannel<MemoryAlert> alerts = new BroadcastChannel<>("memory-alerts");

  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<MemorySnapshot> history = new ArrayDeque<>();
  private final Map<AlertSeverity, Long> lastAlertMillis = new EnumMap<>(AlertSeverity.class);

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> task;

  public MemoryMonitor(
      MemoryProbePort probe,
      FramePoolPort pool,
      ChunkStorePort store,
      ClockPort clock,
      MetricsPort metrics,
      MonitorSettings settings) {
    this.probe = Objects.requireNonNull(probe, "probe");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Starts periodic sampling; the first tick runs immediately. Calling again while running is a no-op.
   *
   * @param intervalSeconds seconds between ticks (1-3600)
   */
  public void startMonitoring(int intervalSeconds) {
    Numbers.requireRange("intervalSeconds", intervalSeconds, 1, 3600);
    lock.lock();
    try {
      if (task != null) {
        log.debug("Memory monitoring already running");
        return;
      }
      scheduler = ExecutorFactories.newScheduler(THREAD_NAME, true);
      task = scheduler.scheduleAtFixedRate(this::tick, 0L, intervalSeconds, TimeUnit.SECONDS);
    } finally {
      lock.unlock();
    }
    log.info("Memory monitoring started (interval={}s, history={})", intervalSeconds, settings.historyCapacity());
  }

  /**
   * Stops sampling. Safe to call repeatedly or before {@link #startMonitoring(int)}.
   */
  public void stopMonitoring() {
    ScheduledExecutorService executor;
    lock.lock();
    try {
      if (task == null) {
        return;
      }
      task.cancel(false);
      task = null;
      executor = scheduler;
      scheduler = null;
    } finally {
      lock.unlock();
    }
    ExecutorFactories.shutdownGracefully(executor, 2_000L);
    log.info("Memory monitoring stopped");
  }

  public boolean isMonitoring() {
    lock.lock();
    try {
      return task != null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes a reading without recording it in history or evaluating alerts.
   */
  public MemorySnapshot currentSnapshot() {
    return collect();
  }

  /**
   * Runs one sampling tick synchronously: read, record, then evaluate thresholds and leaks.
   *
   * @return the recorded snapshot
   */
  public MemorySnapshot sampleNow() {
    long started = System.nanoTime();
    MemorySnapshot snapshot = collect();
    long elapsed = System.nanoTime() - started;
    metrics.observe("memory.sample.latencyNanos", elapsed);
    if (elapsed > settings.slowSample().toNanos()) {
      log.debug("Memory sample took {} ms", TimeUnit.NANOSECONDS.toMillis(elapsed));
    }

    List<MemoryAlert> raised = new ArrayList<>(2);
    lock.lock();
    try {
      history.addLast(snapshot);
      while (history.size() > settings.historyCapacity()) {
        history.removeFirst();
      }
      thresholdAlert(snapshot).ifPresent(raised::add);
      if (history.size() >= settings.minimumLeakSamples()) {
        leakAlert(snapshot).ifPresent(raised::add);
      }
    } finally {
      lock.unlock();
    }
    for (MemoryAlert alert : raised) {
      publish(alert);
    }
    return snapshot;
  }

  /**
   * Snapshots recorded within the last {@code lastMinutes} minutes, oldest first.
   */
  public List<MemorySnapshot> trend(int lastMinutes) {
    Numbers.requireRange("lastMinutes", lastMinutes, 0, 24 * 60);
    long cutoff = clock.nowMillis() - TimeUnit.MINUTES.toMillis(lastMinutes);
    lock.lock();
    try {
      List<MemorySnapshot> result = new ArrayList<>();
      for (MemorySnapshot snapshot : history) {
        if (snapshot.timestampMillis() >= cutoff) {
          result.add(snapshot);
        }
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  public int historySize() {
    lock.lock();
    try {
      return history.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers a synchronous alert handler. Exceptions thrown by the handler are logged and ignored.
   */
  public EventChannel.Registration onAlert(Consumer<? super MemoryAlert> handler) {
    return alerts.onEvent(handler);
  }

  /** Channel carrying every alert raised by this monitor. */
  public EventChannel<MemoryAlert> alerts() {
    return alerts;
  }

  /**
   * Releases every pooled frame.
   *
   * @return number of frames released
   */
  public int forceCleanup() {
    int before = pool.count();
    int released = pool.releaseAll();
    log.info("Forced cleanup released {} of {} pooled frame(s)", released, before);
    return released;
  }

  @Override
  public void close() {
    stopMonitoring();
  }

  private void tick() {
    MDC.put("pipeline", "monitor");
    try {
      sampleNow();
    } catch (RuntimeException ex) {
      log.error("Memory sampling tick failed", ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private MemorySnapshot collect() {
    MemoryProbePort.Reading reading = probe.read();
    return new MemorySnapshot(
        clock.nowMillis(),
        reading.usedMemoryMb(),
        reading.availableMemoryMb(),
        pool.count(),
        reading.activeThreadCount(),
        store.activeConnections());
  }

  private Optional<MemoryAlert> thresholdAlert(MemorySnapshot snapshot) {
    double usage = snapshot.memoryUsagePercent();
    if (usage >= settings.criticalPercent()) {
      if (!debounce(AlertSeverity.CRITICAL, snapshot.timestampMillis())) {
        return Optional.empty();
      }
      return Optional.of(MemoryAlert.threshold(
          snapshot.timestampMillis(),
          AlertSeverity.CRITICAL,
          usageMessage("Critical memory usage", snapshot),
          snapshot,
          "Pause AI processing, clear buffer cache, or restart app to free memory"));
    }
    if (usage >= settings.warningPercent()) {
      if (!debounce(AlertSeverity.WARNING, snapshot.timestampMillis())) {
        return Optional.empty();
      }
      return Optional.of(MemoryAlert.threshold(
          snapshot.timestampMillis(),
          AlertSeverity.WARNING,
          usageMessage("High memory usage", snapshot),
          snapshot,
          "Monitor memory usage. Consider pausing AI processing if usage continues to increase."));
    }
    return Optional.empty();
  }

  private Optional<MemoryAlert> leakAlert(MemorySnapshot latest) {
    long cutoff = latest.timestampMillis() - settings.leakWindow().toMillis();
    List<MemorySnapshot> window = new ArrayList<>();
    for (MemorySnapshot snapshot : history) {
      if (snapshot.timestampMillis() >= cutoff) {
        window.add(snapshot);
      }
    }
    Optional<LeakDetector.Finding> finding = LeakDetector.analyze(window, settings.leakGrowthPercent());
    if (finding.isEmpty()) {
      double growth = LeakDetector.growthPercent(window);
      if (growth > settings.leakGrowthPercent()) {
        log.debug("Memory grew {}% but not steadily; treating as a transient spike",
            String.format(Locale.ROOT, "%.1f", growth));
      }
      return Optional.empty();
    }
    if (!debounce(AlertSeverity.CRITICAL, latest.timestampMillis())) {
      return Optional.empty();
    }
    double growth = finding.get().growthPercent();
    return Optional.of(MemoryAlert.leak(
        latest.timestampMillis(),
        String.format(Locale.ROOT, "Memory leak detected: %.1f%% growth over %d minutes",
            growth, settings.leakWindow().toMinutes()),
        latest,
        "Memory leak detected. Check buffer count (" + latest.bufferCount()
            + " buffers) and restart app if necessary.",
        growth,
        settings.leakWindow()));
  }

  private boolean debounce(AlertSeverity severity, long nowMillis) {
    Long last = lastAlertMillis.get(severity);
    if (last != null && nowMillis - last < settings.alertDebounce().toMillis()) {
      return false;
    }
    lastAlertMillis.put(severity, nowMillis);
    return true;
  }

  private void publish(MemoryAlert alert) {
    String kind = alert.isLeakAlert() ? "leak" : alert.severity().name().toLowerCase(Locale.ROOT);
    metrics.increment("memory.alert." + kind);
    log.warn("Memory alert [{}] {}", alert.severity(), alert.message());
    alerts.publish(alert);
  }

  private static String usageMessage(String prefix, MemorySnapshot snapshot) {
    return String.format(Locale.ROOT, "%s: %d%% (%dMB / %dMB)",
        prefix,
        (int) snapshot.memoryUsagePercent(),
        (int) snapshot.usedMemoryMb(),
        (int) snapshot.totalMemoryMb());
  }
}
