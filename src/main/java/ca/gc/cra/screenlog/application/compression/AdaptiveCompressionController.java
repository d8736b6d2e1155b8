package ca.gc.cra.screenlog.application.compression;

import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.domain.compression.AdjustmentRecord;
import ca.gc.cra.screenlog.domain.compression.AdjustmentStatistics;
import ca.gc.cra.screenlog.domain.compression.CompletedChunk;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Feedback loop that nudges the bitrate multiplier toward a daily storage budget.
 * <p><strong>Why:</strong> Screen content varies wildly; a fixed bitrate either wastes disk on busy days or
 * under-records quiet ones.</p>
 * <p><strong>Role:</strong> Application service fed by the recorder after each chunk.</p>
 * <p><strong>Algorithm:</strong> The last four chunk sizes are averaged and compared with the budget share of the
 * chunk's duration (2 GiB per 8-hour day). Deviations inside 10% are ignored. Oversized averages lower the multiplier
 * by 10% per unit of deviation, undersized ones raise it by 5%, both halved for smoothing and clamped to
 * {@code [0.4, 2.0]}. Changes of 2% or less are skipped.</p>
 * <p><strong>Thread-safety:</strong> All state is guarded by one {@link ReentrantLock}.</p>
 * <p><strong>Observability:</strong> Emits {@code compression.adjusted} and {@code compression.multiplierPermille}.</p>
 *
 * @since 0.1.0
 */
public final class AdaptiveCompressionController {
  private static final Logger log = LoggerFactory.getLogger(AdaptiveCompressionController.class);

  public static final int WINDOW_SIZE = 4;
  public static final long DAILY_BUDGET_BYTES = 2L * 1024 * 1024 * 1024;
  public static final long RECORDING_DAY_SECONDS = 8L * 60 * 60;
  static final double TOLERANCE = 0.10;
  static final double OVERSIZE_GAIN = 0.10;
  static final double UNDERSIZE_GAIN = 0.05;
  static final double SMOOTHING = 0.5;
  static final double MIN_RELATIVE_CHANGE = 0.02;
  static final int HISTORY_LIMIT = 100;

  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Long> window = new ArrayDeque<>(WINDOW_SIZE + 1);
  private final Deque<AdjustmentRecord> history = new ArrayDeque<>(HISTORY_LIMIT + 1);
  private CompressionSettings settings;

  public AdaptiveCompressionController(CompressionSettings initial, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(initial, "initial");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Target chunk size for a chunk of the given duration.
   *
   * @param durationSeconds chunk duration
   * @return budgeted bytes
   */
  public static long targetChunkBytes(long durationSeconds) {
    return Math.round((double) DAILY_BUDGET_BYTES * durationSeconds / RECORDING_DAY_SECONDS);
  }

  /**
   * Records a finished chunk and returns new settings when the multiplier moved.
   *
   * @param chunk chunk just written
   * @return adjusted settings, or empty when the window is filling or no significant change is warranted
   */
  public Optional<CompressionSettings> analyzeAndAdjust(CompletedChunk chunk) {
    Objects.requireNonNull(chunk, "chunk");
    if (chunk.durationSeconds() <= 0) {
      log.debug("Ignoring zero-length chunk {}", chunk.file().getFileName());
      return Optional.empty();
    }
    lock.lock();
    try {
      window.addLast(chunk.sizeBytes());
      while (window.size() > WINDOW_SIZE) {
        window.removeFirst();
      }
      if (window.size() < WINDOW_SIZE) {
        log.debug("Collecting chunk sizes ({}/{})", window.size(), WINDOW_SIZE);
        return Optional.empty();
      }

      long target = targetChunkBytes(chunk.durationSeconds());
      long sum = 0L;
      for (long size : window) {
        sum += size;
      }
      long average = sum / window.size();
      double deviation = (double) (average - target) / target;
      if (Math.abs(deviation) <= TOLERANCE) {
        log.debug("Chunk sizes within target ({} deviation)", percent(deviation));
        return Optional.empty();
      }

      double adjustment = deviation > 0 ? -OVERSIZE_GAIN * deviation : -UNDERSIZE_GAIN * deviation;
      double current = settings.multiplier();
      double next = CompressionSettings.clampMultiplier(current * (1.0 + adjustment * SMOOTHING));
      double change = Math.abs(next - current) / current;
      if (change <= MIN_RELATIVE_CHANGE) {
        log.debug("Multiplier change too small ({})", percent(change));
        return Optional.empty();
      }

      AdjustmentRecord record = new AdjustmentRecord(
          clock.nowMillis(),
          current,
          next,
          deviation,
          average,
          target,
          chunk.sizeBytes(),
          deviation > 0 ? "Oversized chunks" : "Undersized chunks");
      history.addLast(record);
      while (history.size() > HISTORY_LIMIT) {
        history.removeFirst();
      }
      settings = settings.withMultiplier(next);
      metrics.increment("compression.adjusted");
      metrics.observe("compression.multiplierPermille", Math.round(next * 1000));
      log.info("Bitrate multiplier {} -> {} ({}; deviation {}, avg {} MB, target {} MB)",
          String.format(Locale.ROOT, "%.2f", current),
          String.format(Locale.ROOT, "%.2f", next),
          record.reason(),
          percent(deviation),
          average / (1024 * 1024),
          target / (1024 * 1024));
      return Optional.of(settings);
    } finally {
      lock.unlock();
    }
  }

  public CompressionSettings currentSettings() {
    lock.lock();
    try {
      return settings;
    } finally {
      lock.unlock();
    }
  }

  /** Adjustments applied so far, oldest first (at most 100). */
  public List<AdjustmentRecord> history() {
    lock.lock();
    try {
      return List.copyOf(history);
    } finally {
      lock.unlock();
    }
  }

  public AdjustmentStatistics statistics() {
    lock.lock();
    try {
      double current = settings.multiplier();
      if (history.isEmpty()) {
        return new AdjustmentStatistics(0, 0, 0, current, current, current, current);
      }
      int increased = 0;
      int decreased = 0;
      double sum = 0.0;
      double min = Double.MAX_VALUE;
      double max = -Double.MAX_VALUE;
      for (AdjustmentRecord record : history) {
        double value = record.newMultiplier();
        if (value > record.previousMultiplier()) {
          increased++;
        } else if (value < record.previousMultiplier()) {
          decreased++;
        }
        sum += value;
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
      return new AdjustmentStatistics(
          history.size(), increased, decreased, current, sum / history.size(), min, max);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Restores the multiplier to 1.0 and empties the size window. Adjustment history is kept.
   */
  public void reset() {
    lock.lock();
    try {
      settings = settings.withMultiplier(1.0);
      window.clear();
    } finally {
      lock.unlock();
    }
    log.info("Adaptive compression reset to multiplier 1.00");
  }

  /**
   * Swaps in new base settings (for example after a resolution change) while keeping the current multiplier.
   */
  public void rebase(CompressionSettings base) {
    Objects.requireNonNull(base, "base");
    lock.lock();
    try {
      settings = base.withMultiplier(settings.multiplier());
    } finally {
      lock.unlock();
    }
  }

  private static String percent(double fraction) {
    return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
  }
}
