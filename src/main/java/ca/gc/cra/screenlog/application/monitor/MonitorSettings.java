package ca.gc.cra.screenlog.application.monitor;

import ca.gc.cra.screenlog.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs for {@link MemoryMonitor}.
 *
 * @param historyCapacity maximum retained snapshots; oldest are dropped first
 * @param warningPercent usage percentage that raises a warning alert
 * @param criticalPercent usage percentage that raises a critical alert
 * @param alertDebounce minimum spacing between two alerts of the same severity
 * @param leakWindow trailing window analysed for leaks
 * @param minimumLeakSamples history size required before leak analysis runs
 * @param leakGrowthPercent growth across the window above which a sustained rise is a leak
 * @param slowSample sampling latency above which a debug line is logged
 * @since 0.1.0
 */
public record MonitorSettings(
    int historyCapacity,
    double warningPercent,
    double criticalPercent,
    Duration alertDebounce,
    Duration leakWindow,
    int minimumLeakSamples,
    double leakGrowthPercent,
    Duration slowSample) {

  public static final int DEFAULT_INTERVAL_SECONDS = 10;

  public MonitorSettings {
    Numbers.requireRange("historyCapacity", historyCapacity, 1, 100_000);
    Numbers.requireRange("minimumLeakSamples", minimumLeakSamples, 3, historyCapacity);
    if (!(warningPercent > 0 && warningPercent < criticalPercent && criticalPercent <= 100)) {
      throw new IllegalArgumentException("thresholds must satisfy 0 < warning < critical <= 100");
    }
    if (leakGrowthPercent <= 0) {
      throw new IllegalArgumentException("leakGrowthPercent must be positive");
    }
    Objects.requireNonNull(alertDebounce, "alertDebounce");
    Objects.requireNonNull(leakWindow, "leakWindow");
    Objects.requireNonNull(slowSample, "slowSample");
    if (leakWindow.isNegative() || leakWindow.isZero()) {
      throw new IllegalArgumentException("leakWindow must be positive");
    }
  }

  /** 360 snapshots, 75/90 % thresholds, 60 s debounce, 5 minute leak window over at least 30 samples, 5 % growth. */
  public static MonitorSettings defaults() {
    return new MonitorSettings(
        360, 75.0, 90.0, Duration.ofSeconds(60), Duration.ofMinutes(5), 30, 5.0, Duration.ofMillis(10));
  }

  public MonitorSettings withMinimumLeakSamples(int samples) {
    return new MonitorSettings(
        historyCapacity, warningPercent, criticalPercent, alertDebounce, leakWindow, samples, leakGrowthPercent,
        slowSample);
  }
}
