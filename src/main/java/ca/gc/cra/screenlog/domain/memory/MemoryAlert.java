package ca.gc.cra.screenlog.domain.memory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Immutable alert raised by the memory monitor on a threshold breach or a suspected leak.
 * <p><strong>Role:</strong> Domain value published to alert subscribers such as the UI and loggers.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param timestampMillis alert time in epoch milliseconds
 * @param severity alert severity
 * @param message human readable summary
 * @param snapshot snapshot that triggered the alert
 * @param recommendedAction mitigation advice for the operator
 * @param growthRatePercent growth over the detection window; present only for leak alerts
 * @param detectionWindow window analysed for growth; present only for leak alerts
 * @since 0.1.0
 */
public record MemoryAlert(
    long timestampMillis,
    AlertSeverity severity,
    String message,
    MemorySnapshot snapshot,
    String recommendedAction,
    OptionalDouble growthRatePercent,
    Optional<Duration> detectionWindow) {

  public MemoryAlert {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(recommendedAction, "recommendedAction");
    growthRatePercent = Objects.requireNonNullElse(growthRatePercent, OptionalDouble.empty());
    detectionWindow = Objects.requireNonNullElse(detectionWindow, Optional.empty());
  }

  /**
   * Creates a threshold alert without leak metadata.
   *
   * @param timestampMillis alert time
   * @param severity alert severity
   * @param message summary
   * @param snapshot triggering snapshot
   * @param recommendedAction mitigation advice
   * @return alert instance
   */
  public static MemoryAlert threshold(
      long timestampMillis,
      AlertSeverity severity,
      String message,
      MemorySnapshot snapshot,
      String recommendedAction) {
    return new MemoryAlert(
        timestampMillis, severity, message, snapshot, recommendedAction, OptionalDouble.empty(), Optional.empty());
  }

  /**
   * Creates a critical leak alert carrying growth metadata.
   *
   * @param timestampMillis alert time
   * @param message summary
   * @param snapshot most recent snapshot
   * @param recommendedAction mitigation advice
   * @param growthRatePercent growth across the window in percent
   * @param window analysed window
   * @return alert instance
   */
  public static MemoryAlert leak(
      long timestampMillis,
      String message,
      MemorySnapshot snapshot,
      String recommendedAction,
      double growthRatePercent,
      Duration window) {
    return new MemoryAlert(
        timestampMillis,
        AlertSeverity.CRITICAL,
        message,
        snapshot,
        recommendedAction,
        OptionalDouble.of(growthRatePercent),
        Optional.of(window));
  }

  /**
   * Indicates whether this alert came from leak detection.
   *
   * @return {@code true} when growth metadata is attached
   */
  public boolean isLeakAlert() {
    return growthRatePercent.isPresent();
  }
}
