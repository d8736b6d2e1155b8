package ca.gc.cra.screenlog.application.monitor;

import ca.gc.cra.screenlog.domain.memory.MemorySnapshot;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Distinguishes sustained memory growth from transient spikes.
 *
 * <p>The window is cut into three consecutive sub-windows (the last absorbs any remainder). A leak requires the
 * sub-window averages of used memory to be non-decreasing and the growth from the first to the last snapshot to exceed
 * the threshold. A spike that rises and falls inside the window fails the first test.</p>
 *
 * @since 0.1.0
 */
public final class LeakDetector {

  /**
   * Averages and growth computed for a window that was judged to leak.
   *
   * @param growthPercent growth from first to last snapshot, in percent of the first
   * @param earlyAverageMb average used MB in the first third
   * @param middleAverageMb average used MB in the second third
   * @param lateAverageMb average used MB in the final third
   */
  public record Finding(double growthPercent, double earlyAverageMb, double middleAverageMb, double lateAverageMb) {}

  private LeakDetector() {}

  /**
   * Analyses a window of snapshots ordered oldest first.
   *
   * @param window snapshots inside the detection window
   * @param growthThresholdPercent minimum growth, exclusive
   * @return finding when the window shows a sustained leak; empty otherwise
   */
  public static Optional<Finding> analyze(List<MemorySnapshot> window, double growthThresholdPercent) {
    Objects.requireNonNull(window, "window");
    if (window.size() < 3) {
      return Optional.empty();
    }
    double growth = growthPercent(window);
    if (growth <= growthThresholdPercent) {
      return Optional.empty();
    }
    int third = window.size() / 3;
    double early = average(window, 0, third);
    double middle = average(window, third, third * 2);
    double late = average(window, third * 2, window.size());
    if (middle < early || late < middle) {
      return Optional.empty();
    }
    return Optional.of(new Finding(growth, early, middle, late));
  }

  static double growthPercent(List<MemorySnapshot> window) {
    if (window.size() < 2 || window.get(0).usedMemoryMb() <= 0) {
      return 0.0;
    }
    double first = window.get(0).usedMemoryMb();
    return (window.get(window.size() - 1).usedMemoryMb() - first) / first * 100.0;
  }

  private static double average(List<MemorySnapshot> window, int from, int to) {
    double sum = 0.0;
    for (int i = from; i < to; i++) {
      sum += window.get(i).usedMemoryMb();
    }
    return sum / (to - from);
  }
}
