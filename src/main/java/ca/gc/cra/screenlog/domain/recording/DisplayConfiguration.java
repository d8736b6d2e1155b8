package ca.gc.cra.screenlog.domain.recording;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Snapshot of the attached displays.
 * <p><strong>Why:</strong> The recorder compares successive snapshots to decide whether a reconfiguration
 * notification actually requires restarting capture.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param displays attached displays, in source order
 * @since 0.1.0
 */
public record DisplayConfiguration(List<DisplayInfo> displays) {
  public DisplayConfiguration {
    displays = displays == null ? List.of() : List.copyOf(displays);
  }

  public int displayCount() {
    return displays.size();
  }

  /**
   * Returns the primary display id, falling back to the first display.
   *
   * @return primary id, or {@code -1} when no display is attached
   */
  public int primaryDisplayId() {
    return displays.stream()
        .filter(DisplayInfo::primary)
        .findFirst()
        .or(() -> displays.stream().findFirst())
        .map(DisplayInfo::id)
        .orElse(-1);
  }

  /**
   * Returns the primary display, falling back to the first display.
   *
   * @return primary display, or {@code null} when none is attached
   */
  public DisplayInfo primaryDisplay() {
    int id = primaryDisplayId();
    return displays.stream().filter(d -> d.id() == id).findFirst().orElse(null);
  }

  /**
   * Decides whether moving to {@code next} requires a capture restart.
   *
   * @param next newly observed configuration
   * @return {@code true} when display count, primary display or any resolution differs
   */
  public boolean requiresRestart(DisplayConfiguration next) {
    Objects.requireNonNull(next, "next");
    if (displayCount() != next.displayCount() || primaryDisplayId() != next.primaryDisplayId()) {
      return true;
    }
    return !resolutions().equals(next.resolutions());
  }

  private Set<String> resolutions() {
    return displays.stream()
        .map(d -> d.id() + ":" + d.width() + "x" + d.height())
        .collect(Collectors.toSet());
  }
}
