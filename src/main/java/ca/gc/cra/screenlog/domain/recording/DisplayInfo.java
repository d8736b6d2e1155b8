package ca.gc.cra.screenlog.domain.recording;

/**
 * One attached display as reported by the capture source.
 *
 * @param id display identifier
 * @param width width in pixels
 * @param height height in pixels
 * @param primary whether this is the primary display
 * @since 0.1.0
 */
public record DisplayInfo(int id, int width, int height, boolean primary) {
  public DisplayInfo {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("display dimensions must be positive");
    }
  }
}
