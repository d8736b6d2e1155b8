package ca.gc.cra.screenlog.domain.compression;

/**
 * Output frame size in pixels.
 *
 * @param width width in pixels
 * @param height height in pixels
 * @since 0.1.0
 */
public record Resolution(int width, int height) {
  /** Reference resolution the base bitrate is calibrated against. */
  public static final Resolution FULL_HD = new Resolution(1920, 1080);

  public Resolution {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("resolution must be positive (was " + width + "x" + height + ")");
    }
  }

  public long pixels() {
    return (long) width * height;
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
