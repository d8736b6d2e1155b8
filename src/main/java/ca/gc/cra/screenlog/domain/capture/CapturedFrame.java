package ca.gc.cra.screenlog.domain.capture;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> One raw screen image pulled from a capture source.
 * <p><strong>Role:</strong> Domain value handed from the capture source to the frame buffer pool and, by transfer,
 * on to the encoder.</p>
 * <p><strong>Thread-safety:</strong> The payload is cloned once on construction; afterwards the frame is only
 * touched by its current owner.</p>
 * <p><strong>Performance:</strong> Accessor returns the backing array without copying so the encoder can stream it.</p>
 *
 * @param pixels raw frame bytes; defensively copied
 * @param width frame width in pixels
 * @param height frame height in pixels
 * @param displayId identifier of the display the frame was captured from
 * @param capturedAtMillis capture timestamp in epoch milliseconds
 * @since 0.1.0
 */
public record CapturedFrame(byte[] pixels, int width, int height, int displayId, long capturedAtMillis) {
  /**
   * Normalizes the payload and validates the dimensions.
   */
  public CapturedFrame {
    pixels = pixels != null ? pixels.clone() : new byte[0];
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("frame dimensions must be non-negative");
    }
  }

  /**
   * Returns the payload size in bytes.
   *
   * @return number of payload bytes
   */
  public int sizeBytes() {
    return pixels.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CapturedFrame that)) {
      return false;
    }
    return width == that.width()
        && height == that.height()
        && displayId == that.displayId()
        && capturedAtMillis == that.capturedAtMillis()
        && Arrays.equals(pixels, that.pixels());
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(pixels);
    result = 31 * result + Objects.hash(width, height, displayId, capturedAtMillis);
    return result;
  }

  @Override
  public String toString() {
    return "CapturedFrame{"
        + "bytes=" + pixels.length
        + ", width=" + width
        + ", height=" + height
        + ", displayId=" + displayId
        + ", capturedAtMillis=" + capturedAtMillis
        + '}';
  }
}
