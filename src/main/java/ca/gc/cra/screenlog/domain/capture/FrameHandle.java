package ca.gc.cra.screenlog.domain.capture;

import java.util.Objects;

/**
 * <strong>What:</strong> Owned reference to one captured frame held by the frame buffer pool.
 * <p><strong>Why:</strong> Gives each payload exactly one release path; once released or transferred the handle
 * no longer references the frame.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Callers must hold the owning pool's lock while mutating.</p>
 *
 * @since 0.1.0
 */
public final class FrameHandle {
  private final long id;
  private final long acquiredAtMillis;
  private final int sizeBytes;
  private CapturedFrame frame;

  /**
   * Creates a live handle.
   *
   * @param id opaque identifier, unique within the owning pool
   * @param frame frame payload now owned by the handle
   * @param acquiredAtMillis acquisition timestamp in epoch milliseconds
   */
  public FrameHandle(long id, CapturedFrame frame, long acquiredAtMillis) {
    this.id = id;
    this.frame = Objects.requireNonNull(frame, "frame");
    this.acquiredAtMillis = acquiredAtMillis;
    this.sizeBytes = frame.sizeBytes();
  }

  public long id() {
    return id;
  }

  public long acquiredAtMillis() {
    return acquiredAtMillis;
  }

  /**
   * Returns the payload size recorded at acquisition.
   *
   * @return payload bytes
   */
  public int sizeBytes() {
    return sizeBytes;
  }

  /**
   * Indicates whether the payload has already been released or transferred.
   *
   * @return {@code true} once the handle no longer owns a frame
   */
  public boolean isReleased() {
    return frame == null;
  }

  /**
   * Drops the payload reference.
   *
   * @return {@code true} if this call released the payload; {@code false} if it was already gone
   */
  public boolean release() {
    if (frame == null) {
      return false;
    }
    frame = null;
    return true;
  }

  /**
   * Moves the payload out of the handle to a new single owner.
   *
   * @return the frame, or {@code null} when already released
   */
  public CapturedFrame transfer() {
    CapturedFrame moved = frame;
    frame = null;
    return moved;
  }

  @Override
  public String toString() {
    return "FrameHandle{id=" + id + ", acquiredAtMillis=" + acquiredAtMillis
        + ", released=" + isReleased() + '}';
  }
}
