package ca.gc.cra.screenlog.application.port;

import ca.gc.cra.screenlog.domain.capture.BufferPoolDiagnostics;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Port to the bounded frame buffer pool.
 * <p><strong>Why:</strong> The recorder routes frames through the pool, and the memory monitor reads its
 * diagnostics; neither depends on the concrete pool.</p>
 * <p><strong>Thread-safety:</strong> Implementations serialize all mutation; every method is safe from any
 * thread.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code buffer.*} metrics.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.screenlog.infrastructure.buffer.FrameBufferPool
 */
public interface FramePoolPort {
  /**
   * Admits a frame, evicting the oldest live handle first when full.
   *
   * @param frame frame now owned by the pool
   * @return handle id
   */
  long add(CapturedFrame frame);

  /**
   * Releases a handle. Unknown or already released ids are ignored.
   *
   * @param handleId handle id
   */
  void release(long handleId);

  /**
   * Removes a handle and transfers its frame to the caller.
   *
   * @param handleId handle id
   * @return the frame, or empty when the id is unknown
   */
  Optional<CapturedFrame> take(long handleId);

  /**
   * Releases every live handle.
   *
   * @return number of handles released
   */
  int releaseAll();

  int count();

  BufferPoolDiagnostics diagnostics();
}
