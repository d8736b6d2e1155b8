package ca.gc.cra.screenlog.application.port;

import java.io.IOException;

/**
 * Port reporting free space on the recordings volume.
 *
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface DiskSpacePort {
  /**
   * Returns the bytes available to this process on the recordings volume.
   *
   * @return usable bytes
   * @throws IOException if the volume cannot be queried
   */
  long availableBytes() throws IOException;
}
