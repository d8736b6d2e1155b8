package ca.gc.cra.screenlog.application.port;

import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.compression.CompletedChunk;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port to the compression backend that turns a frame stream into chunk files.
 * <p><strong>Why:</strong> Codec internals stay outside the recorder; the recorder only hands over frames and
 * settings and receives a completed chunk or a failure.</p>
 * <p><strong>Role:</strong> Application port implemented by encoder adapters such as {@code GzipFrameEncoder}.</p>
 * <p><strong>Thread-safety:</strong> Sessions are confined to the recorder thread.</p>
 * <p><strong>Observability:</strong> Implementations may emit {@code encode.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface EncoderPort {

  /**
   * Starts a new chunk.
   *
   * @param settings settings to encode with
   * @param startEpochSeconds chunk start; used in the chunk file name
   * @return open session
   * @throws Exception if the backend cannot start a chunk
   */
  Session begin(CompressionSettings settings, long startEpochSeconds) throws Exception;

  /**
   * Returns where a completed chunk covering the given range is (or would be) written.
   *
   * @param startEpochSeconds chunk start
   * @param endEpochSeconds chunk end
   * @return chunk file path
   */
  Path chunkFile(long startEpochSeconds, long endEpochSeconds);

  /**
   * One chunk being encoded. Frames are handed over by transfer; the session owns them afterwards.
   */
  interface Session {
    /**
     * Appends a frame.
     *
     * @param frame frame now owned by the session
     * @throws Exception if encoding fails
     */
    void append(CapturedFrame frame) throws Exception;

    /**
     * Finalizes the chunk file.
     *
     * @param endEpochSeconds chunk end; used in the chunk file name
     * @return completed chunk
     * @throws Exception if finalization fails; the partial output is discarded
     */
    CompletedChunk finish(long endEpochSeconds) throws Exception;

    /**
     * Abandons the chunk and discards partial output. Never throws.
     */
    void abort();

    /**
     * Returns the frames appended so far.
     *
     * @return frame count
     */
    int frameCount();
  }
}
