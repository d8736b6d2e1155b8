package ca.gc.cra.screenlog.domain.chunk;

import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Persisted metadata for one encoded video chunk.
 * <p><strong>Role:</strong> Domain value returned by the persistence coordinator to the recorder and the analysis
 * consumer.</p>
 * <p><strong>Thread-safety:</strong> Immutable snapshot; status changes produce a new row in the store.</p>
 *
 * @param id store-assigned identifier
 * @param file chunk file location
 * @param startEpochSeconds first covered second
 * @param endEpochSeconds last covered second
 * @param status lifecycle status
 * @since 0.1.0
 */
public record RecordingChunk(
    long id, Path file, long startEpochSeconds, long endEpochSeconds, ChunkStatus status) {

  public RecordingChunk {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(status, "status");
    if (endEpochSeconds < startEpochSeconds) {
      throw new IllegalArgumentException("chunk end must not precede start");
    }
  }

  public long durationSeconds() {
    return endEpochSeconds - startEpochSeconds;
  }
}
