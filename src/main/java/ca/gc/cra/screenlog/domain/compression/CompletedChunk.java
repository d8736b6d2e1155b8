package ca.gc.cra.screenlog.domain.compression;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Encoder output for one finished chunk.
 *
 * @param file encoded chunk file
 * @param sizeBytes file size in bytes
 * @param startEpochSeconds first covered second
 * @param endEpochSeconds last covered second
 * @param frameCount frames written to the chunk
 * @param settings settings the chunk was encoded with
 * @since 0.1.0
 */
public record CompletedChunk(
    Path file,
    long sizeBytes,
    long startEpochSeconds,
    long endEpochSeconds,
    int frameCount,
    CompressionSettings settings) {

  public CompletedChunk {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(settings, "settings");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be non-negative");
    }
    if (endEpochSeconds < startEpochSeconds) {
      throw new IllegalArgumentException("chunk end must not precede start");
    }
  }

  public long durationSeconds() {
    return endEpochSeconds - startEpochSeconds;
  }
}
