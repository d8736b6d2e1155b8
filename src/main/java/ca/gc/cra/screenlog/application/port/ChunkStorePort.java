package ca.gc.cra.screenlog.application.port;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> The recorder's and monitor's view of the chunk store.
 * <p><strong>Why:</strong> Components depend on these few operations only, so tests can substitute an in-memory
 * store.</p>
 * <p><strong>Thread-safety:</strong> Implementations serialize writes; every method is safe from any thread.</p>
 * <p><strong>Error handling:</strong> Write failures surface as unchecked
 * {@code PersistenceException}s; the store is unchanged when one is thrown.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.screenlog.infrastructure.persistence.PersistenceCoordinator
 */
public interface ChunkStorePort {
  /**
   * Inserts a pending chunk.
   *
   * @param file chunk file
   * @param startEpochSeconds chunk start
   * @param endEpochSeconds chunk end
   * @return new chunk id
   */
  long registerChunk(Path file, long startEpochSeconds, long endEpochSeconds);

  /**
   * Moves a pending chunk to completed.
   *
   * @param chunkId chunk id
   */
  void markCompleted(long chunkId);

  /**
   * Moves a pending chunk to failed and deletes its file and record.
   *
   * @param chunkId chunk id
   */
  void markFailed(long chunkId);

  /**
   * Upserts a setting as serialized JSON.
   *
   * @param key setting name
   * @param value value to serialize
   */
  void saveSetting(String key, Object value);

  /**
   * Loads a setting, falling back to {@code defaultValue} when absent or undecodable.
   *
   * @param key setting name
   * @param type expected value type
   * @param defaultValue fallback value
   * @param <T> value type
   * @return decoded value or the fallback
   */
  <T> T loadSetting(String key, Class<T> type, T defaultValue);

  /**
   * Returns the number of open store connections when known.
   *
   * @return connection count, or empty when unavailable
   */
  default OptionalInt activeConnections() {
    return OptionalInt.empty();
  }
}
