package ca.gc.cra.screenlog.testing;

import ca.gc.cra.screenlog.application.port.ChunkStorePort;
import ca.gc.cra.screenlog.domain.chunk.ChunkStatus;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chunk store double keeping rows in memory. Unlike the SQLite store, failed chunks stay visible so tests can
 * assert on them.
 */
public final class InMemoryChunkStore implements ChunkStorePort {
  /** Stored chunk row. */
  public record Row(long id, Path file, long start, long end, ChunkStatus status) {}

  private final Map<Long, Row> rows = new LinkedHashMap<>();
  private final Map<String, Object> settings = new ConcurrentHashMap<>();
  private long nextId = 1L;
  private volatile boolean failWrites;

  @Override
  public synchronized long registerChunk(Path file, long startEpochSeconds, long endEpochSeconds) {
    if (failWrites) {
      throw new IllegalStateException("database is locked");
    }
    long id = nextId++;
    rows.put(id, new Row(id, file, startEpochSeconds, endEpochSeconds, ChunkStatus.PENDING));
    return id;
  }

  @Override
  public synchronized void markCompleted(long chunkId) {
    move(chunkId, ChunkStatus.COMPLETED);
  }

  @Override
  public synchronized void markFailed(long chunkId) {
    move(chunkId, ChunkStatus.FAILED);
  }

  @Override
  public void saveSetting(String key, Object value) {
    if (failWrites) {
      throw new IllegalStateException("database is locked");
    }
    settings.put(key, value);
  }

  @Override
  public <T> T loadSetting(String key, Class<T> type, T defaultValue) {
    Object value = settings.get(key);
    return type.isInstance(value) ? type.cast(value) : defaultValue;
  }

  @Override
  public OptionalInt activeConnections() {
    return OptionalInt.of(1);
  }

  public synchronized List<Row> rows() {
    return new ArrayList<>(rows.values());
  }

  public synchronized long count(ChunkStatus status) {
    return rows.values().stream().filter(row -> row.status() == status).count();
  }

  public void failWrites(boolean fail) {
    this.failWrites = fail;
  }

  private void move(long chunkId, ChunkStatus next) {
    Row row = rows.get(chunkId);
    if (row == null || !row.status().canTransitionTo(next)) {
      throw new IllegalStateException("chunk " + chunkId + " cannot move to " + next);
    }
    rows.put(chunkId, new Row(row.id(), row.file(), row.start(), row.end(), next));
  }
}
