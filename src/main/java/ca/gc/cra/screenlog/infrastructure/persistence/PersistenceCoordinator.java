package ca.gc.cra.screenlog.infrastructure.persistence;

import ca.gc.cra.screenlog.application.port.ChunkStorePort;
import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.application.port.MetricsPort;
import ca.gc.cra.screenlog.domain.chunk.AnalysisBatch;
import ca.gc.cra.screenlog.domain.chunk.BatchStatus;
import ca.gc.cra.screenlog.domain.chunk.ChunkStatus;
import ca.gc.cra.screenlog.domain.chunk.CleanupStats;
import ca.gc.cra.screenlog.domain.chunk.RecordingChunk;
import ca.gc.cra.screenlog.domain.chunk.StorageUsage;
import ca.gc.cra.screenlog.domain.chunk.SummaryRecord;
import ca.gc.cra.screenlog.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.screenlog.validation.Numbers;
import ca.gc.cra.screenlog.validation.Strings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> SQLite-backed store for recording chunks, analysis batches, summary records and settings.
 * <p><strong>Why:</strong> The capture producer, the analysis consumer and interactive readers all touch the same
 * metadata; a single serialized writer keeps it consistent while readers proceed without waiting.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link ChunkStorePort}.</p>
 * <p><strong>Thread-safety:</strong> Every mutation runs as one transaction on the {@code screenlog-db-writer}
 * thread. Reads borrow pooled connections and may run from any thread. Callers block until their write commits or
 * rolls back.</p>
 * <p><strong>Observability:</strong> Emits {@code db.write.latencyNanos}; writes slower than 100 ms log a warning.</p>
 *
 * @since 0.1.0
 */
public final class PersistenceCoordinator implements ChunkStorePort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PersistenceCoordinator.class);

  private static final long SLOW_WRITE_NANOS = 100_000_000L;
  private static final long[] OPEN_BACKOFF_MILLIS = {100L, 200L, 400L};
  private static final long SECONDS_PER_DAY = 86_400L;
  private static final long CLOSE_TIMEOUT_MILLIS = 10_000L;

  private final SqliteDataSources sources;
  private final ExecutorService writer;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ObjectMapper mapper;
  private final AtomicBoolean closed = new AtomicBoolean();

  private PersistenceCoordinator(SqliteDataSources sources, ClockPort clock, MetricsPort metrics) {
    this.sources = sources;
    this.clock = clock;
    this.metrics = metrics;
    this.mapper = new ObjectMapper();
    this.writer = ExecutorFactories.newSerialExecutor("screenlog-db-writer", true);
  }

  /**
   * Opens (creating if needed) the database, retrying up to three times with 100, 200 and 400 ms back-off, and
   * applies the schema.
   *
   * @param databaseFile SQLite file path
   * @param readPoolSize maximum pooled reader connections (1-16)
   * @param clock time source for {@code updated_at} and cleanup cut-offs
   * @param metrics metrics sink
   * @return ready coordinator
   * @throws PersistenceException if every attempt fails
   */
  public static PersistenceCoordinator open(
      Path databaseFile, int readPoolSize, ClockPort clock, MetricsPort metrics) {
    Objects.requireNonNull(databaseFile, "databaseFile");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(metrics, "metrics");
    Exception last = null;
    for (int attempt = 0; attempt < OPEN_BACKOFF_MILLIS.length; attempt++) {
      SqliteDataSources sources = null;
      try {
        sources = SqliteDataSources.open(databaseFile, readPoolSize);
        SchemaMigrator.migrate(sources.writer());
        log.info("Chunk store ready at {}", sources.databaseFile());
        return new PersistenceCoordinator(sources, clock, metrics);
      } catch (SQLException | IOException | RuntimeException ex) {
        last = ex;
        if (sources != null) {
          sources.close();
        }
        long backoff = OPEN_BACKOFF_MILLIS[attempt];
        log.warn("Opening chunk store at {} failed (attempt {}/{}); retrying in {} ms",
            databaseFile, attempt + 1, OPEN_BACKOFF_MILLIS.length, backoff, ex);
        try {
          Thread.sleep(backoff);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new PersistenceException("Interrupted while opening chunk store", ie);
        }
      }
    }
    throw new PersistenceException("Unable to open chunk store at " + databaseFile, last);
  }

  @Override
  public long registerChunk(Path file, long startEpochSeconds, long endEpochSeconds) {
    Objects.requireNonNull(file, "file");
    if (endEpochSeconds < startEpochSeconds) {
      throw new IllegalArgumentException("chunk end must not precede start");
    }
    String url = file.toAbsolutePath().toString();
    return write("registerChunk", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO chunks(start_ts, end_ts, file_url, status) VALUES (?, ?, ?, ?)")) {
        ps.setLong(1, startEpochSeconds);
        ps.setLong(2, endEpochSeconds);
        ps.setString(3, url);
        ps.setString(4, ChunkStatus.PENDING.dbValue());
        ps.executeUpdate();
      }
      return lastInsertId(conn);
    });
  }

  @Override
  public void markCompleted(long chunkId) {
    write("markCompleted", conn -> {
      requireTransition(conn, chunkId, ChunkStatus.COMPLETED);
      try (PreparedStatement ps = conn.prepareStatement("UPDATE chunks SET status = ? WHERE id = ?")) {
        ps.setString(1, ChunkStatus.COMPLETED.dbValue());
        ps.setLong(2, chunkId);
        ps.executeUpdate();
      }
      return null;
    });
  }

  /**
   * Marks a pending chunk failed and removes both its record and its file.
   *
   * @param chunkId chunk id
   * @throws PersistenceException if the chunk is unknown or no longer pending
   */
  @Override
  public void markFailed(long chunkId) {
    String fileUrl = write("markFailed", conn -> {
      String url = requireTransition(conn, chunkId, ChunkStatus.FAILED).file().toString();
      try (PreparedStatement update = conn.prepareStatement("UPDATE chunks SET status = ? WHERE id = ?");
          PreparedStatement unlink = conn.prepareStatement("DELETE FROM batch_chunks WHERE chunk_id = ?");
          PreparedStatement delete = conn.prepareStatement("DELETE FROM chunks WHERE id = ?")) {
        update.setString(1, ChunkStatus.FAILED.dbValue());
        update.setLong(2, chunkId);
        update.executeUpdate();
        unlink.setLong(1, chunkId);
        unlink.executeUpdate();
        delete.setLong(1, chunkId);
        delete.executeUpdate();
      }
      return url;
    });
    try {
      if (!Files.deleteIfExists(Paths.get(fileUrl))) {
        log.debug("Failed chunk {} had no file at {}", chunkId, fileUrl);
      }
    } catch (IOException ex) {
      log.warn("Unable to delete file of failed chunk {} at {}", chunkId, fileUrl, ex);
    }
  }

  /**
   * Creates an analysis batch and links it to the given chunks in one transaction.
   *
   * @param startEpochSeconds batch start
   * @param endEpochSeconds batch end
   * @param chunkIds chunks to associate; must be non-empty and all present
   * @return new batch id
   * @throws PersistenceException if any chunk id is unknown; nothing is persisted
   */
  public long saveBatch(long startEpochSeconds, long endEpochSeconds, Collection<Long> chunkIds) {
    Objects.requireNonNull(chunkIds, "chunkIds");
    if (chunkIds.isEmpty()) {
      throw new IllegalArgumentException("chunkIds must not be empty");
    }
    Set<Long> ids = new LinkedHashSet<>(chunkIds);
    long createdAt = clock.nowEpochSeconds();
    return write("saveBatch", conn -> {
      long batchId;
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO analysis_batches(batch_start_ts, batch_end_ts, status, created_at) VALUES (?, ?, ?, ?)")) {
        ps.setLong(1, startEpochSeconds);
        ps.setLong(2, endEpochSeconds);
        ps.setString(3, BatchStatus.PENDING.dbValue());
        ps.setLong(4, createdAt);
        ps.executeUpdate();
      }
      batchId = lastInsertId(conn);
      try (PreparedStatement exists = conn.prepareStatement("SELECT 1 FROM chunks WHERE id = ?");
          PreparedStatement link = conn.prepareStatement(
              "INSERT INTO batch_chunks(batch_id, chunk_id) VALUES (?, ?)")) {
        for (Long id : ids) {
          exists.setLong(1, id);
          try (ResultSet rs = exists.executeQuery()) {
            if (!rs.next()) {
              throw new PersistenceException("Cannot batch unknown chunk " + id);
            }
          }
          link.setLong(1, batchId);
          link.setLong(2, id);
          link.executeUpdate();
        }
      }
      return batchId;
    });
  }

  /**
   * Records the analysis outcome of a batch.
   *
   * @param batchId batch id
   * @param status new status
   * @param reason optional failure reason
   */
  public void updateBatchStatus(long batchId, BatchStatus status, Optional<String> reason) {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(reason, "reason");
    write("updateBatchStatus", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "UPDATE analysis_batches SET status = ?, reason = ? WHERE id = ?")) {
        ps.setString(1, status.dbValue());
        ps.setString(2, reason.orElse(null));
        ps.setLong(3, batchId);
        if (ps.executeUpdate() == 0) {
          throw new PersistenceException("Unknown batch " + batchId);
        }
      }
      return null;
    });
  }

  /**
   * Completed chunks not yet assigned to any batch, starting at or after {@code olderThanEpochSeconds}.
   *
   * @param olderThanEpochSeconds inclusive lower bound on {@code start_ts}
   * @return chunks ordered by start time
   */
  public List<RecordingChunk> fetchUnprocessedChunks(long olderThanEpochSeconds) {
    return read("fetchUnprocessedChunks", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT id, file_url, start_ts, end_ts, status FROM chunks"
              + " WHERE start_ts >= ? AND status = ?"
              + " AND id NOT IN (SELECT chunk_id FROM batch_chunks)"
              + " ORDER BY start_ts ASC, id ASC")) {
        ps.setLong(1, olderThanEpochSeconds);
        ps.setString(2, ChunkStatus.COMPLETED.dbValue());
        return readChunks(ps);
      }
    });
  }

  /**
   * Chunks overlapping {@code [fromEpochSeconds, toEpochSeconds)}.
   */
  public List<RecordingChunk> chunksInRange(long fromEpochSeconds, long toEpochSeconds) {
    return read("chunksInRange", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT id, file_url, start_ts, end_ts, status FROM chunks"
              + " WHERE start_ts < ? AND end_ts >= ? ORDER BY start_ts ASC, id ASC")) {
        ps.setLong(1, toEpochSeconds);
        ps.setLong(2, fromEpochSeconds);
        return readChunks(ps);
      }
    });
  }

  public Optional<RecordingChunk> findChunk(long chunkId) {
    return read("findChunk", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT id, file_url, start_ts, end_ts, status FROM chunks WHERE id = ?")) {
        ps.setLong(1, chunkId);
        return readChunks(ps).stream().findFirst();
      }
    });
  }

  public Optional<AnalysisBatch> findBatch(long batchId) {
    return read("findBatch", conn -> {
      Set<Long> chunkIds = new LinkedHashSet<>();
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT chunk_id FROM batch_chunks WHERE batch_id = ? ORDER BY chunk_id")) {
        ps.setLong(1, batchId);
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            chunkIds.add(rs.getLong(1));
          }
        }
      }
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT batch_start_ts, batch_end_ts, status, reason FROM analysis_batches WHERE id = ?")) {
        ps.setLong(1, batchId);
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) {
            return Optional.<AnalysisBatch>empty();
          }
          return Optional.of(new AnalysisBatch(
              batchId,
              rs.getLong(1),
              rs.getLong(2),
              BatchStatus.fromDbValue(rs.getString(3)),
              chunkIds,
              Optional.ofNullable(rs.getString(4))));
        }
      }
    });
  }

  public int batchCount() {
    return read("batchCount", conn -> {
      try (Statement st = conn.createStatement();
          ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM analysis_batches")) {
        return rs.next() ? rs.getInt(1) : 0;
      }
    });
  }

  /**
   * Inserts a downstream summary record, optionally pointing at a chunk file.
   *
   * @return new record id
   */
  public long insertSummaryRecord(
      long batchId, long startEpochSeconds, long endEpochSeconds, String title, Optional<Path> videoFile) {
    Strings.requireNonBlank("title", title);
    Objects.requireNonNull(videoFile, "videoFile");
    long createdAt = clock.nowEpochSeconds();
    return write("insertSummaryRecord", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO timeline_cards(batch_id, start_ts, end_ts, title, video_summary_url, created_at)"
              + " VALUES (?, ?, ?, ?, ?, ?)")) {
        ps.setLong(1, batchId);
        ps.setLong(2, startEpochSeconds);
        ps.setLong(3, endEpochSeconds);
        ps.setString(4, title);
        ps.setString(5, videoFile.map(p -> p.toAbsolutePath().toString()).orElse(null));
        ps.setLong(6, createdAt);
        ps.executeUpdate();
      }
      return lastInsertId(conn);
    });
  }

  public Optional<SummaryRecord> findSummaryRecord(long recordId) {
    return read("findSummaryRecord", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT batch_id, start_ts, end_ts, title, video_summary_url FROM timeline_cards WHERE id = ?")) {
        ps.setLong(1, recordId);
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) {
            return Optional.<SummaryRecord>empty();
          }
          return Optional.of(new SummaryRecord(
              recordId,
              rs.getLong(1),
              rs.getLong(2),
              rs.getLong(3),
              rs.getString(4),
              Optional.ofNullable(rs.getString(5))));
        }
      }
    });
  }

  /**
   * Deletes chunks that started more than {@code retentionDays} days ago together with their files and batch
   * associations. Summary records keep their rows but lose their video pointer.
   *
   * <p>Selection and row removal run in one writer transaction; files are unlinked only after it commits, so a
   * failed cleanup leaves both rows and files in place.</p>
   *
   * @param retentionDays retention in days (1-365)
   * @return what was found and removed
   */
  public CleanupStats cleanupOldChunks(int retentionDays) {
    Numbers.requireRange("retentionDays", retentionDays, 1, 365);
    long cutoff = clock.nowEpochSeconds() - retentionDays * SECONDS_PER_DAY;
    ExpiredChunks removed = write("cleanupOldChunks", conn -> {
      List<RecordingChunk> expired;
      try (PreparedStatement select = conn.prepareStatement(
          "SELECT id, file_url, start_ts, end_ts, status FROM chunks WHERE start_ts < ? ORDER BY start_ts")) {
        select.setLong(1, cutoff);
        expired = readChunks(select);
      }
      int deleted = 0;
      try (PreparedStatement detach = conn.prepareStatement(
              "UPDATE timeline_cards SET video_summary_url = NULL WHERE video_summary_url = ?");
          PreparedStatement unlink = conn.prepareStatement("DELETE FROM batch_chunks WHERE chunk_id = ?");
          PreparedStatement delete = conn.prepareStatement("DELETE FROM chunks WHERE id = ?")) {
        for (RecordingChunk chunk : expired) {
          detach.setString(1, chunk.file().toString());
          detach.executeUpdate();
          unlink.setLong(1, chunk.id());
          unlink.executeUpdate();
          delete.setLong(1, chunk.id());
          deleted += delete.executeUpdate();
        }
      }
      return new ExpiredChunks(expired, deleted);
    });
    if (removed.chunks().isEmpty()) {
      log.debug("No chunks older than {} day(s)", retentionDays);
      return CleanupStats.EMPTY;
    }

    int filesDeleted = 0;
    long bytesFreed = 0L;
    for (RecordingChunk chunk : removed.chunks()) {
      Path file = chunk.file();
      try {
        long size = Files.size(file);
        Files.delete(file);
        filesDeleted++;
        bytesFreed += size;
      } catch (NoSuchFileException ex) {
        log.warn("Chunk {} file already missing at {}", chunk.id(), file);
      } catch (IOException ex) {
        log.warn("Unable to delete chunk {} file at {}", chunk.id(), file, ex);
      }
    }

    CleanupStats stats =
        new CleanupStats(removed.chunks().size(), filesDeleted, removed.recordsDeleted(), bytesFreed);
    log.info("Removed {} chunk record(s) and {} file(s) older than {} day(s), freeing {} bytes",
        removed.recordsDeleted(), filesDeleted, retentionDays, bytesFreed);
    return stats;
  }

  @Override
  public void saveSetting(String key, Object value) {
    Strings.requireKey("key", key);
    Objects.requireNonNull(value, "value");
    String json;
    try {
      json = mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new PersistenceException("Unable to encode setting " + key, ex);
    }
    long updatedAt = clock.nowEpochSeconds();
    write("saveSetting", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO settings(key, value, updated_at) VALUES (?, ?, ?)"
              + " ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at")) {
        ps.setString(1, key);
        ps.setString(2, json);
        ps.setLong(3, updatedAt);
        ps.executeUpdate();
      }
      return null;
    });
  }

  @Override
  public <T> T loadSetting(String key, Class<T> type, T defaultValue) {
    Strings.requireKey("key", key);
    Objects.requireNonNull(type, "type");
    Optional<String> raw = loadRawSetting(key);
    if (raw.isEmpty()) {
      return defaultValue;
    }
    try {
      T value = mapper.readValue(raw.get(), type);
      return value == null ? defaultValue : value;
    } catch (JsonProcessingException ex) {
      log.warn("Setting {} could not be decoded as {}; using default", key, type.getSimpleName());
      return defaultValue;
    }
  }

  /** Raw JSON stored under {@code key}. */
  public Optional<String> loadRawSetting(String key) {
    Strings.requireKey("key", key);
    return read("loadSetting", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM settings WHERE key = ?")) {
        ps.setString(1, key);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.<String>empty();
        }
      }
    });
  }

  /**
   * Stores raw text under {@code key} without encoding it.
   */
  void saveRawSetting(String key, String rawValue) {
    Objects.requireNonNull(rawValue, "rawValue");
    long updatedAt = clock.nowEpochSeconds();
    write("saveRawSetting", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT OR REPLACE INTO settings(key, value, updated_at) VALUES (?, ?, ?)")) {
        ps.setString(1, key);
        ps.setString(2, rawValue);
        ps.setLong(3, updatedAt);
        ps.executeUpdate();
      }
      return null;
    });
  }

  /**
   * Bytes used by the database files and by everything under {@code recordingsRoot}.
   *
   * @param recordingsRoot directory holding chunk files; may not exist yet
   * @return usage snapshot
   */
  public StorageUsage storageUsage(Path recordingsRoot) {
    Objects.requireNonNull(recordingsRoot, "recordingsRoot");
    Path db = sources.databaseFile();
    long databaseBytes = sizeIfExists(db)
        + sizeIfExists(db.resolveSibling(db.getFileName() + "-wal"))
        + sizeIfExists(db.resolveSibling(db.getFileName() + "-shm"));
    long recordingsBytes = 0L;
    if (Files.isDirectory(recordingsRoot)) {
      try (Stream<Path> files = Files.walk(recordingsRoot)) {
        recordingsBytes = files.filter(Files::isRegularFile).mapToLong(PersistenceCoordinator::sizeIfExists).sum();
      } catch (IOException | UncheckedIOException ex) {
        log.warn("Unable to measure recordings under {}", recordingsRoot, ex);
      }
    }
    return new StorageUsage(databaseBytes, recordingsBytes);
  }

  @Override
  public OptionalInt activeConnections() {
    return closed.get() ? OptionalInt.empty() : sources.activeConnections();
  }

  /**
   * Drains pending writes, then closes the writer connection and the reader pool. Later writes fail.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (!ExecutorFactories.shutdownGracefully(writer, CLOSE_TIMEOUT_MILLIS)) {
      log.warn("Chunk store writer did not drain within {} ms", CLOSE_TIMEOUT_MILLIS);
    }
    sources.close();
    log.info("Chunk store closed");
  }

  private RecordingChunk requireTransition(Connection conn, long chunkId, ChunkStatus next) throws SQLException {
    RecordingChunk chunk;
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT id, file_url, start_ts, end_ts, status FROM chunks WHERE id = ?")) {
      ps.setLong(1, chunkId);
      chunk = readChunks(ps).stream().findFirst()
          .orElseThrow(() -> new PersistenceException("Unknown chunk " + chunkId));
    }
    if (!chunk.status().canTransitionTo(next)) {
      throw new PersistenceException(
          "Chunk " + chunkId + " cannot move from " + chunk.status() + " to " + next);
    }
    return chunk;
  }

  private <T> T write(String operation, SqlWork<T> work) {
    if (closed.get()) {
      throw new PersistenceException("Chunk store is closed; rejected " + operation);
    }
    Future<T> future;
    try {
      future = writer.submit(() -> inTransaction(operation, work));
    } catch (RejectedExecutionException ex) {
      throw new PersistenceException("Chunk store is closed; rejected " + operation, ex);
    }
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PersistenceException("Interrupted waiting for " + operation, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof PersistenceException) {
        throw (PersistenceException) cause;
      }
      throw new PersistenceException(operation + " failed", cause);
    }
  }

  private <T> T inTransaction(String operation, SqlWork<T> work) {
    Connection conn = sources.writer();
    long start = System.nanoTime();
    try {
      T result = work.apply(conn);
      conn.commit();
      return result;
    } catch (SQLException | RuntimeException ex) {
      rollback(conn, operation);
      metrics.increment("db.write.failed");
      if (ex instanceof PersistenceException) {
        throw (PersistenceException) ex;
      }
      throw new PersistenceException(operation + " failed", ex);
    } finally {
      long elapsed = System.nanoTime() - start;
      metrics.observe("db.write.latencyNanos", elapsed);
      if (elapsed > SLOW_WRITE_NANOS) {
        log.warn("Slow write: {} took {} ms", operation, elapsed / 1_000_000L);
      }
    }
  }

  private <T> T read(String operation, SqlWork<T> work) {
    try (Connection conn = sources.borrowReader()) {
      return work.apply(conn);
    } catch (SQLException ex) {
      metrics.increment("db.read.failed");
      throw new PersistenceException(operation + " failed", ex);
    }
  }

  private static void rollback(Connection conn, String operation) {
    try {
      conn.rollback();
    } catch (SQLException ex) {
      log.error("Rollback of {} failed", operation, ex);
    }
  }

  private static long lastInsertId(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
      if (!rs.next()) {
        throw new SQLException("last_insert_rowid() returned no row");
      }
      return rs.getLong(1);
    }
  }

  private static List<RecordingChunk> readChunks(PreparedStatement ps) throws SQLException {
    List<RecordingChunk> chunks = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        chunks.add(new RecordingChunk(
            rs.getLong("id"),
            Paths.get(rs.getString("file_url")),
            rs.getLong("start_ts"),
            rs.getLong("end_ts"),
            ChunkStatus.fromDbValue(rs.getString("status"))));
      }
    }
    return chunks;
  }

  private static long sizeIfExists(Path file) {
    try {
      return Files.isRegularFile(file) ? Files.size(file) : 0L;
    } catch (IOException ex) {
      return 0L;
    }
  }

  private record ExpiredChunks(List<RecordingChunk> chunks, int recordsDeleted) {}

  @FunctionalInterface
  private interface SqlWork<T> {
    T apply(Connection connection) throws SQLException;
  }
}
