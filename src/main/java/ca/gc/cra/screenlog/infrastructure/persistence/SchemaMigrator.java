package ca.gc.cra.screenlog.infrastructure.persistence;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the chunk store schema, tracked through SQLite's {@code user_version} pragma.
 *
 * <p>Each migration step runs inside the writer's transaction; a failed step leaves the version untouched.</p>
 */
final class SchemaMigrator {
  private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

  static final int CURRENT_VERSION = 1;

  private static final List<String> VERSION_1 = List.of(
      "CREATE TABLE IF NOT EXISTS chunks ("
          + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
          + " start_ts INTEGER NOT NULL,"
          + " end_ts INTEGER NOT NULL,"
          + " file_url TEXT NOT NULL,"
          + " status TEXT NOT NULL DEFAULT 'pending')",
      "CREATE INDEX IF NOT EXISTS idx_chunks_status ON chunks(status)",
      "CREATE INDEX IF NOT EXISTS idx_chunks_start_ts ON chunks(start_ts)",
      "CREATE TABLE IF NOT EXISTS analysis_batches ("
          + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
          + " batch_start_ts INTEGER NOT NULL,"
          + " batch_end_ts INTEGER NOT NULL,"
          + " status TEXT NOT NULL DEFAULT 'pending',"
          + " reason TEXT,"
          + " created_at INTEGER NOT NULL)",
      "CREATE INDEX IF NOT EXISTS idx_analysis_batches_status ON analysis_batches(status)",
      "CREATE TABLE IF NOT EXISTS batch_chunks ("
          + " batch_id INTEGER NOT NULL REFERENCES analysis_batches(id) ON DELETE CASCADE,"
          + " chunk_id INTEGER NOT NULL REFERENCES chunks(id) ON DELETE RESTRICT,"
          + " PRIMARY KEY (batch_id, chunk_id))",
      "CREATE INDEX IF NOT EXISTS idx_batch_chunks_chunk ON batch_chunks(chunk_id)",
      "CREATE TABLE IF NOT EXISTS timeline_cards ("
          + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
          + " batch_id INTEGER REFERENCES analysis_batches(id) ON DELETE CASCADE,"
          + " start_ts INTEGER NOT NULL,"
          + " end_ts INTEGER NOT NULL,"
          + " title TEXT NOT NULL,"
          + " video_summary_url TEXT,"
          + " created_at INTEGER NOT NULL)",
      "CREATE INDEX IF NOT EXISTS idx_timeline_cards_time_range ON timeline_cards(start_ts, end_ts)",
      "CREATE TABLE IF NOT EXISTS settings ("
          + " key TEXT PRIMARY KEY,"
          + " value TEXT NOT NULL,"
          + " updated_at INTEGER NOT NULL)");

  private SchemaMigrator() {}

  /**
   * Brings the schema up to {@link #CURRENT_VERSION} and commits.
   *
   * @param writer writer connection with auto-commit disabled
   * @return schema version after migration
   * @throws SQLException if a statement fails; the transaction is rolled back
   */
  static int migrate(Connection writer) throws SQLException {
    int version = userVersion(writer);
    if (version > CURRENT_VERSION) {
      throw new SQLException("Database schema version " + version + " is newer than supported " + CURRENT_VERSION);
    }
    if (version == CURRENT_VERSION) {
      writer.commit();
      log.debug("Schema already at version {}", version);
      return version;
    }
    try (Statement st = writer.createStatement()) {
      for (String sql : VERSION_1) {
        st.execute(sql);
      }
      st.execute("PRAGMA user_version=" + CURRENT_VERSION);
      writer.commit();
    } catch (SQLException ex) {
      writer.rollback();
      throw ex;
    }
    log.info("Migrated chunk store schema from version {} to {}", version, CURRENT_VERSION);
    return CURRENT_VERSION;
  }

  static int userVersion(Connection connection) throws SQLException {
    try (Statement st = connection.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA user_version")) {
      return rs.next() ? rs.getInt(1) : 0;
    }
  }
}
