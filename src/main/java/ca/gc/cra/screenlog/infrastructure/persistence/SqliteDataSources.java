package ca.gc.cra.screenlog.infrastructure.persistence;

import ca.gc.cra.screenlog.validation.Numbers;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the SQLite database behind the chunk store: one dedicated writer connection plus a pooled set of
 * query-only reader connections.
 *
 * <p>The writer switches the file to WAL journaling before the pool starts, so readers never block the writer.</p>
 */
final class SqliteDataSources implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);
  private static final int BUSY_TIMEOUT_MILLIS = 5_000;

  private final Path databaseFile;
  private final Connection writer;
  private final HikariDataSource readers;

  private SqliteDataSources(Path databaseFile, Connection writer, HikariDataSource readers) {
    this.databaseFile = databaseFile;
    this.writer = writer;
    this.readers = readers;
  }

  static SqliteDataSources open(Path databaseFile, int readPoolSize) throws SQLException, IOException {
    Objects.requireNonNull(databaseFile, "databaseFile");
    Numbers.requireRange("readPoolSize", readPoolSize, 1, 16);
    Path absolute = databaseFile.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    String url = "jdbc:sqlite:" + absolute;

    Connection writer = DriverManager.getConnection(url);
    try {
      try (Statement st = writer.createStatement()) {
        String mode;
        try (ResultSet rs = st.executeQuery("PRAGMA journal_mode=WAL")) {
          mode = rs.next() ? rs.getString(1) : "unknown";
        }
        st.execute("PRAGMA foreign_keys=ON");
        st.execute("PRAGMA synchronous=NORMAL");
        st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MILLIS);
        log.debug("Opened SQLite writer for {} (journal_mode={})", absolute, mode);
      }
      writer.setAutoCommit(false);
      return new SqliteDataSources(absolute, writer, createReaderPool(url, readPoolSize));
    } catch (SQLException | RuntimeException ex) {
      closeQuietly(writer);
      throw ex;
    }
  }

  private static HikariDataSource createReaderPool(String url, int readPoolSize) {
    HikariConfig config = new HikariConfig();
    config.setPoolName("screenlog-db-readers");
    config.setJdbcUrl(url);
    config.setDriverClassName("org.sqlite.JDBC");
    config.setMaximumPoolSize(readPoolSize);
    config.setMinimumIdle(1);
    config.setAutoCommit(true);
    config.setConnectionInitSql("PRAGMA query_only=ON");
    config.addDataSourceProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MILLIS));
    return new HikariDataSource(config);
  }

  Path databaseFile() {
    return databaseFile;
  }

  Connection writer() {
    return writer;
  }

  Connection borrowReader() throws SQLException {
    return readers.getConnection();
  }

  /** Active pooled reader connections plus the writer. */
  OptionalInt activeConnections() {
    if (readers.isClosed()) {
      return OptionalInt.empty();
    }
    HikariPoolMXBean bean = readers.getHikariPoolMXBean();
    if (bean == null) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(bean.getActiveConnections() + 1);
  }

  @Override
  public void close() {
    readers.close();
    closeQuietly(writer);
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException ex) {
      log.warn("Failed to close SQLite writer connection", ex);
    }
  }
}
