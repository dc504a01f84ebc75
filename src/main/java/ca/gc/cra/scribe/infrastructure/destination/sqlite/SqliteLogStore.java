package ca.gc.cra.scribe.infrastructure.destination.sqlite;

import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.persistence.sqlite.JdbcConnectionPool;
import ca.gc.cra.scribe.infrastructure.persistence.sqlite.JdbcConnectionPool.PooledConnection;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Objects;
import org.sqlite.SQLiteConfig;

/**
 * <strong>What:</strong> Pooled access to a SQLite log database.
 * <p><strong>Role:</strong> Shared persistence core of the sync and async SQLite destinations.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent inserts; each insert checks out its own connection.</p>
 * <p><strong>Performance:</strong> SQLite busy timeout of {@value #BUSY_TIMEOUT_MS} ms absorbs writer contention.</p>
 *
 * @since 0.1.0
 */
final class SqliteLogStore implements AutoCloseable {
  static final int BUSY_TIMEOUT_MS = 5000;

  private final Path databaseFile;
  private final JdbcConnectionPool pool;

  /**
   * Opens the store and, when requested, creates the directory, table and indexes.
   *
   * @param databaseFile database file
   * @param createIfNotExists whether to create the directory and schema
   * @param maxPoolSize maximum pooled connections
   * @param metrics metrics sink
   * @throws IllegalStateException if initialization fails
   */
  SqliteLogStore(Path databaseFile, boolean createIfNotExists, int maxPoolSize, MetricsPort metrics) {
    this.databaseFile = Objects.requireNonNull(databaseFile, "databaseFile").toAbsolutePath();
    SQLiteConfig config = new SQLiteConfig();
    config.setBusyTimeout(BUSY_TIMEOUT_MS);
    String url = "jdbc:sqlite:" + this.databaseFile;
    this.pool = new JdbcConnectionPool(() -> config.createConnection(url), maxPoolSize, metrics);
    if (createIfNotExists) {
      initialize();
    }
  }

  private void initialize() {
    try {
      Path parent = databaseFile.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (PooledConnection handle = pool.acquire()) {
        LogEntriesTable.create(handle.connection());
      }
    } catch (IOException | SQLException ex) {
      pool.close();
      throw new IllegalStateException("Failed to initialize SQLite log database " + databaseFile, ex);
    }
  }

  void insert(LogEntry entry) throws SQLException, IOException {
    try (PooledConnection handle = pool.acquire()) {
      LogEntriesTable.insert(handle.connection(), entry);
    }
  }

  Path databaseFile() {
    return databaseFile;
  }

  JdbcConnectionPool pool() {
    return pool;
  }

  @Override
  public void close() {
    pool.close();
  }
}
