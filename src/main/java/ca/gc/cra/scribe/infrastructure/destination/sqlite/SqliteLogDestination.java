package ca.gc.cra.scribe.infrastructure.destination.sqlite;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * <strong>What:</strong> Synchronous destination inserting one {@code LogEntries} row per entry.
 * <p><strong>Why:</strong> A queryable, indexed store of entries for local diagnostics tooling.</p>
 * <p><strong>Role:</strong> Infrastructure adapter over sqlite-jdbc and {@code JdbcConnectionPool}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the directory, table and indexes on construction when {@code createIfNotExists} is set.</li>
 *   <li>Insert rows through pooled connections; message and scope properties are JSON text columns.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Governed by {@link DestinationOptions#threadSafety()}; the pool itself is
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Initialization failure is thrown as {@link IllegalStateException}; per-row
 * failures are reported and dropped.</p>
 *
 * @since 0.1.0
 */
public final class SqliteLogDestination extends BaseLogDestination {
  public static final int DEFAULT_MAX_POOL_SIZE = 10;

  private final SqliteLogStore store;

  /**
   * Creates the destination.
   *
   * @param databaseFile database file
   * @param createIfNotExists whether to create the directory and schema
   * @param maxPoolSize maximum pooled connections; must be positive
   * @param options shared destination options
   * @throws IllegalStateException if the schema cannot be created
   */
  public SqliteLogDestination(Path databaseFile, boolean createIfNotExists, int maxPoolSize,
      DestinationOptions options) {
    super("sqlite:" + databaseFile.getFileName(), options);
    this.store = new SqliteLogStore(databaseFile, createIfNotExists, maxPoolSize, options().metrics());
  }

  @Override
  protected void writeEntry(LogEntry entry) throws SQLException, IOException {
    store.insert(entry);
  }

  @Override
  protected void releaseResources() {
    store.close();
  }

  public Path databaseFile() {
    return store.databaseFile();
  }
}
