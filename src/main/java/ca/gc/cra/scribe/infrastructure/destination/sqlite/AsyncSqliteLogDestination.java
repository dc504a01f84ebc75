package ca.gc.cra.scribe.infrastructure.destination.sqlite;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseAsyncLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Asynchronous counterpart of {@link SqliteLogDestination}; inserts run on the destination's I/O executor.
 *
 * @since 0.1.0
 */
public final class AsyncSqliteLogDestination extends BaseAsyncLogDestination {
  private final SqliteLogStore store;

  public AsyncSqliteLogDestination(Path databaseFile, boolean createIfNotExists, int maxPoolSize,
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
