package ca.gc.cra.scribe.infrastructure.destination.file;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseAsyncLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.format.JsonLogRecordWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Asynchronous counterpart of {@link JsonFileLogDestination}.
 *
 * @since 0.1.0
 */
public final class AsyncJsonFileLogDestination extends BaseAsyncLogDestination {
  private final Path file;

  public AsyncJsonFileLogDestination(Path file, boolean append, DestinationOptions options) {
    super("json:" + Objects.requireNonNull(file, "file").getFileName(), options);
    this.file = LogFiles.prepare(file, append);
  }

  @Override
  protected void writeEntry(LogEntry entry) throws IOException {
    LogFiles.appendLine(file, JsonLogRecordWriter.toJsonLine(entry));
  }

  public Path file() {
    return file;
  }
}
