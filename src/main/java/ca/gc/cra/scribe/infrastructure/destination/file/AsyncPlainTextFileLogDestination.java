package ca.gc.cra.scribe.infrastructure.destination.file;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseAsyncLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.format.LogLineFormatter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Asynchronous counterpart of {@link PlainTextFileLogDestination}.
 *
 * @since 0.1.0
 */
public final class AsyncPlainTextFileLogDestination extends BaseAsyncLogDestination {
  private final Path file;

  public AsyncPlainTextFileLogDestination(Path file, boolean append, DestinationOptions options) {
    super("plain-text:" + Objects.requireNonNull(file, "file").getFileName(), options);
    this.file = LogFiles.prepare(file, append);
  }

  @Override
  protected void writeEntry(LogEntry entry) throws IOException {
    LogFiles.appendLine(file, LogLineFormatter.format(entry));
  }

  public Path file() {
    return file;
  }
}
