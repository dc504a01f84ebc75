package ca.gc.cra.scribe.infrastructure.destination.file;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.format.JsonLogRecordWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Synchronous destination appending one JSON object per line.
 * <p><strong>Why:</strong> JSON-lines files are streamable and greppable, and keep message and scope properties
 * as separate fields.</p>
 * <p><strong>Thread-safety:</strong> Governed by {@link DestinationOptions#threadSafety()}.</p>
 * <p><strong>Observability:</strong> Field names are listed on {@link JsonLogRecordWriter}.</p>
 *
 * @since 0.1.0
 */
public final class JsonFileLogDestination extends BaseLogDestination {
  private final Path file;

  /**
   * Creates the destination and prepares the file.
   *
   * @param file target file
   * @param append {@code true} to keep existing content
   * @param options shared destination options
   */
  public JsonFileLogDestination(Path file, boolean append, DestinationOptions options) {
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
