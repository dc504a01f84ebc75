package ca.gc.cra.scribe.infrastructure.destination.file;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.format.LogLineFormatter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Synchronous destination appending formatted text lines to a file.
 * <p><strong>Role:</strong> Infrastructure adapter for human-readable log files.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the parent directory on construction and truncate the file unless appending.</li>
 *   <li>Append {@code [timestamp] [CODE] category: message} lines, followed by exception text when present.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Governed by {@link DestinationOptions#threadSafety()}.</p>
 * <p><strong>Performance:</strong> Each entry opens the file in append mode, so external rotation or deletion is
 * picked up on the next write.</p>
 * <p><strong>Observability:</strong> Write failures (missing directory, full disk) are reported and the entry is
 * dropped for this destination only.</p>
 *
 * @since 0.1.0
 */
public final class PlainTextFileLogDestination extends BaseLogDestination {
  private final Path file;

  /**
   * Creates the destination and prepares the file.
   *
   * @param file target file
   * @param append {@code true} to keep existing content
   * @param options shared destination options
   * @throws java.io.UncheckedIOException if the directory or file cannot be prepared
   */
  public PlainTextFileLogDestination(Path file, boolean append, DestinationOptions options) {
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
