package ca.gc.cra.scribe.infrastructure.destination.console;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseAsyncLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Asynchronous counterpart of {@link ConsoleLogDestination}; printing happens on the destination's I/O thread.
 *
 * @since 0.1.0
 */
public final class AsyncConsoleLogDestination extends BaseAsyncLogDestination {
  private final PrintStream out;
  private final boolean useColors;

  public AsyncConsoleLogDestination(DestinationOptions options) {
    this(System.out, true, options);
  }

  public AsyncConsoleLogDestination(PrintStream out, boolean useColors, DestinationOptions options) {
    super("console", options);
    this.out = Objects.requireNonNull(out, "out");
    this.useColors = useColors;
  }

  @Override
  protected void writeEntry(LogEntry entry) throws IOException {
    out.println(ConsoleStyle.render(entry, useColors));
    if (out.checkError()) {
      throw new IOException("console stream reported an error");
    }
  }

  @Override
  protected void syncResources() {
    out.flush();
  }
}
