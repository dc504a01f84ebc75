package ca.gc.cra.scribe.infrastructure.destination.console;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.BaseLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * <strong>What:</strong> Synchronous destination printing formatted lines to a {@link PrintStream}.
 * <p><strong>Role:</strong> Infrastructure adapter for interactive and container stdout logging.</p>
 * <p><strong>Thread-safety:</strong> Governed by {@link DestinationOptions#threadSafety()}.</p>
 * <p><strong>Observability:</strong> Warning lines are yellow, Error red and Critical bold red when colors are on.</p>
 *
 * @implNote The stream is never closed; it usually is {@link System#out}.
 * @since 0.1.0
 */
public final class ConsoleLogDestination extends BaseLogDestination {
  private final PrintStream out;
  private final boolean useColors;

  public ConsoleLogDestination(DestinationOptions options) {
    this(System.out, true, options);
  }

  /**
   * Creates a console destination.
   *
   * @param out target stream
   * @param useColors whether to wrap lines in ANSI color codes
   * @param options shared destination options
   */
  public ConsoleLogDestination(PrintStream out, boolean useColors, DestinationOptions options) {
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
