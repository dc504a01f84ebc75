package ca.gc.cra.scribe.infrastructure.destination.console;

import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.destination.format.LogLineFormatter;

/** ANSI coloring of formatted console lines. */
final class ConsoleStyle {
  private static final String RESET = "\u001B[0m";
  private static final String YELLOW = "\u001B[33m";
  private static final String RED = "\u001B[31m";
  private static final String BOLD_RED = "\u001B[1;31m";

  private ConsoleStyle() {
    // Utility
  }

  static String render(LogEntry entry, boolean useColors) {
    String line = LogLineFormatter.format(entry);
    if (!useColors) {
      return line;
    }
    String color = switch (entry.level()) {
      case WARNING -> YELLOW;
      case ERROR -> RED;
      case CRITICAL -> BOLD_RED;
      default -> null;
    };
    return color == null ? line : color + line + RESET;
  }
}
