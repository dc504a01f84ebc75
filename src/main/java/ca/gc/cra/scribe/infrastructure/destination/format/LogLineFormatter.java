package ca.gc.cra.scribe.infrastructure.destination.format;

import ca.gc.cra.scribe.domain.log.LogEntry;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders entries as {@code [timestamp] [CODE] category: message} text lines.
 *
 * <p>The timestamp is ISO-8601 UTC with millisecond precision. When the entry carries an exception, its full
 * text follows on subsequent lines.</p>
 *
 * @since 0.1.0
 */
public final class LogLineFormatter {
  public static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private static final String NEWLINE = System.lineSeparator();

  private LogLineFormatter() {
    // Utility
  }

  /**
   * Formats the entry without a trailing line separator.
   *
   * @param entry entry to render
   * @return formatted text; multi-line when an exception is attached
   */
  public static String format(LogEntry entry) {
    StringBuilder sb = new StringBuilder(64 + entry.message().length());
    sb.append('[').append(TIMESTAMP.format(entry.timestamp())).append("] [")
        .append(entry.level().code()).append("] ")
        .append(entry.category()).append(": ")
        .append(entry.message());
    if (entry.hasException()) {
      sb.append(NEWLINE).append(entry.exception().render());
    }
    return sb.toString();
  }
}
