package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.scope.LogScope;
import ca.gc.cra.scribe.application.template.MessageTemplateParser;
import ca.gc.cra.scribe.application.template.MessageTemplateParser.ParseResult;
import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.ExceptionInfo;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import java.time.Clock;
import java.util.Objects;

/**
 * Builds {@link LogEntry} values from log call arguments: renders the template, merges the active scope and
 * captures the exception.
 *
 * @since 0.1.0
 */
public final class LogEntryFactory {
  private final Clock clock;

  public LogEntryFactory() {
    this(Clock.systemUTC());
  }

  public LogEntryFactory(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates an entry for an enabled log call.
   *
   * @param category logger category
   * @param level severity; never {@link LogLevel#NONE}
   * @param eventId event identifier; may be {@code null}
   * @param exception exception to capture; may be {@code null}
   * @param template message template; may be {@code null}
   * @param args template arguments
   * @return the entry, or {@code null} when the rendered message is empty and no exception is attached
   */
  public LogEntry create(
      String category, LogLevel level, EventId eventId, Throwable exception, String template, Object... args) {
    ParseResult parsed = MessageTemplateParser.parse(template, args);
    if (parsed.message().isEmpty() && exception == null) {
      return null;
    }
    return new LogEntry(
        clock.instant(),
        level,
        category,
        eventId,
        parsed.message(),
        template,
        parsed.properties(),
        LogScope.currentProperties(),
        ExceptionInfo.from(exception));
  }
}
