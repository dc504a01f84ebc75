package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.application.scope.LogScope;
import ca.gc.cra.scribe.application.scope.ScopeState;
import ca.gc.cra.scribe.application.template.MessageTemplateParser;
import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.LogLevel;
import java.util.Map;

/**
 * <strong>What:</strong> Category logger accepting message templates and positional arguments.
 * <p><strong>Why:</strong> Callers log once and every configured destination receives the same structured entry.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code ScribeLogger} and {@code AsyncScribeLogger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Discard calls below the minimum level before any template work happens.</li>
 *   <li>Offer level shortcuts and scope helpers on top of {@link #log}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Entries carry the category, template properties and merged scope.</p>
 *
 * @since 0.1.0
 */
public interface StructuredLogger extends AutoCloseable {
  /**
   * Returns the category stamped on every entry.
   *
   * @return category name
   */
  String category();

  /**
   * Indicates whether entries at {@code level} would be emitted.
   *
   * @param level level to test
   * @return {@code true} if {@code level} is at or above the minimum and neither is {@link LogLevel#NONE}
   */
  boolean isEnabled(LogLevel level);

  /**
   * Logs one event.
   *
   * @param level severity
   * @param eventId event identifier; {@code null} means {@link EventId#NONE}
   * @param exception exception to attach; may be {@code null}
   * @param template message template; may be {@code null}
   * @param args positional template arguments
   */
  void log(LogLevel level, EventId eventId, Throwable exception, String template, Object... args);

  /** Flushes the destinations this logger writes to. */
  void flush();

  @Override
  void close();

  default void trace(String template, Object... args) {
    log(LogLevel.TRACE, EventId.NONE, null, template, args);
  }

  default void debug(String template, Object... args) {
    log(LogLevel.DEBUG, EventId.NONE, null, template, args);
  }

  default void info(String template, Object... args) {
    log(LogLevel.INFORMATION, EventId.NONE, null, template, args);
  }

  default void warn(String template, Object... args) {
    log(LogLevel.WARNING, EventId.NONE, null, template, args);
  }

  default void error(String template, Object... args) {
    log(LogLevel.ERROR, EventId.NONE, null, template, args);
  }

  default void error(Throwable exception, String template, Object... args) {
    log(LogLevel.ERROR, EventId.NONE, exception, template, args);
  }

  default void critical(String template, Object... args) {
    log(LogLevel.CRITICAL, EventId.NONE, null, template, args);
  }

  default void critical(Throwable exception, String template, Object... args) {
    log(LogLevel.CRITICAL, EventId.NONE, exception, template, args);
  }

  /**
   * Opens a scope from a property map.
   *
   * @param properties scope properties
   * @return handle closing the scope
   */
  default LogScope beginScope(Map<String, ?> properties) {
    return LogScope.begin(properties);
  }

  /**
   * Opens a scope with one property.
   *
   * @param name property name
   * @param value property value
   * @return handle closing the scope
   */
  default LogScope beginScope(String name, Object value) {
    return LogScope.begin(name, value);
  }

  /**
   * Opens a scope from an object converting itself to properties.
   *
   * @param state scope state
   * @return handle closing the scope
   */
  default LogScope beginScope(ScopeState state) {
    return LogScope.begin(state);
  }

  /**
   * Opens a scope whose properties are parsed from a message template.
   *
   * @param template template such as {@code "Request {RequestId}"}
   * @param args template arguments
   * @return handle closing the scope
   */
  default LogScope beginTemplateScope(String template, Object... args) {
    return LogScope.begin(MessageTemplateParser.parse(template, args).properties());
  }
}
