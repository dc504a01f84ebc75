package ca.gc.cra.scribe.domain.log;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of a single log event.
 * <p><strong>Why:</strong> One value is handed to every destination, so it must never be mutated after creation.</p>
 * <p><strong>Role:</strong> Domain record built by loggers and consumed by destinations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Carry rendered text alongside the raw template and structured properties.</li>
 *   <li>Reject {@link LogLevel#NONE}, which is a threshold marker and never an event level.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; property maps are defensive unmodifiable copies.</p>
 * <p><strong>Performance:</strong> Copies property maps once at construction.</p>
 * <p><strong>Observability:</strong> Fields map one-to-one onto JSON-lines keys and SQLite columns.</p>
 *
 * @param timestamp UTC instant at which the logger accepted the event
 * @param level severity; never {@link LogLevel#NONE}
 * @param category logical source name (e.g., a class name)
 * @param eventId correlation identifier; {@link EventId#NONE} when absent
 * @param message rendered message text
 * @param messageTemplate raw template the message was rendered from; may be {@code null}
 * @param properties properties extracted from the template; never {@code null}, values may be {@code null}
 * @param scopeProperties merged properties of the active scope chain; never {@code null}
 * @param exception captured exception; may be {@code null}
 * @since 0.1.0
 */
public record LogEntry(
    Instant timestamp,
    LogLevel level,
    String category,
    EventId eventId,
    String message,
    String messageTemplate,
    Map<String, Object> properties,
    Map<String, Object> scopeProperties,
    ExceptionInfo exception) {

  public LogEntry {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(message, "message");
    if (level == LogLevel.NONE) {
      throw new IllegalArgumentException("LogLevel.NONE cannot be emitted");
    }
    eventId = eventId == null ? EventId.NONE : eventId;
    properties = freeze(properties);
    scopeProperties = freeze(scopeProperties);
  }

  /**
   * Creates a plain entry without template, properties, or exception.
   *
   * @param level severity
   * @param category logical source name
   * @param message rendered message
   * @return new entry stamped with the current instant
   */
  public static LogEntry of(LogLevel level, String category, String message) {
    return new LogEntry(Instant.now(), level, category, EventId.NONE, message, null, null, null, null);
  }

  /**
   * Indicates whether the entry carries a captured exception.
   *
   * @return {@code true} when {@link #exception()} is non-null
   */
  public boolean hasException() {
    return exception != null;
  }

  private static Map<String, Object> freeze(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    // LinkedHashMap keeps null values, which Map.copyOf rejects.
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
