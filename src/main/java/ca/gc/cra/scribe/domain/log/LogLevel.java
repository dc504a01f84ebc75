package ca.gc.cra.scribe.domain.log;

/**
 * <strong>What:</strong> Ordered severity of a log event.
 * <p><strong>Why:</strong> Loggers compare the call-site level against a configured minimum before doing any work.</p>
 * <p><strong>Role:</strong> Domain enumeration referenced by loggers, destinations, and configuration.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Performance:</strong> Ordinal comparisons only.</p>
 * <p><strong>Observability:</strong> {@link #code()} appears in text sinks; {@link #displayName()} in JSON and SQLite.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  /** Most verbose diagnostics. */
  TRACE("TRCE", "Trace"),
  /** Developer diagnostics. */
  DEBUG("DBUG", "Debug"),
  /** Normal operational events. */
  INFORMATION("INFO", "Information"),
  /** Unexpected but recoverable conditions. */
  WARNING("WARN", "Warning"),
  /** Failures of the current operation. */
  ERROR("FAIL", "Error"),
  /** Failures that threaten the whole process. */
  CRITICAL("CRIT", "Critical"),
  /** Disables a threshold entirely; never emitted. */
  NONE("NONE", "None");

  private final String code;
  private final String displayName;

  LogLevel(String code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  /**
   * Returns the four-letter code written by plain-text and console sinks.
   *
   * @return level code such as {@code INFO} or {@code FAIL}
   */
  public String code() {
    return code;
  }

  /**
   * Returns the human readable level name used by structured sinks.
   *
   * @return display name such as {@code Information}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Indicates whether this level passes the supplied minimum threshold.
   *
   * @param minimum configured minimum level; {@link #NONE} disables everything
   * @return {@code true} when this level is emittable and at or above {@code minimum}
   */
  public boolean isAtLeast(LogLevel minimum) {
    return this != NONE && minimum != NONE && compareTo(minimum) >= 0;
  }

  /**
   * Resolves a level from its enum name, display name, or code, ignoring case.
   *
   * @param raw textual level (e.g., {@code Information}, {@code info}, {@code WARN})
   * @return matching level
   * @throws IllegalArgumentException if {@code raw} is blank or unknown
   */
  public static LogLevel parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("log level must not be blank");
    }
    String candidate = raw.trim();
    for (LogLevel level : values()) {
      if (level.name().equalsIgnoreCase(candidate)
          || level.displayName.equalsIgnoreCase(candidate)
          || level.code.equalsIgnoreCase(candidate)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown log level: " + raw);
  }
}
