package ca.gc.cra.scribe.application.port;

/**
 * <strong>What:</strong> Source of category loggers sharing one set of destinations.
 * <p><strong>Role:</strong> Application port implemented by the sync and async logger factories.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent {@link #logger(String)} calls.</p>
 *
 * @since 0.1.0
 */
public interface LoggerProvider extends AutoCloseable {
  /**
   * Returns the logger for a category, creating it on first use.
   *
   * @param category category name; must not be blank
   * @return cached logger; the same instance for repeated calls with the same category
   */
  StructuredLogger logger(String category);

  /**
   * Convenience for {@code logger(type.getName())}.
   *
   * @param type class whose name becomes the category
   * @return cached logger
   */
  default StructuredLogger logger(Class<?> type) {
    return logger(type.getName());
  }

  /** Flushes all destinations. */
  void flush();

  /** Closes loggers, then destinations; failures are reported and do not stop the sequence. */
  @Override
  void close();
}
