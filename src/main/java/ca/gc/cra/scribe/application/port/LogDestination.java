package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.log.LogEntry;

/**
 * <strong>What:</strong> Synchronous sink for {@link LogEntry} values.
 * <p><strong>Why:</strong> Loggers fan out each entry to several independent outputs; a shared contract lets them
 * treat console, files and databases alike.</p>
 * <p><strong>Role:</strong> Application port implemented by infrastructure destinations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept entries in call order; buffered implementations may defer the physical write.</li>
 *   <li>Make every accepted entry durable on {@link #flush()}.</li>
 *   <li>Flush and release resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Declared per implementation through its thread-safety mode.</p>
 * <p><strong>Performance:</strong> Implementations should keep {@link #writeLog(LogEntry)} cheap when buffered.</p>
 * <p><strong>Observability:</strong> Failures are reported on the diagnostic channel and never thrown.</p>
 *
 * @implNote No method of this contract throws for I/O failures. Loggers still guard calls so that a misbehaving
 * custom destination cannot break its siblings.
 * @since 0.1.0
 */
public interface LogDestination extends AutoCloseable {
  /**
   * Accepts one entry.
   *
   * @param entry entry to write; must not be {@code null}
   */
  void writeLog(LogEntry entry);

  /** Writes every buffered entry. */
  void flush();

  /** Flushes remaining entries and releases resources; idempotent. */
  @Override
  void close();

  /**
   * Human-readable name used in diagnostics.
   *
   * @return destination name; defaults to the simple class name
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
