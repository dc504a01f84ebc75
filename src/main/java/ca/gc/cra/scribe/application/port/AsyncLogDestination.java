package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.log.LogEntry;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous sink for {@link LogEntry} values.
 *
 * <p>Every returned future completes normally, including when the underlying write fails; failures are reported
 * on the diagnostic channel instead. {@link #close()} blocks until {@link #closeAsync()} completes.</p>
 *
 * @since 0.1.0
 */
public interface AsyncLogDestination extends AutoCloseable {
  /**
   * Accepts one entry.
   *
   * @param entry entry to write; must not be {@code null}
   * @return future completing once the entry is buffered or written
   */
  CompletableFuture<Void> writeLogAsync(LogEntry entry);

  /**
   * Writes every buffered entry.
   *
   * @return future completing once buffered entries are written
   */
  CompletableFuture<Void> flushAsync();

  /**
   * Flushes remaining entries and releases resources; idempotent.
   *
   * @return future completing once resources are released
   */
  CompletableFuture<Void> closeAsync();

  @Override
  default void close() {
    closeAsync().join();
  }

  /**
   * Human-readable name used in diagnostics.
   *
   * @return destination name; defaults to the simple class name
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
