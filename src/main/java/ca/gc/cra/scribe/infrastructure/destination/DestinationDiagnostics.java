package ca.gc.cra.scribe.infrastructure.destination;

import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fallback channel reporting failures that destinations and loggers swallow.
 * <p><strong>Why:</strong> Delivery failures must never reach the logging call site, yet operators still need to
 * see them.</p>
 * <p><strong>Role:</strong> Infrastructure helper owned by each destination, logger and factory.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; SLF4J loggers and metrics ports are thread-safe.</p>
 * <p><strong>Observability:</strong> Logs to the {@value #CHANNEL} SLF4J logger and increments
 * {@code scribe.destination.write.failed} / {@code scribe.destination.flush.failed}.</p>
 *
 * @since 0.1.0
 */
public final class DestinationDiagnostics {
  /** SLF4J logger name carrying every swallowed failure. */
  public static final String CHANNEL = "ca.gc.cra.scribe.diagnostics";

  static final String WRITE_FAILED = "scribe.destination.write.failed";
  static final String FLUSH_FAILED = "scribe.destination.flush.failed";

  private static final Logger log = LoggerFactory.getLogger(CHANNEL);

  private final String source;
  private final MetricsPort metrics;
  private final AtomicLong droppedAfterClose = new AtomicLong();

  /**
   * Creates diagnostics for one component.
   *
   * @param source component name included in every report
   * @param metrics metrics sink; {@code null} means {@link MetricsPort#NO_OP}
   */
  public DestinationDiagnostics(String source, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Reports an entry that could not be persisted.
   *
   * @param entry dropped entry
   * @param failure cause
   */
  public void writeFailed(LogEntry entry, Throwable failure) {
    metrics.increment(WRITE_FAILED);
    log.warn("{} failed to write {} entry for {}: {} (message: {})",
        source, entry.level(), entry.category(), describe(failure),
        Logs.truncate(entry.message(), Logs.DIAGNOSTIC_MESSAGE_BYTES), failure);
  }

  /**
   * Reports a failed flush or resource sync.
   *
   * @param failure cause
   */
  public void flushFailed(Throwable failure) {
    metrics.increment(FLUSH_FAILED);
    log.warn("{} failed to flush: {}", source, describe(failure), failure);
  }

  /**
   * Reports a failure during an arbitrary lifecycle action such as close.
   *
   * @param action action name (e.g., {@code close})
   * @param failure cause
   */
  public void actionFailed(String action, Throwable failure) {
    log.warn("{} failed to {}: {}", source, action, describe(failure), failure);
  }

  /**
   * Reports an entry offered after the component was closed; the first and every 1000th occurrence are logged.
   *
   * @param entry dropped entry
   */
  public void droppedAfterClose(LogEntry entry) {
    long count = droppedAfterClose.incrementAndGet();
    if (count == 1 || count % 1000 == 0) {
      log.warn("{} is closed; dropped {} entry for {} (dropped so far: {})",
          source, entry.level(), entry.category(), count);
    }
  }

  /**
   * Reports a non-failure condition worth an operator's attention.
   *
   * @param message SLF4J message pattern
   * @param args pattern arguments
   */
  public void warn(String message, Object... args) {
    log.warn(message, args);
  }

  /**
   * Waits a bounded time for a delivery-side future, reporting instead of propagating an overrun.
   *
   * <p>Unlike {@link CompletableFuture#join()} the wait responds to interruption; the interrupt flag is restored.</p>
   *
   * @param future future to wait on
   * @param timeout longest wait; zero or negative checks completion without waiting
   * @param action action name used in reports (e.g., {@code flush destinations})
   * @return {@code true} if the future completed within the bound
   */
  public boolean await(CompletableFuture<?> future, Duration timeout, String action) {
    try {
      future.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException ex) {
      log.warn("{} gave up waiting to {} after {} ms", source, action, timeout.toMillis());
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("{} interrupted while waiting to {}", source, action);
      return false;
    } catch (ExecutionException ex) {
      actionFailed(action, ex.getCause());
      return true;
    }
  }

  /**
   * Returns a view of {@code future} that completes normally once it completes or {@code timeout} elapses; an overrun
   * is reported. The source future is left untouched.
   *
   * @param future future to bound
   * @param timeout longest wait; zero or negative only accepts an already completed future
   * @param action action name used in reports
   * @return bounded view completing normally
   */
  public CompletableFuture<Void> bound(CompletableFuture<?> future, Duration timeout, String action) {
    CompletableFuture<Void> view = future.thenApply(ignored -> null);
    return view
        .orTimeout(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS)
        .handle((ignored, failure) -> {
          if (failure instanceof TimeoutException) {
            log.warn("{} gave up waiting to {} after {} ms", source, action, timeout.toMillis());
          } else if (failure != null) {
            actionFailed(action, failure.getCause() == null ? failure : failure.getCause());
          }
          return null;
        });
  }

  public String source() {
    return source;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  private static String describe(Throwable failure) {
    if (failure == null) {
      return "unknown error";
    }
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : failure.getClass().getSimpleName() + ": " + message;
  }
}
