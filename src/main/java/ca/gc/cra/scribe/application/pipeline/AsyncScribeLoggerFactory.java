package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.AsyncLogDestination;
import ca.gc.cra.scribe.application.port.LoggerProvider;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.destination.DestinationDiagnostics;
import ca.gc.cra.scribe.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owner of an asynchronous logging pipeline.
 * <p><strong>Role:</strong> Application service implementing {@link LoggerProvider} with
 * {@link AsyncScribeLogger}s; every category logger has its own queue and consumer.</p>
 * <p><strong>Thread-safety:</strong> Logger cache is a {@link ConcurrentHashMap}; close is idempotent.</p>
 * <p><strong>Observability:</strong> Close failures are reported on the diagnostic channel.</p>
 *
 * @since 0.1.0
 */
public final class AsyncScribeLoggerFactory implements LoggerProvider {
  private static final Logger log = LoggerFactory.getLogger(AsyncScribeLoggerFactory.class);

  private final LogLevel minimumLevel;
  private final List<AsyncLogDestination> destinations;
  private final AsyncScribeLogger.Settings settings;
  private final MetricsPort metrics;
  private final LogEntryFactory entries = new LogEntryFactory();
  private final DestinationDiagnostics diagnostics;
  private final Map<String, AsyncScribeLogger> loggers = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates the factory.
   *
   * @param minimumLevel minimum level shared by all loggers
   * @param destinations destinations in delivery order; ownership passes to the factory
   * @param settings queue settings applied to every logger
   * @param metrics metrics sink; {@code null} means {@link MetricsPort#NO_OP}
   */
  public AsyncScribeLoggerFactory(
      LogLevel minimumLevel,
      List<AsyncLogDestination> destinations,
      AsyncScribeLogger.Settings settings,
      MetricsPort metrics) {
    this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
    this.destinations = List.copyOf(destinations);
    this.settings = Objects.requireNonNullElseGet(settings, AsyncScribeLogger.Settings::defaults);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.diagnostics = new DestinationDiagnostics("async-logger-factory", this.metrics);
  }

  @Override
  public AsyncScribeLogger logger(String category) {
    String name = Strings.requireNonBlank("category", category);
    if (closed.get()) {
      throw new IllegalStateException("Logger factory is closed");
    }
    return loggers.computeIfAbsent(name, key -> new AsyncScribeLogger(key, minimumLevel, destinations, false,
        settings, entries, new DestinationDiagnostics("async-logger:" + key, metrics)));
  }

  /**
   * Drains every logger's queue, then flushes each destination once.
   *
   * @param timeout bound on the whole operation, shared by every logger's drain and the destination flush
   * @return future completing normally once destinations are flushed or the timeout has elapsed
   */
  public CompletableFuture<Void> flushAsync(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    CompletableFuture<?>[] drains = loggers.values().stream()
        .map(logger -> logger.drainUntil(deadline, timeout))
        .toArray(CompletableFuture<?>[]::new);
    return CompletableFuture.allOf(drains).thenCompose(ignored -> {
      long left = Math.max(0L, deadline - System.nanoTime());
      return diagnostics.bound(flushDestinations(), Duration.ofNanos(left), "flush destinations");
    });
  }

  @Override
  public void flush() {
    flushAsync(AsyncScribeLogger.DEFAULT_FLUSH_TIMEOUT).join();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    flush();
    for (AsyncScribeLogger logger : loggers.values()) {
      try {
        logger.close();
      } catch (RuntimeException ex) {
        diagnostics.actionFailed("close logger " + logger.category(), ex);
      }
    }
    loggers.clear();
    for (AsyncLogDestination destination : destinations) {
      try {
        diagnostics.await(destination.closeAsync(), settings.shutdownTimeout(), "close " + destination.name());
      } catch (RuntimeException ex) {
        diagnostics.actionFailed("close " + destination.name(), ex);
      }
    }
    log.debug("Closed async logging pipeline with {} destinations", destinations.size());
  }

  public LogLevel minimumLevel() {
    return minimumLevel;
  }

  public List<AsyncLogDestination> destinations() {
    return destinations;
  }

  private CompletableFuture<Void> flushDestinations() {
    CompletableFuture<?>[] flushes = new CompletableFuture<?>[destinations.size()];
    for (int i = 0; i < flushes.length; i++) {
      try {
        flushes[i] = destinations.get(i).flushAsync().exceptionally(ex -> {
          diagnostics.flushFailed(ex);
          return null;
        });
      } catch (RuntimeException ex) {
        diagnostics.flushFailed(ex);
        flushes[i] = CompletableFuture.completedFuture(null);
      }
    }
    return CompletableFuture.allOf(flushes);
  }
}
