package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.LogDestination;
import ca.gc.cra.scribe.application.port.LoggerProvider;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.destination.DestinationDiagnostics;
import ca.gc.cra.scribe.validation.Strings;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owner of a synchronous logging pipeline: one destination list, one minimum level, and a
 * cache of category loggers.
 * <p><strong>Why:</strong> Applications construct the pipeline once in their composition root and hand the
 * provider to the components that log.</p>
 * <p><strong>Role:</strong> Application service implementing {@link LoggerProvider}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the same {@link ScribeLogger} for repeated requests of a category.</li>
 *   <li>On close, flush, then close loggers, then close every destination; one failure never stops the rest.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Logger cache is a {@link ConcurrentHashMap}; close is idempotent.</p>
 * <p><strong>Observability:</strong> Close failures are reported on the diagnostic channel.</p>
 *
 * @since 0.1.0
 */
public final class ScribeLoggerFactory implements LoggerProvider {
  private static final Logger log = LoggerFactory.getLogger(ScribeLoggerFactory.class);

  private final LogLevel minimumLevel;
  private final List<LogDestination> destinations;
  private final MetricsPort metrics;
  private final LogEntryFactory entries = new LogEntryFactory();
  private final DestinationDiagnostics diagnostics;
  private final Map<String, ScribeLogger> loggers = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates the factory.
   *
   * @param minimumLevel minimum level shared by all loggers
   * @param destinations destinations in delivery order; ownership passes to the factory
   * @param metrics metrics sink; {@code null} means {@link MetricsPort#NO_OP}
   */
  public ScribeLoggerFactory(LogLevel minimumLevel, List<LogDestination> destinations, MetricsPort metrics) {
    this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
    this.destinations = List.copyOf(destinations);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.diagnostics = new DestinationDiagnostics("logger-factory", this.metrics);
  }

  @Override
  public ScribeLogger logger(String category) {
    String name = Strings.requireNonBlank("category", category);
    if (closed.get()) {
      throw new IllegalStateException("Logger factory is closed");
    }
    return loggers.computeIfAbsent(name, key -> new ScribeLogger(key, minimumLevel, destinations, false, entries,
        new DestinationDiagnostics("logger:" + key, metrics)));
  }

  @Override
  public void flush() {
    for (LogDestination destination : destinations) {
      try {
        destination.flush();
      } catch (RuntimeException ex) {
        diagnostics.flushFailed(ex);
      }
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    flush();
    for (ScribeLogger logger : loggers.values()) {
      try {
        logger.close();
      } catch (RuntimeException ex) {
        diagnostics.actionFailed("close logger " + logger.category(), ex);
      }
    }
    loggers.clear();
    for (LogDestination destination : destinations) {
      try {
        destination.close();
      } catch (RuntimeException ex) {
        diagnostics.actionFailed("close " + destination.name(), ex);
      }
    }
    log.debug("Closed logging pipeline with {} destinations", destinations.size());
  }

  public LogLevel minimumLevel() {
    return minimumLevel;
  }

  public List<LogDestination> destinations() {
    return destinations;
  }
}
