package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.LogDestination;
import ca.gc.cra.scribe.application.port.StructuredLogger;
import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.destination.DestinationDiagnostics;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Synchronous category logger fanning each entry out to every destination.
 * <p><strong>Why:</strong> The simplest delivery discipline: the calling thread renders and persists the entry
 * before {@link #log} returns.</p>
 * <p><strong>Role:</strong> Application service implementing {@link StructuredLogger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Short-circuit disabled levels before parsing the template.</li>
 *   <li>Deliver to destinations in registration order; one destination failing never blocks the rest.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable apart from the destinations, which guard themselves.</p>
 * <p><strong>Performance:</strong> A disabled call costs one enum comparison.</p>
 * <p><strong>Observability:</strong> Exceptions escaping a custom destination are reported on the diagnostic channel.</p>
 *
 * @since 0.1.0
 */
public final class ScribeLogger implements StructuredLogger {
  private final String category;
  private final LogLevel minimumLevel;
  private final List<LogDestination> destinations;
  private final boolean ownsDestinations;
  private final LogEntryFactory entries;
  private final DestinationDiagnostics diagnostics;

  /**
   * Creates a standalone logger that owns (and closes) its destinations.
   *
   * @param category category stamped on entries
   * @param minimumLevel minimum emitted level
   * @param destinations destinations in delivery order
   */
  public ScribeLogger(String category, LogLevel minimumLevel, List<LogDestination> destinations) {
    this(category, minimumLevel, destinations, true, new LogEntryFactory(),
        new DestinationDiagnostics("logger:" + category, null));
  }

  ScribeLogger(
      String category,
      LogLevel minimumLevel,
      List<LogDestination> destinations,
      boolean ownsDestinations,
      LogEntryFactory entries,
      DestinationDiagnostics diagnostics) {
    this.category = Objects.requireNonNull(category, "category");
    this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
    this.destinations = List.copyOf(destinations);
    this.ownsDestinations = ownsDestinations;
    this.entries = Objects.requireNonNull(entries, "entries");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  @Override
  public String category() {
    return category;
  }

  @Override
  public boolean isEnabled(LogLevel level) {
    return level != null && level.isAtLeast(minimumLevel);
  }

  @Override
  public void log(LogLevel level, EventId eventId, Throwable exception, String template, Object... args) {
    if (!isEnabled(level)) {
      return;
    }
    LogEntry entry = entries.create(category, level, eventId, exception, template, args);
    if (entry == null) {
      return;
    }
    for (LogDestination destination : destinations) {
      try {
        destination.writeLog(entry);
      } catch (RuntimeException ex) {
        diagnostics.writeFailed(entry, ex);
      }
    }
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

  /** Flushes destinations and, for a standalone logger, closes them. */
  @Override
  public void close() {
    if (!ownsDestinations) {
      flush();
      return;
    }
    for (LogDestination destination : destinations) {
      try {
        destination.close();
      } catch (RuntimeException ex) {
        diagnostics.actionFailed("close " + destination.name(), ex);
      }
    }
  }

  public LogLevel minimumLevel() {
    return minimumLevel;
  }

  List<LogDestination> destinations() {
    return destinations;
  }
}
