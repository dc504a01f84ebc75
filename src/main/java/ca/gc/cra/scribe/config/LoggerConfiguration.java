package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.pipeline.ScribeLoggerFactory;
import ca.gc.cra.scribe.application.port.LogDestination;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.console.ConsoleLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.file.JsonFileLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.file.PlainTextFileLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.sqlite.SqliteLogDestination;
import ca.gc.cra.scribe.validation.Numbers;
import ca.gc.cra.scribe.validation.Paths;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Fluent builder for a synchronous logging pipeline.
 * <p><strong>Why:</strong> Collects the minimum level and destination list, validates them, and hands ownership
 * of the constructed destinations to a {@link ScribeLoggerFactory}.</p>
 * <p><strong>Role:</strong> Configuration entry point used directly or via {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject invalid paths and sizes when they are added.</li>
 *   <li>Construct destinations at {@link #build()} in registration order.</li>
 *   <li>Fail {@link #build()} when no destination was configured.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; use from one thread during startup.</p>
 *
 * @implNote Destination options capture the buffer size and metrics in effect at {@link #build()} time.
 * @since 0.1.0
 */
public final class LoggerConfiguration {
  static final String NO_DESTINATIONS = "At least one log destination must be configured.";

  private LogLevel minimumLevel = LogLevel.INFORMATION;
  private int bufferSize = DestinationOptions.DEFAULT_BUFFER_SIZE;
  private MetricsPort metrics = MetricsPort.NO_OP;
  private final List<Function<DestinationOptions, LogDestination>> destinations = new ArrayList<>();

  public static LoggerConfiguration create() {
    return new LoggerConfiguration();
  }

  public LoggerConfiguration setMinimumLevel(LogLevel level) {
    this.minimumLevel = Objects.requireNonNull(level, "level");
    return this;
  }

  public LoggerConfiguration setBufferSize(int size) {
    this.bufferSize = Numbers.requirePositive("bufferSize", size);
    return this;
  }

  public LoggerConfiguration setMetrics(MetricsPort port) {
    this.metrics = Objects.requireNonNullElse(port, MetricsPort.NO_OP);
    return this;
  }

  public LoggerConfiguration addConsole() {
    return addConsole(WriteMode.IMMEDIATE, ThreadSafety.THREAD_SAFE, true);
  }

  public LoggerConfiguration addConsole(WriteMode writeMode, ThreadSafety threadSafety, boolean useColors) {
    return addConsole(System.out, writeMode, threadSafety, useColors);
  }

  /**
   * Adds a console destination writing to the given stream.
   *
   * @param out target stream
   * @param writeMode write mode
   * @param threadSafety thread-safety mode
   * @param useColors whether to emit ANSI colors
   * @return this builder
   */
  public LoggerConfiguration addConsole(
      PrintStream out, WriteMode writeMode, ThreadSafety threadSafety, boolean useColors) {
    Objects.requireNonNull(out, "out");
    destinations.add(defaults -> new ConsoleLogDestination(out, useColors, options(defaults, writeMode, threadSafety)));
    return this;
  }

  public LoggerConfiguration addPlainText(String path) {
    return addPlainText(path, WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, true);
  }

  /**
   * Adds a plain-text file destination.
   *
   * @param path file path
   * @param writeMode write mode
   * @param threadSafety thread-safety mode
   * @param append {@code true} to keep existing content
   * @return this builder
   * @throws IllegalArgumentException if the path is blank, malformed or has no file name
   */
  public LoggerConfiguration addPlainText(String path, WriteMode writeMode, ThreadSafety threadSafety, boolean append) {
    Path file = Paths.requireLogFile("path", path);
    destinations.add(defaults -> new PlainTextFileLogDestination(file, append,
        options(defaults, writeMode, threadSafety)));
    return this;
  }

  public LoggerConfiguration addJson(String path) {
    return addJson(path, WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, true);
  }

  /**
   * Adds a JSON-lines file destination.
   *
   * @param path file path
   * @param writeMode write mode
   * @param threadSafety thread-safety mode
   * @param append {@code true} to keep existing content
   * @return this builder
   * @throws IllegalArgumentException if the path is blank, malformed or has no file name
   */
  public LoggerConfiguration addJson(String path, WriteMode writeMode, ThreadSafety threadSafety, boolean append) {
    Path file = Paths.requireLogFile("path", path);
    destinations.add(defaults -> new JsonFileLogDestination(file, append, options(defaults, writeMode, threadSafety)));
    return this;
  }

  public LoggerConfiguration addSqlite(String path) {
    return addSqlite(path, WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, true, SqliteLogDestination.DEFAULT_MAX_POOL_SIZE);
  }

  /**
   * Adds a SQLite destination.
   *
   * @param path database file path
   * @param writeMode write mode
   * @param threadSafety thread-safety mode
   * @param createIfNotExists whether to create the directory, table and indexes
   * @param maxPoolSize maximum pooled connections; must be positive
   * @return this builder
   * @throws IllegalArgumentException if the path or pool size is invalid
   */
  public LoggerConfiguration addSqlite(
      String path, WriteMode writeMode, ThreadSafety threadSafety, boolean createIfNotExists, int maxPoolSize) {
    Path file = Paths.requireLogFile("path", path);
    Numbers.requirePositive("maxPoolSize", maxPoolSize);
    destinations.add(defaults -> new SqliteLogDestination(file, createIfNotExists, maxPoolSize,
        options(defaults, writeMode, threadSafety)));
    return this;
  }

  /**
   * Adds a caller-constructed destination; ownership passes to the built factory.
   *
   * @param destination destination to add
   * @return this builder
   */
  public LoggerConfiguration addDestination(LogDestination destination) {
    Objects.requireNonNull(destination, "destination");
    destinations.add(defaults -> destination);
    return this;
  }

  /**
   * Constructs the destinations and the logger factory.
   *
   * @return factory owning every destination
   * @throws IllegalStateException if no destination was configured or a destination fails to initialize
   */
  public ScribeLoggerFactory build() {
    if (destinations.isEmpty()) {
      throw new IllegalStateException(NO_DESTINATIONS);
    }
    DestinationOptions defaults = DestinationOptions.defaults().withBufferSize(bufferSize).withMetrics(metrics);
    List<LogDestination> built = new ArrayList<>(destinations.size());
    try {
      for (Function<DestinationOptions, LogDestination> factory : destinations) {
        built.add(factory.apply(defaults));
      }
    } catch (RuntimeException ex) {
      built.forEach(LogDestination::close);
      throw ex;
    }
    return new ScribeLoggerFactory(minimumLevel, built, metrics);
  }

  static DestinationOptions options(DestinationOptions defaults, WriteMode writeMode, ThreadSafety threadSafety) {
    return new DestinationOptions(writeMode, threadSafety, defaults.bufferSize(), defaults.metrics(),
        defaults.executor());
  }
}
