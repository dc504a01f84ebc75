package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.pipeline.AsyncScribeLogger;
import ca.gc.cra.scribe.application.pipeline.AsyncScribeLoggerFactory;
import ca.gc.cra.scribe.application.port.AsyncLogDestination;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import ca.gc.cra.scribe.infrastructure.destination.DestinationOptions;
import ca.gc.cra.scribe.infrastructure.destination.console.AsyncConsoleLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.file.AsyncJsonFileLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.file.AsyncPlainTextFileLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.sqlite.AsyncSqliteLogDestination;
import ca.gc.cra.scribe.infrastructure.destination.sqlite.SqliteLogDestination;
import ca.gc.cra.scribe.validation.Numbers;
import ca.gc.cra.scribe.validation.Paths;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fluent builder for an asynchronous logging pipeline; mirrors {@link LoggerConfiguration} and adds the queue
 * capacity and enqueue timeout of each category logger.
 *
 * @since 0.1.0
 */
public final class AsyncLoggerConfiguration {
  private LogLevel minimumLevel = LogLevel.INFORMATION;
  private int bufferSize = DestinationOptions.DEFAULT_BUFFER_SIZE;
  private int queueCapacity = AsyncScribeLogger.Settings.DEFAULT_QUEUE_CAPACITY;
  private Duration enqueueTimeout = AsyncScribeLogger.Settings.DEFAULT_ENQUEUE_TIMEOUT;
  private MetricsPort metrics = MetricsPort.NO_OP;
  private final List<Function<DestinationOptions, AsyncLogDestination>> destinations = new ArrayList<>();

  public static AsyncLoggerConfiguration create() {
    return new AsyncLoggerConfiguration();
  }

  public AsyncLoggerConfiguration setMinimumLevel(LogLevel level) {
    this.minimumLevel = Objects.requireNonNull(level, "level");
    return this;
  }

  public AsyncLoggerConfiguration setBufferSize(int size) {
    this.bufferSize = Numbers.requirePositive("bufferSize", size);
    return this;
  }

  public AsyncLoggerConfiguration setQueueCapacity(int capacity) {
    this.queueCapacity = Numbers.requirePositive("queueCapacity", capacity);
    return this;
  }

  /**
   * Sets how long a caller waits on a full queue before the overflow policy applies.
   *
   * @param timeout non-negative wait
   * @return this builder
   */
  public AsyncLoggerConfiguration setEnqueueTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("enqueueTimeout must not be negative (was " + timeout + ")");
    }
    this.enqueueTimeout = timeout;
    return this;
  }

  public AsyncLoggerConfiguration setMetrics(MetricsPort port) {
    this.metrics = Objects.requireNonNullElse(port, MetricsPort.NO_OP);
    return this;
  }

  public AsyncLoggerConfiguration addConsole() {
    return addConsole(System.out, WriteMode.IMMEDIATE, ThreadSafety.THREAD_SAFE, true);
  }

  public AsyncLoggerConfiguration addConsole(
      PrintStream out, WriteMode writeMode, ThreadSafety threadSafety, boolean useColors) {
    Objects.requireNonNull(out, "out");
    destinations.add(defaults -> new AsyncConsoleLogDestination(out, useColors,
        LoggerConfiguration.options(defaults, writeMode, threadSafety)));
    return this;
  }

  public AsyncLoggerConfiguration addPlainText(String path) {
    return addPlainText(path, WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, true);
  }

  public AsyncLoggerConfiguration addPlainText(
      String path, WriteMode writeMode, ThreadSafety threadSafety, boolean append) {
    Path file = Paths.requireLogFile("path", path);
    destinations.add(defaults -> new AsyncPlainTextFileLogDestination(file, append,
        LoggerConfiguration.options(defaults, writeMode, threadSafety)));
    return this;
  }

  public AsyncLoggerConfiguration addJson(String path) {
    return addJson(path, WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, true);
  }

  public AsyncLoggerConfiguration addJson(String path, WriteMode writeMode, ThreadSafety threadSafety, boolean append) {
    Path file = Paths.requireLogFile("path", path);
    destinations.add(defaults -> new AsyncJsonFileLogDestination(file, append,
        LoggerConfiguration.options(defaults, writeMode, threadSafety)));
    return this;
  }

  public AsyncLoggerConfiguration addSqlite(String path) {
    return addSqlite(path, WriteMode.BUFFERED, ThreadSafety.THREAD_SAFE, true,
        SqliteLogDestination.DEFAULT_MAX_POOL_SIZE);
  }

  public AsyncLoggerConfiguration addSqlite(
      String path, WriteMode writeMode, ThreadSafety threadSafety, boolean createIfNotExists, int maxPoolSize) {
    Path file = Paths.requireLogFile("path", path);
    Numbers.requirePositive("maxPoolSize", maxPoolSize);
    destinations.add(defaults -> new AsyncSqliteLogDestination(file, createIfNotExists, maxPoolSize,
        LoggerConfiguration.options(defaults, writeMode, threadSafety)));
    return this;
  }

  public AsyncLoggerConfiguration addDestination(AsyncLogDestination destination) {
    Objects.requireNonNull(destination, "destination");
    destinations.add(defaults -> destination);
    return this;
  }

  /**
   * Constructs the destinations and the async logger factory.
   *
   * @return factory owning every destination
   * @throws IllegalStateException if no destination was configured or a destination fails to initialize
   */
  public AsyncScribeLoggerFactory build() {
    if (destinations.isEmpty()) {
      throw new IllegalStateException(LoggerConfiguration.NO_DESTINATIONS);
    }
    DestinationOptions defaults = DestinationOptions.defaults().withBufferSize(bufferSize).withMetrics(metrics);
    List<AsyncLogDestination> built = new ArrayList<>(destinations.size());
    try {
      for (Function<DestinationOptions, AsyncLogDestination> factory : destinations) {
        built.add(factory.apply(defaults));
      }
    } catch (RuntimeException ex) {
      built.forEach(AsyncLogDestination::close);
      throw ex;
    }
    return new AsyncScribeLoggerFactory(minimumLevel, built,
        new AsyncScribeLogger.Settings(queueCapacity, enqueueTimeout), metrics);
  }
}
