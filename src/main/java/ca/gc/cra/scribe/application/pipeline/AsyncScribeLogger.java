package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.AsyncLogDestination;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.application.port.StructuredLogger;
import ca.gc.cra.scribe.domain.log.EventId;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.destination.DestinationDiagnostics;
import ca.gc.cra.scribe.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.scribe.validation.Numbers;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Category logger that hands entries to a bounded queue drained by one background consumer.
 * <p><strong>Why:</strong> Keeps destination I/O off application threads while bounding memory under bursts.</p>
 * <p><strong>Role:</strong> Application service implementing {@link StructuredLogger} over
 * {@link AsyncLogDestination}s.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enqueue enabled entries, waiting at most {@link Settings#enqueueTimeout()} when the queue is full.</li>
 *   <li>On a still-full queue, write Error and Critical entries directly; drop lower levels.</li>
 *   <li>Drain entries in order, fanning each out to all destinations and awaiting them before the next.</li>
 *   <li>Flush via a queue marker; close by draining the backlog, then flushing destinations.</li>
 *   <li>Bound every shutdown wait by {@link Settings#shutdownTimeout()}; entries left behind a stuck destination
 *   are abandoned and reported.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Multi-producer, single-consumer; state transitions are atomic.</p>
 * <p><strong>Performance:</strong> Callers pay one queue offer per entry in the common case.</p>
 * <p><strong>Observability:</strong> Emits {@code scribe.async.enqueue.dropped}, {@code scribe.async.enqueue.direct}
 * and {@code scribe.async.queue.depth}; drops are logged on the first and every 1000th occurrence.</p>
 *
 * @implNote A direct write is started from the calling thread without waiting for it to finish, and may reach
 * destinations ahead of entries that the same caller queued earlier.
 * @since 0.1.0
 */
public final class AsyncScribeLogger implements StructuredLogger {
  static final String DROPPED = "scribe.async.enqueue.dropped";
  static final String DIRECT = "scribe.async.enqueue.direct";
  static final String QUEUE_DEPTH = "scribe.async.queue.depth";

  private static final long CONSUMER_POLL_MILLIS = 25;
  private static final int SATURATION_LOG_THRESHOLD = 1000;
  static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(30);

  /** Lifecycle of the logger; transitions only move forward. */
  public enum State {
    RUNNING,
    DRAINING,
    STOPPED
  }

  private final String category;
  private final LogLevel minimumLevel;
  private final List<AsyncLogDestination> destinations;
  private final boolean ownsDestinations;
  private final Settings settings;
  private final LogEntryFactory entries;
  private final DestinationDiagnostics diagnostics;
  private final MetricsPort metrics;
  private final BlockingQueue<QueueItem> queue;
  private final ExecutorService consumer;
  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
  private final AtomicInteger dropLogLimiter = new AtomicInteger();

  /**
   * Creates a standalone logger that owns (and closes) its destinations.
   *
   * @param category category stamped on entries
   * @param minimumLevel minimum emitted level
   * @param destinations destinations in delivery order
   * @param settings queue settings
   * @param metrics metrics sink; {@code null} means {@link MetricsPort#NO_OP}
   */
  public AsyncScribeLogger(
      String category,
      LogLevel minimumLevel,
      List<AsyncLogDestination> destinations,
      Settings settings,
      MetricsPort metrics) {
    this(category, minimumLevel, destinations, true, settings, new LogEntryFactory(),
        new DestinationDiagnostics("async-logger:" + category, metrics));
  }

  AsyncScribeLogger(
      String category,
      LogLevel minimumLevel,
      List<AsyncLogDestination> destinations,
      boolean ownsDestinations,
      Settings settings,
      LogEntryFactory entries,
      DestinationDiagnostics diagnostics) {
    this.category = Objects.requireNonNull(category, "category");
    this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
    this.destinations = List.copyOf(destinations);
    this.ownsDestinations = ownsDestinations;
    this.settings = Objects.requireNonNullElseGet(settings, Settings::defaults);
    this.entries = Objects.requireNonNull(entries, "entries");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.metrics = diagnostics.metrics();
    this.queue = new ArrayBlockingQueue<>(this.settings.queueCapacity());
    this.consumer = ExecutorFactories.newSerialExecutor(
        "scribe-async-" + category, true, (t, ex) -> diagnostics.actionFailed("drain queue", ex));
    this.consumer.execute(this::drainLoop);
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
    if (state.get() != State.RUNNING) {
      diagnostics.droppedAfterClose(entry);
      return;
    }
    if (offer(QueueItem.of(entry), settings.enqueueTimeout())) {
      return;
    }
    if (entry.level().isAtLeast(LogLevel.ERROR)) {
      metrics.increment(DIRECT);
      fanOut(entry);
    } else {
      metrics.increment(DROPPED);
      logSaturation(entry);
    }
  }

  /**
   * Waits until every entry queued before this call has been delivered, then flushes all destinations.
   *
   * @param timeout bound on the whole operation; the destination flush is started even when the drain overruns
   * @return future completing normally once destinations are flushed or the timeout has elapsed
   */
  public CompletableFuture<Void> flushAsync(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    return drainUntil(deadline, timeout).thenCompose(ignored ->
        diagnostics.bound(flushDestinations(), remaining(deadline), "flush destinations"));
  }

  @Override
  public void flush() {
    flushAsync(DEFAULT_FLUSH_TIMEOUT).join();
  }

  /**
   * Stops accepting entries, delivers the backlog, flushes destinations and, for a standalone logger, closes them.
   */
  @Override
  public void close() {
    if (!state.compareAndSet(State.RUNNING, State.DRAINING)) {
      return;
    }
    stopConsumer();
    deliverLeftovers();
    diagnostics.await(flushDestinations(), settings.shutdownTimeout(), "flush destinations");
    if (ownsDestinations) {
      for (AsyncLogDestination destination : destinations) {
        try {
          diagnostics.await(destination.closeAsync(), settings.shutdownTimeout(), "close " + destination.name());
        } catch (RuntimeException ex) {
          diagnostics.actionFailed("close " + destination.name(), ex);
        }
      }
    }
    state.set(State.STOPPED);
  }

  public State state() {
    return state.get();
  }

  public LogLevel minimumLevel() {
    return minimumLevel;
  }

  /** Entries currently waiting in the queue. */
  public int queueDepth() {
    return queue.size();
  }

  CompletableFuture<Void> drainAsync(Duration timeout) {
    return drainUntil(System.nanoTime() + timeout.toNanos(), timeout);
  }

  /**
   * Queues a marker and completes once the consumer reaches it; the marker offer and the wait share one deadline.
   */
  CompletableFuture<Void> drainUntil(long deadlineNanos, Duration timeout) {
    if (state.get() != State.RUNNING) {
      return CompletableFuture.completedFuture(null);
    }
    CompletableFuture<Void> marker = new CompletableFuture<>();
    if (!offer(QueueItem.marker(marker), remaining(deadlineNanos))) {
      reportDrainTimeout(timeout);
      return CompletableFuture.completedFuture(null);
    }
    return marker
        .orTimeout(remaining(deadlineNanos).toNanos(), TimeUnit.NANOSECONDS)
        .handle((ignored, failure) -> {
          if (failure instanceof TimeoutException) {
            reportDrainTimeout(timeout);
          }
          return null;
        });
  }

  CompletableFuture<Void> flushDestinations() {
    CompletableFuture<?>[] flushes = new CompletableFuture<?>[destinations.size()];
    for (int i = 0; i < flushes.length; i++) {
      AsyncLogDestination destination = destinations.get(i);
      try {
        flushes[i] = destination.flushAsync().exceptionally(ex -> {
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

  private boolean offer(QueueItem item, Duration timeout) {
    try {
      return queue.offer(item, timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void drainLoop() {
    try {
      while (true) {
        QueueItem item = queue.poll(CONSUMER_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (item == null) {
          if (state.get() != State.RUNNING) {
            break;
          }
          continue;
        }
        process(item);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void process(QueueItem item) throws InterruptedException {
    if (item.marker() != null) {
      item.marker().complete(null);
      return;
    }
    try {
      fanOut(item.entry()).get();
    } catch (ExecutionException ex) {
      diagnostics.writeFailed(item.entry(), ex.getCause());
    }
    metrics.observe(QUEUE_DEPTH, queue.size());
  }

  private void deliverLeftovers() {
    long deadline = System.nanoTime() + settings.shutdownTimeout().toNanos();
    boolean stalled = false;
    int abandoned = 0;
    QueueItem leftover;
    while ((leftover = queue.poll()) != null) {
      if (leftover.marker() != null) {
        leftover.marker().complete(null);
      } else if (stalled) {
        abandoned++;
        metrics.increment(DROPPED);
      } else {
        stalled = !diagnostics.await(fanOut(leftover.entry()), remaining(deadline), "deliver queued entry");
      }
    }
    if (abandoned > 0) {
      diagnostics.warn("{} abandoned {} queued entries on close; destinations did not keep up within {} ms",
          diagnostics.source(), abandoned, settings.shutdownTimeout().toMillis());
    }
  }

  private void reportDrainTimeout(Duration timeout) {
    diagnostics.warn("{} flush did not drain the queue within {} (depth={})",
        diagnostics.source(), timeout, queue.size());
  }

  private static Duration remaining(long deadlineNanos) {
    long left = deadlineNanos - System.nanoTime();
    return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
  }

  private CompletableFuture<Void> fanOut(LogEntry entry) {
    CompletableFuture<?>[] writes = new CompletableFuture<?>[destinations.size()];
    for (int i = 0; i < writes.length; i++) {
      AsyncLogDestination destination = destinations.get(i);
      try {
        writes[i] = destination.writeLogAsync(entry).exceptionally(ex -> {
          diagnostics.writeFailed(entry, ex);
          return null;
        });
      } catch (RuntimeException ex) {
        diagnostics.writeFailed(entry, ex);
        writes[i] = CompletableFuture.completedFuture(null);
      }
    }
    return CompletableFuture.allOf(writes);
  }

  private void stopConsumer() {
    consumer.shutdown();
    boolean terminated = false;
    try {
      long waitMillis = settings.shutdownTimeout().toMillis();
      terminated = consumer.awaitTermination(waitMillis, TimeUnit.MILLISECONDS);
      if (!terminated) {
        diagnostics.warn("{} consumer active after {} ms; interrupting", diagnostics.source(), waitMillis);
        consumer.shutdownNow();
        terminated = consumer.awaitTermination(waitMillis, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      diagnostics.warn("{} consumer failed to terminate cleanly", diagnostics.source());
    }
  }

  private void logSaturation(LogEntry entry) {
    int count = dropLogLimiter.incrementAndGet();
    if (count == 1 || count % SATURATION_LOG_THRESHOLD == 0) {
      diagnostics.warn("{} queue full after {} ms wait (capacity={}); dropped {} entry (drops so far: {})",
          diagnostics.source(), settings.enqueueTimeout().toMillis(), settings.queueCapacity(),
          entry.level(), count);
    }
  }

  private record QueueItem(LogEntry entry, CompletableFuture<Void> marker) {
    static QueueItem of(LogEntry entry) {
      return new QueueItem(entry, null);
    }

    static QueueItem marker(CompletableFuture<Void> marker) {
      return new QueueItem(null, marker);
    }
  }

  /**
   * Queue settings for async loggers.
   *
   * @param queueCapacity maximum queued entries; must be positive
   * @param enqueueTimeout longest a caller waits on a full queue; must not be negative
   * @param shutdownTimeout bound on each close step (consumer stop, backlog delivery, destination flush and close)
   */
  public record Settings(int queueCapacity, Duration enqueueTimeout, Duration shutdownTimeout) {
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final Duration DEFAULT_ENQUEUE_TIMEOUT = Duration.ofMillis(50);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    public Settings {
      Numbers.requirePositive("queueCapacity", queueCapacity);
      Objects.requireNonNull(enqueueTimeout, "enqueueTimeout");
      if (enqueueTimeout.isNegative()) {
        throw new IllegalArgumentException("enqueueTimeout must not be negative (was " + enqueueTimeout + ")");
      }
      Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
        throw new IllegalArgumentException("shutdownTimeout must be positive (was " + shutdownTimeout + ")");
      }
    }

    public Settings(int queueCapacity, Duration enqueueTimeout) {
      this(queueCapacity, enqueueTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public static Settings defaults() {
      return new Settings(DEFAULT_QUEUE_CAPACITY, DEFAULT_ENQUEUE_TIMEOUT);
    }
  }
}
