package ca.gc.cra.scribe.infrastructure.destination;

import ca.gc.cra.scribe.application.port.LogDestination;
import ca.gc.cra.scribe.domain.log.LogEntry;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * <strong>What:</strong> Shared buffering, locking and failure containment for synchronous destinations.
 * <p><strong>Why:</strong> Concrete sinks only know how to persist one entry; the write-mode and thread-safety
 * policies are identical for all of them.</p>
 * <p><strong>Role:</strong> Template-method base class; subclasses implement {@link #writeEntry(LogEntry)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Immediate mode: persist each entry on the calling thread.</li>
 *   <li>Buffered mode: accumulate entries and flush inline once the threshold is reached.</li>
 *   <li>Convert every persistence failure into a {@link DeliveryResult} and report it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> In {@code THREAD_SAFE} mode writes, flushes and close hold the write side of a
 * {@link ReentrantReadWriteLock}; in {@code NOT_THREAD_SAFE} mode no lock is taken.</p>
 * <p><strong>Performance:</strong> Buffered flushes swap the pending list in O(1) before persisting.</p>
 * <p><strong>Observability:</strong> Failures go to {@link DestinationDiagnostics}.</p>
 *
 * @implNote Entries offered after {@link #close()} are dropped and reported.
 * @since 0.1.0
 */
public abstract class BaseLogDestination implements LogDestination {
  private final String name;
  private final DestinationOptions options;
  private final DestinationDiagnostics diagnostics;
  private final EntryBuffer buffer;
  private final Lock lock;
  private final AtomicBoolean closed = new AtomicBoolean();

  protected BaseLogDestination(String name, DestinationOptions options) {
    this.name = Objects.requireNonNull(name, "name");
    this.options = Objects.requireNonNullElseGet(options, DestinationOptions::defaults);
    this.diagnostics = new DestinationDiagnostics(name, this.options.metrics());
    this.buffer = new EntryBuffer(this.options.bufferSize());
    this.lock = this.options.threadSafe() ? new ReentrantReadWriteLock().writeLock() : null;
  }

  /**
   * Persists one entry to the underlying medium.
   *
   * @param entry entry to persist
   * @throws Exception on any persistence failure; reported by the caller, never propagated
   */
  protected abstract void writeEntry(LogEntry entry) throws Exception;

  /**
   * Pushes written data to the medium after a batch (e.g., flushing a stream).
   *
   * @throws Exception on failure; reported as a flush failure
   */
  protected void syncResources() throws Exception {
  }

  /**
   * Releases owned resources after the final flush.
   *
   * @throws Exception on failure; reported as a close failure
   */
  protected void releaseResources() throws Exception {
  }

  @Override
  public final void writeLog(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (closed.get()) {
      diagnostics.droppedAfterClose(entry);
      return;
    }
    lock();
    try {
      if (!options.buffered()) {
        deliver(entry);
        sync();
      } else if (buffer.add(entry)) {
        drainBuffer();
      }
    } finally {
      unlock();
    }
  }

  @Override
  public final void flush() {
    lock();
    try {
      drainBuffer();
    } finally {
      unlock();
    }
  }

  @Override
  public final void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    lock();
    try {
      drainBuffer();
      DeliveryResult result = DeliveryResult.attempt(this::releaseResources);
      if (!result.succeeded()) {
        diagnostics.actionFailed("close", result.failure());
      }
    } finally {
      unlock();
    }
  }

  @Override
  public String name() {
    return name;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Number of entries currently waiting in the buffer.
   *
   * @return pending entry count; always zero in immediate mode
   */
  public int pendingCount() {
    lock();
    try {
      return buffer.size();
    } finally {
      unlock();
    }
  }

  protected final DestinationOptions options() {
    return options;
  }

  protected final DestinationDiagnostics diagnostics() {
    return diagnostics;
  }

  private void drainBuffer() {
    List<LogEntry> drained = buffer.drain();
    if (drained.isEmpty()) {
      return;
    }
    for (LogEntry entry : drained) {
      deliver(entry);
    }
    sync();
  }

  private void deliver(LogEntry entry) {
    DeliveryResult result = DeliveryResult.attempt(() -> writeEntry(entry));
    if (!result.succeeded()) {
      diagnostics.writeFailed(entry, result.failure());
    }
  }

  private void sync() {
    DeliveryResult result = DeliveryResult.attempt(this::syncResources);
    if (!result.succeeded()) {
      diagnostics.flushFailed(result.failure());
    }
  }

  private void lock() {
    if (lock != null) {
      lock.lock();
    }
  }

  private void unlock() {
    if (lock != null) {
      lock.unlock();
    }
  }
}
