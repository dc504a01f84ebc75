package ca.gc.cra.scribe.infrastructure.destination;

import ca.gc.cra.scribe.application.port.AsyncLogDestination;
import ca.gc.cra.scribe.domain.log.LogEntry;
import ca.gc.cra.scribe.infrastructure.exec.ExecutorFactories;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Shared buffering, serialization and failure containment for asynchronous destinations.
 * <p><strong>Why:</strong> Blocking file and database I/O must run off the async logger's consumer thread while
 * keeping the same buffering rules as the synchronous destinations.</p>
 * <p><strong>Role:</strong> Template-method base class; subclasses implement {@link #writeEntry(LogEntry)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run every write, flush and close on an I/O executor and expose completion as a future.</li>
 *   <li>Apply immediate or buffered persistence exactly like {@link BaseLogDestination}.</li>
 *   <li>Complete every returned future normally; failures are reported instead.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> By default work runs on a dedicated single daemon thread, which serializes it.
 * With a caller-supplied executor, {@code THREAD_SAFE} mode additionally admits one task at a time through a
 * one-permit {@link Semaphore}.</p>
 * <p><strong>Performance:</strong> One task hand-off per call; buffered mode persists in batches.</p>
 * <p><strong>Observability:</strong> Failures go to {@link DestinationDiagnostics}.</p>
 *
 * @since 0.1.0
 */
public abstract class BaseAsyncLogDestination implements AsyncLogDestination {
  private final String name;
  private final DestinationOptions options;
  private final DestinationDiagnostics diagnostics;
  private final EntryBuffer buffer;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final Semaphore permit;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicReference<CompletableFuture<Void>> closeFuture = new AtomicReference<>();

  protected BaseAsyncLogDestination(String name, DestinationOptions options) {
    this.name = Objects.requireNonNull(name, "name");
    this.options = Objects.requireNonNullElseGet(options, DestinationOptions::defaults);
    this.diagnostics = new DestinationDiagnostics(name, this.options.metrics());
    this.buffer = new EntryBuffer(this.options.bufferSize());
    if (this.options.executor() != null) {
      this.executor = this.options.executor();
      this.ownedExecutor = null;
    } else {
      this.ownedExecutor = ExecutorFactories.newSerialExecutor(
          "scribe-" + name, true, (t, ex) -> diagnostics.actionFailed("run I/O task", ex));
      this.executor = ownedExecutor;
    }
    this.permit = this.options.threadSafe() ? new Semaphore(1) : null;
  }

  /**
   * Persists one entry; runs on the I/O executor.
   *
   * @param entry entry to persist
   * @throws Exception on any persistence failure; reported, never propagated
   */
  protected abstract void writeEntry(LogEntry entry) throws Exception;

  /**
   * Pushes written data to the medium after a batch; runs on the I/O executor.
   *
   * @throws Exception on failure; reported as a flush failure
   */
  protected void syncResources() throws Exception {
  }

  /**
   * Releases owned resources after the final flush; runs on the I/O executor.
   *
   * @throws Exception on failure; reported as a close failure
   */
  protected void releaseResources() throws Exception {
  }

  @Override
  public final CompletableFuture<Void> writeLogAsync(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (closed.get()) {
      diagnostics.droppedAfterClose(entry);
      return CompletableFuture.completedFuture(null);
    }
    return submit("write", () -> {
      if (!options.buffered()) {
        deliver(entry);
        sync();
      } else if (buffer.add(entry)) {
        drainBuffer();
      }
    });
  }

  @Override
  public final CompletableFuture<Void> flushAsync() {
    if (closed.get()) {
      CompletableFuture<Void> closing = closeFuture.get();
      return closing == null ? CompletableFuture.completedFuture(null) : closing;
    }
    return submit("flush", this::drainBuffer);
  }

  @Override
  public final CompletableFuture<Void> closeAsync() {
    CompletableFuture<Void> pending = new CompletableFuture<>();
    if (!closeFuture.compareAndSet(null, pending)) {
      return closeFuture.get();
    }
    closed.set(true);
    submit("close", () -> {
      drainBuffer();
      DeliveryResult result = DeliveryResult.attempt(this::releaseResources);
      if (!result.succeeded()) {
        diagnostics.actionFailed("close", result.failure());
      }
    }).whenComplete((ignored, failure) -> {
      if (ownedExecutor != null) {
        ownedExecutor.shutdown();
      }
      pending.complete(null);
    });
    return pending;
  }

  @Override
  public String name() {
    return name;
  }

  public boolean isClosed() {
    return closed.get();
  }

  protected final DestinationOptions options() {
    return options;
  }

  protected final DestinationDiagnostics diagnostics() {
    return diagnostics;
  }

  private CompletableFuture<Void> submit(String action, Runnable work) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    try {
      executor.execute(() -> {
        try {
          DeliveryResult result = DeliveryResult.attempt(() -> runExclusive(work));
          if (!result.succeeded()) {
            diagnostics.actionFailed(action, result.failure());
          }
        } finally {
          done.complete(null);
        }
      });
    } catch (RejectedExecutionException ex) {
      diagnostics.actionFailed(action, ex);
      done.complete(null);
    }
    return done;
  }

  private void runExclusive(Runnable work) throws InterruptedException {
    if (permit == null) {
      work.run();
      return;
    }
    permit.acquire();
    try {
      work.run();
    } finally {
      permit.release();
    }
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
}
