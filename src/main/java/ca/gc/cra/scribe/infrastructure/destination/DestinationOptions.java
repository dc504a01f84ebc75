package ca.gc.cra.scribe.infrastructure.destination;

import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.ThreadSafety;
import ca.gc.cra.scribe.domain.log.WriteMode;
import ca.gc.cra.scribe.validation.Numbers;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Behavioural settings shared by every destination.
 *
 * @param writeMode immediate or buffered persistence
 * @param threadSafety whether the destination serializes writers internally
 * @param bufferSize auto-flush threshold for buffered mode; must be positive
 * @param metrics metrics sink for failure counters
 * @param executor executor used by async destinations; {@code null} means a dedicated serial worker
 * @since 0.1.0
 */
public record DestinationOptions(
    WriteMode writeMode,
    ThreadSafety threadSafety,
    int bufferSize,
    MetricsPort metrics,
    Executor executor) {

  public static final int DEFAULT_BUFFER_SIZE = 100;

  public DestinationOptions {
    writeMode = Objects.requireNonNullElse(writeMode, WriteMode.IMMEDIATE);
    threadSafety = Objects.requireNonNullElse(threadSafety, ThreadSafety.THREAD_SAFE);
    Numbers.requirePositive("bufferSize", bufferSize);
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Immediate, thread-safe options with the default buffer size.
   *
   * @return default options
   */
  public static DestinationOptions defaults() {
    return new DestinationOptions(WriteMode.IMMEDIATE, ThreadSafety.THREAD_SAFE, DEFAULT_BUFFER_SIZE, null, null);
  }

  /**
   * Options with the given modes and the default buffer size.
   *
   * @param writeMode write mode
   * @param threadSafety thread-safety mode
   * @return options
   */
  public static DestinationOptions of(WriteMode writeMode, ThreadSafety threadSafety) {
    return new DestinationOptions(writeMode, threadSafety, DEFAULT_BUFFER_SIZE, null, null);
  }

  public DestinationOptions withBufferSize(int size) {
    return new DestinationOptions(writeMode, threadSafety, size, metrics, executor);
  }

  public DestinationOptions withMetrics(MetricsPort port) {
    return new DestinationOptions(writeMode, threadSafety, bufferSize, port, executor);
  }

  public DestinationOptions withExecutor(Executor ioExecutor) {
    return new DestinationOptions(writeMode, threadSafety, bufferSize, metrics, ioExecutor);
  }

  public boolean buffered() {
    return writeMode == WriteMode.BUFFERED;
  }

  public boolean threadSafe() {
    return threadSafety == ThreadSafety.THREAD_SAFE;
  }
}
