package ca.gc.cra.scribe.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the worker threads used by async loggers and async destinations.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor that runs tasks in submission order.
   *
   * @param prefix thread-name prefix used to tag the worker thread
   * @param daemon whether the worker is a daemon thread
   * @param handler uncaught exception handler installed on the worker; {@code null} ignores
   * @return configured executor service
   */
  public static ExecutorService newSerialExecutor(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, daemon, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a named thread factory.
   *
   * @param prefix thread-name prefix; defaults to {@code scribe-worker}
   * @param daemon whether created threads are daemon threads
   * @param handler uncaught exception handler; {@code null} ignores
   * @return thread factory
   */
  public static ThreadFactory threadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "scribe-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
