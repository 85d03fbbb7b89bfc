package ca.gc.cra.lumen.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the thread pools and dedicated threads used by LUMEN.
 *
 * <ul>
 *   <li>{@code lumen-worker-*}: shared background pool for attach workflows, connects and detach cleanup.</li>
 *   <li>{@code lumen-session-*}: one serial executor per debug session; all state transitions run there.</li>
 *   <li>{@code lumen-rx-*}: one receive-loop thread per transporter.</li>
 *   <li>{@code lumen-proc-*}: stdout/stderr readers for spawned helper processes.</li>
 * </ul>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final AtomicInteger THREAD_INDEX = new AtomicInteger();

  /** Handler that logs uncaught exceptions with the thread name. */
  public static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a bounded-thread worker pool with an unbounded hand-off queue; idle threads time out.
   *
   * @param size maximum number of worker threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "lumen-worker" : prefix;
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        size,
        size,
        30L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(threadPrefix, true, handler),
        new ThreadPoolExecutor.AbortPolicy());
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  /**
   * Builds a single-threaded executor that runs tasks in submission order.
   *
   * @param prefix thread-name prefix, typically including the session id
   * @param handler uncaught exception handler
   * @return serial executor
   */
  public static ExecutorService newSerialExecutor(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "lumen-session" : prefix;
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(threadPrefix, true, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Starts a dedicated daemon thread, e.g. a transporter receive loop or a process stream reader.
   *
   * @param prefix thread-name prefix
   * @param task body
   * @return the started thread
   */
  public static Thread startDaemon(String prefix, Runnable task) {
    Objects.requireNonNull(task, "task");
    Thread thread = threadFactory(prefix, true, LOGGING_HANDLER).newThread(task);
    thread.start();
    return thread;
  }

  private static ThreadFactory threadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + THREAD_INDEX.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
