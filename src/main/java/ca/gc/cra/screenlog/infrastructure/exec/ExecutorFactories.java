package ca.gc.cra.screenlog.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named executors used by the store writer, the recorder and the monitors.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor whose tasks run strictly in submission order.
   *
   * @param name thread name
   * @param daemon whether the thread should not keep the JVM alive
   * @return configured executor service
   */
  public static ExecutorService newSerialExecutor(String name, boolean daemon) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(name, daemon, LOGGING_HANDLER),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-thread scheduler for periodic and delayed tasks. Cancelled tasks are removed from the queue
   * and pending delayed tasks are dropped on shutdown.
   *
   * @param name thread name
   * @param daemon whether the thread should not keep the JVM alive
   * @return configured scheduler
   */
  public static ScheduledExecutorService newScheduler(String name, boolean daemon) {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, threadFactory(name, daemon, LOGGING_HANDLER));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Shuts an executor down and waits for running tasks to finish.
   *
   * @param executor executor to stop; {@code null} is ignored
   * @param timeoutMillis maximum wait before forcing shutdown
   * @return {@code true} if the executor terminated within the timeout
   */
  public static boolean shutdownGracefully(ExecutorService executor, long timeoutMillis) {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    try {
      if (executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Executor did not terminate within {} ms; forcing shutdown", timeoutMillis);
      executor.shutdownNow();
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
      return false;
    }
  }

  private static ThreadFactory threadFactory(String name, boolean daemon, UncaughtExceptionHandler handler) {
    String threadName = (name == null || name.isBlank()) ? "screenlog-worker" : name;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      int n = index.getAndIncrement();
      thread.setName(n == 0 ? threadName : threadName + "-" + n);
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
