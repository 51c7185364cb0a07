package ca.gc.cra.nfcrx.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating executors aligned with the receiver's concurrency model.
 */
public final class ExecutorFactories {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  /**
   * Builds a pool for long-lived tasks that grows to {@code maxSize} workers before queueing.
   *
   * <p>{@code coreSize} workers are started eagerly. Every submission beyond the live worker count
   * gets a fresh worker until {@code maxSize} is reached; further submissions wait in an unbounded
   * queue until a worker returns. Idle workers retire after {@value #IDLE_KEEP_ALIVE_SECONDS} seconds.
   * Workers are non-daemon threads named {@code <prefix>-<n>}; the JVM does not exit while a task runs.</p>
   *
   * @param coreSize workers started up front
   * @param maxSize upper bound on concurrent workers
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newTaskPool(
      int coreSize, int maxSize, String prefix, UncaughtExceptionHandler handler) {
    if (coreSize <= 0) {
      throw new IllegalArgumentException("coreSize must be positive");
    }
    if (maxSize < coreSize) {
      throw new IllegalArgumentException("maxSize must be >= coreSize");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "rx-task" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    ThreadPoolExecutor pool = new ThreadPoolExecutor(
        maxSize,
        maxSize,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
    pool.allowCoreThreadTimeOut(true);
    for (int i = 0; i < coreSize; i++) {
      pool.prestartCoreThread();
    }
    return pool;
  }
}
