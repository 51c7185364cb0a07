package ca.gc.cra.nfcrx.infrastructure.exec;

import ca.gc.cra.nfcrx.application.port.ManagedTask;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fixed worker pool running long-lived {@link ManagedTask}s, one worker per task.
 * <p><strong>Sizing:</strong> Between {@code coreSize} and {@code maxSize} workers; submissions beyond
 * {@code maxSize} queue until a worker frees up. Tasks are never time-sliced.</p>
 * <p><strong>Shutdown:</strong> {@link #requestShutdown()} only raises the shared {@link TerminationSignal}
 * and is safe from restricted contexts. {@link #shutdown()} raises the signal and then joins every
 * worker on the calling thread. Both are idempotent. Workers are never interrupted; cancellation is
 * cooperative.</p>
 *
 * @since 0.1.0
 */
public final class TaskExecutor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);
  private static final Duration DEFAULT_JOIN_WARN_INTERVAL = Duration.ofSeconds(5);

  private final ThreadPoolExecutor pool;
  private final TerminationSignal termination = new TerminationSignal();
  private final AtomicBoolean joined = new AtomicBoolean();
  private final AtomicInteger running = new AtomicInteger();
  private final Duration joinWarnInterval;

  public TaskExecutor(int coreSize, int maxSize) {
    this(coreSize, maxSize, DEFAULT_JOIN_WARN_INTERVAL);
  }

  /**
   * Creates the executor and starts {@code coreSize} workers.
   *
   * @param coreSize workers started eagerly; must be positive
   * @param maxSize maximum concurrent workers; must be {@code >= coreSize}
   * @param joinWarnInterval how long {@link #shutdown()} waits between "still waiting" warnings
   */
  public TaskExecutor(int coreSize, int maxSize, Duration joinWarnInterval) {
    this.joinWarnInterval = Objects.requireNonNull(joinWarnInterval, "joinWarnInterval");
    this.pool = ExecutorFactories.newTaskPool(coreSize, maxSize, "rx-task", TaskExecutor::handleCrash);
  }

  /**
   * Assigns a worker to {@code task}, or queues it when all {@code maxSize} workers are busy.
   *
   * @param task task to run until termination
   * @throws IllegalStateException when shutdown has already been requested
   */
  public void submit(ManagedTask task) {
    Objects.requireNonNull(task, "task");
    if (termination.isRaised()) {
      throw new IllegalStateException("executor is shutting down; rejected task " + task.name());
    }
    try {
      pool.execute(() -> runTask(task));
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("executor rejected task " + task.name(), ex);
    }
    log.debug("Submitted task {}", task.name());
  }

  /**
   * Raises the termination signal without waiting. Non-blocking and idempotent.
   */
  public void requestShutdown() {
    termination.raise();
  }

  /**
   * Raises the termination signal and waits for every worker to return.
   *
   * <p>Subsequent calls return immediately. If the calling thread is interrupted while joining, the
   * interrupt flag is restored and the method returns without waiting further.</p>
   */
  public void shutdown() {
    requestShutdown();
    if (!joined.compareAndSet(false, true)) {
      return;
    }
    pool.shutdown();
    try {
      while (!pool.awaitTermination(joinWarnInterval.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Still waiting for {} task(s) to observe termination", running.get());
      }
      log.debug("All task workers joined");
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while joining task workers; {} still running", running.get());
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  public TerminationSignal termination() {
    return termination;
  }

  public boolean isShutdownRequested() {
    return termination.isRaised();
  }

  public boolean isTerminated() {
    return pool.isTerminated();
  }

  /**
   * Returns the number of tasks currently executing (not queued).
   *
   * @return running task count
   */
  public int runningTasks() {
    return running.get();
  }

  /**
   * Returns the number of live worker threads.
   *
   * @return pool size
   */
  public int workerCount() {
    return pool.getPoolSize();
  }

  private void runTask(ManagedTask task) {
    running.incrementAndGet();
    MDC.put("task", task.name());
    try {
      log.info("Task {} started on {}", task.name(), Thread.currentThread().getName());
      task.run(termination);
      log.info("Task {} finished", task.name());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Task {} interrupted", task.name());
    } catch (Exception ex) {
      log.error("Task {} failed", task.name(), ex);
    } finally {
      MDC.remove("task");
      running.decrementAndGet();
    }
  }

  private static void handleCrash(Thread thread, Throwable failure) {
    log.error("Task worker {} crashed", thread.getName(), failure);
  }
}
