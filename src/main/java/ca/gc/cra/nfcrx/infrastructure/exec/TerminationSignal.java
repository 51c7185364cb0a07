package ca.gc.cra.nfcrx.infrastructure.exec;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-way shutdown flag shared by the executor and the tasks it runs.
 *
 * <p>{@link #raise()} is non-blocking and allocation-free, so it may be called from a shutdown hook or
 * any other restricted context. Tasks either poll {@link #isRaised()} or park in {@link #await(long, TimeUnit)}
 * between iterations; the latter wakes immediately when the flag is raised.</p>
 *
 * @since 0.1.0
 */
public final class TerminationSignal {
  private final CountDownLatch latch = new CountDownLatch(1);

  /** Raises the flag; idempotent. */
  public void raise() {
    latch.countDown();
  }

  public boolean isRaised() {
    return latch.getCount() == 0;
  }

  /**
   * Parks the caller until the flag is raised or the timeout elapses.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return {@code true} when the flag is raised
   * @throws InterruptedException when the caller is interrupted while waiting
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return latch.await(timeout, unit);
  }
}
