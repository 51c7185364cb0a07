package ca.gc.cra.nfcrx.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic timestamps to the control loop and simulated tasks.
 * <p><strong>Why:</strong> Capture time budgets and frame timestamps must not jump with wall-clock
 * adjustments, and tests need a clock they can drive.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the loop and task workers read it
 * concurrently.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.nfcrx.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds with an arbitrary origin.
   *
   * @return nanoseconds; only differences between two readings are meaningful
   */
  long nanoTime();
}
