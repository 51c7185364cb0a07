package ca.gc.cra.nfcrx.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the receiver runtime.
 * <p><strong>Why:</strong> Lets the control loop and the bus record counters without binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the loop and
 * from task worker threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking; subject delivery invokes them inline.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code loop.frames.drained}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
