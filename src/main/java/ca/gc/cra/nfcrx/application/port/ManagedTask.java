package ca.gc.cra.nfcrx.application.port;

import ca.gc.cra.nfcrx.infrastructure.exec.TerminationSignal;

/**
 * Long-running unit of work (radio capture, decoder) occupying one executor worker for its lifetime.
 *
 * <p>Implementations run their own internal loop and must return promptly once the supplied
 * {@link TerminationSignal} is raised; cancellation is cooperative and workers are never interrupted
 * on the normal shutdown path.</p>
 *
 * @since 0.1.0
 */
public interface ManagedTask {
  /**
   * Short task name used for worker thread names and log context.
   *
   * @return name such as {@code radio} or {@code decoder}
   */
  String name();

  /**
   * Runs the task until {@code termination} is raised.
   *
   * @param termination shared shutdown flag to poll
   * @throws Exception when the task fails irrecoverably; the worker logs it and exits
   */
  void run(TerminationSignal termination) throws Exception;
}
