package ca.gc.cra.nfcrx.application.pipeline;

/**
 * Convergence phase of a managed task as seen by the control loop.
 *
 * <p>Transitions follow observed status and command completions only; the tick timer merely
 * decides when the loop looks.</p>
 *
 * @since 0.1.0
 */
public enum TaskPhase {
  /** No status yet, or the observed state differs from the desired configuration. */
  UNCONVERGED,
  /** A configure command was published and has not completed yet. */
  CONFIGURING,
  /** Configuration applied (optimistically or confirmed) and the task is idle. */
  CONFIGURED,
  /** Start command accepted; waiting for the task to report it is streaming. */
  STARTING,
  /** The task reports a running state. */
  RUNNING
}
