package ca.gc.cra.nfcrx.application.pipeline;

/**
 * Why the control loop stopped.
 *
 * @since 0.1.0
 */
public enum ShutdownReason {
  /** Configured capture time budget elapsed. */
  TIME_LIMIT(false, "time limit reached"),
  /** External termination request (SIGINT/SIGTERM). */
  SIGNAL(false, "terminated on signal"),
  /** Programmatic stop requested by the embedding code. */
  STOP_REQUESTED(false, "stop requested"),
  /** Capture task reports no device, or a device without identity. */
  DEVICE_ABSENT(true, "invalid receiver"),
  /** Capture device type is not in the catalog. */
  UNKNOWN_DEVICE(true, "invalid receiver"),
  /** Decoder task reports no status. */
  DECODER_UNAVAILABLE(true, "invalid decoder");

  private final boolean fatal;
  private final String summary;

  ShutdownReason(boolean fatal, String summary) {
    this.fatal = fatal;
    this.summary = summary;
  }

  public boolean fatal() {
    return fatal;
  }

  /**
   * Returns the operator notice printed when the capture finishes for this reason.
   *
   * @return line such as {@code Finish capture, time limit reached!}
   */
  public String notice() {
    return "Finish capture, " + summary + "!";
  }
}
