package ca.gc.cra.nfcrx.application.pipeline;

import java.util.Objects;

/**
 * Raised while evaluating a task's status when the capture cannot continue.
 *
 * @since 0.1.0
 */
public final class FatalTaskException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ShutdownReason reason;

  /**
   * Creates the exception.
   *
   * @param reason fatal shutdown reason
   * @param message operator-facing detail
   */
  public FatalTaskException(ShutdownReason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
    if (!reason.fatal()) {
      throw new IllegalArgumentException(reason + " is not a fatal reason");
    }
  }

  public ShutdownReason reason() {
    return reason;
  }
}
