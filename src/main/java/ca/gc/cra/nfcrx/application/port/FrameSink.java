package ca.gc.cra.nfcrx.application.port;

import ca.gc.cra.nfcrx.domain.frame.FrameRecord;

/**
 * Output port receiving drained frames and operator notices from the control loop.
 *
 * <p>Only the control-loop thread calls a sink, so implementations need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface FrameSink {
  /**
   * Emits one decoded frame.
   *
   * @param frame frame drained from the queue
   */
  void accept(FrameRecord frame);

  /**
   * Emits an operator-facing notice (e.g., why the capture finished).
   *
   * @param message single line of text
   */
  void notice(String message);

  /** Pushes buffered output to the underlying channel; called once per loop tick. */
  void flush();
}
