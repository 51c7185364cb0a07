package ca.gc.cra.nfcrx.infrastructure.time;

import ca.gc.cra.nfcrx.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {

  /**
   * Returns the JVM's monotonic time source.
   *
   * @return nanoseconds with an arbitrary origin
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
