package ca.gc.cra.nfcrx.infrastructure.bus;

/**
 * Handle for one {@link Subject} registration.
 *
 * <p>Closing removes only this registration; other subscribers of the same subject are unaffected.
 * Closing is idempotent.</p>
 *
 * @since 0.1.0
 */
public interface Subscription extends AutoCloseable {

  /**
   * Indicates whether the registration still receives values.
   *
   * @return {@code false} once closed
   */
  boolean isActive();

  /** Removes the registration from its subject. */
  @Override
  void close();
}
