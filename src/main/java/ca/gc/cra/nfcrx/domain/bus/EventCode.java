package ca.gc.cra.nfcrx.domain.bus;

/**
 * Command and notification codes carried by {@link Event}s on the task bus.
 *
 * @since 0.1.0
 */
public enum EventCode {
  /** Ask a task to publish a fresh status snapshot. */
  QUERY,
  /** Apply the event payload onto the task's live configuration. */
  CONFIGURE,
  /** Begin streaming (capture) or decoding. */
  START,
  /** Stop streaming or decoding and return to idle. */
  STOP,
  /** One-way status snapshot published by a task; carries no completion. */
  STATUS
}
