package ca.gc.cra.nfcrx.domain.frame;

/**
 * Kind of event reported by the decoder.
 *
 * @since 0.1.0
 */
public enum FrameType {
  CARRIER_ON("CarrierOn", false),
  CARRIER_OFF("CarrierOff", false),
  /** Reader to card (PCD to PICC). */
  POLL("PCD->PICC", true),
  /** Card to reader (PICC to PCD). */
  LISTEN("PICC->PCD", true);

  private final String label;
  private final boolean data;

  FrameType(String label, boolean data) {
    this.label = label;
    this.data = data;
  }

  public String label() {
    return label;
  }

  /**
   * Indicates whether frames of this type carry technology, rate and payload bytes.
   *
   * @return {@code true} for poll and listen frames
   */
  public boolean isData() {
    return data;
  }
}
