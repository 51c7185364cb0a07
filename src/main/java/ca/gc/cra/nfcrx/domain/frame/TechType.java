package ca.gc.cra.nfcrx.domain.frame;

import java.util.Locale;

/**
 * NFC technology a frame was decoded with.
 *
 * @since 0.1.0
 */
public enum TechType {
  NONE("None", null),
  NFC_A("NfcA", "nfca"),
  NFC_B("NfcB", "nfcb"),
  NFC_F("NfcF", "nfcf"),
  NFC_V("NfcV", "nfcv");

  private final String label;
  private final String protocolKey;

  TechType(String label, String protocolKey) {
    this.label = label;
    this.protocolKey = protocolKey;
  }

  public String label() {
    return label;
  }

  /**
   * Returns the decoder configuration key used to enable this technology.
   *
   * @return protocol key such as {@code nfca}, or {@code null} for {@link #NONE}
   */
  public String protocolKey() {
    return protocolKey;
  }

  /**
   * Resolves a decoder protocol key ({@code nfca}, {@code nfcb}, {@code nfcf}, {@code nfcv}).
   *
   * @param key protocol key, case-insensitive
   * @return matching technology
   * @throws IllegalArgumentException when the key names no supported protocol
   */
  public static TechType fromProtocolKey(String key) {
    if (key != null) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      for (TechType tech : values()) {
        if (normalized.equals(tech.protocolKey)) {
          return tech;
        }
      }
    }
    throw new IllegalArgumentException("unknown protocol: " + key);
  }
}
