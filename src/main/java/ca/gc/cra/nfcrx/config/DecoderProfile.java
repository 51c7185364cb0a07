package ca.gc.cra.nfcrx.config;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the decoder's desired configuration from the enabled protocols and the debug switch.
 *
 * <p>The sample rate is deliberately absent: it is learned from the capture task at runtime.</p>
 *
 * @since 0.1.0
 */
public final class DecoderProfile {

  private DecoderProfile() {}

  /**
   * Returns every decodable technology.
   *
   * @return mutable set of NFC-A, NFC-B, NFC-F and NFC-V
   */
  public static EnumSet<TechType> allProtocols() {
    return EnumSet.of(TechType.NFC_A, TechType.NFC_B, TechType.NFC_F, TechType.NFC_V);
  }

  /**
   * Builds the desired decoder document.
   *
   * @param enabled technologies to enable; every other decodable technology is disabled
   * @param debugEnabled whether the decoder should write its debug signal artifact
   * @return desired tree such as {@code {"debugEnabled":false,"nfca":{"enabled":true},...}}
   */
  public static ConfigTree desired(Set<TechType> enabled, boolean debugEnabled) {
    Objects.requireNonNull(enabled, "enabled");
    ConfigTree tree = ConfigTree.builder().put("debugEnabled", debugEnabled).build();
    for (TechType tech : allProtocols()) {
      tree = tree.withPath(tech.protocolKey() + ".enabled", enabled.contains(tech));
    }
    return tree;
  }
}
