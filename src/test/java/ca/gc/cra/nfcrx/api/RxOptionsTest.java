package ca.gc.cra.nfcrx.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nfcrx.config.DecoderProfile;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class RxOptionsTest {

  @Test
  void noArgumentsYieldDefaults() {
    RxOptions options = RxOptions.parse(new String[0]);

    assertEquals(0, options.verbosity());
    assertFalse(options.debugEnabled());
    assertEquals(DecoderProfile.allProtocols(), options.protocols());
    assertNull(options.timeLimit());
    assertNull(options.configPath());
    assertFalse(options.help());
  }

  @Test
  void protocolListSelectsTechnologies() {
    RxOptions options = RxOptions.parse(new String[] {"-p", "nfca,nfcv"});

    assertEquals(EnumSet.of(TechType.NFC_A, TechType.NFC_V), options.protocols());
  }

  @Test
  void clusteredFlagsAndAttachedArguments() {
    RxOptions options = RxOptions.parse(new String[] {"-vvd", "-t5", "-pNFCF", "-c", "rx.yaml"});

    assertEquals(2, options.verbosity());
    assertTrue(options.debugEnabled());
    assertEquals(Duration.ofSeconds(5), options.timeLimit());
    assertEquals(EnumSet.of(TechType.NFC_F), options.protocols());
    assertEquals(Path.of("rx.yaml"), options.configPath());
  }

  @Test
  void zeroTimeLimitMeansUnlimited() {
    assertNull(RxOptions.parse(new String[] {"-t", "0"}).timeLimit());
  }

  @Test
  void helpFlag() {
    assertTrue(RxOptions.parse(new String[] {"-h"}).help());
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"-x"}));
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"capture"}));
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"-t"}));
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"-t", "-1"}));
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"-t", "ten"}));
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"-p", "nfcz"}));
    assertThrows(IllegalArgumentException.class, () -> RxOptions.parse(new String[] {"-p", ","}));
  }
}
