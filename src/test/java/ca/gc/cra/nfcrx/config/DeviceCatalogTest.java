package ca.gc.cra.nfcrx.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nfcrx.domain.config.ConfigDiff;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DeviceCatalogTest {

  @Test
  void lookupUsesPrefixBeforeFirstColon() {
    DeviceCatalog catalog = DeviceCatalog.defaults();

    ConfigTree airspy = catalog.lookup("airspy:0x35AC63DC2D8C7A4F").orElseThrow();

    assertEquals(40_680_000L, airspy.scalar("centerFreq").orElseThrow());
    assertEquals(10_000_000L, airspy.scalar("sampleRate").orElseThrow());
    assertEquals(3L, airspy.scalar("gainValue").orElseThrow());
    assertEquals(27_120_000L, catalog.lookup("rtlsdr:00000001").orElseThrow().scalar("centerFreq").orElseThrow());
  }

  @Test
  void unknownPrefixIsEmpty() {
    assertTrue(DeviceCatalog.defaults().lookup("hackrf:1").isEmpty());
    assertTrue(DeviceCatalog.defaults().lookup("radio.airspy:1").isEmpty());
  }

  @Test
  void identityWithoutSeparatorResolvesByWholeString() {
    assertEquals("airspy", DeviceCatalog.deviceType("airspy"));
    assertEquals("airspy", DeviceCatalog.deviceType("airspy:a:b"));
  }

  @Test
  void overridesMergePerParameterAndMayAddDevices() {
    ConfigTree overrides = ConfigTree.fromMap(Map.of(
        "airspy", Map.of("gainValue", 5),
        "hackrf", Map.of("sampleRate", 8_000_000, "biasTee", true)));

    DeviceCatalog catalog = DeviceCatalog.defaults().withOverrides(overrides);

    ConfigTree airspy = catalog.lookup("airspy:1").orElseThrow();
    assertEquals(5L, airspy.scalar("gainValue").orElseThrow());
    assertEquals(40_680_000L, airspy.scalar("centerFreq").orElseThrow());
    ConfigTree hackrf = catalog.lookup("hackrf:1").orElseThrow();
    assertEquals(8_000_000L, hackrf.scalar("sampleRate").orElseThrow());
    assertEquals(true, hackrf.scalar("biasTee").orElseThrow());
  }

  @Test
  void integralDoubleOverrideEqualsReportedLong() {
    DeviceCatalog catalog = DeviceCatalog.defaults()
        .withOverrides(ConfigTree.fromMap(Map.of("airspy", Map.of("sampleRate", 1.0e7))));

    ConfigTree desired = catalog.lookup("airspy:0").orElseThrow();
    ConfigTree reported = DeviceCatalog.defaults().lookup("airspy:0").orElseThrow()
        .with("status", "streaming");

    assertEquals(10_000_000L, desired.scalar("sampleRate").orElseThrow());
    assertTrue(ConfigDiff.satisfies(reported, desired));
  }

  @Test
  void scalarDeviceEntryIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> DeviceCatalog.defaults().withOverrides(ConfigTree.fromMap(Map.of("airspy", 1))));
  }
}
