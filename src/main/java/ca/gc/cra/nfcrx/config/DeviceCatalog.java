package ca.gc.cra.nfcrx.config;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Static mapping from device type to the radio parameters the receiver should run with.
 * <p><strong>Lookup:</strong> A device identity such as {@code airspy:0x35AC63DC2D8C7A4F} resolves by its prefix
 * up to the first {@code ':'}; identities without a separator resolve by the whole string.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class DeviceCatalog {
  private final Map<String, ConfigTree> entries;

  private DeviceCatalog(Map<String, ConfigTree> entries) {
    this.entries = Map.copyOf(entries);
  }

  /**
   * Returns the built-in catalog (AirSpy and RTL-SDR receivers).
   *
   * @return default catalog
   */
  public static DeviceCatalog defaults() {
    Map<String, ConfigTree> entries = new LinkedHashMap<>();
    entries.put("airspy", ConfigTree.builder()
        .put("centerFreq", 40_680_000)
        .put("sampleRate", 10_000_000)
        .put("gainMode", 1)
        .put("gainValue", 3)
        .put("mixerAgc", 0)
        .put("tunerAgc", 0)
        .build());
    entries.put("rtlsdr", ConfigTree.builder()
        .put("centerFreq", 27_120_000)
        .put("sampleRate", 3_200_000)
        .put("gainMode", 1)
        .put("gainValue", 77)
        .put("mixerAgc", 0)
        .put("tunerAgc", 0)
        .build());
    return new DeviceCatalog(entries);
  }

  /**
   * Builds a catalog with a single entry; used by tests and embedded callers.
   *
   * @param deviceType identity prefix
   * @param parameters desired parameters
   * @return catalog holding only that entry
   */
  public static DeviceCatalog of(String deviceType, ConfigTree parameters) {
    return new DeviceCatalog(Map.of(deviceType, parameters));
  }

  /**
   * Returns the catalog key for a device identity.
   *
   * @param identity identity string reported by the capture task
   * @return prefix up to the first {@code ':'}
   */
  public static String deviceType(String identity) {
    Objects.requireNonNull(identity, "identity");
    int idx = identity.indexOf(':');
    return idx < 0 ? identity : identity.substring(0, idx);
  }

  /**
   * Resolves the desired parameters for a device identity.
   *
   * @param identity identity string reported by the capture task
   * @return desired parameters, or empty when the device type is unknown
   */
  public Optional<ConfigTree> lookup(String identity) {
    return Optional.ofNullable(entries.get(deviceType(identity)));
  }

  public Set<String> deviceTypes() {
    return entries.keySet();
  }

  /**
   * Merges per-device overrides onto this catalog. Parameters of a known device type are replaced or
   * added one by one; unknown device types are added as new entries.
   *
   * @param overrides tree keyed by device type, each value a tree of parameters
   * @return catalog with overrides applied
   * @throws IllegalArgumentException when a device type maps to a scalar instead of parameters
   */
  public DeviceCatalog withOverrides(ConfigTree overrides) {
    Objects.requireNonNull(overrides, "overrides");
    if (overrides.isEmpty()) {
      return this;
    }
    Map<String, ConfigTree> merged = new LinkedHashMap<>(entries);
    for (String type : overrides.keys()) {
      ConfigTree parameters = overrides.tree(type)
          .orElseThrow(() -> new IllegalArgumentException("catalog." + type + " must map parameter names to values"));
      merged.put(type, merged.getOrDefault(type, ConfigTree.empty()).merge(parameters));
    }
    return new DeviceCatalog(merged);
  }
}
