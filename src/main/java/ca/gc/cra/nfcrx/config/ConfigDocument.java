package ca.gc.cra.nfcrx.config;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.util.Map;
import java.util.Objects;

/**
 * Receiver configuration as read from YAML: scalar settings flattened to dotted keys, and the device
 * catalog overrides kept as a typed tree.
 *
 * @param settings flattened settings such as {@code executor.maxSize}
 * @param catalog overrides keyed by device type, e.g. {@code {"airspy":{"gainValue":5}}}
 * @since 0.1.0
 */
public record ConfigDocument(Map<String, String> settings, ConfigTree catalog) {

  public ConfigDocument {
    settings = Map.copyOf(Objects.requireNonNull(settings, "settings"));
    Objects.requireNonNull(catalog, "catalog");
  }

  public static ConfigDocument empty() {
    return new ConfigDocument(Map.of(), ConfigTree.empty());
  }
}
