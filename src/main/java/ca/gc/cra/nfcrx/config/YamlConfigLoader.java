package ca.gc.cra.nfcrx.config;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the receiver's YAML file.
 *
 * <p>The {@code common} section is applied first, then the requested section on top. Settings are
 * flattened to dotted keys for {@link RxConfig}. The {@code catalog} subtree is not flattened: its
 * values keep the types SnakeYAML resolved, so {@code 1.0e7} stays numeric and {@code '42'} stays text.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  static final String CATALOG_KEY = "catalog";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} for {@code section}.
   *
   * @param path YAML file
   * @param section section name such as {@code rx}; matched case-insensitively
   * @return settings and catalog overrides, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of mappings or holds unsupported values
   */
  public static Optional<ConfigDocument> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(ConfigDocument.empty());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML root must be a mapping of sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    ConfigTree catalog = ConfigTree.empty();
    for (String wanted : new String[] {COMMON_SECTION, section.trim().toLowerCase(Locale.ROOT)}) {
      Map<?, ?> body = section(root, wanted);
      for (Map.Entry<?, ?> entry : body.entrySet()) {
        String key = keyOf(entry.getKey(), wanted);
        if (key.equals(CATALOG_KEY)) {
          catalog = catalog.merge(catalogTree(entry.getValue(), wanted));
        } else {
          putSetting(settings, key, entry.getValue());
        }
      }
    }
    return Optional.of(new ConfigDocument(settings, catalog));
  }

  private static Map<?, ?> section(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name)) {
        if (entry.getValue() == null) {
          return Map.of();
        }
        if (!(entry.getValue() instanceof Map<?, ?> body)) {
          throw new IllegalArgumentException("section " + name + " must be a mapping");
        }
        return body;
      }
    }
    return Map.of();
  }

  private static ConfigTree catalogTree(Object node, String section) {
    if (node == null) {
      return ConfigTree.empty();
    }
    if (!(node instanceof Map<?, ?> devices)) {
      throw new IllegalArgumentException(section + "." + CATALOG_KEY + " must map device types to parameters");
    }
    try {
      return ConfigTree.fromMap(devices);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException(section + "." + CATALOG_KEY + " holds an out-of-range number", ex);
    }
  }

  private static void putSetting(Map<String, String> target, String key, Object value) {
    if (value instanceof Map<?, ?> nested) {
      for (Map.Entry<?, ?> entry : nested.entrySet()) {
        putSetting(target, key + '.' + keyOf(entry.getKey(), key), entry.getValue());
      }
    } else if (value instanceof Iterable<?>) {
      throw new IllegalArgumentException("lists are not supported (" + key + ")");
    } else {
      target.put(key, value == null ? "" : value.toString());
    }
  }

  private static String keyOf(Object raw, String parent) {
    if (!(raw instanceof String key) || key.isBlank()) {
      throw new IllegalArgumentException(parent + " has a blank or non-string key: " + raw);
    }
    return key;
  }
}
