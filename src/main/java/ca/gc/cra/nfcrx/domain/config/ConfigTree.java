package ca.gc.cra.nfcrx.domain.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable, insertion-ordered tree of string keys to {@link ConfigValue} nodes.
 * <p><strong>Why:</strong> Serves both as a live status snapshot reported by a task and as the desired
 * configuration document the control loop converges that task towards.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between task workers and the control loop.</p>
 * <p><strong>Performance:</strong> Copy-on-write; every {@code with*} call copies the top-level map only,
 * nested trees are shared structurally.</p>
 *
 * @since 0.1.0
 * @see ConfigDiff
 */
public final class ConfigTree implements ConfigValue {
  private static final ConfigTree EMPTY = new ConfigTree(Map.of());

  private final Map<String, ConfigValue> entries;

  private ConfigTree(Map<String, ConfigValue> entries) {
    this.entries = entries;
  }

  /**
   * Returns the shared empty tree.
   *
   * @return tree without entries
   */
  public static ConfigTree empty() {
    return EMPTY;
  }

  /**
   * Creates a builder for assembling trees key by key.
   *
   * @return new mutable builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Converts a nested map (as produced by YAML or JSON readers) into a tree.
   *
   * @param source map whose keys are strings and values are maps or scalars; {@code null} values are skipped
   * @return immutable tree preserving the source iteration order
   * @throws IllegalArgumentException when a key is not a string or a value is unsupported
   */
  public static ConfigTree fromMap(Map<?, ?> source) {
    if (source == null || source.isEmpty()) {
      return EMPTY;
    }
    Builder builder = builder();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("config keys must be strings (was " + entry.getKey() + ")");
      }
      if (entry.getValue() == null) {
        continue;
      }
      builder.put(key, ConfigValue.of(entry.getValue()));
    }
    return builder.build();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }

  /**
   * Returns the keys in insertion order.
   *
   * @return unmodifiable key view
   */
  public Set<String> keys() {
    return entries.keySet();
  }

  /**
   * Returns the node stored under {@code key}.
   *
   * @param key top-level key
   * @return node when present
   */
  public Optional<ConfigValue> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  /**
   * Returns the raw scalar value stored under {@code key}.
   *
   * @param key top-level key
   * @return scalar payload ({@link Boolean}, {@link Long}, {@link Double}, {@link String}) when present
   */
  public Optional<Object> scalar(String key) {
    return entries.get(key) instanceof Scalar scalar ? Optional.of(scalar.value()) : Optional.empty();
  }

  /**
   * Returns the string stored under {@code key}; non-string scalars are not converted.
   *
   * @param key top-level key
   * @return string value when the key holds a string scalar
   */
  public Optional<String> string(String key) {
    return scalar(key).filter(String.class::isInstance).map(String.class::cast);
  }

  /**
   * Returns the nested tree stored under {@code key}.
   *
   * @param key top-level key
   * @return nested tree when present
   */
  public Optional<ConfigTree> tree(String key) {
    return entries.get(key) instanceof ConfigTree tree ? Optional.of(tree) : Optional.empty();
  }

  /**
   * Returns a copy of this tree with {@code key} set to {@code value}.
   *
   * @param key top-level key
   * @param value scalar, map, or node
   * @return updated copy
   */
  public ConfigTree with(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
    copy.put(key, ConfigValue.of(value));
    return new ConfigTree(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a copy of this tree with a value set under a dotted path, creating intermediate trees.
   *
   * @param path dotted key path such as {@code nfca.enabled}
   * @param value scalar, map, or node
   * @return updated copy
   */
  public ConfigTree withPath(String path, Object value) {
    Objects.requireNonNull(path, "path");
    int dot = path.indexOf('.');
    if (dot < 0) {
      return with(path, value);
    }
    String head = path.substring(0, dot);
    ConfigTree child = tree(head).orElse(EMPTY);
    return with(head, child.withPath(path.substring(dot + 1), value));
  }

  /**
   * Returns a copy of this tree without {@code key}.
   *
   * @param key top-level key
   * @return updated copy, or this tree when the key is absent
   */
  public ConfigTree without(String key) {
    if (!entries.containsKey(key)) {
      return this;
    }
    Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
    copy.remove(key);
    return copy.isEmpty() ? EMPTY : new ConfigTree(Collections.unmodifiableMap(copy));
  }

  /**
   * Deep-merges {@code overlay} onto this tree. Nested trees merge recursively; any other overlay
   * node replaces the existing node.
   *
   * @param overlay tree whose entries take precedence
   * @return merged copy
   */
  public ConfigTree merge(ConfigTree overlay) {
    Objects.requireNonNull(overlay, "overlay");
    if (overlay.isEmpty()) {
      return this;
    }
    Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
    for (Map.Entry<String, ConfigValue> entry : overlay.entries.entrySet()) {
      ConfigValue existing = copy.get(entry.getKey());
      if (existing instanceof ConfigTree base && entry.getValue() instanceof ConfigTree nested) {
        copy.put(entry.getKey(), base.merge(nested));
      } else {
        copy.put(entry.getKey(), entry.getValue());
      }
    }
    return new ConfigTree(Collections.unmodifiableMap(copy));
  }

  /**
   * Converts the tree back into nested {@link LinkedHashMap}s with raw scalar values.
   *
   * @return mutable nested map owned by the caller
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<String, ConfigValue> entry : entries.entrySet()) {
      if (entry.getValue() instanceof ConfigTree tree) {
        map.put(entry.getKey(), tree.toMap());
      } else {
        map.put(entry.getKey(), ((Scalar) entry.getValue()).value());
      }
    }
    return map;
  }

  Map<String, ConfigValue> entries() {
    return entries;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ConfigTree tree && entries.equals(tree.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  /**
   * Renders the tree as compact JSON.
   *
   * @return JSON text
   */
  @Override
  public String toString() {
    return ConfigTreeJson.write(this);
  }

  /** Mutable builder preserving insertion order. */
  public static final class Builder {
    private final Map<String, ConfigValue> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, Object value) {
      entries.put(Objects.requireNonNull(key, "key"), ConfigValue.of(value));
      return this;
    }

    public ConfigTree build() {
      if (entries.isEmpty()) {
        return EMPTY;
      }
      return new ConfigTree(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }
  }
}
