package ca.gc.cra.nfcrx.domain.config;

import java.util.Map;
import java.util.Objects;

/**
 * Structural diff between an observed tree and a desired tree.
 *
 * <p>Only the desired tree's keys are visited; keys present solely in the observed tree are
 * ignored. Nested desired trees are diffed recursively and kept only when non-empty; scalar desired
 * values are kept when the observed tree lacks the key or holds a different node. The result is the
 * minimal document that, merged onto the observed tree, satisfies the desired one.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ConfigDiff {

  private ConfigDiff() {}

  /**
   * Computes the entries of {@code desired} not yet satisfied by {@code observed}.
   *
   * @param observed last reported state; {@code null} is treated as empty
   * @param desired target document; must not be {@code null}
   * @return unsatisfied entries, empty when {@code observed} already satisfies {@code desired}
   */
  public static ConfigTree diff(ConfigTree observed, ConfigTree desired) {
    Objects.requireNonNull(desired, "desired");
    ConfigTree current = observed == null ? ConfigTree.empty() : observed;
    ConfigTree.Builder result = ConfigTree.builder();
    for (Map.Entry<String, ConfigValue> entry : desired.entries().entrySet()) {
      String key = entry.getKey();
      ConfigValue want = entry.getValue();
      ConfigValue have = current.get(key).orElse(null);
      if (want instanceof ConfigTree nested) {
        ConfigTree nestedObserved = have instanceof ConfigTree tree ? tree : ConfigTree.empty();
        ConfigTree nestedDiff = diff(nestedObserved, nested);
        if (!nestedDiff.isEmpty()) {
          result.put(key, nestedDiff);
        }
      } else if (!want.equals(have)) {
        result.put(key, want);
      }
    }
    return result.build();
  }

  /**
   * Indicates whether {@code observed} already satisfies every leaf of {@code desired}.
   *
   * @param observed last reported state
   * @param desired target document
   * @return {@code true} when the diff is empty
   */
  public static boolean satisfies(ConfigTree observed, ConfigTree desired) {
    return diff(observed, desired).isEmpty();
  }
}
