package ca.gc.cra.nfcrx.domain.config;

/**
 * Node of a {@link ConfigTree}: either a nested tree or a scalar leaf.
 *
 * <p>Scalars are normalized on construction so that structurally equal documents compare equal
 * regardless of how the numbers were produced (YAML ints, JSON longs, literals in code).</p>
 *
 * @since 0.1.0
 */
public sealed interface ConfigValue permits ConfigTree, ConfigValue.Scalar {

  /**
   * Wraps a raw Java value into a config node.
   *
   * @param raw {@link ConfigValue}, {@link java.util.Map}, {@link Boolean}, {@link Number}, or {@link CharSequence}
   * @return normalized node
   * @throws IllegalArgumentException when {@code raw} is {@code null} or of an unsupported type
   */
  static ConfigValue of(Object raw) {
    if (raw instanceof ConfigValue value) {
      return value;
    }
    if (raw instanceof java.util.Map<?, ?> map) {
      return ConfigTree.fromMap(map);
    }
    return Scalar.of(raw);
  }

  /**
   * Scalar leaf holding a {@link Boolean}, {@link Long}, {@link Double}, or {@link String}.
   *
   * @param value normalized scalar
   */
  record Scalar(Object value) implements ConfigValue {

    public Scalar {
      if (!(value instanceof Boolean || value instanceof Long
          || value instanceof Double || value instanceof String)) {
        throw new IllegalArgumentException("unsupported scalar type: "
            + (value == null ? "null" : value.getClass().getName()));
      }
    }

    /**
     * Normalizes a raw value: integral numbers become {@link Long}, other numbers {@link Double}.
     *
     * @param raw value to wrap
     * @return scalar node
     */
    public static Scalar of(Object raw) {
      if (raw == null) {
        throw new IllegalArgumentException("config scalars must not be null");
      }
      if (raw instanceof Boolean || raw instanceof String) {
        return new Scalar(raw);
      }
      if (raw instanceof CharSequence text) {
        return new Scalar(text.toString());
      }
      if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
        return new Scalar(((Number) raw).longValue());
      }
      if (raw instanceof java.math.BigInteger big) {
        return new Scalar(big.longValueExact());
      }
      if (raw instanceof Number number) {
        double d = number.doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p53) {
          return new Scalar((long) d);
        }
        return new Scalar(d);
      }
      throw new IllegalArgumentException("unsupported scalar type: " + raw.getClass().getName());
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }
}
