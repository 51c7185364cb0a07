package ca.gc.cra.nfcrx.config;

import java.util.Locale;

/**
 * Capture task implementation to submit at startup.
 *
 * @since 0.1.0
 */
public enum ReceiverDriver {
  /** Loopback receiver announcing a configurable device identity. */
  SIMULATED,
  /** Receiver that always reports no device attached. */
  ABSENT;

  /**
   * Parses a driver name.
   *
   * @param raw driver name, case-insensitive; blank selects {@code fallback}
   * @param fallback value returned for blank input
   * @return parsed driver
   * @throws IllegalArgumentException for unknown names
   */
  public static ReceiverDriver fromString(String raw, ReceiverDriver fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "simulated", "sim" -> SIMULATED;
      case "absent", "none" -> ABSENT;
      default -> throw new IllegalArgumentException("receiver.driver must be 'simulated' or 'absent' (was " + raw + ")");
    };
  }
}
