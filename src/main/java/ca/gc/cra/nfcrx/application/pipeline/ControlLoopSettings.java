package ca.gc.cra.nfcrx.application.pipeline;

import ca.gc.cra.nfcrx.config.DeviceCatalog;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tuning and desired state handed to {@link CaptureControlLoop}.
 *
 * @param tickInterval interval between reconciliation ticks
 * @param timeLimit capture budget, or {@code null} for none
 * @param catalog desired radio parameters per device type
 * @param decoderDesired desired decoder configuration without the sample rate
 * @since 0.1.0
 */
public record ControlLoopSettings(
    Duration tickInterval, Duration timeLimit, DeviceCatalog catalog, ConfigTree decoderDesired) {

  public ControlLoopSettings {
    Objects.requireNonNull(tickInterval, "tickInterval");
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(decoderDesired, "decoderDesired");
    if (tickInterval.isZero() || tickInterval.isNegative()) {
      throw new IllegalArgumentException("tickInterval must be positive");
    }
    if (timeLimit != null && (timeLimit.isZero() || timeLimit.isNegative())) {
      timeLimit = null;
    }
  }

  public Optional<Duration> timeBudget() {
    return Optional.ofNullable(timeLimit);
  }
}
