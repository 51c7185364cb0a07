package ca.gc.cra.nfcrx.infrastructure.task;

import ca.gc.cra.nfcrx.application.port.ClockPort;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loopback radio receiver announcing a fixed device identity.
 *
 * <p>Configure payloads are merged into the reported parameters; {@code START} moves the status from
 * {@code idle} to {@code streaming} and {@code STOP} moves it back.</p>
 *
 * @since 0.1.0
 */
public final class SimulatedRadioDeviceTask extends BusTask {
  private static final Logger log = LoggerFactory.getLogger(SimulatedRadioDeviceTask.class);
  static final String STATUS_IDLE = "idle";
  static final String STATUS_STREAMING = "streaming";
  static final long POWER_ON_SAMPLE_RATE = 2_500_000L;

  private final String deviceName;
  private volatile ConfigTree parameters;
  private volatile String state = STATUS_IDLE;

  /**
   * Creates the receiver.
   *
   * @param registry subject registry
   * @param clock monotonic clock
   * @param statusInterval interval between unsolicited snapshots
   * @param deviceName identity such as {@code airspy:SIM-0001}
   */
  public SimulatedRadioDeviceTask(
      SubjectRegistry registry, ClockPort clock, Duration statusInterval, String deviceName) {
    super("radio", registry, SubjectRegistry.RADIO_COMMAND, SubjectRegistry.RADIO_STATUS, clock, statusInterval);
    this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
    this.parameters = ConfigTree.builder().put("sampleRate", POWER_ON_SAMPLE_RATE).build();
  }

  @Override
  protected ConfigTree snapshot() {
    return ConfigTree.builder()
        .put("status", state)
        .put("name", deviceName)
        .build()
        .merge(parameters);
  }

  @Override
  protected void onConfigure(ConfigTree delta) {
    parameters = parameters.merge(delta);
    log.debug("Receiver {} configured: {}", deviceName, parameters);
  }

  @Override
  protected void onStart() {
    if (!STATUS_STREAMING.equals(state)) {
      state = STATUS_STREAMING;
      log.info("Receiver {} streaming at {} samples/s", deviceName, parameters.scalar("sampleRate").orElse("?"));
    }
  }

  @Override
  protected void onStop() {
    state = STATUS_IDLE;
  }
}
