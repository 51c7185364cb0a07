package ca.gc.cra.nfcrx.infrastructure.task;

import ca.gc.cra.nfcrx.application.port.ClockPort;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import java.time.Duration;

/**
 * Radio task standing in for a host without any attached receiver.
 * Every snapshot reports {@code status=absent}; commands other than {@code QUERY} are rejected.
 *
 * @since 0.1.0
 */
public final class AbsentRadioDeviceTask extends BusTask {
  private static final ConfigTree ABSENT = ConfigTree.builder().put("status", "absent").build();

  public AbsentRadioDeviceTask(SubjectRegistry registry, ClockPort clock, Duration statusInterval) {
    super("radio", registry, SubjectRegistry.RADIO_COMMAND, SubjectRegistry.RADIO_STATUS, clock, statusInterval);
  }

  @Override
  protected ConfigTree snapshot() {
    return ABSENT;
  }

  @Override
  protected void onConfigure(ConfigTree delta) {
    throw new IllegalStateException("no receiver attached");
  }

  @Override
  protected void onStart() {
    throw new IllegalStateException("no receiver attached");
  }

  @Override
  protected void onStop() {
    // nothing running
  }
}
