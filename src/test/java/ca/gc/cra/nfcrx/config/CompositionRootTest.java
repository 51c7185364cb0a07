package ca.gc.cra.nfcrx.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nfcrx.application.pipeline.CaptureControlLoop;
import ca.gc.cra.nfcrx.application.pipeline.ControlLoopSettings;
import ca.gc.cra.nfcrx.application.pipeline.ShutdownReason;
import ca.gc.cra.nfcrx.application.pipeline.TaskPhase;
import ca.gc.cra.nfcrx.application.port.FrameSink;
import ca.gc.cra.nfcrx.application.port.MetricsPort;
import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import ca.gc.cra.nfcrx.domain.frame.FrameType;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import ca.gc.cra.nfcrx.infrastructure.task.AbsentRadioDeviceTask;
import ca.gc.cra.nfcrx.infrastructure.task.SimulatedRadioDeviceTask;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void loopSettingsCarryConfigAndDecoderProfile() {
    RxConfig config = RxConfig.fromMap(Map.of("tickMillis", "50"));
    CompositionRoot root = new CompositionRoot(
        config, Duration.ofSeconds(7), EnumSet.of(TechType.NFC_F), true, MetricsPort.NO_OP);

    ControlLoopSettings settings = root.loopSettings();

    assertEquals(Duration.ofMillis(50), settings.tickInterval());
    assertEquals(Duration.ofSeconds(7), settings.timeBudget().orElseThrow());
    assertEquals(DecoderProfile.desired(Set.of(TechType.NFC_F), true), settings.decoderDesired());
  }

  @Test
  void driverSelectsRadioTask() {
    SubjectRegistry registry = new SubjectRegistry();
    CompositionRoot simulated = root(Map.of());
    CompositionRoot absent = root(Map.of("receiver.driver", "absent"));

    assertInstanceOf(SimulatedRadioDeviceTask.class, simulated.radioTask(registry));
    assertInstanceOf(AbsentRadioDeviceTask.class, absent.radioTask(registry));
  }

  @Test
  void simulatedReceiverConvergesAndStreamsUntilTimeLimit() {
    CompositionRoot root = new CompositionRoot(
        RxConfig.fromMap(Map.of("tickMillis", "20", "decoder.frameIntervalMillis", "20")),
        Duration.ofSeconds(1),
        EnumSet.of(TechType.NFC_A, TechType.NFC_V),
        false,
        MetricsPort.NO_OP);
    RecordingSink sink = new RecordingSink();
    CaptureControlLoop loop = root.controlLoop(sink);

    ShutdownReason reason = loop.run();

    assertEquals(ShutdownReason.TIME_LIMIT, reason);
    assertEquals(TaskPhase.RUNNING, loop.radioView().phase());
    assertEquals(TaskPhase.RUNNING, loop.decoderView().phase());
    assertFalse(sink.frames.isEmpty());
    assertEquals(FrameType.CARRIER_ON, sink.frames.get(0).frameType());
    assertTrue(sink.frames.stream().noneMatch(f -> f.techType() == TechType.NFC_B || f.techType() == TechType.NFC_F));
    assertEquals(List.of("Finish capture, time limit reached!"), sink.notices);
    for (int i = 1; i < sink.frames.size(); i++) {
      assertTrue(sink.frames.get(i).timeStart() > sink.frames.get(i - 1).timeStart());
    }
  }

  @Test
  void absentReceiverStopsWithFatalReason() {
    RecordingSink sink = new RecordingSink();
    CaptureControlLoop loop = root(Map.of("receiver.driver", "absent", "tickMillis", "20")).controlLoop(sink);

    ShutdownReason reason = loop.run();

    assertEquals(ShutdownReason.DEVICE_ABSENT, reason);
    assertTrue(reason.fatal());
    assertEquals(List.of("Finish capture, invalid receiver!"), sink.notices);
    assertTrue(sink.frames.isEmpty());
  }

  @Test
  void unknownReceiverTypeStopsWithFatalReason() {
    RecordingSink sink = new RecordingSink();
    CaptureControlLoop loop =
        root(Map.of("receiver.name", "hackrf:0", "tickMillis", "20")).controlLoop(sink);

    assertEquals(ShutdownReason.UNKNOWN_DEVICE, loop.run());
    assertEquals(List.of("Finish capture, invalid receiver!"), sink.notices);
  }

  private static CompositionRoot root(Map<String, String> overrides) {
    return new CompositionRoot(RxConfig.fromMap(overrides), Duration.ofSeconds(5),
        DecoderProfile.allProtocols(), false, MetricsPort.NO_OP);
  }

  private static final class RecordingSink implements FrameSink {
    private final List<FrameRecord> frames = new ArrayList<>();
    private final List<String> notices = new ArrayList<>();

    @Override
    public void accept(FrameRecord frame) {
      frames.add(frame);
    }

    @Override
    public void notice(String message) {
      notices.add(message);
    }

    @Override
    public void flush() {}
  }
}
