package ca.gc.cra.nfcrx.infrastructure.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nfcrx.domain.bus.Event;
import ca.gc.cra.nfcrx.domain.bus.EventCode;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import ca.gc.cra.nfcrx.domain.frame.FrameType;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimulatedDecoderTaskTest {
  private final AtomicLong now = new AtomicLong(1_000_000_000L);
  private SubjectRegistry registry;
  private List<FrameRecord> frames;
  private List<ConfigTree> snapshots;
  private SimulatedDecoderTask task;

  @BeforeEach
  void setUp() {
    registry = new SubjectRegistry();
    frames = new ArrayList<>();
    snapshots = new ArrayList<>();
    registry.subject(SubjectRegistry.DECODER_FRAME, FrameRecord.class).subscribe(frames::add);
    registry.events(SubjectRegistry.DECODER_STATUS).subscribe(e -> snapshots.add(e.payload().orElseThrow()));
    task = new SimulatedDecoderTask(registry, now::get, Duration.ofMillis(100), Duration.ofMillis(250));
  }

  @Test
  void startWithoutSampleRateFails() {
    List<Throwable> failures = new ArrayList<>();

    task.dispatch(Event.command(EventCode.START, null, null, failures::add));

    assertEquals(1, failures.size());
    assertEquals("idle", snapshots.get(snapshots.size() - 1).string("status").orElseThrow());
  }

  @Test
  void emitsCarrierFramedExchangePerEnabledProtocol() {
    configure(ConfigTree.builder().put("sampleRate", 10_000_000).build()
        .withPath("nfca.enabled", true)
        .withPath("nfcb.enabled", false)
        .withPath("nfcf.enabled", false)
        .withPath("nfcv.enabled", true));
    task.dispatch(Event.command(EventCode.START));
    assertEquals("decoding", snapshots.get(snapshots.size() - 1).string("status").orElseThrow());

    task.onIdle(now.get());

    assertEquals(6, frames.size());
    assertEquals(FrameType.CARRIER_ON, frames.get(0).frameType());
    assertEquals(TechType.NFC_A, frames.get(1).techType());
    assertEquals(FrameType.POLL, frames.get(1).frameType());
    assertEquals(FrameType.LISTEN, frames.get(2).frameType());
    assertEquals(TechType.NFC_V, frames.get(3).techType());
    assertEquals(FrameType.CARRIER_OFF, frames.get(5).frameType());
    for (int i = 1; i < frames.size(); i++) {
      assertTrue(frames.get(i).timeStart() > frames.get(i - 1).timeStart(), "timeStart must increase");
    }
  }

  @Test
  void roundsFollowTheFrameInterval() {
    configure(ConfigTree.builder().put("sampleRate", 3_200_000).build().withPath("nfcf.enabled", true));
    task.dispatch(Event.command(EventCode.START));

    task.onIdle(now.get());
    task.onIdle(now.addAndGet(100_000_000L));
    assertEquals(4, frames.size());

    task.onIdle(now.addAndGet(200_000_000L));
    assertEquals(8, frames.size());
    assertEquals(212_000, frames.get(5).bitRate());
    assertTrue(frames.get(4).timeStart() >= 0.3);
  }

  @Test
  void noProtocolsEnabledEmitsNothing() {
    configure(ConfigTree.builder().put("sampleRate", 10_000_000).build());
    task.dispatch(Event.command(EventCode.START));

    task.onIdle(now.get());

    assertTrue(frames.isEmpty());
  }

  private void configure(ConfigTree delta) {
    task.dispatch(Event.command(EventCode.CONFIGURE, delta, null, null));
  }
}
