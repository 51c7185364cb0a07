package ca.gc.cra.nfcrx.infrastructure.task;

import ca.gc.cra.nfcrx.application.port.ClockPort;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import ca.gc.cra.nfcrx.domain.frame.FrameType;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import ca.gc.cra.nfcrx.infrastructure.bus.Subject;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loopback decoder emitting one synthetic poll/listen exchange per enabled
 * technology every {@code frameInterval} while started.
 * <p><strong>State:</strong> {@code idle} until {@code START}, then {@code decoding}. Starting requires a
 * {@code sampleRate} to have been configured.</p>
 * <p><strong>Frames:</strong> Each round is framed by carrier on/off records; {@code timeStart} is measured
 * from the first start and increases monotonically.</p>
 *
 * @since 0.1.0
 */
public final class SimulatedDecoderTask extends BusTask {
  private static final Logger log = LoggerFactory.getLogger(SimulatedDecoderTask.class);
  static final String STATUS_IDLE = "idle";
  static final String STATUS_DECODING = "decoding";
  private static final double STEP_SECONDS = 0.0005;

  private final Subject<FrameRecord> frames;
  private final long frameIntervalNanos;
  private volatile ConfigTree settings = ConfigTree.empty();
  private volatile String state = STATUS_IDLE;
  private long originNanos = -1;
  private long nextRoundNanos;
  private long rounds;

  /**
   * Creates the decoder.
   *
   * @param registry subject registry
   * @param clock monotonic clock
   * @param statusInterval interval between unsolicited snapshots
   * @param frameInterval interval between synthetic exchanges
   */
  public SimulatedDecoderTask(
      SubjectRegistry registry, ClockPort clock, Duration statusInterval, Duration frameInterval) {
    super("decoder", registry, SubjectRegistry.DECODER_COMMAND, SubjectRegistry.DECODER_STATUS, clock, statusInterval);
    this.frames = registry.subject(SubjectRegistry.DECODER_FRAME, FrameRecord.class);
    Objects.requireNonNull(frameInterval, "frameInterval");
    if (frameInterval.isZero() || frameInterval.isNegative()) {
      throw new IllegalArgumentException("frameInterval must be positive");
    }
    this.frameIntervalNanos = frameInterval.toNanos();
  }

  @Override
  protected ConfigTree snapshot() {
    return ConfigTree.builder().put("status", state).build().merge(settings);
  }

  @Override
  protected void onConfigure(ConfigTree delta) {
    settings = settings.merge(delta);
    log.debug("Decoder configured: {}", settings);
  }

  @Override
  protected void onStart() {
    if (!settings.containsKey("sampleRate")) {
      throw new IllegalStateException("sampleRate not configured");
    }
    if (STATUS_DECODING.equals(state)) {
      return;
    }
    long now = clock().nanoTime();
    if (originNanos < 0) {
      originNanos = now;
    }
    nextRoundNanos = now;
    state = STATUS_DECODING;
    log.info("Decoder started for {}", enabledProtocols());
  }

  @Override
  protected void onStop() {
    state = STATUS_IDLE;
  }

  @Override
  protected void onIdle(long nowNanos) {
    if (!STATUS_DECODING.equals(state) || nowNanos - nextRoundNanos < 0) {
      return;
    }
    nextRoundNanos = nowNanos + frameIntervalNanos;
    emitRound((nowNanos - originNanos) / 1e9);
  }

  /**
   * Publishes one carrier-framed exchange per enabled technology.
   *
   * @param start seconds since the first start
   */
  void emitRound(double start) {
    List<TechType> enabled = enabledProtocols();
    if (enabled.isEmpty()) {
      return;
    }
    double t = start;
    frames.publish(FrameRecord.carrier(t, FrameType.CARRIER_ON));
    for (TechType tech : enabled) {
      Exchange exchange = Exchange.of(tech);
      t += STEP_SECONDS;
      frames.publish(new FrameRecord(t, FrameType.POLL, tech, exchange.bitRate, exchange.poll));
      t += STEP_SECONDS;
      frames.publish(new FrameRecord(t, FrameType.LISTEN, tech, exchange.bitRate, exchange.listen));
    }
    t += STEP_SECONDS;
    frames.publish(FrameRecord.carrier(t, FrameType.CARRIER_OFF));
    rounds++;
    log.trace("Emitted round {} with {} exchange(s)", rounds, enabled.size());
  }

  List<TechType> enabledProtocols() {
    ConfigTree current = settings;
    List<TechType> enabled = new ArrayList<>(4);
    for (TechType tech : TechType.values()) {
      if (tech.protocolKey() == null) {
        continue;
      }
      boolean on = current.tree(tech.protocolKey())
          .flatMap(t -> t.scalar("enabled"))
          .map(Boolean.TRUE::equals)
          .orElse(false);
      if (on) {
        enabled.add(tech);
      }
    }
    return enabled;
  }

  private enum Exchange {
    A(106_000, new byte[] {0x26}, new byte[] {0x44, 0x00}),
    B(106_000, new byte[] {0x05, 0x00, 0x00, 0x71, (byte) 0xFF},
        new byte[] {0x50, 0x12, 0x34, 0x56, 0x78, 0x00, 0x00, 0x00, 0x00, 0x00, 0x71, 0x71, (byte) 0x9A, 0x5C}),
    F(212_000, new byte[] {0x06, 0x00, (byte) 0xFF, (byte) 0xFF, 0x01, 0x00},
        new byte[] {0x12, 0x01, 0x01, 0x2E, 0x3D, 0x4C, 0x5B, 0x6A, 0x79, (byte) 0x88,
            0x00, (byte) 0xF1, 0x00, 0x00, 0x00, 0x01, 0x43, 0x00}),
    V(26_484, new byte[] {0x26, 0x01, 0x00, (byte) 0xF6, 0x0A},
        new byte[] {0x00, 0x00, 0x11, 0x22, 0x33, 0x44, 0x55, 0x66, 0x07, (byte) 0xE0, 0x4C, 0x0B});

    private final int bitRate;
    private final byte[] poll;
    private final byte[] listen;

    Exchange(int bitRate, byte[] poll, byte[] listen) {
      this.bitRate = bitRate;
      this.poll = poll;
      this.listen = listen;
    }

    static Exchange of(TechType tech) {
      return switch (tech) {
        case NFC_A -> A;
        case NFC_B -> B;
        case NFC_F -> F;
        case NFC_V -> V;
        case NONE -> throw new IllegalArgumentException("no exchange for " + tech);
      };
    }
  }
}
