package ca.gc.cra.nfcrx.config;

import ca.gc.cra.nfcrx.application.pipeline.CaptureControlLoop;
import ca.gc.cra.nfcrx.application.pipeline.ControlLoopSettings;
import ca.gc.cra.nfcrx.application.port.ClockPort;
import ca.gc.cra.nfcrx.application.port.FrameSink;
import ca.gc.cra.nfcrx.application.port.ManagedTask;
import ca.gc.cra.nfcrx.application.port.MetricsPort;
import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import ca.gc.cra.nfcrx.infrastructure.buffer.DrainingQueue;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import ca.gc.cra.nfcrx.infrastructure.exec.TaskExecutor;
import ca.gc.cra.nfcrx.infrastructure.task.AbsentRadioDeviceTask;
import ca.gc.cra.nfcrx.infrastructure.task.SimulatedDecoderTask;
import ca.gc.cra.nfcrx.infrastructure.task.SimulatedRadioDeviceTask;
import ca.gc.cra.nfcrx.infrastructure.time.SystemClockAdapter;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Composition root wiring the receiver runtime: subject registry, executor, tasks,
 * frame queue and control loop.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI only deals with arguments and exit codes.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup; {@link #controlLoop(FrameSink)}
 * builds a fresh graph on every call.</p>
 *
 * @since 0.1.0
 * @see CaptureControlLoop
 */
public final class CompositionRoot {
  private final RxConfig config;
  private final Duration timeLimit;
  private final Set<TechType> protocols;
  private final boolean debugEnabled;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the root with the system clock.
   *
   * @param config runtime configuration
   * @param timeLimit capture budget, or {@code null} for none
   * @param protocols enabled decoder technologies
   * @param debugEnabled whether the decoder should write its debug artifact
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(
      RxConfig config, Duration timeLimit, Set<TechType> protocols, boolean debugEnabled, MetricsPort metrics) {
    this(config, timeLimit, protocols, debugEnabled, metrics, new SystemClockAdapter());
  }

  CompositionRoot(
      RxConfig config,
      Duration timeLimit,
      Set<TechType> protocols,
      boolean debugEnabled,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.timeLimit = timeLimit;
    this.protocols = Set.copyOf(protocols);
    this.debugEnabled = debugEnabled;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /**
   * Builds the settings handed to the control loop.
   *
   * @return loop settings with the decoder profile derived from the enabled protocols
   */
  public ControlLoopSettings loopSettings() {
    return new ControlLoopSettings(
        config.tickInterval(),
        timeLimit,
        config.catalog(),
        DecoderProfile.desired(protocols, debugEnabled));
  }

  /**
   * Wires a complete receiver graph around {@code sink}.
   *
   * @param sink destination for decoded frames and notices
   * @return control loop ready to {@link CaptureControlLoop#run()}
   */
  public CaptureControlLoop controlLoop(FrameSink sink) {
    SubjectRegistry registry = new SubjectRegistry(metrics);
    TaskExecutor executor = new TaskExecutor(
        config.executorCoreSize(), config.executorMaxSize(), config.joinWarnInterval());
    List<ManagedTask> tasks = List.of(radioTask(registry), decoderTask(registry));
    return new CaptureControlLoop(
        registry, executor, tasks, new DrainingQueue<FrameRecord>(), sink, clock, metrics, loopSettings());
  }

  ManagedTask radioTask(SubjectRegistry registry) {
    return switch (config.receiverDriver()) {
      case SIMULATED -> new SimulatedRadioDeviceTask(
          registry, clock, config.tickInterval(), config.receiverName());
      case ABSENT -> new AbsentRadioDeviceTask(registry, clock, config.tickInterval());
    };
  }

  ManagedTask decoderTask(SubjectRegistry registry) {
    return new SimulatedDecoderTask(registry, clock, config.tickInterval(), config.frameInterval());
  }
}
