package ca.gc.cra.nfcrx.application.pipeline;

import ca.gc.cra.nfcrx.application.port.ClockPort;
import ca.gc.cra.nfcrx.application.port.FrameSink;
import ca.gc.cra.nfcrx.application.port.ManagedTask;
import ca.gc.cra.nfcrx.application.port.MetricsPort;
import ca.gc.cra.nfcrx.domain.bus.Event;
import ca.gc.cra.nfcrx.domain.bus.EventCode;
import ca.gc.cra.nfcrx.domain.config.ConfigDiff;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import ca.gc.cra.nfcrx.infrastructure.buffer.DrainingQueue;
import ca.gc.cra.nfcrx.infrastructure.bus.Subject;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import ca.gc.cra.nfcrx.infrastructure.bus.Subscription;
import ca.gc.cra.nfcrx.infrastructure.exec.TaskExecutor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reconciliation loop that drives the radio capture task and the decoder task to
 * their desired configuration, starts them, and drains decoded frames to a {@link FrameSink}.
 * <p><strong>Why:</strong> Both tasks run independently and report state asynchronously; the loop converges
 * them by recomputing a structural diff every tick instead of tracking individual command outcomes.</p>
 * <p><strong>Tick:</strong> evaluate the capture task, evaluate the decoder task, publish the resulting
 * commands, drain the frame queue, check the time budget. Evaluation runs under the lock shared with the
 * {@link TaskView}s; commands are published after the lock is released so that a task settling a command
 * synchronously can never contend with the loop.</p>
 * <p><strong>Shutdown:</strong> {@link #requestShutdown(ShutdownReason)} sets a flag, raises the executor's
 * termination signal and wakes the loop without blocking. The loop thread then joins the task workers
 * itself before {@link #run()} returns. Frames queued after shutdown begins may not reach the sink.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} may be called once; {@link #requestShutdown(ShutdownReason)}
 * and {@link #awaitFinished(Duration)} from any thread.</p>
 *
 * @since 0.1.0
 */
public final class CaptureControlLoop {
  private static final Logger log = LoggerFactory.getLogger(CaptureControlLoop.class);
  private static final String SAMPLE_RATE = "sampleRate";
  private static final String NAME = "name";

  private final Subject<Event> radioStatus;
  private final Subject<Event> radioCommand;
  private final Subject<Event> decoderStatus;
  private final Subject<Event> decoderCommand;
  private final Subject<FrameRecord> decoderFrames;
  private final TaskExecutor executor;
  private final List<ManagedTask> tasks;
  private final DrainingQueue<FrameRecord> frames;
  private final FrameSink sink;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ControlLoopSettings settings;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition wake = lock.newCondition();
  private final TaskView radio;
  private final TaskView decoder;
  private final AtomicReference<ShutdownReason> reason = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final CountDownLatch finished = new CountDownLatch(1);
  private final List<Subscription> subscriptions = new ArrayList<>();
  private volatile boolean terminate;
  private long startedAtNanos;

  /**
   * Creates the loop; nothing is subscribed or submitted until {@link #run()}.
   *
   * @param registry subject registry shared with the tasks
   * @param executor executor the tasks are submitted to
   * @param tasks capture and decoder tasks
   * @param frames queue fed by the frame subscription
   * @param sink destination for drained frames and operator notices
   * @param clock monotonic clock used for the time budget
   * @param metrics metrics sink
   * @param settings tick interval, time budget, catalog and decoder profile
   */
  public CaptureControlLoop(
      SubjectRegistry registry,
      TaskExecutor executor,
      List<ManagedTask> tasks,
      DrainingQueue<FrameRecord> frames,
      FrameSink sink,
      ClockPort clock,
      MetricsPort metrics,
      ControlLoopSettings settings) {
    Objects.requireNonNull(registry, "registry");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.tasks = List.copyOf(tasks);
    this.frames = Objects.requireNonNull(frames, "frames");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.radioStatus = registry.events(SubjectRegistry.RADIO_STATUS);
    this.radioCommand = registry.events(SubjectRegistry.RADIO_COMMAND);
    this.decoderStatus = registry.events(SubjectRegistry.DECODER_STATUS);
    this.decoderCommand = registry.events(SubjectRegistry.DECODER_COMMAND);
    this.decoderFrames = registry.subject(SubjectRegistry.DECODER_FRAME, FrameRecord.class);
    this.radio = new TaskView("radio", lock, ConfigTree.empty());
    this.decoder = new TaskView("decoder", lock, settings.decoderDesired());
  }

  /**
   * Runs the loop on the calling thread until a shutdown reason is recorded, then joins the task workers.
   *
   * @return the first recorded shutdown reason
   * @throws IllegalStateException when called more than once
   */
  public ShutdownReason run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("control loop already started");
    }
    MDC.put("pipeline", "rx");
    try {
      attach();
      startedAtNanos = clock.nanoTime();
      if (submitTasks()) {
        radioCommand.publish(Event.command(EventCode.QUERY));
        decoderCommand.publish(Event.command(EventCode.QUERY));
        log.info("Control loop running; tick={}ms, timeLimit={}",
            settings.tickInterval().toMillis(),
            settings.timeBudget().map(d -> d.toSeconds() + "s").orElse("none"));
        while (tick()) {
          // keep ticking
        }
      }
      if (reason.get() == ShutdownReason.SIGNAL) {
        sink.notice(ShutdownReason.SIGNAL.notice());
      }
      return reason.get();
    } finally {
      executor.shutdown();
      detach();
      int undrained = frames.size();
      if (undrained > 0) {
        log.debug("{} frame(s) left undrained at shutdown", undrained);
      }
      log.info("Control loop stopped: {}", reason.get());
      MDC.remove("pipeline");
      finished.countDown();
    }
  }

  /**
   * Records {@code why} as the shutdown reason unless one is already recorded, raises the executor's
   * termination signal and wakes the loop. Never blocks, so it is safe from a shutdown hook.
   *
   * @param why reason to record
   */
  public void requestShutdown(ShutdownReason why) {
    Objects.requireNonNull(why, "why");
    if (reason.compareAndSet(null, why)) {
      log.debug("Shutdown requested: {}", why);
    }
    terminate = true;
    executor.requestShutdown();
    if (lock.tryLock()) {
      try {
        wake.signalAll();
      } finally {
        lock.unlock();
      }
    }
  }

  /**
   * Waits until {@link #run()} has joined the workers and returned.
   *
   * @param timeout maximum wait
   * @return {@code true} when the loop finished in time
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean awaitFinished(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isShutdownRequested() {
    return terminate;
  }

  public Optional<ShutdownReason> shutdownReason() {
    return Optional.ofNullable(reason.get());
  }

  public TaskView radioView() {
    return radio;
  }

  public TaskView decoderView() {
    return decoder;
  }

  void attach() {
    subscriptions.add(radioStatus.subscribe(event -> radio.observe(snapshotOf(event))));
    subscriptions.add(decoderStatus.subscribe(event -> decoder.observe(snapshotOf(event))));
    subscriptions.add(decoderFrames.subscribe(frames::add));
  }

  /**
   * Runs one iteration: wait, evaluate both tasks, publish commands, drain frames, check the budget.
   * An empty status snapshot counts as no status yet.
   *
   * @return {@code false} once the loop should stop
   */
  boolean tick() {
    List<Event> radioOut = new ArrayList<>(2);
    List<Event> decoderOut = new ArrayList<>(2);
    FatalTaskException fatal = null;
    lock.lock();
    try {
      if (!terminate) {
        wake.awaitNanos(settings.tickInterval().toNanos());
      }
      if (terminate) {
        return false;
      }
      try {
        evaluateRadio(radioOut);
        evaluateDecoder(decoderOut);
      } catch (FatalTaskException ex) {
        fatal = ex;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Control loop interrupted; shutting down");
      requestShutdown(ShutdownReason.SIGNAL);
      return false;
    } finally {
      lock.unlock();
    }
    metrics.increment("loop.tick");
    if (fatal != null) {
      log.error("Fatal task condition: {}", fatal.getMessage());
      metrics.increment("loop.fatal");
      sink.notice(fatal.reason().notice());
      requestShutdown(fatal.reason());
    }
    radioOut.forEach(radioCommand::publish);
    decoderOut.forEach(decoderCommand::publish);
    drain();
    checkBudget();
    return !terminate;
  }

  private void evaluateRadio(List<Event> out) throws FatalTaskException {
    Optional<ConfigTree> seen = radio.observed();
    if (seen.isEmpty() || seen.get().isEmpty()) {
      return;
    }
    ConfigTree observed = seen.get();
    String status = observed.string(TaskView.STATUS_KEY).orElse(null);
    if (status == null || TaskView.STATUS_ABSENT.equals(status)) {
      throw new FatalTaskException(ShutdownReason.DEVICE_ABSENT, "radio reports no device");
    }
    String identity = observed.string(NAME).orElse(null);
    if (identity == null || identity.isBlank()) {
      throw new FatalTaskException(ShutdownReason.DEVICE_ABSENT, "radio reports no device identity");
    }
    observed.get(SAMPLE_RATE).ifPresent(rate -> decoder.updateDesired(d -> d.with(SAMPLE_RATE, rate)));
    ConfigTree desired = settings.catalog().lookup(identity)
        .orElseThrow(() -> new FatalTaskException(ShutdownReason.UNKNOWN_DEVICE,
            "no catalog entry for receiver " + identity));
    radio.updateDesired(ignored -> desired);
    reconcile(radio, observed, desired, status, out);
  }

  private void evaluateDecoder(List<Event> out) throws FatalTaskException {
    Optional<ConfigTree> seen = decoder.observed();
    if (seen.isEmpty() || seen.get().isEmpty()) {
      return;
    }
    ConfigTree observed = seen.get();
    String status = observed.string(TaskView.STATUS_KEY).orElse(null);
    if (status == null || TaskView.STATUS_ABSENT.equals(status)) {
      throw new FatalTaskException(ShutdownReason.DECODER_UNAVAILABLE, "decoder reports no status");
    }
    ConfigTree desired = decoder.desired();
    if (!desired.containsKey(SAMPLE_RATE)) {
      return;
    }
    reconcile(decoder, observed, desired, status, out);
  }

  private void reconcile(TaskView view, ConfigTree observed, ConfigTree desired, String status, List<Event> out) {
    ConfigTree delta = ConfigDiff.diff(observed, desired);
    if (delta.isEmpty()) {
      view.reconcile(true);
    } else if (!view.configured()) {
      view.configureSent();
      log.debug("Configuring {} with {}", view.name(), delta);
      metrics.increment("loop.command.configure");
      out.add(Event.command(EventCode.CONFIGURE, delta,
          view::configureSucceeded,
          failure -> {
            log.warn("Configure of {} failed: {}", view.name(), failure.toString());
            view.configureFailed();
          }));
    }
    if (view.configured() && TaskView.STATUS_IDLE.equals(status)) {
      log.debug("Starting {}", view.name());
      metrics.increment("loop.command.start");
      out.add(Event.command(EventCode.START, null,
          () -> view.assumeStatus(TaskView.STATUS_WAITING),
          failure -> log.warn("Start of {} failed: {}", view.name(), failure.toString())));
    }
  }

  private void drain() {
    int drained = frames.drain(sink::accept);
    if (drained > 0) {
      sink.flush();
      metrics.increment("loop.frames.drained");
      metrics.observe("loop.frames.batch", drained);
      log.trace("Drained {} frame(s)", drained);
    }
  }

  private void checkBudget() {
    Optional<Duration> budget = settings.timeBudget();
    if (budget.isPresent() && !terminate
        && clock.nanoTime() - startedAtNanos >= budget.get().toNanos()) {
      log.info("Time limit of {}s reached", budget.get().toSeconds());
      sink.notice(ShutdownReason.TIME_LIMIT.notice());
      requestShutdown(ShutdownReason.TIME_LIMIT);
    }
  }

  private boolean submitTasks() {
    for (ManagedTask task : tasks) {
      if (terminate) {
        return false;
      }
      try {
        executor.submit(task);
      } catch (IllegalStateException ex) {
        if (terminate) {
          return false;
        }
        throw ex;
      }
    }
    return !terminate;
  }

  private void detach() {
    for (Subscription subscription : subscriptions) {
      subscription.close();
    }
    subscriptions.clear();
  }

  private static ConfigTree snapshotOf(Event event) {
    return event.payload().orElse(ConfigTree.empty());
  }
}
