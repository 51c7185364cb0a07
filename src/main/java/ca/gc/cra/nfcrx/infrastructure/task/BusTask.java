package ca.gc.cra.nfcrx.infrastructure.task;

import ca.gc.cra.nfcrx.application.port.ClockPort;
import ca.gc.cra.nfcrx.application.port.ManagedTask;
import ca.gc.cra.nfcrx.domain.bus.Event;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.infrastructure.bus.Subject;
import ca.gc.cra.nfcrx.infrastructure.bus.SubjectRegistry;
import ca.gc.cra.nfcrx.infrastructure.bus.Subscription;
import ca.gc.cra.nfcrx.infrastructure.exec.TerminationSignal;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base for tasks that take commands from one subject and report status on another.
 * <p><strong>Inbox:</strong> The command subscription only enqueues, so publishers never block on the
 * task. Commands are applied one at a time on the task's worker thread; each accepted command is settled
 * exactly once, and a status snapshot follows every command.</p>
 * <p><strong>Cadence:</strong> Between commands the task calls {@link #onIdle(long)} and republishes its
 * status every {@code statusInterval}. The inbox is polled in short slices so that termination is noticed
 * promptly.</p>
 * <p><strong>Shutdown:</strong> Commands still queued when the termination signal is raised are failed.</p>
 *
 * @since 0.1.0
 */
public abstract class BusTask implements ManagedTask {
  private static final Logger log = LoggerFactory.getLogger(BusTask.class);
  private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  private final String name;
  private final Subject<Event> commands;
  private final Subject<Event> status;
  private final ClockPort clock;
  private final long statusIntervalNanos;
  private final LinkedBlockingQueue<Event> inbox = new LinkedBlockingQueue<>();

  /**
   * Creates the task.
   *
   * @param name task name
   * @param registry subject registry
   * @param commandSubject subject carrying commands for this task
   * @param statusSubject subject receiving this task's snapshots
   * @param clock monotonic clock
   * @param statusInterval interval between unsolicited status snapshots
   */
  protected BusTask(
      String name,
      SubjectRegistry registry,
      String commandSubject,
      String statusSubject,
      ClockPort clock,
      Duration statusInterval) {
    this.name = Objects.requireNonNull(name, "name");
    Objects.requireNonNull(registry, "registry");
    this.commands = registry.events(commandSubject);
    this.status = registry.events(statusSubject);
    this.clock = Objects.requireNonNull(clock, "clock");
    if (statusInterval.isZero() || statusInterval.isNegative()) {
      throw new IllegalArgumentException("statusInterval must be positive");
    }
    this.statusIntervalNanos = statusInterval.toNanos();
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final void run(TerminationSignal termination) throws Exception {
    Subscription subscription = commands.subscribe(inbox::offer);
    try {
      publishStatus();
      long nextStatus = clock.nanoTime() + statusIntervalNanos;
      while (!termination.isRaised()) {
        Event command = inbox.poll(Math.min(POLL_SLICE_NANOS, statusIntervalNanos), TimeUnit.NANOSECONDS);
        if (command != null) {
          dispatch(command);
        }
        long now = clock.nanoTime();
        onIdle(now);
        if (now - nextStatus >= 0) {
          publishStatus();
          nextStatus = now + statusIntervalNanos;
        }
      }
    } finally {
      subscription.close();
      failPending();
    }
  }

  /**
   * Applies one command and publishes the resulting status.
   *
   * @param command command taken from the inbox
   */
  final void dispatch(Event command) {
    try {
      switch (command.code()) {
        case QUERY -> log.trace("{} answering query", name);
        case CONFIGURE -> onConfigure(command.payload().orElse(ConfigTree.empty()));
        case START -> onStart();
        case STOP -> onStop();
        default -> throw new IllegalArgumentException("unsupported command " + command.code());
      }
      command.succeed();
    } catch (RuntimeException ex) {
      log.warn("{} rejected {}: {}", name, command.code(), ex.getMessage());
      command.fail(ex);
    }
    publishStatus();
  }

  /** Publishes the current snapshot on the status subject. */
  protected final void publishStatus() {
    status.publish(Event.status(snapshot()));
  }

  protected final ClockPort clock() {
    return clock;
  }

  /**
   * Returns the current status snapshot; must contain at least {@code status}.
   *
   * @return status tree
   */
  protected abstract ConfigTree snapshot();

  /**
   * Applies a configuration delta.
   *
   * @param delta entries to merge into the task's configuration
   */
  protected abstract void onConfigure(ConfigTree delta);

  protected abstract void onStart();

  protected abstract void onStop();

  /**
   * Hook invoked after every inbox poll; runs on the task worker.
   *
   * @param nowNanos current monotonic time
   */
  protected void onIdle(long nowNanos) {}

  private void failPending() {
    Event leftover;
    while ((leftover = inbox.poll()) != null) {
      leftover.fail(new IllegalStateException(name + " stopped before handling " + leftover.code()));
    }
  }
}
