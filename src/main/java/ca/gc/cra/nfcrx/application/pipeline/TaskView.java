package ca.gc.cra.nfcrx.application.pipeline;

import ca.gc.cra.nfcrx.domain.config.ConfigDiff;
import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> The control loop's picture of one managed task: last observed status, desired
 * configuration, and whether configuration is considered applied.
 * <p><strong>Thread-safety:</strong> Status snapshots arrive on the publishing task's worker thread and
 * command continuations on whichever thread settles the command, while the control loop reads on its
 * own thread. Every accessor serializes on the lock shared with the loop's wait condition.</p>
 * <p><strong>Optimistic state:</strong> A successful configure marks the task configured before the next
 * snapshot confirms it. If a snapshot received after that point still does not satisfy the desired
 * configuration, the flag is cleared so the next tick re-issues the configure.</p>
 *
 * @since 0.1.0
 */
public final class TaskView {
  static final String STATUS_KEY = "status";
  static final String STATUS_IDLE = "idle";
  static final String STATUS_WAITING = "waiting";
  static final String STATUS_ABSENT = "absent";

  private final String name;
  private final Lock lock;

  private ConfigTree observed;
  private ConfigTree desired;
  private boolean configured;
  private boolean configurePending;
  private long statusVersion;
  private long configuredAtVersion = -1;

  /**
   * Creates a view with an initial desired configuration.
   *
   * @param name task name used in logs
   * @param lock lock shared with the control loop's wait condition
   * @param desired initial desired configuration
   */
  public TaskView(String name, Lock lock, ConfigTree desired) {
    this.name = Objects.requireNonNull(name, "name");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.desired = Objects.requireNonNull(desired, "desired");
  }

  public String name() {
    return name;
  }

  /**
   * Records a status snapshot published by the task.
   *
   * @param snapshot status tree
   */
  public void observe(ConfigTree snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    lock.lock();
    try {
      observed = snapshot;
      statusVersion++;
      if (configured && statusVersion > configuredAtVersion
          && !ConfigDiff.satisfies(snapshot, desired)) {
        configured = false;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the last observed status.
   *
   * @return status tree, or empty when the task has not reported yet
   */
  public Optional<ConfigTree> observed() {
    lock.lock();
    try {
      return Optional.ofNullable(observed);
    } finally {
      lock.unlock();
    }
  }

  public ConfigTree desired() {
    lock.lock();
    try {
      return desired;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replaces the desired configuration. A change clears the configured flag so the new document is
   * pushed on the next tick.
   *
   * @param update function of the current desired configuration
   * @return the new desired configuration
   */
  public ConfigTree updateDesired(UnaryOperator<ConfigTree> update) {
    lock.lock();
    try {
      ConfigTree next = Objects.requireNonNull(update.apply(desired), "desired");
      if (!next.equals(desired)) {
        desired = next;
        configured = false;
      }
      return desired;
    } finally {
      lock.unlock();
    }
  }

  public boolean configured() {
    lock.lock();
    try {
      return configured;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sets the configured flag from a fresh diff: an empty diff means the observed state already
   * satisfies the desired configuration.
   *
   * @param satisfied whether the latest diff was empty
   */
  void reconcile(boolean satisfied) {
    lock.lock();
    try {
      if (satisfied) {
        configured = true;
        configurePending = false;
        configuredAtVersion = statusVersion;
      }
    } finally {
      lock.unlock();
    }
  }

  void configureSent() {
    lock.lock();
    try {
      configurePending = true;
    } finally {
      lock.unlock();
    }
  }

  /** Marks configuration as applied; invoked by the configure command's success continuation. */
  void configureSucceeded() {
    lock.lock();
    try {
      configured = true;
      configurePending = false;
      configuredAtVersion = statusVersion;
    } finally {
      lock.unlock();
    }
  }

  void configureFailed() {
    lock.lock();
    try {
      configurePending = false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Overrides the observed {@code status} value ahead of the next snapshot; used by the start
   * command's success continuation.
   *
   * @param status optimistic status
   */
  void assumeStatus(String status) {
    lock.lock();
    try {
      ConfigTree base = observed == null ? ConfigTree.empty() : observed;
      observed = base.with(STATUS_KEY, status);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Derives the task's convergence phase from the current state.
   *
   * @return phase
   */
  public TaskPhase phase() {
    lock.lock();
    try {
      if (!configured) {
        return configurePending ? TaskPhase.CONFIGURING : TaskPhase.UNCONVERGED;
      }
      String status = observed == null ? null : observed.string(STATUS_KEY).orElse(null);
      if (STATUS_IDLE.equals(status)) {
        return TaskPhase.CONFIGURED;
      }
      if (STATUS_WAITING.equals(status)) {
        return TaskPhase.STARTING;
      }
      return status == null || STATUS_ABSENT.equals(status) ? TaskPhase.UNCONVERGED : TaskPhase.RUNNING;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "TaskView{" + name + ", " + phase() + '}';
  }
}
