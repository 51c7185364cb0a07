package ca.gc.cra.nfcrx.domain.bus;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Immutable envelope published on the task bus.
 * <p><strong>Why:</strong> Carries a command (or status) code, an optional configuration payload, and a
 * one-shot completion that the receiving task settles when it has finished acting on the event.</p>
 * <p><strong>Completion:</strong> Settled at most once, success xor failure; the first call to
 * {@link #succeed()} or {@link #fail(Throwable)} wins and later calls return {@code false}. Continuations
 * registered by the sender run on the thread that settles the event, never on the bus itself.</p>
 * <p><strong>Thread-safety:</strong> Safe to settle from any thread.</p>
 *
 * @since 0.1.0
 */
public final class Event {
  private final EventCode code;
  private final ConfigTree payload;
  private final CompletableFuture<Void> completion;

  private Event(EventCode code, ConfigTree payload, CompletableFuture<Void> completion) {
    this.code = Objects.requireNonNull(code, "code");
    this.payload = payload;
    this.completion = completion;
  }

  /**
   * Creates a command without payload or continuations.
   *
   * @param code command code
   * @return new event
   */
  public static Event command(EventCode code) {
    return new Event(code, null, new CompletableFuture<>());
  }

  /**
   * Creates a command whose continuations fire once the receiver settles it.
   *
   * @param code command code
   * @param payload optional payload, may be {@code null}
   * @param onSuccess invoked once when the receiver reports success; may be {@code null}
   * @param onFailure invoked once with the cause when the receiver reports failure; may be {@code null}
   * @return new event
   */
  public static Event command(
      EventCode code, ConfigTree payload, Runnable onSuccess, Consumer<Throwable> onFailure) {
    CompletableFuture<Void> completion = new CompletableFuture<>();
    completion.whenComplete((ignored, failure) -> {
      if (failure == null) {
        if (onSuccess != null) {
          onSuccess.run();
        }
      } else if (onFailure != null) {
        onFailure.accept(failure);
      }
    });
    return new Event(code, payload, completion);
  }

  /**
   * Creates a one-way status snapshot.
   *
   * @param snapshot status tree
   * @return status event, already settled
   */
  public static Event status(ConfigTree snapshot) {
    return new Event(EventCode.STATUS, Objects.requireNonNull(snapshot, "snapshot"),
        CompletableFuture.completedFuture(null));
  }

  public EventCode code() {
    return code;
  }

  /**
   * Returns the payload when one was attached.
   *
   * @return payload tree
   */
  public Optional<ConfigTree> payload() {
    return Optional.ofNullable(payload);
  }

  /**
   * Reports successful handling of this event.
   *
   * @return {@code true} when this call settled the event
   */
  public boolean succeed() {
    return completion.complete(null);
  }

  /**
   * Reports failed handling of this event.
   *
   * @param cause failure cause
   * @return {@code true} when this call settled the event
   */
  public boolean fail(Throwable cause) {
    return completion.completeExceptionally(Objects.requireNonNull(cause, "cause"));
  }

  public boolean isSettled() {
    return completion.isDone();
  }

  /**
   * Exposes the completion for callers that prefer composing over continuations.
   *
   * @return completion stage settled by the receiving task
   */
  public CompletionStage<Void> completion() {
    return completion.minimalCompletionStage();
  }

  @Override
  public String toString() {
    return payload == null ? code.name() : code.name() + payload;
  }
}
