package ca.gc.cra.nfcrx.infrastructure.bus;

import ca.gc.cra.nfcrx.application.port.MetricsPort;
import ca.gc.cra.nfcrx.domain.bus.Event;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Process-wide directory of {@link Subject}s addressed by name.
 * <p><strong>Why:</strong> Independently constructed tasks rendezvous on a channel by name without sharing a
 * compile-time reference. One registry is created at startup and handed to every component that
 * publishes or subscribes.</p>
 * <p><strong>Thread-safety:</strong> Lookups are atomic; concurrent first lookups of a name yield the same
 * subject.</p>
 *
 * @since 0.1.0
 */
public final class SubjectRegistry {
  /** Status snapshots from the radio capture task. */
  public static final String RADIO_STATUS = "radio.status";
  /** Commands addressed to the radio capture task. */
  public static final String RADIO_COMMAND = "radio.command";
  /** Status snapshots from the decoder task. */
  public static final String DECODER_STATUS = "decoder.status";
  /** Commands addressed to the decoder task. */
  public static final String DECODER_COMMAND = "decoder.command";
  /** Frames emitted by the decoder task. */
  public static final String DECODER_FRAME = "decoder.frame";

  private final ConcurrentMap<String, Subject<?>> subjects = new ConcurrentHashMap<>();
  private final MetricsPort metrics;

  public SubjectRegistry() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a registry whose subjects report subscriber faults to {@code metrics}.
   *
   * @param metrics metrics sink shared by every subject
   */
  public SubjectRegistry(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the subject registered under {@code name}, creating it on first use.
   *
   * @param name channel name
   * @param type element type; repeated lookups must use the same type
   * @param <T> element type
   * @return singleton subject for the name
   * @throws IllegalArgumentException when the name is already bound to a different element type
   */
  public <T> Subject<T> subject(String name, Class<T> type) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Subject<?> subject = subjects.computeIfAbsent(name, key -> new Subject<>(key, type, metrics));
    if (!subject.type().equals(type)) {
      throw new IllegalArgumentException("subject " + name + " carries "
          + subject.type().getName() + ", not " + type.getName());
    }
    return narrow(subject);
  }

  /**
   * Shorthand for an {@link Event} channel.
   *
   * @param name channel name
   * @return singleton event subject
   */
  public Subject<Event> events(String name) {
    return subject(name, Event.class);
  }

  public int size() {
    return subjects.size();
  }

  // Callers check the element type against Subject#type() first.
  @SuppressWarnings("unchecked")
  private static <T> Subject<T> narrow(Subject<?> subject) {
    return (Subject<T>) subject;
  }
}
