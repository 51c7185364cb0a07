package ca.gc.cra.nfcrx.infrastructure.bus;

import ca.gc.cra.nfcrx.application.port.MetricsPort;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Named, typed broadcast channel.
 * <p><strong>Delivery:</strong> {@link #publish(Object)} invokes every registered callback synchronously on
 * the publisher's thread, in subscription order, then returns. There is no buffering or deferral, so
 * callbacks must be cheap (update state or enqueue).</p>
 * <p><strong>Fault isolation:</strong> A callback that throws an exception or error is logged and counted;
 * remaining subscribers still receive the value and the publisher never sees the failure. Only
 * {@link VirtualMachineError}s propagate.</p>
 * <p><strong>Thread-safety:</strong> Subscribing, closing subscriptions and publishing may happen from any
 * thread. A subscription closed before a publish starts is not invoked by it.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 * @see SubjectRegistry
 */
public final class Subject<T> {
  private static final Logger log = LoggerFactory.getLogger(Subject.class);

  private final String name;
  private final Class<T> type;
  private final MetricsPort metrics;
  private final List<Registration<T>> registrations = new CopyOnWriteArrayList<>();

  Subject(String name, Class<T> type, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String name() {
    return name;
  }

  public Class<T> type() {
    return type;
  }

  /**
   * Registers a callback.
   *
   * @param callback invoked for every value published after this call
   * @return handle that removes the registration when closed
   */
  public Subscription subscribe(Consumer<? super T> callback) {
    Registration<T> registration = new Registration<>(this, Objects.requireNonNull(callback, "callback"));
    registrations.add(registration);
    log.trace("Subscribed to {} ({} subscribers)", name, registrations.size());
    return registration;
  }

  /**
   * Delivers {@code value} to every live subscriber.
   *
   * @param value value to broadcast; must not be {@code null}
   * @return number of subscribers that accepted the value without failing
   */
  public int publish(T value) {
    T checked = type.cast(Objects.requireNonNull(value, "value"));
    int delivered = 0;
    for (Registration<T> registration : registrations) {
      if (!registration.isActive()) {
        continue;
      }
      try {
        registration.callback.accept(checked);
        delivered++;
      } catch (VirtualMachineError fatal) {
        throw fatal;
      } catch (RuntimeException | Error ex) {
        metrics.increment("bus.subscriber.fault");
        log.warn("Subscriber on {} failed; continuing delivery", name, ex);
      }
    }
    return delivered;
  }

  public int subscriberCount() {
    return registrations.size();
  }

  private void remove(Registration<T> registration) {
    if (registrations.remove(registration)) {
      log.trace("Unsubscribed from {} ({} subscribers)", name, registrations.size());
    }
  }

  @Override
  public String toString() {
    return "Subject{" + name + ", " + type.getSimpleName() + '}';
  }

  private static final class Registration<T> implements Subscription {
    private final Subject<T> owner;
    private final Consumer<? super T> callback;
    private volatile boolean active = true;

    private Registration(Subject<T> owner, Consumer<? super T> callback) {
      this.owner = owner;
      this.callback = callback;
    }

    @Override
    public boolean isActive() {
      return active;
    }

    @Override
    public void close() {
      if (active) {
        active = false;
        owner.remove(this);
      }
    }
  }
}
