package ca.gc.cra.nfcrx.infrastructure.buffer;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Unbounded, thread-safe FIFO between bus callbacks and the control loop.
 * <p><strong>Producers:</strong> {@link #add(Object)} never blocks, so it is safe inside a subject callback
 * running on a task worker.</p>
 * <p><strong>Consumer:</strong> {@link #get()} returns immediately, letting the loop drain everything queued
 * so far without stalling its tick; {@link #get(long, TimeUnit)} waits for consumers that want to.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 */
public final class DrainingQueue<T> {
  private final LinkedBlockingQueue<T> items = new LinkedBlockingQueue<>();

  /**
   * Appends {@code item}.
   *
   * @param item element; must not be {@code null}
   */
  public void add(T item) {
    items.offer(Objects.requireNonNull(item, "item"));
  }

  /**
   * Removes the head without waiting.
   *
   * @return head element, or empty when nothing is queued
   */
  public Optional<T> get() {
    return Optional.ofNullable(items.poll());
  }

  /**
   * Removes the head, waiting up to {@code timeout} for one to arrive.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return head element, or empty on timeout
   * @throws InterruptedException when interrupted while waiting
   */
  public Optional<T> get(long timeout, TimeUnit unit) throws InterruptedException {
    return Optional.ofNullable(items.poll(timeout, unit));
  }

  /**
   * Removes and hands every currently queued element to {@code consumer} in FIFO order.
   *
   * <p>Elements added concurrently while draining may or may not be included.</p>
   *
   * @param consumer element callback
   * @return number of elements drained
   */
  public int drain(Consumer<? super T> consumer) {
    Objects.requireNonNull(consumer, "consumer");
    int count = 0;
    for (Optional<T> next = get(); next.isPresent(); next = get()) {
      consumer.accept(next.get());
      count++;
    }
    return count;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
