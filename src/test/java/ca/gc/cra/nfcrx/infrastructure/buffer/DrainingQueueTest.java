package ca.gc.cra.nfcrx.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DrainingQueueTest {

  @Test
  void getReturnsEmptyImmediatelyWhenNothingQueued() {
    DrainingQueue<String> queue = new DrainingQueue<>();

    assertTrue(queue.get().isEmpty());
  }

  @Test
  void drainObservesEveryItemOnceInFifoOrder() {
    DrainingQueue<Integer> queue = new DrainingQueue<>();
    for (int i = 0; i < 100; i++) {
      queue.add(i);
    }
    List<Integer> drained = new ArrayList<>();

    int count = queue.drain(drained::add);

    assertEquals(100, count);
    for (int i = 0; i < 100; i++) {
      assertEquals(i, drained.get(i));
    }
    assertTrue(queue.isEmpty());
    assertEquals(0, queue.drain(drained::add));
  }

  @Test
  void timedGetWaitsForProducer() throws InterruptedException {
    DrainingQueue<String> queue = new DrainingQueue<>();
    Thread producer = new Thread(() -> {
      try {
        Thread.sleep(50);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      queue.add("late");
    });
    producer.start();

    Optional<String> item = queue.get(5, TimeUnit.SECONDS);

    assertEquals("late", item.orElseThrow());
    producer.join(1_000);
  }

  @Test
  void concurrentProducersLoseNothing() throws InterruptedException {
    DrainingQueue<Integer> queue = new DrainingQueue<>();
    List<Thread> producers = new ArrayList<>();
    for (int p = 0; p < 4; p++) {
      Thread producer = new Thread(() -> {
        for (int i = 0; i < 1_000; i++) {
          queue.add(i);
        }
      });
      producers.add(producer);
      producer.start();
    }
    for (Thread producer : producers) {
      producer.join(5_000);
    }

    assertEquals(4_000, queue.drain(item -> {}));
  }
}
