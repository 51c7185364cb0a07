package ca.gc.cra.nfcrx.domain.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class EventTest {

  @Test
  void successContinuationRunsExactlyOnce() {
    AtomicInteger successes = new AtomicInteger();
    List<Throwable> failures = new ArrayList<>();
    Event event = Event.command(EventCode.CONFIGURE, ConfigTree.empty(), successes::incrementAndGet, failures::add);

    assertTrue(event.succeed());
    assertFalse(event.succeed());
    assertFalse(event.fail(new IllegalStateException("late")));

    assertEquals(1, successes.get());
    assertTrue(failures.isEmpty());
    assertTrue(event.isSettled());
  }

  @Test
  void failureContinuationReceivesCause() {
    AtomicInteger successes = new AtomicInteger();
    List<Throwable> failures = new ArrayList<>();
    Event event = Event.command(EventCode.START, null, successes::incrementAndGet, failures::add);
    IllegalStateException cause = new IllegalStateException("no device");

    assertTrue(event.fail(cause));
    assertFalse(event.succeed());

    assertEquals(0, successes.get());
    assertEquals(1, failures.size());
    assertEquals(cause, failures.get(0));
  }

  @Test
  void concurrentSettlementFiresOneContinuation() throws InterruptedException {
    AtomicInteger fired = new AtomicInteger();
    Event event = Event.command(EventCode.CONFIGURE, null, fired::incrementAndGet, ex -> fired.incrementAndGet());
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      boolean succeed = i % 2 == 0;
      Thread thread = new Thread(() -> {
        try {
          start.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
        if (succeed) {
          event.succeed();
        } else {
          event.fail(new IllegalStateException("x"));
        }
      });
      threads.add(thread);
      thread.start();
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join(5_000);
    }

    assertEquals(1, fired.get());
  }

  @Test
  void statusEventsAreAlreadySettledAndCarryPayload() {
    ConfigTree snapshot = ConfigTree.builder().put("status", "idle").build();

    Event event = Event.status(snapshot);

    assertEquals(EventCode.STATUS, event.code());
    assertEquals(snapshot, event.payload().orElseThrow());
    assertTrue(event.isSettled());
  }

  @Test
  void plainCommandHasNoPayload() {
    Event event = Event.command(EventCode.QUERY);

    assertTrue(event.payload().isEmpty());
    assertEquals("QUERY", event.toString());
  }
}
