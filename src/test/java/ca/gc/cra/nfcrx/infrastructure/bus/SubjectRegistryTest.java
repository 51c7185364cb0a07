package ca.gc.cra.nfcrx.infrastructure.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.nfcrx.domain.bus.Event;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SubjectRegistryTest {

  @Test
  void sameNameAndTypeYieldSameSubject() {
    SubjectRegistry registry = new SubjectRegistry();

    Subject<Event> first = registry.events(SubjectRegistry.RADIO_STATUS);
    Subject<Event> second = registry.subject(SubjectRegistry.RADIO_STATUS, Event.class);

    assertSame(first, second);
    assertNotSame(first, registry.events(SubjectRegistry.DECODER_STATUS));
    assertEquals(2, registry.size());
  }

  @Test
  void typeMismatchIsRejected() {
    SubjectRegistry registry = new SubjectRegistry();
    registry.events("shared");

    assertThrows(IllegalArgumentException.class, () -> registry.subject("shared", String.class));
  }

  @Test
  void independentRegistriesDoNotShareSubjects() {
    assertNotSame(new SubjectRegistry().events("x"), new SubjectRegistry().events("x"));
  }

  @Test
  void concurrentFirstLookupsRendezvous() throws InterruptedException {
    SubjectRegistry registry = new SubjectRegistry();
    Set<Subject<Event>> seen = ConcurrentHashMap.newKeySet();
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      Thread thread = new Thread(() -> {
        try {
          start.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
        seen.add(registry.events(SubjectRegistry.DECODER_FRAME + ".events"));
      });
      threads.add(thread);
      thread.start();
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join(5_000);
    }

    assertEquals(1, seen.size());
  }
}
