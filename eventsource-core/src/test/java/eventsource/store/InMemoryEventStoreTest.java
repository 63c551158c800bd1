package eventsource.store;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.ValidationError;
import eventsource.queue.InMemoryMessageQueue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

  private static Event event(String aggregateId, String type) {
    return Event.builder(type)
        .aggregateId(aggregateId)
        .aggregateType("Account")
        .payload(Map.of("type", type))
        .build();
  }

  @Test
  void appendStampsContiguousPositions() {
    InMemoryEventStore store = new InMemoryEventStore();

    assertEquals(2L, store.append("acc-1", 0, List.of(event("acc-1", "Opened"), event("acc-1", "Deposited")))
        .orElseThrow());
    assertEquals(3L, store.append("acc-1", 2, List.of(event("acc-1", "Withdrawn"))).orElseThrow());

    List<Event> stream = store.read("acc-1", 0);
    assertEquals(List.of(1L, 2L, 3L), stream.stream().map(Event::sequenceNumber).toList());
    assertEquals(List.of("Withdrawn"), store.read("acc-1", 2).stream().map(Event::eventType).toList());
    assertEquals(3L, store.currentVersion("acc-1"));
    assertEquals(0L, store.currentVersion("unknown"));
  }

  @Test
  void staleExpectedVersionIsConflict() {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append("acc-1", 0, List.of(event("acc-1", "Opened"))).orElseThrow();

    Result<Long> result = store.append("acc-1", 0, List.of(event("acc-1", "Deposited")));

    ConcurrencyConflict conflict = assertInstanceOf(ConcurrencyConflict.class, result.failure().orElseThrow());
    assertEquals(0L, conflict.expectedVersion());
    assertEquals(1L, conflict.actualVersion());
    assertEquals(1L, store.currentVersion("acc-1"));
  }

  @Test
  void concurrentAppendsAtSameVersionHaveExactlyOneWinner() throws Exception {
    InMemoryEventStore store = new InMemoryEventStore();
    int writers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Result<Long>>> futures = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        Callable<Result<Long>> append = () -> {
          start.await();
          return store.append("acc-1", 0, List.of(event("acc-1", "Opened")));
        };
        futures.add(pool.submit(append));
      }
      start.countDown();

      int wins = 0;
      int conflicts = 0;
      for (Future<Result<Long>> future : futures) {
        Result<Long> result = future.get(5, TimeUnit.SECONDS);
        if (result.isOk()) {
          wins++;
        } else if (result.failure().orElseThrow() instanceof ConcurrencyConflict) {
          conflicts++;
        }
      }
      assertEquals(1, wins);
      assertEquals(writers - 1, conflicts);
      assertEquals(1L, store.currentVersion("acc-1"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void invalidBatchesAreRejected() {
    InMemoryEventStore store = new InMemoryEventStore();
    Event opened = event("acc-1", "Opened");

    assertInstanceOf(ValidationError.class,
        store.append("acc-1", 0, List.of(event("acc-2", "Opened"))).failure().orElseThrow());
    assertInstanceOf(ValidationError.class,
        store.append("acc-1", 0, List.of(opened, opened)).failure().orElseThrow());
    assertInstanceOf(ValidationError.class,
        store.append("acc-1", 0, List.of(opened.withSequenceNumber(5))).failure().orElseThrow());
    assertInstanceOf(ValidationError.class,
        store.append("acc-1", -1, List.of(opened)).failure().orElseThrow());
    assertEquals(0L, store.currentVersion("acc-1"));
  }

  @Test
  void eventIdsAreUniqueAcrossAppends() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    InMemoryEventStore store = new InMemoryEventStore(queue);
    Event opened = event("acc-1", "Opened");
    store.append("acc-1", 0, List.of(opened)).orElseThrow();

    Result<Long> sameStream = store.append("acc-1", 1, List.of(opened.withSequenceNumber(0)));
    Event copy = Event.builder("Opened")
        .eventId(opened.eventId())
        .aggregateId("acc-2")
        .aggregateType("Account")
        .build();
    Result<Long> otherStream = store.append("acc-2", 0, List.of(copy));

    ValidationError error = assertInstanceOf(ValidationError.class, sameStream.failure().orElseThrow());
    assertEquals("eventId", error.field());
    assertInstanceOf(ValidationError.class, otherStream.failure().orElseThrow());
    assertEquals(1L, store.currentVersion("acc-1"));
    assertEquals(0L, store.currentVersion("acc-2"));
    assertEquals(1, store.readAll(0, 10).size());
    assertEquals(1L, queue.countUnprocessed());
  }

  @Test
  void emptyBatchReturnsCurrentVersion() {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append("acc-1", 0, List.of(event("acc-1", "Opened"))).orElseThrow();

    assertEquals(1L, store.append("acc-1", 1, List.of()).orElseThrow());
  }

  @Test
  void readAllPagesThroughGlobalOrder() {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append("acc-1", 0, List.of(event("acc-1", "Opened"))).orElseThrow();
    store.append("acc-2", 0, List.of(event("acc-2", "Opened"))).orElseThrow();
    store.append("acc-1", 1, List.of(event("acc-1", "Deposited"))).orElseThrow();

    List<StoredEvent> first = store.readAll(0, 2);
    List<StoredEvent> rest = store.readAll(first.get(1).globalPosition(), 10);

    assertEquals(List.of(1L, 2L), first.stream().map(StoredEvent::globalPosition).toList());
    assertEquals(1, rest.size());
    assertEquals("Deposited", rest.get(0).event().eventType());
    assertThrows(IllegalArgumentException.class, () -> store.readAll(0, 0));
  }

  @Test
  void readAllAcceptsLargeLimitAfterAPosition() {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append("acc-1", 0, List.of(event("acc-1", "Opened"), event("acc-1", "Deposited"),
        event("acc-1", "Withdrawn"))).orElseThrow();

    List<StoredEvent> tail = store.readAll(1, Integer.MAX_VALUE);

    assertEquals(List.of(2L, 3L), tail.stream().map(StoredEvent::globalPosition).toList());
    assertTrue(store.readAll(3, Integer.MAX_VALUE).isEmpty());
    assertTrue(store.readAll(Long.MAX_VALUE, Integer.MAX_VALUE).isEmpty());
  }

  @Test
  void appendEnqueuesOneRowPerEvent() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    InMemoryEventStore store = new InMemoryEventStore(queue);

    store.append("acc-1", 0, List.of(event("acc-1", "Opened"), event("acc-1", "Deposited"))).orElseThrow();
    store.append("acc-1", 0, List.of(event("acc-1", "Opened")));

    assertEquals(2L, queue.countUnprocessed());
  }
}
