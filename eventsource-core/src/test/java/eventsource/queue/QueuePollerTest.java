package eventsource.queue;

import eventsource.Result;
import eventsource.error.EventSourcingError.ValidationError;
import eventsource.spi.QueuedMessage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueuePollerTest {

  @Test
  void deliveredRowsAreMarkedProcessedInEnqueueOrder() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    queue.enqueue("m1", "OrderPlaced", "{}");
    queue.enqueue("m2", "OrderPaid", "{}");
    queue.enqueue("m3", "OrderShipped", "{}");
    List<String> seen = new CopyOnWriteArrayList<>();

    try (QueuePoller poller = QueuePoller.builder()
        .queue(queue)
        .handler(row -> {
          seen.add(row.messageId());
          return Result.ok(row.messageId());
        })
        .build()) {
      assertEquals(3, poller.poll());
      assertEquals(0, poller.poll());
    }

    assertEquals(List.of("m1", "m2", "m3"), seen);
    assertEquals(0L, queue.countUnprocessed());
  }

  @Test
  void batchSizeLimitsRowsPerCycle() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    for (int i = 0; i < 5; i++) {
      queue.enqueue("m" + i, "OrderPlaced", "{}");
    }

    try (QueuePoller poller = QueuePoller.builder()
        .queue(queue)
        .handler(Result::ok)
        .batchSize(2)
        .build()) {
      assertEquals(2, poller.poll());
      assertEquals(2, poller.poll());
      assertEquals(1, poller.poll());
    }
  }

  @Test
  void failedRowsAreRetriedThenParked() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("command");
    queue.enqueue("bad", "ChargePayment", "{}");
    queue.enqueue("good", "ShipOrder", "{}");

    try (QueuePoller poller = QueuePoller.builder()
        .queue(queue)
        .handler(row -> row.messageId().equals("bad")
            ? Result.err(new ValidationError("payload", "card declined"))
            : Result.ok(row))
        .maxAttempts(3)
        .build()) {
      assertEquals(1, poller.poll());
      assertEquals(1, queue.attempts("bad"));
      assertEquals(0, poller.poll());
      assertEquals(0, poller.poll());
      assertEquals(3, queue.attempts("bad"));

      // parked: stays unprocessed but is no longer offered
      assertEquals(0, poller.poll());
      assertEquals(3, queue.attempts("bad"));
    }
    assertFalse(queue.isProcessed("bad"));
    assertTrue(queue.isProcessed("good"));
    assertEquals(1L, queue.countUnprocessed());
  }

  @Test
  void throwingHandlerCountsAsFailedAttempt() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    queue.enqueue("m1", "OrderPlaced", "{}");

    try (QueuePoller poller = QueuePoller.builder()
        .queue(queue)
        .handler(row -> {
          throw new IllegalStateException("boom");
        })
        .build()) {
      assertEquals(0, poller.poll());
    }
    assertEquals(1, queue.attempts("m1"));
    assertFalse(queue.isProcessed("m1"));
  }

  @Test
  void recentRowsAreLeftToTheHotPath() {
    MutableClock clock = new MutableClock();
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event", clock);
    queue.enqueue("m1", "OrderPlaced", "{}");

    try (QueuePoller poller = QueuePoller.builder()
        .queue(queue)
        .handler(Result::ok)
        .skipRecent(Duration.ofSeconds(30))
        .clock(clock)
        .build()) {
      clock.advance(Duration.ofSeconds(10));
      assertEquals(0, poller.poll());
      clock.advance(Duration.ofSeconds(20));
      assertEquals(1, poller.poll());
    }
  }

  @Test
  void enqueueWakesStartedPoller() throws Exception {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("command");
    CountDownLatch delivered = new CountDownLatch(1);
    QueueHandler handler = row -> {
      delivered.countDown();
      return Result.ok(row);
    };

    try (QueuePoller poller = QueuePoller.builder()
        .queue(queue)
        .handler(handler)
        .intervalMs(60_000)
        .wakeOnEnqueue(true)
        .build()) {
      poller.start();
      queue.enqueue("c1", "ShipOrder", "{}");
      assertTrue(delivered.await(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void closedPollerDoesNothing() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    queue.enqueue("m1", "OrderPlaced", "{}");
    QueuePoller poller = QueuePoller.builder().queue(queue).handler(Result::ok).build();
    poller.close();

    assertEquals(0, poller.poll());
    assertThrows(IllegalStateException.class, poller::start);
  }

  @Test
  void rejectsInvalidConfiguration() {
    InMemoryMessageQueue queue = new InMemoryMessageQueue("event");
    QueueHandler handler = Result::ok;
    assertThrows(NullPointerException.class, () -> QueuePoller.builder().handler(handler).build());
    assertThrows(NullPointerException.class, () -> QueuePoller.builder().queue(queue).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueuePoller.builder().queue(queue).handler(handler).batchSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueuePoller.builder().queue(queue).handler(handler).maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueuePoller.builder().queue(queue).handler(handler).skipRecent(Duration.ofSeconds(-1)).build());
  }

  static final class MutableClock extends Clock {
    private volatile Instant now = Instant.parse("2026-01-01T00:00:00Z");

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
