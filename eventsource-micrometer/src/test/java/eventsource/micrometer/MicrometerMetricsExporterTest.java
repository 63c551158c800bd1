package eventsource.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void eventsAppendedCountsEvents() {
    exporter.incrementEventsAppended(3);
    exporter.incrementEventsAppended(2);
    assertEquals(5.0, counter("eventsource.events.appended").count());
  }

  @Test
  void conflictsAndDispatchCounters() {
    exporter.incrementConcurrencyConflicts();
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchFailure();
    exporter.incrementDispatchSkipped();
    assertEquals(1.0, counter("eventsource.append.conflicts").count());
    assertEquals(2.0, counter("eventsource.dispatch.success").count());
    assertEquals(1.0, counter("eventsource.dispatch.failure").count());
    assertEquals(1.0, counter("eventsource.dispatch.skipped").count());
  }

  @Test
  void commandsAreTaggedByOutcome() {
    exporter.incrementCommandsDispatched(true);
    exporter.incrementCommandsDispatched(true);
    exporter.incrementCommandsDispatched(false);
    assertEquals(2.0, registry.get("eventsource.commands.dispatched").tag("outcome", "success").counter().count());
    assertEquals(1.0, registry.get("eventsource.commands.dispatched").tag("outcome", "failure").counter().count());
  }

  @Test
  void sagaTransitionsAreTaggedBySagaAndStatus() {
    exporter.recordSagaTransition("OrderSaga", "WAITING");
    exporter.recordSagaTransition("OrderSaga", "COMPLETED");
    exporter.incrementCompensations();
    assertEquals(1.0, registry.get("eventsource.saga.transitions")
        .tag("saga", "OrderSaga").tag("status", "COMPLETED").counter().count());
    assertEquals(1.0, counter("eventsource.saga.compensations").count());
  }

  @Test
  void queueGaugesArePerQueue() {
    exporter.recordUnprocessedDepth("event", 42);
    exporter.recordUnprocessedDepth("command", 7);
    exporter.recordOldestLagMs("event", 12345L);
    assertEquals(42.0, queueGauge("eventsource.queue.depth", "event").value());
    assertEquals(7.0, queueGauge("eventsource.queue.depth", "command").value());
    assertEquals(12345.0, queueGauge("eventsource.queue.lag.oldest.ms", "event").value());

    exporter.recordUnprocessedDepth("event", 0);
    assertEquals(0.0, queueGauge("eventsource.queue.depth", "event").value());
  }

  @Test
  void redeliveredAndParkedAreTaggedByQueue() {
    exporter.incrementRedelivered("event");
    exporter.incrementParked("command");
    assertEquals(1.0, registry.get("eventsource.queue.redelivered").tag("queue", "event").counter().count());
    assertEquals(1.0, registry.get("eventsource.queue.parked").tag("queue", "command").counter().count());
  }

  @Test
  void handlerDurationIsTimedPerHandler() {
    exporter.recordHandlerDurationMs("projection", 15);
    exporter.recordHandlerDurationMs("projection", 5);
    Timer timer = registry.get("eventsource.handler.duration").tag("handler", "projection").timer();
    assertEquals(2, timer.count());
    assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void snapshotCounters() {
    exporter.incrementSnapshotsTaken();
    exporter.incrementSnapshotFallbacks();
    assertEquals(1.0, counter("eventsource.snapshots.taken").count());
    assertEquals(1.0, counter("eventsource.snapshots.fallbacks").count());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "orders.es");
    prefixed.incrementDispatchSuccess();
    assertEquals(1.0, custom.get("orders.es.dispatch.success").counter().count());
    assertNull(custom.find("eventsource.dispatch.success").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "es."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesAllMetersAndIgnoresLaterCalls() {
    exporter.recordUnprocessedDepth("event", 3);
    exporter.incrementRedelivered("event");
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementDispatchSuccess();
    exporter.recordUnprocessedDepth("event", 9);
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge queueGauge(String name, String queue) {
    return registry.get(name).tag("queue", queue).gauge();
  }
}
