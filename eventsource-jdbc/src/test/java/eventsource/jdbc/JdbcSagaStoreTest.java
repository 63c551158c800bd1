package eventsource.jdbc;

import eventsource.Result;
import eventsource.command.Command;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.saga.CompletedStep;
import eventsource.saga.SagaInstance;
import eventsource.saga.SagaStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSagaStoreTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private H2Database db;
  private JdbcSagaStore store;

  @BeforeEach
  void setup() {
    db = H2Database.create("sagas");
    store = new JdbcSagaStore(db.session(), db.dialect);
  }

  @AfterEach
  void teardown() throws Exception {
    db.shutdown();
  }

  private static SagaInstance waiting(String sagaId) {
    Command release = new Command("cmd-1", "ReleaseInventory", Map.of("orderId", "order-1"),
        "corr-1", "evt-1", NOW);
    return new SagaInstance(sagaId, "OrderFulfillment", SagaStatus.WAITING,
        Map.of("orderId", "order-1", "attempt", 2),
        List.of(new CompletedStep("reserve", release), new CompletedStep("audit", null)),
        List.of("compensated charge with RefundPayment"),
        List.of("evt-1", "evt-2"),
        1, null, 0L, NOW, NOW);
  }

  @Test
  void savedInstanceRoundTripsEveryField() {
    SagaInstance saved = store.save(waiting("OrderFulfillment:corr-1"), 0L).orElseThrow();
    SagaInstance loaded = store.load("OrderFulfillment:corr-1").orElseThrow();

    assertEquals(1L, saved.version());
    assertEquals(saved, loaded);
    CompletedStep reserve = loaded.completedSteps().get(0);
    assertEquals("ReleaseInventory", reserve.compensation().commandType());
    assertEquals("corr-1", reserve.compensation().correlationId());
    assertNull(loaded.completedSteps().get(1).compensation());
    assertTrue(loaded.hasHandled("evt-2"));
  }

  @Test
  void versionsGuardConcurrentUpdates() {
    SagaInstance v1 = store.save(waiting("s-1"), 0L).orElseThrow();

    SagaInstance v2 = store.save(v1.withStatus(SagaStatus.COMPLETED, NOW.plusSeconds(5)), 1L).orElseThrow();
    Result<SagaInstance> stale = store.save(v1.withStatus(SagaStatus.COMPENSATING, NOW), 1L);
    Result<SagaInstance> duplicateStart = store.save(SagaInstance.start("s-1", "OrderFulfillment", NOW), 0L);

    assertEquals(2L, v2.version());
    ConcurrencyConflict conflict = assertInstanceOf(ConcurrencyConflict.class, stale.failure().orElseThrow());
    assertEquals(2L, conflict.actualVersion());
    assertInstanceOf(ConcurrencyConflict.class, duplicateStart.failure().orElseThrow());
    assertEquals(SagaStatus.COMPLETED, store.load("s-1").orElseThrow().status());
  }

  @Test
  void findsByStatusAndDeletes() {
    store.save(waiting("s-1"), 0L).orElseThrow();
    SagaInstance other = store.save(waiting("s-2"), 0L).orElseThrow();
    store.save(other.withStatus(SagaStatus.COMPENSATING, NOW.plusSeconds(1)), 1L).orElseThrow();

    assertEquals(List.of("s-1"), store.findByStatus(SagaStatus.WAITING).stream().map(SagaInstance::sagaId).toList());
    assertEquals(List.of("s-2"),
        store.findByStatus(SagaStatus.COMPENSATING).stream().map(SagaInstance::sagaId).toList());

    assertTrue(store.delete("s-1"));
    assertFalse(store.delete("s-1"));
    assertInstanceOf(NotFound.class, store.load("s-1").failure().orElseThrow());
  }
}
