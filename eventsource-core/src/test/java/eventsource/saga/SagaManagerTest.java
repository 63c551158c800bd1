package eventsource.saga;

import eventsource.Event;
import eventsource.Result;
import eventsource.bus.DefaultEventBus;
import eventsource.command.Command;
import eventsource.command.DefaultCommandBus;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.HandlerError;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.error.EventSourcingError.SagaCompensationError;
import eventsource.error.EventSourcingError.ValidationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SagaManagerTest {
  private final List<String> issued = new CopyOnWriteArrayList<>();
  private InMemorySagaStore store;
  private DefaultCommandBus commandBus;
  private SagaManager manager;

  /** Reserve inventory, charge payment, ship; retries payment on timeout. */
  static final class OrderFulfillmentSaga implements Saga {
    @Override
    public String sagaType() {
      return "OrderFulfillment";
    }

    @Override
    public Set<String> eventTypes() {
      return Set.of("OrderPlaced", "InventoryReserved", "PaymentProcessed", "PaymentTimedOut",
          "PaymentDeclined");
    }

    @Override
    public boolean startsWith(Event event) {
      return event.eventType().equals("OrderPlaced");
    }

    @Override
    public int maxRetries() {
      return 2;
    }

    @Override
    public void handle(SagaContext context, Event event) {
      String orderId = (String) event.payload().get("orderId");
      switch (event.eventType()) {
        case "OrderPlaced":
          context.data().put("orderId", orderId);
          context.send(Command.of("ReserveInventory", Map.of("orderId", orderId)));
          context.waitFor();
          break;
        case "InventoryReserved":
          context.stepCompleted("reserveInventory", Command.of("ReleaseInventory", Map.of("orderId", orderId)));
          context.send(Command.of("ChargePayment", Map.of("orderId", orderId)));
          break;
        case "PaymentProcessed":
          context.stepCompleted("chargePayment", Command.of("RefundPayment", Map.of("orderId", orderId)));
          context.send(Command.of("ShipOrder", Map.of("orderId", orderId)));
          context.complete();
          break;
        case "PaymentTimedOut":
          context.timeout(Command.of("ChargePayment", Map.of("orderId", orderId)));
          break;
        case "PaymentDeclined":
          context.fail("payment declined");
          break;
        default:
          throw new IllegalStateException("unexpected " + event.eventType());
      }
    }
  }

  /** Counts ticks; every tick starts or advances the same saga. */
  static final class TickCounterSaga implements Saga {
    final AtomicInteger handled = new AtomicInteger();

    @Override
    public String sagaType() {
      return "TickCounter";
    }

    @Override
    public Set<String> eventTypes() {
      return Set.of("Tick");
    }

    @Override
    public boolean startsWith(Event event) {
      return true;
    }

    @Override
    public void handle(SagaContext context, Event event) {
      handled.incrementAndGet();
      int n = ((Number) context.data().getOrDefault("n", 0)).intValue();
      context.data().put("n", n + 1);
      context.waitFor();
    }
  }

  /** Reports a conflict for the first {@code conflicts} saves, then delegates. */
  static final class ConflictingSagaStore implements SagaStore {
    private final InMemorySagaStore delegate = new InMemorySagaStore();
    private final AtomicInteger remaining;
    final AtomicInteger saves = new AtomicInteger();

    ConflictingSagaStore(int conflicts) {
      this.remaining = new AtomicInteger(conflicts);
    }

    @Override
    public Result<SagaInstance> load(String sagaId) {
      return delegate.load(sagaId);
    }

    @Override
    public Result<SagaInstance> save(SagaInstance instance, long expectedVersion) {
      saves.incrementAndGet();
      if (remaining.getAndDecrement() > 0) {
        return Result.err(new ConcurrencyConflict(instance.sagaId(), expectedVersion, expectedVersion + 1));
      }
      return delegate.save(instance, expectedVersion);
    }

    @Override
    public List<SagaInstance> findByStatus(SagaStatus status) {
      return delegate.findByStatus(status);
    }

    @Override
    public boolean delete(String sagaId) {
      return delegate.delete(sagaId);
    }
  }

  /** Two steps with compensations; a failure of step 2 unwinds both. */
  static final class TwoStepSaga implements Saga {
    @Override
    public String sagaType() {
      return "TwoStep";
    }

    @Override
    public Set<String> eventTypes() {
      return Set.of("Step1Completed", "Step2Completed", "Step2Failed", "Explode");
    }

    @Override
    public boolean startsWith(Event event) {
      return event.eventType().equals("Step1Completed");
    }

    @Override
    public void handle(SagaContext context, Event event) {
      switch (event.eventType()) {
        case "Step1Completed":
          context.stepCompleted("step1", Command.of("CompensateStep1", Map.of()));
          break;
        case "Step2Completed":
          context.stepCompleted("step2", Command.of("CompensateStep2", Map.of()));
          break;
        case "Step2Failed":
          context.fail("step 2 failed");
          break;
        default:
          throw new IllegalArgumentException("cannot handle " + event.eventType());
      }
    }
  }

  @BeforeEach
  void setup() {
    store = new InMemorySagaStore();
    commandBus = DefaultCommandBus.builder().build();
    for (String type : List.of("ReserveInventory", "ChargePayment", "ShipOrder", "ReleaseInventory",
        "RefundPayment", "CompensateStep1", "CompensateStep2")) {
      commandBus.register(type, cmd -> {
        issued.add(cmd.commandType());
        return Result.ok(null);
      });
    }
    manager = SagaManager.builder().store(store).commandBus(commandBus).build();
    manager.register(new OrderFulfillmentSaga());
    manager.register(new TwoStepSaga());
  }

  private static Event event(String type, String correlationId) {
    return Event.builder(type)
        .aggregateId("order-1")
        .aggregateType("Order")
        .correlationId(correlationId)
        .payload(Map.of("orderId", "order-1"))
        .build();
  }

  private List<SagaOutcome> handle(Event event) {
    return manager.handle(event).orElseThrow();
  }

  @Test
  void happyPathIssuesCommandsInOrderAndCompletes() {
    handle(event("OrderPlaced", "order-1"));
    handle(event("InventoryReserved", "order-1"));
    List<SagaOutcome> last = handle(event("PaymentProcessed", "order-1"));

    assertEquals(List.of("ReserveInventory", "ChargePayment", "ShipOrder"), issued);
    assertEquals(SagaStatus.COMPLETED, last.get(0).status());
    SagaInstance saved = store.load("OrderFulfillment:order-1").orElseThrow();
    assertEquals(SagaStatus.COMPLETED, saved.status());
    assertEquals("order-1", saved.data().get("orderId"));
    assertEquals(3, saved.handledEvents().size());
    assertEquals(3L, saved.version());
  }

  @Test
  void failureCompensatesCompletedStepsInReverseOrder() {
    handle(event("Step1Completed", "run-1"));
    handle(event("Step2Completed", "run-1"));
    List<SagaOutcome> outcomes = handle(event("Step2Failed", "run-1"));

    assertEquals(List.of("CompensateStep2", "CompensateStep1"), issued);
    SagaOutcome outcome = outcomes.get(0);
    assertEquals(SagaStatus.COMPENSATED, outcome.status());
    assertEquals(List.of("CompensateStep2", "CompensateStep1"),
        outcome.commands().stream().map(Command::commandType).toList());
    SagaInstance saved = store.load("TwoStep:run-1").orElseThrow();
    assertEquals(SagaStatus.COMPENSATED, saved.status());
    assertTrue(saved.completedSteps().isEmpty());
    assertEquals(List.of("compensated step2 with CompensateStep2", "compensated step1 with CompensateStep1"),
        saved.compensationLog());
    assertEquals("step 2 failed", saved.failureReason());
  }

  @Test
  void compensatingCommandsCarryTheFailureCausation() {
    List<Command> received = new ArrayList<>();
    DefaultCommandBus recording = DefaultCommandBus.builder().build();
    recording.register("CompensateStep1", cmd -> {
      received.add(cmd);
      return Result.ok(null);
    });
    SagaManager local = SagaManager.builder().store(new InMemorySagaStore()).commandBus(recording).build();
    local.register(new TwoStepSaga());
    Event failed = event("Step2Failed", "run-2");

    local.handle(event("Step1Completed", "run-2")).orElseThrow();
    local.handle(failed).orElseThrow();

    assertEquals(1, received.size());
    assertEquals("run-2", received.get(0).correlationId());
    assertEquals(failed.eventId(), received.get(0).causationId());
  }

  @Test
  void redeliveredEventIsIgnored() {
    Event placed = event("OrderPlaced", "order-1");

    handle(placed);
    List<SagaOutcome> again = handle(placed);

    assertTrue(again.get(0).ignored());
    assertEquals(List.of("ReserveInventory"), issued);
    assertEquals(1L, store.load("OrderFulfillment:order-1").orElseThrow().version());
  }

  @Test
  void terminalSagaIgnoresFurtherEvents() {
    handle(event("Step1Completed", "run-1"));
    handle(event("Step2Failed", "run-1"));
    issued.clear();

    List<SagaOutcome> outcomes = handle(event("Step2Completed", "run-1"));

    assertTrue(outcomes.get(0).ignored());
    assertEquals(SagaStatus.COMPENSATED, outcomes.get(0).status());
    assertTrue(issued.isEmpty());
  }

  @Test
  void eventThatDoesNotStartASagaIsSkipped() {
    assertTrue(handle(event("InventoryReserved", "unknown-order")).isEmpty());
    assertTrue(store.findByStatus(SagaStatus.STARTED).isEmpty());
    assertTrue(handle(event("Unrelated", "order-1")).isEmpty());
  }

  @Test
  void timeoutRetriesUntilMaxRetriesThenFails() {
    handle(event("OrderPlaced", "order-1"));
    handle(event("InventoryReserved", "order-1"));
    issued.clear();

    assertEquals(SagaStatus.WAITING, handle(event("PaymentTimedOut", "order-1")).get(0).status());
    assertEquals(SagaStatus.WAITING, handle(event("PaymentTimedOut", "order-1")).get(0).status());
    SagaOutcome exhausted = handle(event("PaymentTimedOut", "order-1")).get(0);

    assertEquals(List.of("ChargePayment", "ChargePayment"), issued);
    assertEquals(SagaStatus.FAILED, exhausted.status());
    SagaInstance saved = store.load("OrderFulfillment:order-1").orElseThrow();
    assertEquals(2, saved.retryCount());
    assertEquals("timed out after 2 retries", saved.failureReason());
  }

  @Test
  void failedForwardCommandTriggersCompensation() {
    DefaultCommandBus failing = DefaultCommandBus.builder().build();
    failing.register("ReserveInventory", cmd -> Result.ok(null));
    failing.register("ChargePayment", cmd -> Result.err(new ValidationError("card", "expired")));
    failing.register("ReleaseInventory", cmd -> {
      issued.add(cmd.commandType());
      return Result.ok(null);
    });
    SagaManager local = SagaManager.builder().store(store).commandBus(failing).build();
    local.register(new OrderFulfillmentSaga());

    local.handle(event("OrderPlaced", "order-9")).orElseThrow();
    SagaOutcome outcome = local.handle(event("InventoryReserved", "order-9")).orElseThrow().get(0);

    assertEquals(SagaStatus.COMPENSATED, outcome.status());
    assertEquals(List.of("ReleaseInventory"), issued);
    String reason = store.load("OrderFulfillment:order-9").orElseThrow().failureReason();
    assertTrue(reason.startsWith("ChargePayment failed"), reason);
  }

  @Test
  void failedCompensationLeavesSagaFailedAndReturnsError() {
    DefaultCommandBus failing = DefaultCommandBus.builder().build();
    failing.register("CompensateStep2", cmd -> {
      issued.add(cmd.commandType());
      return Result.ok(null);
    });
    failing.register("CompensateStep1", cmd -> {
      throw new IllegalStateException("ledger unavailable");
    });
    SagaManager local = SagaManager.builder().store(store).commandBus(failing).build();
    local.register(new TwoStepSaga());

    local.handle(event("Step1Completed", "run-3")).orElseThrow();
    local.handle(event("Step2Completed", "run-3")).orElseThrow();
    Result<List<SagaOutcome>> result = local.handle(event("Step2Failed", "run-3"));

    SagaCompensationError error = assertInstanceOf(SagaCompensationError.class, result.failure().orElseThrow());
    assertEquals("step1", error.failedStep());
    assertEquals(List.of("CompensateStep2"), issued);
    SagaInstance saved = store.load("TwoStep:run-3").orElseThrow();
    assertEquals(SagaStatus.FAILED, saved.status());
    assertEquals(2, saved.compensationLog().size());
  }

  @Test
  void throwingSagaHandlerIsHandlerErrorAndStateIsUnchanged() {
    handle(event("Step1Completed", "run-4"));

    Result<List<SagaOutcome>> result = manager.handle(event("Explode", "run-4"));

    HandlerError error = assertInstanceOf(HandlerError.class, result.failure().orElseThrow());
    assertEquals("TwoStep", error.handlerName());
    assertEquals(1L, store.load("TwoStep:run-4").orElseThrow().version());
  }

  @Test
  void resumeFinishesInterruptedCompensation() {
    Instant now = Instant.now();
    SagaInstance interrupted = new SagaInstance("TwoStep:run-5", "TwoStep", SagaStatus.COMPENSATING, Map.of(),
        List.of(new CompletedStep("step1", Command.of("CompensateStep1", Map.of())),
            new CompletedStep("audit", null)),
        List.of(), List.of(), 0, "crashed", 0L, now, now);
    store.save(interrupted, 0L).orElseThrow();

    List<SagaOutcome> resumed = manager.resumeCompensations();

    assertEquals(1, resumed.size());
    assertEquals(SagaStatus.COMPENSATED, resumed.get(0).status());
    assertEquals(List.of("CompensateStep1"), issued);
    assertEquals(List.of("skipped audit: no compensation", "compensated step1 with CompensateStep1"),
        store.load("TwoStep:run-5").orElseThrow().compensationLog());
  }

  @Test
  void subscribedManagerReceivesEventsFromBus() {
    try (DefaultEventBus bus = DefaultEventBus.builder().build()) {
      manager.subscribeTo(bus);

      bus.publish(event("OrderPlaced", "order-7")).orElseThrow();

      assertEquals(List.of("ReserveInventory"), issued);
      assertTrue(bus.publish(event("Explode", "order-7")).isOk());
    }
  }

  @Test
  void concurrentEventsForOneSagaAreSerialized() throws Exception {
    TickCounterSaga saga = new TickCounterSaga();
    SagaManager local = SagaManager.builder().store(store).commandBus(commandBus).build();
    local.register(saga);
    int ticks = 200;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Result<List<SagaOutcome>>>> futures = new ArrayList<>();
      for (int i = 0; i < ticks; i++) {
        Event tick = event("Tick", "clock-1");
        futures.add(pool.submit(() -> {
          start.await();
          return local.handle(tick);
        }));
      }
      start.countDown();
      for (Future<Result<List<SagaOutcome>>> future : futures) {
        assertTrue(future.get(10, TimeUnit.SECONDS).isOk());
      }
    } finally {
      pool.shutdownNow();
    }

    SagaInstance saved = store.load("TickCounter:clock-1").orElseThrow();
    assertEquals(ticks, ((Number) saved.data().get("n")).intValue());
    assertEquals(ticks, saved.version());
    assertEquals(ticks, saved.handledEvents().size());
    assertEquals(ticks, saga.handled.get());
  }

  @Test
  void versionConflictReRunsTheEventAndSaves() {
    TickCounterSaga saga = new TickCounterSaga();
    ConflictingSagaStore conflicting = new ConflictingSagaStore(1);
    SagaManager local = SagaManager.builder().store(conflicting).commandBus(commandBus).build();
    local.register(saga);

    SagaOutcome outcome = local.handle(event("Tick", "clock-2")).orElseThrow().get(0);

    assertEquals(SagaStatus.WAITING, outcome.status());
    assertEquals(2, saga.handled.get());
    assertEquals(2, conflicting.saves.get());
    SagaInstance saved = conflicting.load("TickCounter:clock-2").orElseThrow();
    assertEquals(1L, saved.version());
    assertEquals(1, ((Number) saved.data().get("n")).intValue());
  }

  @Test
  void persistentConflictIsReturnedAfterRetries() {
    TickCounterSaga saga = new TickCounterSaga();
    ConflictingSagaStore conflicting = new ConflictingSagaStore(Integer.MAX_VALUE);
    SagaManager local = SagaManager.builder()
        .store(conflicting)
        .commandBus(commandBus)
        .maxConflictRetries(2)
        .build();
    local.register(saga);

    Result<List<SagaOutcome>> result = local.handle(event("Tick", "clock-3"));

    assertInstanceOf(ConcurrencyConflict.class, result.failure().orElseThrow());
    assertEquals(3, conflicting.saves.get());
    assertInstanceOf(NotFound.class, conflicting.load("TickCounter:clock-3").failure().orElseThrow());
  }

  @Test
  void duplicateSagaTypeIsRejected() {
    assertThrows(IllegalStateException.class, () -> manager.register(new TwoStepSaga()));
  }
}
