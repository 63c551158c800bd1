package eventsource.spring;

import eventsource.Event;
import eventsource.Result;
import eventsource.bus.DefaultEventBus;
import eventsource.jdbc.DataSourceConnectionProvider;
import eventsource.jdbc.JdbcEventStore;
import eventsource.jdbc.JdbcMessageQueue;
import eventsource.jdbc.JdbcSchema;
import eventsource.jdbc.JdbcSession;
import eventsource.jdbc.dialect.H2Dialect;
import eventsource.uow.CommitResult;
import eventsource.uow.UnitOfWork;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringTxContextIntegrationTest {
  private SpringTxContext txContext;
  private DataSourceTransactionManager txManager;
  private JdbcEventStore eventStore;
  private JdbcMessageQueue eventQueue;
  private DefaultEventBus bus;
  private UnitOfWork unitOfWork;
  private final List<String> received = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setup() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:es_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(ds);
    H2Dialect dialect = new H2Dialect();
    JdbcSchema.create(connectionProvider, dialect);

    txContext = new SpringTxContext(ds);
    txManager = new DataSourceTransactionManager(ds);
    JdbcSession session = new JdbcSession(connectionProvider, txContext);
    eventQueue = JdbcMessageQueue.events(session, dialect);
    eventStore = JdbcEventStore.builder()
        .session(session)
        .dialect(dialect)
        .eventQueue(eventQueue)
        .build();
    bus = DefaultEventBus.builder().concurrency(1).build();
    bus.subscribe("Order", "recorder", event -> received.add(event.eventType()));
    unitOfWork = UnitOfWork.builder()
        .eventStore(eventStore)
        .eventBus(bus)
        .eventQueue(eventQueue)
        .txContext(txContext)
        .build();
  }

  @AfterEach
  void teardown() {
    bus.close();
  }

  @Test
  void commitPublishesAfterSpringTransactionCommits() {
    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    Result<CommitResult> result;
    try {
      result = unitOfWork.commit("order-1", 0,
          List.of(event("order-1", "OrderPlaced"), event("order-1", "OrderPaid")));
      assertTrue(received.isEmpty());
      txManager.commit(status);
    } catch (RuntimeException e) {
      txManager.rollback(status);
      throw e;
    }

    assertEquals(CommitResult.Status.DEFERRED, result.orElseThrow().status());
    assertEquals(List.of("OrderPlaced", "OrderPaid"), received);
    assertEquals(2L, eventStore.currentVersion("order-1"));
    assertEquals(0L, eventQueue.countUnprocessed());
  }

  @Test
  void rollbackDiscardsEventsAndPublishesNothing() {
    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    Result<CommitResult> result = unitOfWork.commit("order-2", 0, List.of(event("order-2", "OrderPlaced")));
    txManager.rollback(status);

    assertEquals(CommitResult.Status.DEFERRED, result.orElseThrow().status());
    assertTrue(received.isEmpty());
    assertEquals(0L, eventStore.currentVersion("order-2"));
    assertEquals(0L, eventQueue.countUnprocessed());
  }

  @Test
  void withoutTransactionPublishesImmediately() {
    assertFalse(txContext.isTransactionActive());

    Result<CommitResult> result = unitOfWork.commit("order-3", 0, List.of(event("order-3", "OrderPlaced")));

    assertEquals(CommitResult.Status.PUBLISHED, result.orElseThrow().status());
    assertEquals(List.of("OrderPlaced"), received);
    assertEquals(0L, eventQueue.countUnprocessed());
  }

  @Test
  void callbacksRequireActiveTransaction() {
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
    assertThrows(IllegalStateException.class, () -> txContext.afterRollback(() -> { }));
    assertThrows(IllegalStateException.class, txContext::currentConnection);
  }

  @Test
  void afterRollbackRunsOnlyOnRollback() {
    List<String> calls = new CopyOnWriteArrayList<>();

    TransactionStatus committed = txManager.getTransaction(new DefaultTransactionDefinition());
    txContext.afterRollback(() -> calls.add("rollback-1"));
    txContext.afterCommit(() -> calls.add("commit-1"));
    txManager.commit(committed);

    TransactionStatus rolledBack = txManager.getTransaction(new DefaultTransactionDefinition());
    txContext.afterRollback(() -> calls.add("rollback-2"));
    txContext.afterCommit(() -> calls.add("commit-2"));
    txManager.rollback(rolledBack);

    assertEquals(List.of("commit-1", "rollback-2"), calls);
  }

  @Test
  void failingCallbackDoesNotStopLaterCallbacks() {
    List<String> calls = new CopyOnWriteArrayList<>();

    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    txContext.afterCommit(() -> {
      throw new IllegalStateException("boom");
    });
    txContext.afterCommit(() -> calls.add("second"));
    txManager.commit(status);

    assertEquals(List.of("second"), calls);
    assertFalse(txContext.isTransactionActive());
  }

  private static Event event(String aggregateId, String type) {
    return Event.builder(type)
        .aggregateId(aggregateId)
        .aggregateType("Order")
        .occurredAt(Instant.now())
        .payload(Map.of("type", type))
        .build();
  }
}
