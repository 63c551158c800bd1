package eventsource.jdbc.tx;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ThreadLocalTxContextTest {
  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    txContext = new ThreadLocalTxContext();
  }

  @Test
  void inactiveUntilBound() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
    assertThrows(IllegalStateException.class, () -> txContext.afterRollback(() -> { }));
  }

  @Test
  void boundConnectionIsVisibleOnlyToItsThread() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      txContext.bind(conn);
      assertTrue(txContext.isTransactionActive());
      assertSame(conn, txContext.currentConnection());

      AtomicBoolean seenElsewhere = new AtomicBoolean(true);
      Thread other = new Thread(() -> seenElsewhere.set(txContext.isTransactionActive()));
      other.start();
      other.join();
      assertFalse(seenElsewhere.get());

      assertThrows(IllegalStateException.class, () -> txContext.bind(conn));
      txContext.complete(true);
    }
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void completeRunsCallbacksForOutcomeInOrder() throws SQLException {
    List<String> calls = new ArrayList<>();
    try (Connection conn = dataSource.getConnection()) {
      txContext.bind(conn);
      txContext.afterCommit(() -> calls.add("commit-1"));
      txContext.afterCommit(() -> calls.add("commit-2"));
      txContext.afterRollback(() -> calls.add("rollback"));
      txContext.complete(true);

      txContext.bind(conn);
      txContext.afterCommit(() -> calls.add("commit-3"));
      txContext.afterRollback(() -> calls.add("rollback-2"));
      txContext.complete(false);
    }
    assertEquals(List.of("commit-1", "commit-2", "rollback-2"), calls);
  }

  @Test
  void everyCallbackRunsWhenOneFails() throws SQLException {
    AtomicInteger ran = new AtomicInteger();
    try (Connection conn = dataSource.getConnection()) {
      txContext.bind(conn);
      txContext.afterCommit(() -> {
        throw new IllegalStateException("first");
      });
      txContext.afterCommit(ran::incrementAndGet);
      txContext.afterCommit(() -> {
        throw new IllegalArgumentException("second");
      });

      IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> txContext.complete(true));
      assertEquals(1, thrown.getSuppressed().length);
    }
    assertEquals(1, ran.get());
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void completeWithoutTransactionIsNoOp() {
    assertDoesNotThrow(() -> txContext.complete(true));
  }
}
