package eventsource.jdbc.tx;

import eventsource.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for plain JDBC. Obtains a connection, disables auto-commit and
 * binds it to a {@link ThreadLocalTxContext}.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *   unitOfWork.commit(order);
 *   tx.commit();
 * }
 * }</pre>
 *
 * <p>After-commit callbacks (such as deferred publishing) run after the connection has
 * committed and been unbound, so they may open transactions of their own.
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  @FunctionalInterface
  public interface TxWork<T> {
    T run() throws Exception;
  }

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a transaction bound to the calling thread.
   *
   * @return a handle to use with try-with-resources; closing it without
   *     {@link Transaction#commit()} rolls back
   * @throws SQLException if a connection cannot be obtained
   * @throws IllegalStateException if this thread already has a transaction
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs work in a transaction, committing when it returns and rolling back when it throws.
   */
  public <T> T execute(TxWork<T> work) throws Exception {
    try (Transaction tx = begin()) {
      T result = work.run();
      tx.commit();
      return result;
    }
  }

  /**
   * An active transaction handle.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        finish(false);
        throw e;
      }
      finish(true);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish(boolean committed) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        logger.log(Level.FINE, "Could not restore auto-commit", e);
      } finally {
        connection.close();
      }
      txContext.complete(committed);
    }
  }
}
