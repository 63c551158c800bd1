package eventsource.jdbc;

import eventsource.spi.ConnectionProvider;
import eventsource.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs store work on the caller's transaction when one is active, otherwise on a
 * connection of its own.
 *
 * <p>Joining the caller's transaction is what makes an append and its queue rows
 * commit or roll back together with the caller's own writes.
 */
public final class JdbcSession {
  private static final Logger logger = Logger.getLogger(JdbcSession.class.getName());

  @FunctionalInterface
  public interface SqlWork<T> {
    T run(Connection connection) throws SQLException;
  }

  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;

  /**
   * @param txContext transaction context to join, or {@code null} to always use own connections
   */
  public JdbcSession(ConnectionProvider connectionProvider, TxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = txContext;
  }

  public boolean isTransactionActive() {
    return txContext != null && txContext.isTransactionActive();
  }

  /**
   * Runs {@code callback} after the surrounding transaction commits, or immediately when
   * there is none.
   */
  public void afterCommit(Runnable callback) {
    if (isTransactionActive()) {
      txContext.afterCommit(callback);
    } else {
      callback.run();
    }
  }

  /**
   * Runs work atomically: inside the active transaction, or in a new one that is
   * committed on return and rolled back on any exception.
   */
  public <T> T inTransaction(SqlWork<T> work) {
    if (isTransactionActive()) {
      try {
        return work.run(txContext.currentConnection());
      } catch (SQLException e) {
        throw new EventStoreException("Statement failed in caller transaction", e);
      }
    }
    try (Connection connection = connectionProvider.getConnection()) {
      boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        T result = work.run(connection);
        connection.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(connection, e);
        throw e instanceof SQLException sql ? new EventStoreException("Transaction failed", sql)
            : (RuntimeException) e;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to obtain or release connection", e);
    }
  }

  /**
   * Runs read-only work on the active transaction's connection or a fresh auto-commit one.
   */
  public <T> T withConnection(SqlWork<T> work) {
    if (isTransactionActive()) {
      try {
        return work.run(txContext.currentConnection());
      } catch (SQLException e) {
        throw new EventStoreException("Statement failed in caller transaction", e);
      }
    }
    try (Connection connection = connectionProvider.getConnection()) {
      return work.run(connection);
    } catch (SQLException e) {
      throw new EventStoreException("Query failed", e);
    }
  }

  private static void rollbackQuietly(Connection connection, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }
}
