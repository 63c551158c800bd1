package eventsource.spring;

import eventsource.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} backed by Spring's {@link TransactionSynchronizationManager}.
 *
 * <p>Event appends, queue rows and saga state join the Spring-managed transaction
 * through {@link DataSourceUtils}; a unit of work committed inside it defers publishing
 * to a {@link TransactionSynchronization}.
 *
 * <p>Callbacks run from {@code afterCompletion}, once Spring has cleared the thread's
 * synchronizations. At that point {@link #isTransactionActive()} reports {@code false},
 * so handlers that write through the JDBC stores open their own transaction instead of
 * reusing the already committed connection.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(SpringTxContext.class.getName());

  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive()
        && TransactionSynchronizationManager.isSynchronizationActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronization("afterCommit");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_COMMITTED) {
          runQuietly(callback, "after-commit");
        }
      }
    });
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronization("afterRollback");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          runQuietly(callback, "after-rollback");
        }
      }
    });
  }

  /**
   * The transaction outcome is already final here; a failing callback must not surface
   * as an exception from the caller's commit.
   */
  private static void runQuietly(Runnable callback, String phase) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Spring " + phase + " callback failed", e);
    }
  }

  private void requireSynchronization(String operation) {
    if (!TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + operation + " callback");
    }
  }
}
