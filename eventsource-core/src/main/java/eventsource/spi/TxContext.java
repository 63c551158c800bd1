package eventsource.spi;

import java.sql.Connection;

/**
 * Abstracts the transaction lifecycle so appends can join the caller's transaction
 * without depending on a specific transaction manager.
 *
 * <p>When a transaction is active, JDBC stores write through {@link #currentConnection()}
 * and the unit of work defers publication to {@link #afterCommit(Runnable)}.
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);

  /**
   * Registers a callback to run after the current transaction rolls back.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterRollback(Runnable callback);
}
