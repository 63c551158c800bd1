/**
 * Thread-bound transactions for applications that manage JDBC by hand.
 *
 * @see eventsource.jdbc.tx.JdbcTransactionManager
 * @see eventsource.jdbc.tx.ThreadLocalTxContext
 */
package eventsource.jdbc.tx;
