/**
 * JDBC implementations of the event store, snapshot store, saga store, durable message
 * queues and processed-key store.
 *
 * <p>All stores run through a {@link eventsource.jdbc.JdbcSession}, which joins the
 * caller's transaction when a {@link eventsource.spi.TxContext} reports one. DDL for H2,
 * PostgreSQL and MySQL ships under {@code schema/}.
 *
 * @see eventsource.jdbc.JdbcEventStore
 * @see eventsource.jdbc.JdbcMessageQueue
 * @see eventsource.jdbc.JdbcSchema
 */
package eventsource.jdbc;
