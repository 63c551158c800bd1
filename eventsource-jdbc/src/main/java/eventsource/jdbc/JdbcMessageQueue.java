package eventsource.jdbc;

import eventsource.jdbc.spi.Dialect;
import eventsource.spi.MessageQueue;
import eventsource.spi.QueuedMessage;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MessageQueue} over an append-only table ({@code es_event_queue} or
 * {@code es_command_queue}).
 *
 * <p>Enqueue joins the caller's transaction when one is active, so a row becomes
 * visible exactly when the write that produced it commits. Listeners registered with
 * {@link #onEnqueued} run after that commit. With a notify channel set on PostgreSQL,
 * each enqueue also issues {@code pg_notify} so that other processes running a
 * {@link PostgresNotificationListener} wake up immediately.
 */
public final class JdbcMessageQueue implements MessageQueue {
  private static final Logger logger = Logger.getLogger(JdbcMessageQueue.class.getName());
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final JdbcTemplate.RowMapper<QueuedMessage> ROW_MAPPER = rs -> new QueuedMessage(
      rs.getLong("id"),
      rs.getString("message_id"),
      rs.getString("message_type"),
      rs.getString("payload"),
      rs.getInt("attempts"),
      rs.getTimestamp("created_at").toInstant());

  private final String name;
  private final String table;
  private final JdbcSession session;
  private final Dialect dialect;
  private final String notifyChannel;
  private final Clock clock;
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  public JdbcMessageQueue(String name, String table, JdbcSession session, Dialect dialect) {
    this(name, table, session, dialect, null, Clock.systemUTC());
  }

  /**
   * @param notifyChannel PostgreSQL channel to notify on enqueue, or {@code null}
   */
  public JdbcMessageQueue(String name, String table, JdbcSession session, Dialect dialect,
      String notifyChannel, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.table = TableNames.validate(table);
    this.session = Objects.requireNonNull(session, "session");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (notifyChannel != null) {
      TableNames.validate(notifyChannel);
    }
    this.notifyChannel = notifyChannel;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** The event queue on {@code es_event_queue}. */
  public static JdbcMessageQueue events(JdbcSession session, Dialect dialect) {
    return new JdbcMessageQueue("event", TableNames.EVENT_QUEUE, session, dialect);
  }

  /** The command queue on {@code es_command_queue}. */
  public static JdbcMessageQueue commands(JdbcSession session, Dialect dialect) {
    return new JdbcMessageQueue("command", TableNames.COMMAND_QUEUE, session, dialect);
  }

  @Override
  public String name() {
    return name;
  }

  public String notifyChannel() {
    return notifyChannel;
  }

  @Override
  public void enqueue(String messageId, String messageType, String payload) {
    session.inTransaction(conn -> {
      enqueue(conn, messageId, messageType, payload);
      return null;
    });
    session.afterCommit(this::fireEnqueued);
  }

  /**
   * Inserts a row on the given connection, as part of the caller's transaction. The
   * caller is responsible for {@link #fireEnqueued()} once the transaction commits.
   */
  void enqueue(Connection conn, String messageId, String messageType, String payload) {
    String sql = "INSERT INTO " + table +
        " (message_id, message_type, payload, processed, attempts, created_at)" +
        " VALUES (?,?,?,FALSE,0,?)";
    JdbcTemplate.update(conn, sql, messageId, messageType, payload, JdbcTemplate.timestamp(clock.instant()));
    if (notifyChannel != null) {
      JdbcTemplate.query(conn, "SELECT pg_notify(?, ?)", rs -> null, notifyChannel, messageId);
    }
  }

  void fireEnqueued() {
    for (Runnable listener : listeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Enqueue listener failed on " + name + " queue", e);
      }
    }
  }

  @Override
  public List<QueuedMessage> pollUnprocessed(Instant createdBefore, int maxAttempts, int limit) {
    return session.withConnection(conn -> JdbcTemplate.query(conn, dialect.pollUnprocessedSql(table),
        ROW_MAPPER, JdbcTemplate.timestamp(createdBefore), maxAttempts, limit));
  }

  @Override
  public boolean markProcessed(String messageId) {
    String sql = "UPDATE " + table + " SET processed = TRUE, processed_at = ?, last_error = NULL" +
        " WHERE message_id = ? AND processed = FALSE";
    return session.inTransaction(conn ->
        JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(clock.instant()), messageId)) > 0;
  }

  @Override
  public void markFailed(String messageId, String error) {
    String sql = "UPDATE " + table + " SET attempts = attempts + 1, last_error = ?" +
        " WHERE message_id = ? AND processed = FALSE";
    session.inTransaction(conn -> JdbcTemplate.update(conn, sql, truncateError(error), messageId));
  }

  @Override
  public long countUnprocessed() {
    return session.withConnection(conn ->
        JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + table + " WHERE processed = FALSE"));
  }

  @Override
  public int purgeProcessed(Instant olderThan, int limit) {
    return session.inTransaction(conn -> JdbcTemplate.update(conn, dialect.purgeProcessedSql(table),
        JdbcTemplate.timestamp(olderThan), limit));
  }

  @Override
  public void onEnqueued(Runnable listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
