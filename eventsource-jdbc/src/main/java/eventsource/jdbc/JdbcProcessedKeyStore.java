package eventsource.jdbc;

import eventsource.bus.ProcessedKeyStore;
import eventsource.jdbc.spi.Dialect;

import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ProcessedKeyStore} on the {@code es_processed_key} table. The primary key on
 * {@code (consumer, message_key)} decides which of two racing deliveries records a key.
 *
 * <p>When the handler writes to the same database inside the caller's transaction,
 * recording the key there makes the side effect and the dedup record commit together.
 */
public final class JdbcProcessedKeyStore implements ProcessedKeyStore {
  private final JdbcSession session;
  private final Dialect dialect;
  private final String table;
  private final Clock clock;

  public JdbcProcessedKeyStore(JdbcSession session, Dialect dialect) {
    this(session, dialect, TableNames.PROCESSED_KEYS, Clock.systemUTC());
  }

  public JdbcProcessedKeyStore(JdbcSession session, Dialect dialect, String table, Clock clock) {
    this.session = Objects.requireNonNull(session, "session");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean isProcessed(String consumer, String key) {
    return session.withConnection(conn -> JdbcTemplate.queryLong(conn,
        "SELECT COUNT(*) FROM " + table + " WHERE consumer = ? AND message_key = ?",
        Objects.requireNonNull(consumer, "consumer"), Objects.requireNonNull(key, "key"))) > 0;
  }

  @Override
  public boolean markProcessed(String consumer, String key) {
    String sql = "INSERT INTO " + table + " (consumer, message_key, processed_at) VALUES (?,?,?)";
    return session.inTransaction(conn -> {
      Savepoint savepoint = conn.setSavepoint();
      try {
        JdbcTemplate.update(conn, sql, consumer, key, JdbcTemplate.timestamp(clock.instant()));
        return true;
      } catch (EventStoreException e) {
        SQLException cause = e.sqlException();
        if (cause == null || !dialect.isUniqueViolation(cause)) {
          throw e;
        }
        conn.rollback(savepoint);
        return false;
      }
    });
  }

  @Override
  public int purge(Instant olderThan) {
    return session.inTransaction(conn -> JdbcTemplate.update(conn,
        "DELETE FROM " + table + " WHERE processed_at < ?", JdbcTemplate.timestamp(olderThan)));
  }
}
