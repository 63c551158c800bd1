package eventsource.jdbc;

import eventsource.Result;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.jdbc.spi.Dialect;
import eventsource.snapshot.Snapshot;
import eventsource.snapshot.SnapshotStore;
import eventsource.util.JsonCodec;

import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SnapshotStore} on the {@code es_snapshot} table, keyed by
 * {@code (aggregate_id, version)}. Saving a version that already exists replaces it.
 */
public final class JdbcSnapshotStore implements SnapshotStore {
  private final JdbcSession session;
  private final Dialect dialect;
  private final String table;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Snapshot> rowMapper;

  public JdbcSnapshotStore(JdbcSession session, Dialect dialect) {
    this(session, dialect, TableNames.SNAPSHOTS, JsonCodec.getDefault());
  }

  public JdbcSnapshotStore(JdbcSession session, Dialect dialect, String table, JsonCodec jsonCodec) {
    this.session = Objects.requireNonNull(session, "session");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new Snapshot(
        rs.getString("aggregate_id"),
        rs.getString("aggregate_type"),
        rs.getLong("version"),
        rs.getInt("schema_version"),
        this.jsonCodec.parseObject(rs.getString("state")),
        rs.getTimestamp("created_at").toInstant());
  }

  @Override
  public void save(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    String insert = "INSERT INTO " + table +
        " (aggregate_id, version, aggregate_type, schema_version, state, created_at) VALUES (?,?,?,?,?,?)";
    String update = "UPDATE " + table + " SET aggregate_type = ?, schema_version = ?, state = ?, created_at = ?" +
        " WHERE aggregate_id = ? AND version = ?";
    String state = jsonCodec.toJson(snapshot.state());
    session.inTransaction(conn -> {
      Savepoint savepoint = conn.setSavepoint();
      try {
        JdbcTemplate.update(conn, insert, snapshot.aggregateId(), snapshot.version(), snapshot.aggregateType(),
            snapshot.schemaVersion(), state, JdbcTemplate.timestamp(snapshot.createdAt()));
      } catch (EventStoreException e) {
        SQLException cause = e.sqlException();
        if (cause == null || !dialect.isUniqueViolation(cause)) {
          throw e;
        }
        conn.rollback(savepoint);
        JdbcTemplate.update(conn, update, snapshot.aggregateType(), snapshot.schemaVersion(), state,
            JdbcTemplate.timestamp(snapshot.createdAt()), snapshot.aggregateId(), snapshot.version());
      }
      return null;
    });
  }

  @Override
  public Result<Snapshot> load(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    String sql = "SELECT aggregate_id, version, aggregate_type, schema_version, state, created_at FROM " + table +
        " WHERE aggregate_id = ? ORDER BY version DESC LIMIT 1";
    Optional<Snapshot> latest = session.withConnection(
        conn -> JdbcTemplate.queryOne(conn, sql, rowMapper, aggregateId));
    return latest.<Result<Snapshot>>map(Result::ok)
        .orElseGet(() -> Result.err(new NotFound("Snapshot", aggregateId)));
  }

  @Override
  public int prune(String aggregateId, int keepLatest) {
    if (keepLatest < 1) {
      throw new IllegalArgumentException("keepLatest must be >= 1");
    }
    String threshold = "SELECT version FROM " + table +
        " WHERE aggregate_id = ? ORDER BY version DESC LIMIT 1 OFFSET ?";
    return session.inTransaction(conn -> {
      Optional<Long> oldestKept = JdbcTemplate.queryOne(conn, threshold, rs -> rs.getLong(1),
          aggregateId, keepLatest - 1);
      if (oldestKept.isEmpty()) {
        return 0;
      }
      return JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE aggregate_id = ? AND version < ?",
          aggregateId, oldestKept.get());
    });
  }
}
