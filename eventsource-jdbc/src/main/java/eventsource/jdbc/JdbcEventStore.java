package eventsource.jdbc;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.ValidationError;
import eventsource.jdbc.spi.Dialect;
import eventsource.store.EventBatch;
import eventsource.store.EventStore;
import eventsource.store.StoredEvent;
import eventsource.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventStore} on the {@code es_event} table.
 *
 * <p>Optimistic concurrency is enforced by the unique constraint on
 * {@code (aggregate_id, sequence_number)}: a concurrent writer that read the same
 * version fails on insert, its batch is rolled back to a savepoint, and the append
 * returns {@code ConcurrencyConflict}. The batch and its event queue rows are written in
 * one transaction, either the caller's or one of its own.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class JdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private static final String COLUMNS = "global_position, event_id, aggregate_id, aggregate_type, event_type, " +
      "schema_version, sequence_number, occurred_at, correlation_id, causation_id, payload, metadata";

  private final JdbcSession session;
  private final Dialect dialect;
  private final String table;
  private final JdbcMessageQueue eventQueue;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<StoredEvent> rowMapper;

  private JdbcEventStore(Builder builder) {
    this.session = Objects.requireNonNull(builder.session, "session");
    this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
    this.table = TableNames.validate(builder.table);
    this.eventQueue = builder.eventQueue;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.rowMapper = this::mapRow;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Result<Long> append(String aggregateId, long expectedVersion, List<Event> events) {
    Result<List<Event>> prepared = EventBatch.prepare(aggregateId, expectedVersion, events);
    if (prepared.isErr()) {
      return prepared.map(ignored -> 0L);
    }
    List<Event> batch = prepared.orElseThrow();
    Result<Long> result = session.inTransaction(conn -> appendBatch(conn, aggregateId, expectedVersion, batch));
    if (result.isOk() && eventQueue != null && !batch.isEmpty()) {
      session.afterCommit(eventQueue::fireEnqueued);
    }
    return result;
  }

  private Result<Long> appendBatch(Connection conn, String aggregateId, long expectedVersion, List<Event> batch)
      throws SQLException {
    long actual = currentVersion(conn, aggregateId);
    if (actual != expectedVersion) {
      return Result.err(new ConcurrencyConflict(aggregateId, expectedVersion, actual));
    }
    if (batch.isEmpty()) {
      return Result.ok(actual);
    }

    String sql = "INSERT INTO " + table + " (event_id, aggregate_id, aggregate_type, event_type, " +
        "schema_version, sequence_number, occurred_at, correlation_id, causation_id, payload, metadata)" +
        " VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    Savepoint savepoint = conn.setSavepoint();
    try {
      for (Event event : batch) {
        JdbcTemplate.update(conn, sql,
            event.eventId(), event.aggregateId(), event.aggregateType(), event.eventType(),
            event.schemaVersion(), event.sequenceNumber(), JdbcTemplate.timestamp(event.occurredAt()),
            event.correlationId(), event.causationId(),
            jsonCodec.toJson(event.payload()), jsonCodec.toJson(event.metadata()));
        if (eventQueue != null) {
          eventQueue.enqueue(conn, event.eventId(), event.eventType(), jsonCodec.encodeEvent(event));
        }
      }
    } catch (EventStoreException e) {
      SQLException cause = e.sqlException();
      if (cause == null || !dialect.isUniqueViolation(cause)) {
        throw e;
      }
      conn.rollback(savepoint);
      long now = currentVersion(conn, aggregateId);
      if (now == expectedVersion) {
        return Result.err(new ValidationError("eventId", "an event id of this batch already exists"));
      }
      logger.log(Level.FINE, "Concurrent append to {0}: expected v{1}, now v{2}",
          new Object[]{aggregateId, expectedVersion, now});
      return Result.err(new ConcurrencyConflict(aggregateId, expectedVersion, now));
    }
    return Result.ok(expectedVersion + batch.size());
  }

  @Override
  public List<Event> read(String aggregateId, long afterVersion) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    String sql = "SELECT " + COLUMNS + " FROM " + table +
        " WHERE aggregate_id = ? AND sequence_number > ? ORDER BY sequence_number";
    return session.withConnection(conn -> JdbcTemplate.query(conn, sql, rowMapper, aggregateId, afterVersion))
        .stream()
        .map(StoredEvent::event)
        .toList();
  }

  @Override
  public List<StoredEvent> readAll(long afterPosition, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT " + COLUMNS + " FROM " + table +
        " WHERE global_position > ? ORDER BY global_position LIMIT ?";
    return session.withConnection(conn -> JdbcTemplate.query(conn, sql, rowMapper, afterPosition, limit));
  }

  @Override
  public long currentVersion(String aggregateId) {
    return session.withConnection(conn -> currentVersion(conn, aggregateId));
  }

  private long currentVersion(Connection conn, String aggregateId) {
    return JdbcTemplate.queryLong(conn,
        "SELECT COALESCE(MAX(sequence_number), 0) FROM " + table + " WHERE aggregate_id = ?", aggregateId);
  }

  private StoredEvent mapRow(ResultSet rs) throws SQLException {
    Map<String, String> metadata = new LinkedHashMap<>();
    jsonCodec.parseObject(rs.getString("metadata")).forEach((k, v) -> metadata.put(k, String.valueOf(v)));
    Event event = Event.builder(rs.getString("event_type"))
        .eventId(rs.getString("event_id"))
        .aggregateId(rs.getString("aggregate_id"))
        .aggregateType(rs.getString("aggregate_type"))
        .schemaVersion(rs.getInt("schema_version"))
        .sequenceNumber(rs.getLong("sequence_number"))
        .occurredAt(rs.getTimestamp("occurred_at").toInstant())
        .correlationId(rs.getString("correlation_id"))
        .causationId(rs.getString("causation_id"))
        .payload(jsonCodec.parseObject(rs.getString("payload")))
        .metadata(metadata)
        .build();
    return new StoredEvent(rs.getLong("global_position"), event);
  }

  /** Builder for {@link JdbcEventStore}. */
  public static final class Builder {
    private JdbcSession session;
    private Dialect dialect;
    private String table = TableNames.EVENTS;
    private JdbcMessageQueue eventQueue;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder session(JdbcSession session) {
      this.session = session;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Optional. Defaults to {@value TableNames#EVENTS}.
     */
    public Builder table(String table) {
      this.table = table;
      return this;
    }

    /**
     * Sets the queue that receives one row per appended event in the same transaction.
     *
     * <p>Optional.
     */
    public Builder eventQueue(JdbcMessageQueue eventQueue) {
      this.eventQueue = eventQueue;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public JdbcEventStore build() {
      return new JdbcEventStore(this);
    }
  }
}
