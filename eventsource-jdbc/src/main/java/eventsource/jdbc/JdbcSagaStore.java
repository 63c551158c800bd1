package eventsource.jdbc;

import eventsource.Result;
import eventsource.command.Command;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.jdbc.spi.Dialect;
import eventsource.saga.CompletedStep;
import eventsource.saga.SagaInstance;
import eventsource.saga.SagaStatus;
import eventsource.saga.SagaStore;
import eventsource.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SagaStore} on the {@code es_saga} table.
 *
 * <p>The {@code version} column is the optimistic lock: an update only matches the row
 * at the expected version, and a first save only succeeds if no row exists yet.
 * Completed steps are stored as a JSON array of {@code {name, compensation}} where the
 * compensation uses the command envelope of {@link JsonCodec#encodeCommand}.
 */
public final class JdbcSagaStore implements SagaStore {
  private static final String COLUMNS = "saga_id, saga_type, status, data, completed_steps, compensation_log, " +
      "handled_events, retry_count, failure_reason, version, created_at, updated_at";

  private final JdbcSession session;
  private final Dialect dialect;
  private final String table;
  private final JsonCodec jsonCodec;

  public JdbcSagaStore(JdbcSession session, Dialect dialect) {
    this(session, dialect, TableNames.SAGAS, JsonCodec.getDefault());
  }

  public JdbcSagaStore(JdbcSession session, Dialect dialect, String table, JsonCodec jsonCodec) {
    this.session = Objects.requireNonNull(session, "session");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Result<SagaInstance> load(String sagaId) {
    Objects.requireNonNull(sagaId, "sagaId");
    Optional<SagaInstance> found = session.withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE saga_id = ?", this::mapRow, sagaId));
    return found.<Result<SagaInstance>>map(Result::ok)
        .orElseGet(() -> Result.err(new NotFound("Saga", sagaId)));
  }

  @Override
  public Result<SagaInstance> save(SagaInstance instance, long expectedVersion) {
    Objects.requireNonNull(instance, "instance");
    SagaInstance saved = instance.withVersion(expectedVersion + 1);
    return session.inTransaction(conn -> expectedVersion == 0L
        ? insert(conn, saved)
        : update(conn, saved, expectedVersion));
  }

  private Result<SagaInstance> insert(Connection conn, SagaInstance saga) throws SQLException {
    String sql = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    Savepoint savepoint = conn.setSavepoint();
    try {
      JdbcTemplate.update(conn, sql, saga.sagaId(), saga.sagaType(), saga.status().name(),
          jsonCodec.toJson(saga.data()), encodeSteps(saga.completedSteps()),
          jsonCodec.toJson(saga.compensationLog()), jsonCodec.toJson(saga.handledEvents()),
          saga.retryCount(), saga.failureReason(), saga.version(),
          JdbcTemplate.timestamp(saga.createdAt()), JdbcTemplate.timestamp(saga.updatedAt()));
    } catch (EventStoreException e) {
      SQLException cause = e.sqlException();
      if (cause == null || !dialect.isUniqueViolation(cause)) {
        throw e;
      }
      conn.rollback(savepoint);
      return Result.err(new ConcurrencyConflict(saga.sagaId(), 0L, currentVersion(conn, saga.sagaId())));
    }
    return Result.ok(saga);
  }

  private Result<SagaInstance> update(Connection conn, SagaInstance saga, long expectedVersion) {
    String sql = "UPDATE " + table + " SET status = ?, data = ?, completed_steps = ?, compensation_log = ?," +
        " handled_events = ?, retry_count = ?, failure_reason = ?, version = ?, updated_at = ?" +
        " WHERE saga_id = ? AND version = ?";
    int updated = JdbcTemplate.update(conn, sql, saga.status().name(), jsonCodec.toJson(saga.data()),
        encodeSteps(saga.completedSteps()), jsonCodec.toJson(saga.compensationLog()),
        jsonCodec.toJson(saga.handledEvents()), saga.retryCount(), saga.failureReason(), saga.version(),
        JdbcTemplate.timestamp(saga.updatedAt()), saga.sagaId(), expectedVersion);
    if (updated == 0) {
      return Result.err(new ConcurrencyConflict(saga.sagaId(), expectedVersion, currentVersion(conn, saga.sagaId())));
    }
    return Result.ok(saga);
  }

  @Override
  public List<SagaInstance> findByStatus(SagaStatus status) {
    Objects.requireNonNull(status, "status");
    return session.withConnection(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE status = ? ORDER BY updated_at",
        this::mapRow, status.name()));
  }

  @Override
  public boolean delete(String sagaId) {
    return session.inTransaction(conn ->
        JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE saga_id = ?", sagaId)) > 0;
  }

  private long currentVersion(Connection conn, String sagaId) {
    return JdbcTemplate.queryLong(conn, "SELECT version FROM " + table + " WHERE saga_id = ?", sagaId);
  }

  private String encodeSteps(List<CompletedStep> steps) {
    List<Map<String, Object>> encoded = new ArrayList<>(steps.size());
    for (CompletedStep step : steps) {
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("name", step.name());
      json.put("compensation", step.compensation() == null ? null
          : jsonCodec.parseObject(jsonCodec.encodeCommand(step.compensation())));
      encoded.add(json);
    }
    return jsonCodec.toJson(encoded);
  }

  private List<CompletedStep> decodeSteps(String json) {
    List<CompletedStep> steps = new ArrayList<>();
    for (Object element : jsonCodec.parseList(json)) {
      Map<?, ?> step = (Map<?, ?>) element;
      Object compensation = step.get("compensation");
      Command command = compensation == null ? null : jsonCodec.decodeCommand(jsonCodec.toJson(compensation));
      steps.add(new CompletedStep((String) step.get("name"), command));
    }
    return steps;
  }

  private List<String> decodeStrings(String json) {
    List<String> values = new ArrayList<>();
    for (Object element : jsonCodec.parseList(json)) {
      values.add(String.valueOf(element));
    }
    return values;
  }

  private SagaInstance mapRow(ResultSet rs) throws SQLException {
    return new SagaInstance(
        rs.getString("saga_id"),
        rs.getString("saga_type"),
        SagaStatus.valueOf(rs.getString("status")),
        jsonCodec.parseObject(rs.getString("data")),
        decodeSteps(rs.getString("completed_steps")),
        decodeStrings(rs.getString("compensation_log")),
        decodeStrings(rs.getString("handled_events")),
        rs.getInt("retry_count"),
        rs.getString("failure_reason"),
        rs.getLong("version"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
