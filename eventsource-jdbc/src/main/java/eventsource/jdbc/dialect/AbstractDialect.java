package eventsource.jdbc.dialect;

import eventsource.jdbc.spi.Dialect;

import java.sql.SQLException;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  /** SQLSTATE class 23: integrity constraint violation. */
  private static final String INTEGRITY_VIOLATION = "23";

  @Override
  public boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (state != null && state.startsWith(INTEGRITY_VIOLATION)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String purgeProcessedSql(String table) {
    // Subquery limits the batch; works on H2 and PostgreSQL
    return "DELETE FROM " + table + " WHERE id IN (" +
        "SELECT id FROM " + table +
        " WHERE processed = TRUE AND processed_at < ?" +
        " ORDER BY processed_at LIMIT ?)";
  }

  @Override
  public String pollUnprocessedSql(String table) {
    return "SELECT id, message_id, message_type, payload, attempts, created_at" +
        " FROM " + table +
        " WHERE processed = FALSE AND created_at <= ? AND attempts < ?" +
        " ORDER BY created_at, id LIMIT ?";
  }
}
