package eventsource.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 */
public final class MySqlDialect extends AbstractDialect {
  private static final int ER_DUP_ENTRY = 1062;

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY;
  }

  /**
   * MySQL rejects {@code LIMIT} in an {@code IN} subquery but supports it on
   * {@code DELETE} directly.
   */
  @Override
  public String purgeProcessedSql(String table) {
    return "DELETE FROM " + table +
        " WHERE processed = TRUE AND processed_at < ?" +
        " ORDER BY processed_at LIMIT ?";
  }
}
