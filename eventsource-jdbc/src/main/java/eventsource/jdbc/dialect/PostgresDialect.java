package eventsource.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {
  private static final String UNIQUE_VIOLATION = "23505";

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    return UNIQUE_VIOLATION.equals(e.getSQLState());
  }
}
