package eventsource.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 dialect, used for tests and embedded deployments.
 */
public final class H2Dialect extends AbstractDialect {

  /** H2 reports duplicate keys with both SQLSTATE and vendor code 23505. */
  private static final int DUPLICATE_KEY = 23505;

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current.getErrorCode() == DUPLICATE_KEY
          || String.valueOf(DUPLICATE_KEY).equals(current.getSQLState())) {
        return true;
      }
    }
    return false;
  }
}
