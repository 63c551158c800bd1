package eventsource.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper shared by the stores of this module.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new EventStoreException("Failed to execute update: " + sql, e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to execute query: " + sql, e);
    }
  }

  /** Execute SELECT expected to return at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Execute a SELECT returning a single numeric column, 0 when there is no row. */
  public static long queryLong(Connection conn, String sql, Object... params) {
    return queryOne(conn, sql, rs -> rs.getLong(1), params).orElse(0L);
  }

  public static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setNull(i + 1, Types.VARCHAR);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
