package eventsource.jdbc.dialect;

import eventsource.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry for database dialects with auto-detection support.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventsource.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect byUrl = Dialects.detect("jdbc:postgresql://localhost/app");
 * Dialect byName = Dialects.get("mysql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .collect(Collectors.toUnmodifiableList());

    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * @throws IllegalArgumentException if no dialect has this name (case-insensitive)
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * @throws IllegalStateException if the connection URL cannot be read
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect matches it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + DIALECTS.stream()
            .flatMap(d -> d.jdbcUrlPrefixes().stream())
            .collect(Collectors.toList()));
  }
}
