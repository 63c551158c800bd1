package eventsource.jdbc.spi;

import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the SQL that differs between databases. Register custom
 * dialects via {@code META-INF/services/eventsource.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, PostgreSQL, MySQL.
 *
 * @see eventsource.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Classpath resource holding the DDL for every table of this module.
   */
  default String schemaResource() {
    return "schema/" + name() + ".sql";
  }

  /**
   * Whether the exception reports a primary key or unique constraint violation.
   */
  boolean isUniqueViolation(SQLException e);

  /**
   * SQL deleting processed queue rows older than a cutoff, oldest first.
   *
   * <p>Parameters: processed_at cutoff (Timestamp), limit (int)
   */
  String purgeProcessedSql(String table);

  /**
   * SQL selecting unprocessed queue rows created before a cutoff, oldest first.
   *
   * <p>Parameters: created_at cutoff (Timestamp), max attempts (int), limit (int)
   *
   * <p>Returns columns: id, message_id, message_type, payload, attempts, created_at
   */
  String pollUnprocessedSql(String table);
}
