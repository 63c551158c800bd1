package eventsource.jdbc;

import eventsource.jdbc.spi.Dialect;
import eventsource.spi.ConnectionProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the tables of this module from the dialect's bundled DDL.
 *
 * <p>The scripts use the default table names of {@link TableNames}. Deployments that
 * manage schema with a migration tool can copy them from {@code schema/*.sql}.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  private JdbcSchema() {}

  /**
   * Runs every statement of the dialect's schema script. Statements are idempotent on
   * H2 and PostgreSQL; on MySQL the index statements fail if run twice.
   */
  public static void create(ConnectionProvider connectionProvider, Dialect dialect) {
    List<String> statements = statements(dialect);
    try (Connection conn = connectionProvider.getConnection();
         Statement statement = conn.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to create schema for " + dialect.name(), e);
    }
    logger.log(Level.INFO, "Applied {0} schema ({1} statements)",
        new Object[]{dialect.name(), statements.size()});
  }

  static List<String> statements(Dialect dialect) {
    String script;
    try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(dialect.schemaResource())) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + dialect.schemaResource());
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + dialect.schemaResource(), e);
    }
    List<String> statements = new ArrayList<>();
    for (String part : script.split(";")) {
      if (!part.isBlank()) {
        statements.add(part.trim());
      }
    }
    return statements;
  }
}
