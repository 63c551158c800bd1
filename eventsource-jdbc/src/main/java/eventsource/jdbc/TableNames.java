package eventsource.jdbc;

import java.util.Objects;

/**
 * Default table names and the validation applied to custom ones.
 */
public final class TableNames {
  public static final String EVENTS = "es_event";
  public static final String SNAPSHOTS = "es_snapshot";
  public static final String EVENT_QUEUE = "es_event_queue";
  public static final String COMMAND_QUEUE = "es_command_queue";
  public static final String SAGAS = "es_saga";
  public static final String PROCESSED_KEYS = "es_processed_key";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * @throws IllegalArgumentException if the name is not a plain SQL identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
