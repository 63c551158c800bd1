package eventsource.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by the stores in this module.
 *
 * <p>Infrastructure failures are thrown, never returned inside a
 * {@link eventsource.Result}.
 */
public final class EventStoreException extends RuntimeException {
  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * The underlying {@link java.sql.SQLException}, if this exception wraps one.
   */
  public java.sql.SQLException sqlException() {
    return getCause() instanceof java.sql.SQLException sql ? sql : null;
  }
}
