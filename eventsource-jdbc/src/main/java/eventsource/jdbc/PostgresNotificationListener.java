package eventsource.jdbc;

import eventsource.spi.ConnectionProvider;
import eventsource.util.DaemonThreadFactory;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Push path for a {@link JdbcMessageQueue} on PostgreSQL: holds a dedicated connection
 * that {@code LISTEN}s on the queue's notify channel and runs a callback, typically
 * {@link eventsource.queue.QueuePoller#wakeUp()}, for every batch of notifications.
 *
 * <p>Notifications are a latency optimisation only. A lost connection is logged and
 * re-established after {@code reconnectDelayMs}; the poller's fixed-delay sweep covers
 * anything missed meanwhile.
 *
 * <p>Requires the PostgreSQL JDBC driver on the classpath.
 */
public final class PostgresNotificationListener implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PostgresNotificationListener.class.getName());

  private final ConnectionProvider connectionProvider;
  private final String channel;
  private final Runnable onNotification;
  private final int pollTimeoutMs;
  private final long reconnectDelayMs;

  private ExecutorService executor;
  private volatile boolean closed;

  public PostgresNotificationListener(ConnectionProvider connectionProvider, String channel,
      Runnable onNotification) {
    this(connectionProvider, channel, onNotification, 500, 5000);
  }

  public PostgresNotificationListener(ConnectionProvider connectionProvider, String channel,
      Runnable onNotification, int pollTimeoutMs, long reconnectDelayMs) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.channel = TableNames.validate(channel);
    this.onNotification = Objects.requireNonNull(onNotification, "onNotification");
    if (pollTimeoutMs <= 0) {
      throw new IllegalArgumentException("pollTimeoutMs must be > 0");
    }
    if (reconnectDelayMs <= 0) {
      throw new IllegalArgumentException("reconnectDelayMs must be > 0");
    }
    this.pollTimeoutMs = pollTimeoutMs;
    this.reconnectDelayMs = reconnectDelayMs;
  }

  /**
   * Starts listening. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PostgresNotificationListener has been closed");
    }
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("eventsource-listen-" + channel + "-"));
    executor.execute(this::run);
  }

  private void run() {
    while (!closed) {
      try (Connection conn = connectionProvider.getConnection()) {
        try (Statement statement = conn.createStatement()) {
          statement.execute("LISTEN " + channel);
        }
        PGConnection pg = conn.unwrap(PGConnection.class);
        logger.log(Level.INFO, "Listening on channel {0}", channel);
        while (!closed) {
          PGNotification[] notifications = pg.getNotifications(pollTimeoutMs);
          if (notifications != null && notifications.length > 0) {
            onNotification.run();
          }
        }
      } catch (SQLException | RuntimeException e) {
        if (closed) {
          return;
        }
        logger.log(Level.WARNING, "Listener on " + channel + " failed; reconnecting in "
            + reconnectDelayMs + " ms", e);
        try {
          Thread.sleep(reconnectDelayMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(pollTimeoutMs + 1000L, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
