package eventsource.queue;

import eventsource.spi.MessageQueue;
import eventsource.spi.QueuedMessage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Message queue held in memory, for tests and single-process deployments that accept
 * losing unprocessed rows on restart.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryMessageQueue implements MessageQueue {
  private static final Logger logger = Logger.getLogger(InMemoryMessageQueue.class.getName());

  private final String name;
  private final Clock clock;
  private final Map<String, Row> rows = new LinkedHashMap<>();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private long nextId = 1;

  public InMemoryMessageQueue(String name) {
    this(name, Clock.systemUTC());
  }

  public InMemoryMessageQueue(String name, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void enqueue(String messageId, String messageType, String payload) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(messageType, "messageType");
    Objects.requireNonNull(payload, "payload");
    synchronized (rows) {
      if (rows.containsKey(messageId)) {
        throw new IllegalStateException("Duplicate message id in " + name + " queue: " + messageId);
      }
      rows.put(messageId, new Row(nextId++, messageId, messageType, payload, clock.instant()));
    }
    for (Runnable listener : listeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Enqueue listener failed on " + name + " queue", e);
      }
    }
  }

  @Override
  public List<QueuedMessage> pollUnprocessed(Instant createdBefore, int maxAttempts, int limit) {
    List<QueuedMessage> result = new ArrayList<>();
    synchronized (rows) {
      for (Row row : rows.values()) {
        if (result.size() >= limit) {
          break;
        }
        if (row.processedAt == null && row.attempts < maxAttempts && !row.createdAt.isAfter(createdBefore)) {
          result.add(row.toMessage());
        }
      }
    }
    return result;
  }

  @Override
  public boolean markProcessed(String messageId) {
    synchronized (rows) {
      Row row = rows.get(messageId);
      if (row == null || row.processedAt != null) {
        return false;
      }
      row.processedAt = clock.instant();
      return true;
    }
  }

  @Override
  public void markFailed(String messageId, String error) {
    synchronized (rows) {
      Row row = rows.get(messageId);
      if (row != null && row.processedAt == null) {
        row.attempts++;
        row.lastError = error;
      }
    }
  }

  @Override
  public long countUnprocessed() {
    synchronized (rows) {
      return rows.values().stream().filter(row -> row.processedAt == null).count();
    }
  }

  @Override
  public int purgeProcessed(Instant olderThan, int limit) {
    int deleted = 0;
    synchronized (rows) {
      Iterator<Row> it = rows.values().iterator();
      while (it.hasNext() && deleted < limit) {
        Row row = it.next();
        if (row.processedAt != null && row.processedAt.isBefore(olderThan)) {
          it.remove();
          deleted++;
        }
      }
    }
    return deleted;
  }

  @Override
  public void onEnqueued(Runnable listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean isProcessed(String messageId) {
    synchronized (rows) {
      Row row = rows.get(messageId);
      return row != null && row.processedAt != null;
    }
  }

  /**
   * Failed attempts recorded for a row, or {@code -1} if the row does not exist.
   */
  public int attempts(String messageId) {
    synchronized (rows) {
      Row row = rows.get(messageId);
      return row == null ? -1 : row.attempts;
    }
  }

  public int size() {
    synchronized (rows) {
      return rows.size();
    }
  }

  private static final class Row {
    final long id;
    final String messageId;
    final String messageType;
    final String payload;
    final Instant createdAt;
    int attempts;
    String lastError;
    Instant processedAt;

    Row(long id, String messageId, String messageType, String payload, Instant createdAt) {
      this.id = id;
      this.messageId = messageId;
      this.messageType = messageType;
      this.payload = payload;
      this.createdAt = createdAt;
    }

    QueuedMessage toMessage() {
      return new QueuedMessage(id, messageId, messageType, payload, attempts, createdAt);
    }
  }
}
