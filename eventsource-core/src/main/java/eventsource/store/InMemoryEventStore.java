package eventsource.store;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.ValidationError;
import eventsource.spi.MessageQueue;
import eventsource.util.JsonCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event store held in memory. Intended for tests and single-process tools.
 *
 * <p>Appends to one aggregate are serialized through {@link ConcurrentHashMap#compute};
 * appends to different aggregates proceed in parallel and only contend on the global
 * log. When an event queue is attached, its rows are written inside the same critical
 * section so a committed event is always visible in the queue.
 *
 * <p>Event ids are unique across all aggregates; an append carrying an id that is
 * already stored fails with a {@link ValidationError} and writes nothing.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(InMemoryEventStore.class.getName());

  private final Map<String, List<Event>> streams = new ConcurrentHashMap<>();
  private final List<StoredEvent> globalLog = new ArrayList<>();
  // guarded by globalLog
  private final Set<String> eventIds = new HashSet<>();
  private final MessageQueue eventQueue;
  private final JsonCodec jsonCodec;

  public InMemoryEventStore() {
    this(null);
  }

  /**
   * @param eventQueue queue receiving one row per appended event, or {@code null}
   */
  public InMemoryEventStore(MessageQueue eventQueue) {
    this(eventQueue, JsonCodec.getDefault());
  }

  public InMemoryEventStore(MessageQueue eventQueue, JsonCodec jsonCodec) {
    this.eventQueue = eventQueue;
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Result<Long> append(String aggregateId, long expectedVersion, List<Event> events) {
    Result<List<Event>> prepared = EventBatch.prepare(aggregateId, expectedVersion, events);
    if (prepared.isErr()) {
      return prepared.map(ignored -> 0L);
    }
    List<Event> batch = prepared.orElseThrow();
    AtomicReference<Result<Long>> outcome = new AtomicReference<>();

    streams.compute(aggregateId, (id, stream) -> {
      List<Event> current = stream == null ? List.of() : stream;
      long actual = current.size();
      if (actual != expectedVersion) {
        outcome.set(Result.err(new ConcurrencyConflict(aggregateId, expectedVersion, actual)));
        return stream;
      }
      if (batch.isEmpty()) {
        outcome.set(Result.ok(actual));
        return stream;
      }
      synchronized (globalLog) {
        for (Event event : batch) {
          if (eventIds.contains(event.eventId())) {
            outcome.set(Result.err(new ValidationError("eventId",
                "an event with id " + event.eventId() + " already exists")));
            return stream;
          }
        }
        if (eventQueue != null) {
          for (Event event : batch) {
            eventQueue.enqueue(event.eventId(), event.eventType(), jsonCodec.encodeEvent(event));
          }
        }
        for (Event event : batch) {
          eventIds.add(event.eventId());
          globalLog.add(new StoredEvent(globalLog.size() + 1L, event));
        }
      }
      List<Event> next = new ArrayList<>(current.size() + batch.size());
      next.addAll(current);
      next.addAll(batch);
      outcome.set(Result.ok((long) next.size()));
      return Collections.unmodifiableList(next);
    });

    Result<Long> result = outcome.get();
    if (logger.isLoggable(Level.FINE) && result.isOk()) {
      logger.fine("Appended " + batch.size() + " event(s) to " + aggregateId
          + ", version now " + result.orElseThrow());
    }
    return result;
  }

  @Override
  public List<Event> read(String aggregateId, long afterVersion) {
    List<Event> stream = streams.get(aggregateId);
    if (stream == null || afterVersion >= stream.size()) {
      return List.of();
    }
    return List.copyOf(stream.subList((int) Math.max(0L, afterVersion), stream.size()));
  }

  @Override
  public List<StoredEvent> readAll(long afterPosition, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    synchronized (globalLog) {
      int from = (int) Math.min(Math.max(0L, afterPosition), globalLog.size());
      int to = (int) Math.min(globalLog.size(), (long) from + limit);
      return List.copyOf(globalLog.subList(from, to));
    }
  }

  @Override
  public long currentVersion(String aggregateId) {
    List<Event> stream = streams.get(aggregateId);
    return stream == null ? 0L : stream.size();
  }
}
