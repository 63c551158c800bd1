package eventsource.store;

import eventsource.Event;
import eventsource.Result;

import java.util.List;

/**
 * Append-only, per-aggregate event log with optimistic concurrency.
 *
 * <p>Implementations make the version check and sequence assignment a single
 * serialization point per aggregate: of two concurrent appends with the same
 * {@code expectedVersion}, exactly one succeeds and the other returns
 * {@link eventsource.error.EventSourcingError.ConcurrencyConflict}.
 *
 * @see InMemoryEventStore
 */
public interface EventStore {

  /**
   * Atomically appends a batch to the stream of {@code aggregateId}.
   *
   * <p>Events with {@code sequenceNumber == 0} are stamped with contiguous positions
   * starting at {@code expectedVersion + 1}; pre-stamped events must already carry
   * exactly those positions.
   *
   * @return the new stream version, a {@code ConcurrencyConflict} if the stream is not
   *     at {@code expectedVersion}, or a {@code ValidationError} for a malformed batch
   */
  Result<Long> append(String aggregateId, long expectedVersion, List<Event> events);

  /**
   * Returns the events of a stream strictly after {@code afterVersion}, in sequence order.
   */
  List<Event> read(String aggregateId, long afterVersion);

  default List<Event> read(String aggregateId) {
    return read(aggregateId, 0L);
  }

  /**
   * Returns up to {@code limit} events across all streams strictly after the given
   * global position, in append order.
   */
  List<StoredEvent> readAll(long afterPosition, int limit);

  /**
   * Returns the highest sequence number of a stream, {@code 0} for an empty stream.
   */
  long currentVersion(String aggregateId);
}
