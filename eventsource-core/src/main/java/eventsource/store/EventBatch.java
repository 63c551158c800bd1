package eventsource.store;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.ValidationError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validation and sequence stamping shared by event store implementations.
 */
public final class EventBatch {

  private EventBatch() {
  }

  /**
   * Checks that every event belongs to {@code aggregateId}, that ids are unique and that
   * positions are contiguous from {@code expectedVersion + 1}, stamping unassigned ones.
   *
   * @return the stamped events, or a {@link ValidationError}
   */
  public static Result<List<Event>> prepare(String aggregateId, long expectedVersion, List<Event> events) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(events, "events");
    if (expectedVersion < 0) {
      return Result.err(new ValidationError("expectedVersion", "must be >= 0, got " + expectedVersion));
    }
    List<Event> stamped = new ArrayList<>(events.size());
    Set<String> ids = new HashSet<>();
    long next = expectedVersion + 1;
    for (Event event : events) {
      if (event == null) {
        return Result.err(new ValidationError("events", "batch contains a null event"));
      }
      if (!aggregateId.equals(event.aggregateId())) {
        return Result.err(new ValidationError("aggregateId", "event " + event.eventId()
            + " belongs to " + event.aggregateId() + ", not " + aggregateId));
      }
      if (!ids.add(event.eventId())) {
        return Result.err(new ValidationError("eventId", "duplicate event id " + event.eventId()));
      }
      if (event.sequenceNumber() == 0) {
        stamped.add(event.withSequenceNumber(next));
      } else if (event.sequenceNumber() == next) {
        stamped.add(event);
      } else {
        return Result.err(new ValidationError("sequenceNumber", "event " + event.eventId()
            + " has position " + event.sequenceNumber() + ", expected " + next));
      }
      next++;
    }
    return Result.ok(List.copyOf(stamped));
  }
}
