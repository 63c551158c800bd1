package eventsource.store;

import eventsource.Event;

import java.util.Objects;

/**
 * An event together with its position in the store-wide append order.
 */
public record StoredEvent(long globalPosition, Event event) {
  public StoredEvent {
    Objects.requireNonNull(event, "event");
  }
}
