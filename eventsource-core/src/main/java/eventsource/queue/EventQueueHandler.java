package eventsource.queue;

import eventsource.Event;
import eventsource.Result;
import eventsource.bus.EventBus;
import eventsource.spi.QueuedMessage;
import eventsource.upcast.UpcasterRegistry;
import eventsource.util.JsonCodec;

import java.util.Objects;

/**
 * Republishes queued events to the event bus, upcast to the current schema first.
 */
public final class EventQueueHandler implements QueueHandler {
  private final EventBus eventBus;
  private final UpcasterRegistry upcasters;
  private final JsonCodec jsonCodec;

  public EventQueueHandler(EventBus eventBus, UpcasterRegistry upcasters) {
    this(eventBus, upcasters, JsonCodec.getDefault());
  }

  public EventQueueHandler(EventBus eventBus, UpcasterRegistry upcasters, JsonCodec jsonCodec) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    this.upcasters = Objects.requireNonNull(upcasters, "upcasters");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Result<?> handle(QueuedMessage message) {
    Event event = jsonCodec.decodeEvent(message.payload());
    return upcasters.upcast(event).flatMap(eventBus::publish);
  }
}
