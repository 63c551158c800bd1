package eventsource.bus;

import eventsource.Event;

import java.util.Objects;

/**
 * One event on its way to one subscription, as seen by {@link EventMiddleware}.
 */
public record Delivery(Event event, Subscription subscription) {
  public Delivery {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(subscription, "subscription");
  }

  public String handlerName() {
    return subscription.handlerName();
  }
}
