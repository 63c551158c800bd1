package eventsource.bus;

import eventsource.Event;
import eventsource.Result;

import java.util.List;

/**
 * Topic-based publish/subscribe for domain events.
 *
 * <p>Handlers for one event run in descending {@link Subscription#priority()} order,
 * ties in registration order. Failures never stop sibling handlers or later events;
 * every failure of a publish call is returned together as
 * {@link eventsource.error.EventSourcingError.HandlerFailures}.
 *
 * @see DefaultEventBus
 */
public interface EventBus {

  int PRIORITY_HIGH = 100;
  int PRIORITY_NORMAL = 0;
  int PRIORITY_LOW = -100;

  /**
   * Subscribes a handler to the topics (event types) matching {@code topicPattern}.
   *
   * @param handlerName stable name, used in error reports and delivery deduplication
   * @throws IllegalStateException if a subscription with the same handler name exists
   * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
   */
  Subscription subscribe(String topicPattern, String handlerName, EventHandler handler, int priority);

  default Subscription subscribe(String topicPattern, String handlerName, EventHandler handler) {
    return subscribe(topicPattern, handlerName, handler, PRIORITY_NORMAL);
  }

  /**
   * @return {@code true} if the subscription was registered
   */
  boolean unsubscribe(Subscription subscription);

  List<Subscription> subscriptions();

  Result<DispatchReport> publish(Event event);

  /**
   * Publishes events in batches using the bus's default batch size.
   */
  Result<DispatchReport> publishMany(List<Event> events);

  /**
   * Publishes events in batches of {@code batchSize}. Within a batch, events of one
   * aggregate are delivered in list order while different aggregates run concurrently.
   * Each batch completes before the next starts.
   */
  Result<DispatchReport> publishMany(List<Event> events, int batchSize);
}
