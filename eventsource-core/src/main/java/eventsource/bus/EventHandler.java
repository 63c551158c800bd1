package eventsource.bus;

import eventsource.Event;

/**
 * Receives events published on an {@link EventBus}.
 *
 * <p>Handlers must tolerate redelivery: the queue poller republishes any event whose
 * delivery did not fully succeed. Wrap a handler in {@link IdempotentEventHandler} to
 * run its side effects once per event.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * @throws Exception to report the delivery as failed
   */
  void handle(Event event) throws Exception;
}
