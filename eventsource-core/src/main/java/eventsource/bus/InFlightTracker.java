package eventsource.bus;

/**
 * Guards against delivering the same event to the same handler concurrently.
 *
 * <p>Keys have the form {@code handlerName + ":" + eventId}.
 */
public interface InFlightTracker {

  /**
   * Claims a delivery key.
   *
   * @return {@code false} if the key is already claimed by another delivery
   */
  boolean tryAcquire(String deliveryKey);

  void release(String deliveryKey);

  static String key(String handlerName, String eventId) {
    return handlerName + ":" + eventId;
  }
}
