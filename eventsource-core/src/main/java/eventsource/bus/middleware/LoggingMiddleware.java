package eventsource.bus.middleware;

import eventsource.Event;
import eventsource.bus.Delivery;
import eventsource.bus.EventMiddleware;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs each delivery at {@code FINE} and each failed delivery at {@code WARNING}.
 */
public final class LoggingMiddleware implements EventMiddleware {
  private static final Logger logger = Logger.getLogger(LoggingMiddleware.class.getName());

  @Override
  public void invoke(Delivery delivery, Next next) throws Exception {
    Event event = delivery.event();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Delivering " + event.eventType() + " [" + event.eventId() + "] of "
          + event.aggregateId() + " to " + delivery.handlerName());
    }
    try {
      next.proceed();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Handler " + delivery.handlerName() + " failed on "
          + event.eventType() + " [" + event.eventId() + "] of " + event.aggregateId(), e);
      throw e;
    }
  }
}
