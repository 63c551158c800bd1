package eventsource.bus;

/**
 * Wraps every delivery of an event to a subscription.
 *
 * <p>Middlewares run in registration order around the handler. A middleware may
 * short-circuit by not calling {@link Next#proceed()}, in which case the delivery counts
 * as successful; throwing counts it as failed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventMiddleware audit = (delivery, next) -> {
 *   auditLog.record(delivery.event().eventId(), delivery.handlerName());
 *   next.proceed();
 * };
 * }</pre>
 */
@FunctionalInterface
public interface EventMiddleware {

  void invoke(Delivery delivery, Next next) throws Exception;

  /**
   * Continuation to the next middleware, or to the handler itself.
   */
  @FunctionalInterface
  interface Next {
    void proceed() throws Exception;
  }
}
