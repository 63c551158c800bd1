package eventsource.bus;

/**
 * Outcome of a publish call in which every delivery succeeded.
 *
 * @param events     events published
 * @param deliveries handler invocations that completed
 * @param skipped    deliveries skipped because the same event was already in flight
 *                   for the same handler
 */
public record DispatchReport(int events, int deliveries, int skipped) {

  static final DispatchReport EMPTY = new DispatchReport(0, 0, 0);

  DispatchReport plus(DispatchReport other) {
    return new DispatchReport(events + other.events, deliveries + other.deliveries,
        skipped + other.skipped);
  }
}
