package eventsource.bus;

import eventsource.Event;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a handler at most once per dedup key, so redelivered events have no repeated
 * side effects.
 *
 * <p>The key is recorded only after the delegate returns normally; a failed delivery
 * stays eligible for redelivery. Concurrent deliveries of the same event are already
 * excluded by the bus's {@link InFlightTracker}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * bus.subscribe("OrderShipped", "shipping-mailer",
 *     new IdempotentEventHandler("shipping-mailer", keyStore, mailer::sendShippedMail));
 * }</pre>
 */
public final class IdempotentEventHandler implements EventHandler {
  private static final Logger logger = Logger.getLogger(IdempotentEventHandler.class.getName());

  private final String consumer;
  private final ProcessedKeyStore keyStore;
  private final EventHandler delegate;
  private final Function<Event, String> dedupKey;

  /**
   * Deduplicates on the event id.
   */
  public IdempotentEventHandler(String consumer, ProcessedKeyStore keyStore, EventHandler delegate) {
    this(consumer, keyStore, delegate, Event::eventId);
  }

  public IdempotentEventHandler(String consumer, ProcessedKeyStore keyStore, EventHandler delegate,
      Function<Event, String> dedupKey) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.dedupKey = Objects.requireNonNull(dedupKey, "dedupKey");
  }

  @Override
  public void handle(Event event) throws Exception {
    String key = dedupKey.apply(event);
    if (keyStore.isProcessed(consumer, key)) {
      logger.log(Level.FINE, "{0} already handled {1}; skipping", new Object[]{consumer, key});
      return;
    }
    delegate.handle(event);
    keyStore.markProcessed(consumer, key);
  }
}
