package eventsource.queue;

import eventsource.Result;
import eventsource.spi.QueuedMessage;

/**
 * Delivers one queued row. A row is marked processed only when the result is ok;
 * an error or a thrown exception counts as a failed attempt.
 *
 * @see EventQueueHandler
 * @see CommandQueueHandler
 */
@FunctionalInterface
public interface QueueHandler {

  Result<?> handle(QueuedMessage message);
}
