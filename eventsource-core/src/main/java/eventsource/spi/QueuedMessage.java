package eventsource.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Unprocessed row of a durable message queue.
 *
 * @param id          monotonic row id
 * @param messageId   id of the queued event or command
 * @param messageType event or command type
 * @param payload     JSON encoding of the event or command
 * @param attempts    failed delivery attempts so far
 * @param createdAt   time the row was written
 */
public record QueuedMessage(
    long id,
    String messageId,
    String messageType,
    String payload,
    int attempts,
    Instant createdAt
) {
  public QueuedMessage {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(messageType, "messageType");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
