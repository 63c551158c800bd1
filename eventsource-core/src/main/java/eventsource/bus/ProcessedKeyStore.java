package eventsource.bus;

import java.time.Instant;

/**
 * Records which dedup keys a consumer has already handled.
 *
 * @see IdempotentEventHandler
 * @see InMemoryProcessedKeyStore
 */
public interface ProcessedKeyStore {

  boolean isProcessed(String consumer, String key);

  /**
   * Records a key as handled by a consumer.
   *
   * @return {@code false} if the key was already recorded
   */
  boolean markProcessed(String consumer, String key);

  /**
   * Deletes keys recorded before {@code olderThan}.
   *
   * @return the number of keys deleted
   */
  int purge(Instant olderThan);
}
