package eventsource.spi;

import java.time.Instant;
import java.util.List;

/**
 * Durable, append-only queue of events or commands awaiting delivery.
 *
 * <p>The event store writes one row per appended event in the same atomic step as the
 * append, so an event that was committed but never published stays visible here until
 * it is marked processed. A {@link eventsource.queue.QueuePoller} sweeps the rows that
 * the in-process path failed to deliver.
 *
 * @see eventsource.queue.InMemoryMessageQueue
 */
public interface MessageQueue {

    /**
     * Name used in logs and metrics (e.g. {@code "events"}, {@code "commands"}).
     */
    String name();

    /**
     * Appends a row. Duplicate message ids are rejected by the backing store.
     */
    void enqueue(String messageId, String messageType, String payload);

    /**
     * Returns unprocessed rows created at or before {@code createdBefore} with fewer than
     * {@code maxAttempts} failed attempts, oldest first.
     */
    List<QueuedMessage> pollUnprocessed(Instant createdBefore, int maxAttempts, int limit);

    /**
     * Marks a row processed.
     *
     * @return {@code true} if the row was unprocessed before this call
     */
    boolean markProcessed(String messageId);

    /**
     * Records a failed delivery attempt.
     */
    void markFailed(String messageId, String error);

    long countUnprocessed();

    /**
     * Deletes up to {@code limit} processed rows processed before {@code olderThan}.
     *
     * @return the number of rows deleted
     */
    int purgeProcessed(Instant olderThan, int limit);

    /**
     * Registers a callback invoked once newly enqueued rows become visible to readers.
     */
    void onEnqueued(Runnable listener);
}
