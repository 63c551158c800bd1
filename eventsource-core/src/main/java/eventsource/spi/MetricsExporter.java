package eventsource.spi;

/**
 * Observability hook for exporting counters, gauges and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code eventsource-micrometer}
 * bridges this interface to Micrometer.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events appended to the event store.
     *
     * @param count number of events in the committed batch
     */
    void incrementEventsAppended(int count);

    /**
     * Increments the count of appends rejected with a concurrency conflict.
     */
    void incrementConcurrencyConflicts();

    /**
     * Increments the count of successful handler deliveries on the event bus.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of failed handler deliveries on the event bus.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of deliveries skipped because the same event was already
     * in flight for the same handler.
     */
    default void incrementDispatchSkipped() {
    }

    /**
     * Records the time spent inside one event handler.
     */
    default void recordHandlerDurationMs(String handlerName, long durationMs) {
    }

    /**
     * Increments the count of dispatched commands.
     *
     * @param success whether the handler returned a successful result
     */
    default void incrementCommandsDispatched(boolean success) {
    }

    /**
     * Increments the count of snapshots written.
     */
    default void incrementSnapshotsTaken() {
    }

    /**
     * Increments the count of snapshot loads that fell back to a full replay.
     */
    default void incrementSnapshotFallbacks() {
    }

    /**
     * Records that a saga instance was persisted in the given status.
     */
    default void recordSagaTransition(String sagaType, String status) {
    }

    /**
     * Increments the count of compensating commands issued by sagas.
     */
    default void incrementCompensations() {
    }

    /**
     * Increments the count of queue rows redelivered by a poller.
     */
    void incrementRedelivered(String queueName);

    /**
     * Increments the count of queue rows parked after exhausting their attempts.
     */
    default void incrementParked(String queueName) {
    }

    /**
     * Records the number of unprocessed rows in a queue.
     */
    void recordUnprocessedDepth(String queueName, long depth);

    /**
     * Records the age of the oldest unprocessed row seen by the last poll.
     */
    default void recordOldestLagMs(String queueName, long lagMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsAppended(int count) {
        }

        @Override
        public void incrementConcurrencyConflicts() {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementRedelivered(String queueName) {
        }

        @Override
        public void recordUnprocessedDepth(String queueName, long depth) {
        }
    }
}
