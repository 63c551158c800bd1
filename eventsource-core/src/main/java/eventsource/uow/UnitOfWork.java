package eventsource.uow;

import eventsource.Event;
import eventsource.Result;
import eventsource.bus.DispatchReport;
import eventsource.bus.EventBus;
import eventsource.error.EventSourcingError;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.HandlerError;
import eventsource.error.EventSourcingError.HandlerFailures;
import eventsource.replay.EventSourcedAggregate;
import eventsource.replay.ReplayEngine;
import eventsource.spi.MessageQueue;
import eventsource.spi.MetricsExporter;
import eventsource.spi.TxContext;
import eventsource.store.EventBatch;
import eventsource.store.EventStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends the events of one aggregate and then publishes them.
 *
 * <p>The append always completes before anything is published. When the store was
 * built with an event queue, each appended event also has an unprocessed queue row;
 * rows of events every handler accepted are marked processed here, and the rest are
 * left for a {@link eventsource.queue.QueuePoller} to redeliver.
 *
 * <p>If a {@link TxContext} reports an active transaction, publishing is registered as
 * an after-commit callback so handlers never see events that are rolled back.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe if its
 * collaborators are.
 */
public final class UnitOfWork {
  private static final Logger logger = Logger.getLogger(UnitOfWork.class.getName());

  private final EventStore eventStore;
  private final EventBus eventBus;
  private final MessageQueue eventQueue;
  private final ReplayEngine replayEngine;
  private final TxContext txContext;
  private final MetricsExporter metrics;
  private final int publishBatchSize;

  private UnitOfWork(Builder builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    if (builder.publishBatchSize < 0) {
      throw new IllegalArgumentException("publishBatchSize must be >= 0");
    }
    this.eventQueue = builder.eventQueue;
    this.replayEngine = builder.replayEngine;
    this.txContext = builder.txContext;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.publishBatchSize = builder.publishBatchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Commits the uncommitted events of an aggregate and, when a replay engine is
   * configured, writes a snapshot if one is due.
   *
   * @return the commit result, or the store's {@code ConcurrencyConflict} or
   *     {@code ValidationError} (the aggregate keeps its uncommitted events)
   */
  public <S> Result<CommitResult> commit(EventSourcedAggregate<S> aggregate) {
    Objects.requireNonNull(aggregate, "aggregate");
    if (!aggregate.hasUncommittedEvents()) {
      return Result.ok(new CommitResult(aggregate.version(), List.of(),
          CommitResult.Status.NOTHING_TO_COMMIT, null));
    }
    Result<CommitResult> result = commit(aggregate.aggregateId(), aggregate.expectedVersion(),
        aggregate.uncommittedEvents());
    if (result.isErr()) {
      return result;
    }
    aggregate.markCommitted();
    if (replayEngine != null) {
      try {
        replayEngine.snapshotIfDue(aggregate.snapshotView(), aggregate.dispatch());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Snapshot of " + aggregate.aggregateId() + " failed; continuing", e);
      }
    }
    return result;
  }

  /**
   * Appends events at {@code expectedVersion} and publishes them.
   */
  public Result<CommitResult> commit(String aggregateId, long expectedVersion, List<Event> events) {
    Result<Long> appended = eventStore.append(aggregateId, expectedVersion, events);
    if (appended.isErr()) {
      if (appended.failure().orElseThrow() instanceof ConcurrencyConflict) {
        metrics.incrementConcurrencyConflicts();
      }
      return appended.map(ignored -> null);
    }
    long version = appended.orElseThrow();
    List<Event> stamped = EventBatch.prepare(aggregateId, expectedVersion, events).orElseThrow();
    metrics.incrementEventsAppended(stamped.size());
    if (stamped.isEmpty()) {
      return Result.ok(new CommitResult(version, stamped, CommitResult.Status.NOTHING_TO_COMMIT, null));
    }

    if (txContext != null && txContext.isTransactionActive()) {
      txContext.afterCommit(() -> publish(stamped));
      txContext.afterRollback(() -> logger.log(Level.FINE,
          "Append of {0} event(s) to {1} rolled back; nothing published",
          new Object[]{stamped.size(), aggregateId}));
      return Result.ok(new CommitResult(version, stamped, CommitResult.Status.DEFERRED, null));
    }

    EventSourcingError failure = publish(stamped);
    return Result.ok(failure == null
        ? new CommitResult(version, stamped, CommitResult.Status.PUBLISHED, null)
        : new CommitResult(version, stamped, CommitResult.Status.PUBLISH_FAILED, failure));
  }

  /**
   * Publishes and marks fully delivered events processed.
   *
   * @return the publish failure, or {@code null}
   */
  private EventSourcingError publish(List<Event> events) {
    Result<DispatchReport> published;
    try {
      published = publishBatchSize > 0
          ? eventBus.publishMany(events, publishBatchSize)
          : eventBus.publishMany(events);
    } catch (RuntimeException e) {
      Event first = events.get(0);
      logger.log(Level.WARNING, "Publishing " + events.size() + " event(s) of " + first.aggregateId()
          + " failed; leaving them to the recovery sweep", e);
      return new HandlerError("eventBus", first.eventId(), first.eventType(), e);
    }

    EventSourcingError failure = published.failure().orElse(null);
    if (failure != null) {
      logger.log(Level.WARNING, "Events of {0} committed but not fully delivered: {1}",
          new Object[]{events.get(0).aggregateId(), failure.message()});
    }
    if (eventQueue != null) {
      for (Event event : events) {
        boolean delivered = failure == null
            || (failure instanceof HandlerFailures failures && !failures.concerns(event.eventId()));
        if (delivered) {
          eventQueue.markProcessed(event.eventId());
        }
      }
    }
    return failure;
  }

  /** Builder for {@link UnitOfWork}. */
  public static final class Builder {
    private EventStore eventStore;
    private EventBus eventBus;
    private MessageQueue eventQueue;
    private ReplayEngine replayEngine;
    private TxContext txContext;
    private MetricsExporter metrics;
    private int publishBatchSize;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the queue the event store writes its rows to, so delivered rows can be
     * marked processed.
     *
     * <p>Optional.
     */
    public Builder eventQueue(MessageQueue eventQueue) {
      this.eventQueue = eventQueue;
      return this;
    }

    /**
     * Sets the replay engine whose snapshot strategy runs after each aggregate commit.
     *
     * <p>Optional.
     */
    public Builder replayEngine(ReplayEngine replayEngine) {
      this.replayEngine = replayEngine;
      return this;
    }

    /**
     * Optional. Without one, events are published immediately after the append.
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@code 0}, which uses the bus's own batch size.
     */
    public Builder publishBatchSize(int publishBatchSize) {
      this.publishBatchSize = publishBatchSize;
      return this;
    }

    public UnitOfWork build() {
      return new UnitOfWork(this);
    }
  }
}
