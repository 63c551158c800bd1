package eventsource.replay;

import eventsource.Event;
import eventsource.Result;
import eventsource.upcast.UpcasterRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate state loaded from its stream plus the events raised since the load.
 *
 * <p>{@link #raise} stamps each new event with the next stream position, the current
 * schema version of its type and the active correlation, then applies it so that
 * {@link #state()} always reflects the uncommitted tail. A
 * {@link eventsource.uow.UnitOfWork} appends {@link #uncommittedEvents()} with
 * {@link #expectedVersion()} and calls {@link #markCommitted()} on success.
 *
 * <p>Instances are not thread-safe; one command handler owns an aggregate at a time.
 *
 * @param <S> the aggregate state type
 */
public final class EventSourcedAggregate<S> {
  private final String aggregateId;
  private final ApplyDispatch<S> dispatch;
  private final UpcasterRegistry upcasters;
  private final List<Event> uncommitted = new ArrayList<>();
  private S state;
  private long committedVersion;
  private String correlationId;
  private String causationId;

  private EventSourcedAggregate(String aggregateId, S state, long committedVersion,
      ApplyDispatch<S> dispatch, UpcasterRegistry upcasters) {
    if (aggregateId == null || aggregateId.isEmpty()) {
      throw new IllegalArgumentException("aggregateId cannot be null or empty");
    }
    this.aggregateId = aggregateId;
    this.state = state;
    this.committedVersion = committedVersion;
    this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    this.upcasters = Objects.requireNonNull(upcasters, "upcasters");
  }

  /**
   * Starts a new, empty aggregate at version 0.
   */
  public static <S> EventSourcedAggregate<S> create(String aggregateId, ApplyDispatch<S> dispatch,
      UpcasterRegistry upcasters) {
    return new EventSourcedAggregate<>(aggregateId, dispatch.initialState(), 0L, dispatch, upcasters);
  }

  /**
   * Wraps state produced by {@link ReplayEngine#load}.
   */
  public static <S> EventSourcedAggregate<S> fromState(AggregateState<S> loaded, ApplyDispatch<S> dispatch,
      UpcasterRegistry upcasters) {
    Objects.requireNonNull(loaded, "loaded");
    return new EventSourcedAggregate<>(loaded.aggregateId(), loaded.state(), loaded.version(),
        dispatch, upcasters);
  }

  /**
   * Rebuilds an aggregate from a raw history, upcasting each event.
   *
   * @return the aggregate, or a {@code ValidationError} if positions are not contiguous
   *     from 1, or the first {@code UpcastError}
   */
  public static <S> Result<EventSourcedAggregate<S>> fromHistory(String aggregateId, List<Event> history,
      ApplyDispatch<S> dispatch, UpcasterRegistry upcasters) {
    Objects.requireNonNull(history, "history");
    return ReplayEngine.fold(aggregateId, dispatch.initialState(), 0L, history, dispatch, upcasters)
        .map(loaded -> fromState(loaded, dispatch, upcasters));
  }

  /**
   * Sets the correlation and causation ids stamped on subsequently raised events.
   *
   * @return this aggregate
   */
  public EventSourcedAggregate<S> causedBy(Event cause) {
    Objects.requireNonNull(cause, "cause");
    this.correlationId = cause.correlationId();
    this.causationId = cause.eventId();
    return this;
  }

  /**
   * Sets the correlation and causation ids from a command context.
   *
   * @return this aggregate
   */
  public EventSourcedAggregate<S> correlatedWith(String correlationId, String causationId) {
    this.correlationId = correlationId;
    this.causationId = causationId;
    return this;
  }

  /**
   * Records a new event and applies it to the in-memory state.
   *
   * @return the raised event, or a {@code ValidationError} if the aggregate has no apply
   *     handler for the type (nothing is recorded in that case)
   */
  public Result<Event> raise(String eventType, Map<String, ?> payload) {
    Event event = Event.builder(eventType)
        .aggregateId(aggregateId)
        .aggregateType(dispatch.aggregateType())
        .schemaVersion(upcasters.currentVersion(eventType))
        .sequenceNumber(version() + 1)
        .correlationId(correlationId)
        .causationId(causationId)
        .payload(payload)
        .build();
    Result<S> next = dispatch.apply(state, event);
    if (next.isErr()) {
      return next.map(ignored -> event);
    }
    state = next.orElseThrow();
    uncommitted.add(event);
    return Result.ok(event);
  }

  public String aggregateId() {
    return aggregateId;
  }

  public String aggregateType() {
    return dispatch.aggregateType();
  }

  public ApplyDispatch<S> dispatch() {
    return dispatch;
  }

  public S state() {
    return state;
  }

  /**
   * Stream version including uncommitted events.
   */
  public long version() {
    return committedVersion + uncommitted.size();
  }

  /**
   * Version the stream must be at for the uncommitted events to be appended.
   */
  public long expectedVersion() {
    return committedVersion;
  }

  public List<Event> uncommittedEvents() {
    return Collections.unmodifiableList(new ArrayList<>(uncommitted));
  }

  public boolean hasUncommittedEvents() {
    return !uncommitted.isEmpty();
  }

  /**
   * Clears the uncommitted events after a successful append.
   */
  public void markCommitted() {
    committedVersion += uncommitted.size();
    uncommitted.clear();
  }

  public AggregateState<S> snapshotView() {
    return new AggregateState<>(aggregateId, state, version());
  }
}
