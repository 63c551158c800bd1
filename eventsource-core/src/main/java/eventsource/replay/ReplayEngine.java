package eventsource.replay;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.error.EventSourcingError.SnapshotIncompatible;
import eventsource.snapshot.Snapshot;
import eventsource.snapshot.SnapshotStore;
import eventsource.snapshot.SnapshotStrategy;
import eventsource.spi.MetricsExporter;
import eventsource.store.EventStore;
import eventsource.upcast.UpcasterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds aggregate state from the latest snapshot plus the events after it.
 *
 * <p>Load algorithm:
 * <ol>
 *   <li>load the latest snapshot, if the aggregate has a {@link SnapshotCodec} and a
 *       snapshot store is configured;</li>
 *   <li>read the stream strictly after the snapshot version (or from the start);</li>
 *   <li>upcast each event to the current schema version of its type, then apply it.</li>
 * </ol>
 * Snapshots are never upcast. A snapshot whose schema version differs from the codec's
 * is handled according to {@link SnapshotCompatibility}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see ApplyDispatch
 */
public final class ReplayEngine {
  private static final Logger logger = Logger.getLogger(ReplayEngine.class.getName());

  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final UpcasterRegistry upcasters;
  private final SnapshotStrategy snapshotStrategy;
  private final SnapshotCompatibility compatibility;
  private final int snapshotsToKeep;
  private final MetricsExporter metrics;
  private final Clock clock;

  private ReplayEngine(Builder builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.upcasters = Objects.requireNonNull(builder.upcasters, "upcasters");
    this.snapshotStore = builder.snapshotStore;
    this.snapshotStrategy = builder.snapshotStrategy != null
        ? builder.snapshotStrategy : SnapshotStrategy.NEVER;
    this.compatibility = builder.compatibility != null
        ? builder.compatibility : SnapshotCompatibility.FALLBACK_TO_FULL_REPLAY;
    if (builder.snapshotsToKeep < 0) {
      throw new IllegalArgumentException("snapshotsToKeep must be >= 0");
    }
    this.snapshotsToKeep = builder.snapshotsToKeep;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public UpcasterRegistry upcasters() {
    return upcasters;
  }

  /**
   * Loads an aggregate from snapshot plus tail.
   *
   * @return the state, {@code NotFound} if the aggregate has neither snapshot nor events,
   *     or the first {@code UpcastError}, {@code ValidationError} or
   *     {@code SnapshotIncompatible} met on the way
   */
  public <S> Result<AggregateState<S>> load(String aggregateId, ApplyDispatch<S> dispatch) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(dispatch, "dispatch");
    Optional<SnapshotCodec<S>> codec = dispatch.snapshotCodec();
    if (snapshotStore == null || codec.isEmpty()) {
      return loadFull(aggregateId, dispatch);
    }

    Result<Snapshot> snapshot = snapshotStore.load(aggregateId);
    if (snapshot.isErr()) {
      return loadFull(aggregateId, dispatch);
    }
    Snapshot found = snapshot.orElseThrow();
    if (found.schemaVersion() != codec.get().schemaVersion()) {
      if (compatibility == SnapshotCompatibility.STRICT) {
        return Result.err(new SnapshotIncompatible(aggregateId,
            codec.get().schemaVersion(), found.schemaVersion()));
      }
      logger.log(Level.WARNING, "Snapshot of {0} at v{1} has schema v{2}, expected v{3}; replaying in full",
          new Object[]{aggregateId, found.version(), found.schemaVersion(), codec.get().schemaVersion()});
      metrics.incrementSnapshotFallbacks();
      return loadFull(aggregateId, dispatch);
    }
    S state = codec.get().fromSnapshot(found.state());
    return replay(aggregateId, state, found.version(), dispatch);
  }

  /**
   * Loads an aggregate by replaying every event from the first, ignoring snapshots.
   */
  public <S> Result<AggregateState<S>> loadFull(String aggregateId, ApplyDispatch<S> dispatch) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(dispatch, "dispatch");
    Result<AggregateState<S>> replayed = replay(aggregateId, dispatch.initialState(), 0L, dispatch);
    if (replayed.isOk() && replayed.orElseThrow().version() == 0L) {
      return Result.err(new NotFound(dispatch.aggregateType(), aggregateId));
    }
    return replayed;
  }

  /**
   * Applies a list of raw events to a starting state, upcasting each one first.
   * Positions must continue contiguously from {@code fromVersion}.
   */
  public <S> Result<AggregateState<S>> apply(String aggregateId, S initial, long fromVersion,
      List<Event> events, ApplyDispatch<S> dispatch) {
    return fold(aggregateId, initial, fromVersion, events, dispatch, upcasters);
  }

  /**
   * Writes a snapshot of the given state when the configured strategy says it is due.
   *
   * @return {@code true} if a snapshot was written
   */
  public <S> boolean snapshotIfDue(AggregateState<S> state, ApplyDispatch<S> dispatch) {
    Objects.requireNonNull(state, "state");
    Optional<SnapshotCodec<S>> codec = dispatch.snapshotCodec();
    if (snapshotStore == null || codec.isEmpty() || state.version() == 0L) {
      return false;
    }
    Result<Snapshot> latest = snapshotStore.load(state.aggregateId());
    long lastVersion = 0L;
    Duration age = null;
    if (latest.isOk()) {
      Snapshot snapshot = latest.orElseThrow();
      if (snapshot.schemaVersion() == codec.get().schemaVersion()) {
        lastVersion = snapshot.version();
        age = Duration.between(snapshot.createdAt(), clock.instant());
      }
    }
    long eventsSinceLast = state.version() - lastVersion;
    if (eventsSinceLast <= 0 || !snapshotStrategy.shouldSnapshot(eventsSinceLast, age)) {
      return false;
    }
    snapshotStore.save(new Snapshot(state.aggregateId(), dispatch.aggregateType(), state.version(),
        codec.get().schemaVersion(), codec.get().toSnapshot(state.state()), clock.instant()));
    metrics.incrementSnapshotsTaken();
    if (snapshotsToKeep > 0) {
      snapshotStore.prune(state.aggregateId(), snapshotsToKeep);
    }
    logger.log(Level.FINE, "Snapshot of {0} written at v{1}",
        new Object[]{state.aggregateId(), state.version()});
    return true;
  }

  private <S> Result<AggregateState<S>> replay(String aggregateId, S initial, long fromVersion,
      ApplyDispatch<S> dispatch) {
    List<Event> tail = eventStore.read(aggregateId, fromVersion);
    return fold(aggregateId, initial, fromVersion, tail, dispatch, upcasters);
  }

  static <S> Result<AggregateState<S>> fold(String aggregateId, S initial, long fromVersion,
      List<Event> events, ApplyDispatch<S> dispatch, UpcasterRegistry upcasters) {
    S state = initial;
    long version = fromVersion;
    for (Event event : events) {
      if (event.sequenceNumber() != version + 1) {
        return Result.err(new EventSourcingError.ValidationError("sequenceNumber",
            "stream " + aggregateId + " expected position " + (version + 1)
                + " but found " + event.sequenceNumber()));
      }
      Result<Event> upcast = upcasters.upcast(event);
      if (upcast.isErr()) {
        return upcast.map(ignored -> null);
      }
      Result<S> next = dispatch.apply(state, upcast.orElseThrow());
      if (next.isErr()) {
        return next.map(ignored -> null);
      }
      state = next.orElseThrow();
      version = event.sequenceNumber();
    }
    return Result.ok(new AggregateState<>(aggregateId, state, version));
  }

  /** Builder for {@link ReplayEngine}. */
  public static final class Builder {
    private EventStore eventStore;
    private SnapshotStore snapshotStore;
    private UpcasterRegistry upcasters = new UpcasterRegistry();
    private SnapshotStrategy snapshotStrategy;
    private SnapshotCompatibility compatibility;
    private int snapshotsToKeep;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the event store to read streams from.
     *
     * <p><b>Required.</b>
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the snapshot store.
     *
     * <p>Optional. Without one every load is a full replay.
     */
    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /**
     * Sets the upcaster registry applied to every replayed event.
     *
     * <p>Optional. Defaults to an empty registry.
     */
    public Builder upcasters(UpcasterRegistry upcasters) {
      this.upcasters = upcasters;
      return this;
    }

    /**
     * Sets the strategy consulted by {@link ReplayEngine#snapshotIfDue}.
     *
     * <p>Optional. Defaults to {@link SnapshotStrategy#NEVER}.
     */
    public Builder snapshotStrategy(SnapshotStrategy snapshotStrategy) {
      this.snapshotStrategy = snapshotStrategy;
      return this;
    }

    /**
     * Sets the policy for snapshots written under a different schema version.
     *
     * <p>Optional. Defaults to {@link SnapshotCompatibility#FALLBACK_TO_FULL_REPLAY}.
     */
    public Builder snapshotCompatibility(SnapshotCompatibility compatibility) {
      this.compatibility = compatibility;
      return this;
    }

    /**
     * Prunes older snapshots after each write, keeping this many.
     *
     * <p>Optional. Defaults to {@code 0} (retain all). Must be &ge; 0.
     */
    public Builder snapshotsToKeep(int snapshotsToKeep) {
      this.snapshotsToKeep = snapshotsToKeep;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to stamp and age snapshots.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException if {@code eventStore} or {@code upcasters} is null
     * @throws IllegalArgumentException if {@code snapshotsToKeep < 0}
     */
    public ReplayEngine build() {
      return new ReplayEngine(this);
    }
  }
}
