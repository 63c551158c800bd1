package eventsource.replay;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.ValidationError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Event-type-to-handler table that folds an aggregate's events into its state.
 *
 * <p>Apply handlers must be deterministic and free of side effects: they receive the
 * current state and an upcast payload and return the next state.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ApplyDispatch<Stock> stock = ApplyDispatch.builder("InventoryItem", Stock::empty)
 *     .on("InventoryAdded", (s, p) -> s.add(((Number) p.get("quantity")).longValue()))
 *     .on("InventoryRemoved", (s, p) -> s.remove(((Number) p.get("quantity")).longValue()))
 *     .snapshotCodec(SnapshotCodec.of(1, Stock::toMap, Stock::fromMap))
 *     .build();
 * }</pre>
 *
 * @param <S> the aggregate state type
 */
public final class ApplyDispatch<S> {
  private final String aggregateType;
  private final Supplier<? extends S> initialState;
  private final Map<String, BiFunction<S, Map<String, Object>, S>> handlers;
  private final SnapshotCodec<S> snapshotCodec;

  private ApplyDispatch(Builder<S> builder) {
    this.aggregateType = Objects.requireNonNull(builder.aggregateType, "aggregateType");
    this.initialState = Objects.requireNonNull(builder.initialState, "initialState");
    this.handlers = Map.copyOf(builder.handlers);
    this.snapshotCodec = builder.snapshotCodec;
  }

  public static <S> Builder<S> builder(String aggregateType, Supplier<? extends S> initialState) {
    return new Builder<>(aggregateType, initialState);
  }

  public String aggregateType() {
    return aggregateType;
  }

  public S initialState() {
    return initialState.get();
  }

  public Set<String> eventTypes() {
    return handlers.keySet();
  }

  public Optional<SnapshotCodec<S>> snapshotCodec() {
    return Optional.ofNullable(snapshotCodec);
  }

  /**
   * Applies one (already upcast) event to a state.
   *
   * @return the next state, or a {@link ValidationError} if no handler exists for the type
   */
  public Result<S> apply(S state, Event event) {
    BiFunction<S, Map<String, Object>, S> handler = handlers.get(event.eventType());
    if (handler == null) {
      return Result.err(new ValidationError("eventType", "no apply handler for "
          + event.eventType() + " on " + aggregateType));
    }
    return Result.ok(handler.apply(state, event.payload()));
  }

  /** Builder for {@link ApplyDispatch}. */
  public static final class Builder<S> {
    private final String aggregateType;
    private final Supplier<? extends S> initialState;
    private final Map<String, BiFunction<S, Map<String, Object>, S>> handlers = new LinkedHashMap<>();
    private SnapshotCodec<S> snapshotCodec;

    private Builder(String aggregateType, Supplier<? extends S> initialState) {
      this.aggregateType = aggregateType;
      this.initialState = initialState;
    }

    /**
     * Registers the apply handler for an event type.
     *
     * @throws IllegalStateException if a handler is already registered for the type
     */
    public Builder<S> on(String eventType, BiFunction<S, Map<String, Object>, S> handler) {
      Objects.requireNonNull(eventType, "eventType");
      Objects.requireNonNull(handler, "handler");
      if (handlers.putIfAbsent(eventType, handler) != null) {
        throw new IllegalStateException("Apply handler already registered for " + eventType);
      }
      return this;
    }

    /**
     * Sets the codec used to write and read snapshots.
     *
     * <p>Optional. Without a codec the aggregate is always replayed in full.
     */
    public Builder<S> snapshotCodec(SnapshotCodec<S> snapshotCodec) {
      this.snapshotCodec = snapshotCodec;
      return this;
    }

    public ApplyDispatch<S> build() {
      return new ApplyDispatch<>(this);
    }
  }
}
