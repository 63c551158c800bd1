package eventsource.replay;

import java.util.Objects;

/**
 * Replayed aggregate state together with the stream version it reflects.
 */
public record AggregateState<S>(String aggregateId, S state, long version) {
  public AggregateState {
    Objects.requireNonNull(aggregateId, "aggregateId");
    if (version < 0) {
      throw new IllegalArgumentException("version must be >= 0");
    }
  }
}
