package eventsource.snapshot;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Combines child strategies with OR ({@link #anyOf}) or AND ({@link #allOf}) semantics.
 *
 * <p>Every child is evaluated on each call, regardless of earlier answers.
 */
public final class CompositeSnapshotStrategy implements SnapshotStrategy {

  public enum Mode { ANY, ALL }

  private final Mode mode;
  private final List<SnapshotStrategy> strategies;

  public CompositeSnapshotStrategy(Mode mode, List<SnapshotStrategy> strategies) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.strategies = List.copyOf(strategies);
    if (this.strategies.isEmpty()) {
      throw new IllegalArgumentException("strategies cannot be empty");
    }
  }

  public static CompositeSnapshotStrategy anyOf(SnapshotStrategy... strategies) {
    return new CompositeSnapshotStrategy(Mode.ANY, List.of(strategies));
  }

  public static CompositeSnapshotStrategy allOf(SnapshotStrategy... strategies) {
    return new CompositeSnapshotStrategy(Mode.ALL, List.of(strategies));
  }

  @Override
  public boolean shouldSnapshot(long eventsSinceLast, Duration timeSinceLast) {
    int positive = 0;
    for (SnapshotStrategy strategy : strategies) {
      if (strategy.shouldSnapshot(eventsSinceLast, timeSinceLast)) {
        positive++;
      }
    }
    return mode == Mode.ANY ? positive > 0 : positive == strategies.size();
  }
}
