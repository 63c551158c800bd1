package eventsource.snapshot;

import java.time.Duration;

/**
 * Snapshots once at least {@code threshold} events accumulated since the last snapshot.
 */
public final class EventCountSnapshotStrategy implements SnapshotStrategy {
  public static final int DEFAULT_THRESHOLD = 10;

  private final long threshold;

  public EventCountSnapshotStrategy() {
    this(DEFAULT_THRESHOLD);
  }

  public EventCountSnapshotStrategy(long threshold) {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be >= 1, got: " + threshold);
    }
    this.threshold = threshold;
  }

  @Override
  public boolean shouldSnapshot(long eventsSinceLast, Duration timeSinceLast) {
    return eventsSinceLast >= threshold;
  }
}
