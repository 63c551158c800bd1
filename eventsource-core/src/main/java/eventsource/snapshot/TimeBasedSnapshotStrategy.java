package eventsource.snapshot;

import java.time.Duration;
import java.util.Objects;

/**
 * Snapshots when the latest snapshot is older than the configured interval, or when
 * there is none yet. Never snapshots a stream with no new events.
 */
public final class TimeBasedSnapshotStrategy implements SnapshotStrategy {
  private final Duration interval;

  public TimeBasedSnapshotStrategy(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.interval = interval;
  }

  @Override
  public boolean shouldSnapshot(long eventsSinceLast, Duration timeSinceLast) {
    if (eventsSinceLast <= 0) {
      return false;
    }
    return timeSinceLast == null || timeSinceLast.compareTo(interval) >= 0;
  }
}
