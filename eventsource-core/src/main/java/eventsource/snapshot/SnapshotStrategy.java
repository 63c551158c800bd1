package eventsource.snapshot;

import java.time.Duration;

/**
 * Decides whether an aggregate is due for a new snapshot.
 *
 * @see EventCountSnapshotStrategy
 * @see TimeBasedSnapshotStrategy
 * @see CompositeSnapshotStrategy
 */
@FunctionalInterface
public interface SnapshotStrategy {

  /**
   * Never takes snapshots.
   */
  SnapshotStrategy NEVER = (eventsSinceLast, timeSinceLast) -> false;

  /**
   * @param eventsSinceLast events appended since the latest snapshot (or since the
   *                        start of the stream)
   * @param timeSinceLast   age of the latest snapshot, or {@code null} if none exists
   */
  boolean shouldSnapshot(long eventsSinceLast, Duration timeSinceLast);
}
