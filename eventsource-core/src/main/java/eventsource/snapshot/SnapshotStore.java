package eventsource.snapshot;

import eventsource.Result;

/**
 * Storage for aggregate snapshots. Superseded snapshots are retained until pruned.
 *
 * @see InMemorySnapshotStore
 */
public interface SnapshotStore {

  /**
   * Saves a snapshot. A snapshot already stored at the same version is replaced, so a
   * snapshot rewritten under a new schema version supersedes the old one.
   */
  void save(Snapshot snapshot);

  /**
   * Loads the latest snapshot of an aggregate.
   *
   * @return the snapshot, or {@link eventsource.error.EventSourcingError.NotFound}
   */
  Result<Snapshot> load(String aggregateId);

  /**
   * Deletes all but the {@code keepLatest} most recent snapshots of an aggregate.
   *
   * @return the number of snapshots deleted
   */
  int prune(String aggregateId, int keepLatest);
}
