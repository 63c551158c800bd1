package eventsource.snapshot;

import eventsource.Result;
import eventsource.error.EventSourcingError.NotFound;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Snapshot store held in memory. This class is thread-safe.
 */
public final class InMemorySnapshotStore implements SnapshotStore {
  private final Map<String, NavigableMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();

  @Override
  public void save(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    snapshots.computeIfAbsent(snapshot.aggregateId(), k -> new ConcurrentSkipListMap<>())
        .put(snapshot.version(), snapshot);
  }

  @Override
  public Result<Snapshot> load(String aggregateId) {
    NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
    Map.Entry<Long, Snapshot> latest = versions == null ? null : versions.lastEntry();
    if (latest == null) {
      return Result.err(new NotFound("Snapshot", aggregateId));
    }
    return Result.ok(latest.getValue());
  }

  @Override
  public int prune(String aggregateId, int keepLatest) {
    if (keepLatest < 1) {
      throw new IllegalArgumentException("keepLatest must be >= 1");
    }
    NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
    if (versions == null) {
      return 0;
    }
    int deleted = 0;
    while (versions.size() > keepLatest) {
      if (versions.pollFirstEntry() != null) {
        deleted++;
      }
    }
    return deleted;
  }
}
