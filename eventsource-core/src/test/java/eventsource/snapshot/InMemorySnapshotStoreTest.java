package eventsource.snapshot;

import eventsource.error.EventSourcingError.NotFound;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySnapshotStoreTest {

  private static Snapshot snapshot(long version) {
    return new Snapshot("item-1", "InventoryItem", version, 1, Map.of("quantity", version), Instant.now());
  }

  @Test
  void loadReturnsHighestVersion() {
    InMemorySnapshotStore store = new InMemorySnapshotStore();
    store.save(snapshot(10));
    store.save(snapshot(30));
    store.save(snapshot(20));

    assertEquals(30L, store.load("item-1").orElseThrow().version());
  }

  @Test
  void saveAtExistingVersionReplacesSnapshot() {
    InMemorySnapshotStore store = new InMemorySnapshotStore();
    store.save(snapshot(4));
    store.save(new Snapshot("item-1", "InventoryItem", 4, 2, Map.of("qty", 4L), Instant.now()));

    Snapshot latest = store.load("item-1").orElseThrow();
    assertEquals(4L, latest.version());
    assertEquals(2, latest.schemaVersion());
    assertEquals(Map.of("qty", 4L), latest.state());
  }

  @Test
  void missingSnapshotIsNotFound() {
    assertInstanceOf(NotFound.class, new InMemorySnapshotStore().load("item-1").failure().orElseThrow());
  }

  @Test
  void pruneKeepsLatest() {
    InMemorySnapshotStore store = new InMemorySnapshotStore();
    for (long v = 1; v <= 5; v++) {
      store.save(snapshot(v));
    }

    assertEquals(3, store.prune("item-1", 2));
    assertEquals(0, store.prune("item-1", 2));
    assertEquals(0, store.prune("unknown", 1));
    assertEquals(5L, store.load("item-1").orElseThrow().version());
    assertThrows(IllegalArgumentException.class, () -> store.prune("item-1", 0));
  }

  @Test
  void snapshotRejectsInvalidVersions() {
    assertThrows(IllegalArgumentException.class,
        () -> new Snapshot("item-1", "InventoryItem", 0, 1, Map.of(), Instant.now()));
    assertThrows(IllegalArgumentException.class,
        () -> new Snapshot("item-1", "InventoryItem", 1, 0, Map.of(), Instant.now()));
  }
}
