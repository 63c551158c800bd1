package eventsource.jdbc;

import eventsource.Result;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.snapshot.Snapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSnapshotStoreTest {
  private H2Database db;
  private JdbcSnapshotStore store;

  @BeforeEach
  void setup() {
    db = H2Database.create("snapshots");
    store = new JdbcSnapshotStore(db.session(), db.dialect);
  }

  @AfterEach
  void teardown() throws Exception {
    db.shutdown();
  }

  private static Snapshot snapshot(long version, int quantity) {
    return new Snapshot("inv-1", "Inventory", version, 1,
        Map.of("quantity", quantity, "lots", List.of("A", "B")), Instant.parse("2026-03-01T12:00:00Z"));
  }

  @Test
  void loadReturnsLatestVersion() {
    store.save(snapshot(10, 100));
    store.save(snapshot(20, 200));

    Snapshot latest = store.load("inv-1").orElseThrow();

    assertEquals(20L, latest.version());
    assertEquals(1, latest.schemaVersion());
    assertEquals("Inventory", latest.aggregateType());
    assertEquals(200, ((Number) latest.state().get("quantity")).intValue());
    assertEquals(List.of("A", "B"), latest.state().get("lots"));
    assertEquals(Instant.parse("2026-03-01T12:00:00Z"), latest.createdAt());
  }

  @Test
  void savingSameVersionReplacesIt() throws Exception {
    store.save(snapshot(10, 100));
    store.save(snapshot(10, 150));

    assertEquals(150, ((Number) store.load("inv-1").orElseThrow().state().get("quantity")).intValue());
    assertEquals(1L, db.count(TableNames.SNAPSHOTS));
  }

  @Test
  void missingSnapshotIsNotFound() {
    Result<Snapshot> result = store.load("inv-none");

    NotFound notFound = assertInstanceOf(NotFound.class, result.failure().orElseThrow());
    assertEquals("inv-none", notFound.id());
  }

  @Test
  void pruneKeepsNewest() throws Exception {
    for (long v = 5; v <= 25; v += 5) {
      store.save(snapshot(v, (int) v));
    }

    assertEquals(3, store.prune("inv-1", 2));
    assertEquals(2L, db.count(TableNames.SNAPSHOTS));
    assertEquals(25L, store.load("inv-1").orElseThrow().version());
    assertEquals(0, store.prune("inv-1", 5));
    assertThrows(IllegalArgumentException.class, () -> store.prune("inv-1", 0));
  }
}
