package eventsource;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

  @Test
  void builderAppliesDefaults() {
    Event event = Event.builder("ItemAdded")
        .aggregateId("cart-1")
        .aggregateType("Cart")
        .build();

    assertNotNull(event.eventId());
    assertEquals(26, event.eventId().length()); // ULID
    assertEquals(event.eventId(), event.correlationId());
    assertNull(event.causationId());
    assertEquals(1, event.schemaVersion());
    assertEquals(0L, event.sequenceNumber());
    assertNotNull(event.occurredAt());
    assertTrue(event.payload().isEmpty());
    assertTrue(event.metadata().isEmpty());
  }

  @Test
  void builderAcceptsAllFields() {
    Instant now = Instant.parse("2024-03-01T10:15:30Z");
    Event event = Event.builder("ItemAdded")
        .eventId("evt-1")
        .aggregateId("cart-1")
        .aggregateType("Cart")
        .schemaVersion(2)
        .sequenceNumber(7)
        .occurredAt(now)
        .correlationId("corr-1")
        .causationId("cmd-1")
        .payload(Map.of("sku", "A-1"))
        .metadata(Map.of("tenant", "t1"))
        .build();

    assertEquals("evt-1", event.eventId());
    assertEquals(2, event.schemaVersion());
    assertEquals(7L, event.sequenceNumber());
    assertEquals(now, event.occurredAt());
    assertEquals("corr-1", event.correlationId());
    assertEquals("cmd-1", event.causationId());
    assertEquals("A-1", event.payload().get("sku"));
    assertEquals("t1", event.metadata().get("tenant"));
  }

  @Test
  void payloadIsDeepCopiedAndUnmodifiable() {
    List<Object> lines = new ArrayList<>(List.of("a"));
    Map<String, Object> nested = new HashMap<>(Map.of("lines", lines));
    Map<String, Object> payload = new HashMap<>(Map.of("order", nested));

    Event event = Event.builder("OrderPlaced")
        .aggregateId("order-1")
        .aggregateType("Order")
        .payload(payload)
        .build();
    lines.add("b");
    nested.put("extra", 1);

    @SuppressWarnings("unchecked")
    Map<String, Object> order = (Map<String, Object>) event.payload().get("order");
    assertEquals(List.of("a"), order.get("lines"));
    assertFalse(order.containsKey("extra"));
    assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
    assertThrows(UnsupportedOperationException.class, () -> order.put("x", 1));
  }

  @Test
  void invalidFieldsAreRejected() {
    assertThrows(NullPointerException.class,
        () -> Event.builder("T").aggregateType("A").build());
    assertThrows(IllegalArgumentException.class,
        () -> Event.builder("").aggregateId("a").aggregateType("A").build());
    assertThrows(IllegalArgumentException.class,
        () -> Event.builder("T").aggregateId("a").aggregateType("A").schemaVersion(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> Event.builder("T").aggregateId("a").aggregateType("A").sequenceNumber(-1).build());

    Map<String, String> metadata = new HashMap<>();
    metadata.put("k", null);
    assertThrows(IllegalArgumentException.class,
        () -> Event.builder("T").aggregateId("a").aggregateType("A").metadata(metadata).build());
  }

  @Test
  void copiesKeepIdentity() {
    Event event = Event.builder("InventoryAdded")
        .aggregateId("item-1")
        .aggregateType("Item")
        .payload(Map.of("qty", 3))
        .build();

    Event upgraded = event.withPayload(2, Map.of("quantity", 3));
    assertEquals(event.eventId(), upgraded.eventId());
    assertEquals(event.occurredAt(), upgraded.occurredAt());
    assertEquals(2, upgraded.schemaVersion());
    assertEquals(Map.of("quantity", 3), upgraded.payload());

    Event positioned = event.withSequenceNumber(4);
    assertEquals(4L, positioned.sequenceNumber());
    assertEquals(0L, event.sequenceNumber());

    assertEquals(event, event.toBuilder().build());
    assertNotEquals(event, positioned);
  }
}
