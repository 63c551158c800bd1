package eventsource.util;

import eventsource.Event;
import eventsource.command.Command;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void eventEnvelopeKeepsEveryField() {
    Event event = Event.builder("InventoryAdded")
        .aggregateId("item-1")
        .aggregateType("InventoryItem")
        .schemaVersion(2)
        .sequenceNumber(7)
        .occurredAt(Instant.parse("2026-03-01T10:15:30.123456Z"))
        .correlationId("corr-1")
        .causationId("cause-1")
        .payload(Map.of("quantity", 5, "tags", List.of("a", "b")))
        .metadata(Map.of("tenant", "acme"))
        .build();

    Event decoded = codec.decodeEvent(codec.encodeEvent(event));

    assertEquals(event, decoded);
    assertEquals(event.occurredAt(), decoded.occurredAt());
    assertEquals(List.of("a", "b"), decoded.payload().get("tags"));
    assertEquals("acme", decoded.metadata().get("tenant"));
    assertEquals("cause-1", decoded.causationId());
  }

  @Test
  void commandKeepsCorrelation() {
    Command command = new Command("cmd-1", "ShipOrder", Map.of("orderId", "o-1"), "corr-1", "evt-1",
        Instant.parse("2026-03-01T10:15:30Z"));

    assertEquals(command, codec.decodeCommand(codec.encodeCommand(command)));
  }

  @Test
  void malformedInputRaisesCodecException() {
    assertThrows(JsonCodec.CodecException.class, () -> codec.parseObject("{not json"));
    assertThrows(JsonCodec.CodecException.class, () -> codec.decodeEvent("{\"event_type\":\"X\"}"));
  }

  @Test
  void blankInputParsesEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseList(" ").isEmpty());
  }
}
