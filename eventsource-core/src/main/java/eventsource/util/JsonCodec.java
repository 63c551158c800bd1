package eventsource.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import eventsource.Event;
import eventsource.command.Command;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON encoding of event envelopes, commands and structured payloads, backed by Jackson.
 *
 * <p>The event envelope uses the storage field names {@code event_id, aggregate_id,
 * aggregate_type, event_type, schema_version, sequence_number, occurred_at,
 * correlation_id, causation_id, payload, metadata}. Timestamps are ISO-8601 strings.
 *
 * <p>Instances are thread-safe. Use {@link #getDefault()} unless a custom
 * {@link ObjectMapper} is required.
 */
public final class JsonCodec {
  private static final JsonCodec DEFAULT = new JsonCodec(defaultMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static JsonCodec getDefault() {
    return DEFAULT;
  }

  private static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  /** Serializes any Jackson-serializable value. */
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to serialize " + value.getClass().getName(), e);
    }
  }

  /** Parses a JSON object; {@code null} or blank input yields an empty map. */
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      return mapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to parse JSON object", e);
    }
  }

  /** Parses a JSON array; {@code null} or blank input yields an empty list. */
  public List<Object> parseList(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return mapper.readValue(json, LIST_TYPE);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to parse JSON array", e);
    }
  }

  public String encodeEvent(Event event) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("event_id", event.eventId());
    json.put("aggregate_id", event.aggregateId());
    json.put("aggregate_type", event.aggregateType());
    json.put("event_type", event.eventType());
    json.put("schema_version", event.schemaVersion());
    json.put("sequence_number", event.sequenceNumber());
    json.put("occurred_at", event.occurredAt().toString());
    json.put("correlation_id", event.correlationId());
    json.put("causation_id", event.causationId());
    json.put("payload", event.payload());
    json.put("metadata", event.metadata());
    return toJson(json);
  }

  @SuppressWarnings("unchecked")
  public Event decodeEvent(String json) {
    Map<String, Object> map = parseObject(json);
    try {
      Map<String, String> metadata = new LinkedHashMap<>();
      Object rawMetadata = map.get("metadata");
      if (rawMetadata instanceof Map<?, ?> m) {
        m.forEach((k, v) -> metadata.put(String.valueOf(k), String.valueOf(v)));
      }
      return Event.builder((String) map.get("event_type"))
          .eventId((String) map.get("event_id"))
          .aggregateId((String) map.get("aggregate_id"))
          .aggregateType((String) map.get("aggregate_type"))
          .schemaVersion(((Number) map.get("schema_version")).intValue())
          .sequenceNumber(((Number) map.get("sequence_number")).longValue())
          .occurredAt(Instant.parse((String) map.get("occurred_at")))
          .correlationId((String) map.get("correlation_id"))
          .causationId((String) map.get("causation_id"))
          .payload((Map<String, Object>) map.get("payload"))
          .metadata(metadata)
          .build();
    } catch (RuntimeException e) {
      throw new CodecException("Malformed event envelope", e);
    }
  }

  public String encodeCommand(Command command) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("command_id", command.commandId());
    json.put("command_type", command.commandType());
    json.put("correlation_id", command.correlationId());
    json.put("causation_id", command.causationId());
    json.put("issued_at", command.issuedAt().toString());
    json.put("payload", command.payload());
    return toJson(json);
  }

  @SuppressWarnings("unchecked")
  public Command decodeCommand(String json) {
    Map<String, Object> map = parseObject(json);
    try {
      return new Command(
          (String) map.get("command_id"),
          (String) map.get("command_type"),
          (Map<String, Object>) map.get("payload"),
          (String) map.get("correlation_id"),
          (String) map.get("causation_id"),
          Instant.parse((String) map.get("issued_at")));
    } catch (RuntimeException e) {
      throw new CodecException("Malformed command", e);
    }
  }

  /**
   * Unchecked exception for malformed or unserializable JSON.
   */
  public static final class CodecException extends RuntimeException {
    public CodecException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
