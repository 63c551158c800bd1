package eventsource;

import com.github.f4b6a3.ulid.UlidCreator;
import eventsource.util.Payloads;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, versioned domain event as stored in an aggregate's stream.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default and defaults its
 * {@code correlationId} to its own id. {@code sequenceNumber} may be left at {@code 0}
 * ("unassigned") until the event store stamps it with the stream position on append.
 * The payload is deep-copied into unmodifiable maps and lists.
 *
 * @see eventsource.store.EventStore
 * @see eventsource.upcast.UpcasterRegistry
 */
public final class Event {
    private final String eventId;
    private final String aggregateId;
    private final String aggregateType;
    private final String eventType;
    private final int schemaVersion;
    private final long sequenceNumber;
    private final Instant occurredAt;
    private final String correlationId;
    private final String causationId;
    private final Map<String, Object> payload;
    private final Map<String, String> metadata;

    private Event(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.eventType = requireText(builder.eventType, "eventType");
        this.aggregateId = requireText(builder.aggregateId, "aggregateId");
        this.aggregateType = requireText(builder.aggregateType, "aggregateType");
        if (builder.schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + builder.schemaVersion);
        }
        if (builder.sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0, got: " + builder.sequenceNumber);
        }
        this.schemaVersion = builder.schemaVersion;
        this.sequenceNumber = builder.sequenceNumber;
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
        this.correlationId = builder.correlationId == null ? this.eventId : builder.correlationId;
        this.causationId = builder.causationId;
        this.payload = Payloads.immutableCopy(builder.payload);

        Map<String, String> metadataCopy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (metadataCopy.containsKey(null) || metadataCopy.containsValue(null)) {
            throw new IllegalArgumentException("metadata cannot contain null keys or values");
        }
        this.metadata = metadataCopy;
    }

    /**
     * Creates a builder for an event of the given type.
     *
     * @param eventType the event type name
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    public String eventId() {
        return eventId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String eventType() {
        return eventType;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    /**
     * Position of this event within its aggregate's stream, starting at 1.
     * {@code 0} means the position has not been assigned yet.
     */
    public long sequenceNumber() {
        return sequenceNumber;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * Id of the event or command that directly caused this event, or {@code null}.
     */
    public String causationId() {
        return causationId;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    /**
     * Returns a copy of this event carrying a migrated payload at a new schema version.
     *
     * @param version the schema version of {@code newPayload}
     * @param newPayload the migrated payload
     * @return a new event with the same identity and position
     */
    public Event withPayload(int version, Map<String, Object> newPayload) {
        return toBuilder().schemaVersion(version).payload(newPayload).build();
    }

    /**
     * Returns a copy of this event stamped with the given stream position.
     */
    public Event withSequenceNumber(long sequenceNumber) {
        return toBuilder().sequenceNumber(sequenceNumber).build();
    }

    /**
     * Returns a builder pre-populated with every field of this event.
     */
    public Builder toBuilder() {
        return new Builder(eventType)
                .eventId(eventId)
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .schemaVersion(schemaVersion)
                .sequenceNumber(sequenceNumber)
                .occurredAt(occurredAt)
                .correlationId(correlationId)
                .causationId(causationId)
                .payload(payload)
                .metadata(metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event other)) return false;
        return schemaVersion == other.schemaVersion
                && sequenceNumber == other.sequenceNumber
                && eventId.equals(other.eventId)
                && aggregateId.equals(other.aggregateId)
                && aggregateType.equals(other.aggregateType)
                && eventType.equals(other.eventType)
                && occurredAt.equals(other.occurredAt)
                && correlationId.equals(other.correlationId)
                && Objects.equals(causationId, other.causationId)
                && payload.equals(other.payload)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, sequenceNumber, schemaVersion);
    }

    @Override
    public String toString() {
        return "Event{eventId=" + eventId
                + ", eventType=" + eventType
                + ", aggregateType=" + aggregateType
                + ", aggregateId=" + aggregateId
                + ", sequenceNumber=" + sequenceNumber
                + ", schemaVersion=" + schemaVersion
                + '}';
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return value;
    }

    /** Builder for {@link Event}. */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private String aggregateId;
        private String aggregateType;
        private int schemaVersion = 1;
        private long sequenceNumber;
        private Instant occurredAt;
        private String correlationId;
        private String causationId;
        private Map<String, Object> payload;
        private Map<String, String> metadata;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * Sets the payload schema version.
         *
         * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
         */
        public Builder schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        /**
         * Sets the stream position.
         *
         * <p>Optional. Defaults to {@code 0}, meaning the store assigns it on append.
         */
        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder payload(Map<String, ?> payload) {
            this.payload = payload == null ? null : new LinkedHashMap<>(payload);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Builds the event.
         *
         * @throws NullPointerException if {@code eventType}, {@code aggregateId} or
         *     {@code aggregateType} is null
         * @throws IllegalArgumentException if a required field is empty, or
         *     {@code schemaVersion < 1}, or {@code sequenceNumber < 0}
         */
        public Event build() {
            return new Event(this);
        }
    }
}
