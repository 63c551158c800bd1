package eventsource.snapshot;

import eventsource.util.Payloads;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Materialized aggregate state at a known stream version. Never mutated once saved.
 *
 * @param aggregateId   the aggregate
 * @param aggregateType the aggregate type
 * @param version       stream version the state reflects
 * @param schemaVersion version of the state layout, compared against the aggregate's
 *                      snapshot codec on load
 * @param state         the serialized state
 * @param createdAt     when the snapshot was taken
 */
public record Snapshot(
    String aggregateId,
    String aggregateType,
    long version,
    int schemaVersion,
    Map<String, Object> state,
    Instant createdAt
) {
  public Snapshot {
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(aggregateType, "aggregateType");
    Objects.requireNonNull(createdAt, "createdAt");
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got: " + version);
    }
    if (schemaVersion < 1) {
      throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + schemaVersion);
    }
    state = Payloads.immutableCopy(state);
  }
}
