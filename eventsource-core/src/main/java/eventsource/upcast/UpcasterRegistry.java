package eventsource.upcast;

import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.UpcastError;
import eventsource.util.Payloads;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of upcaster chains keyed by {@code (eventType, fromVersion)}.
 *
 * <p>An upcaster registered for version {@code n} produces version {@code n + 1}.
 * Chains are applied in ascending order and never skip a step; a missing link is
 * reported as an {@link UpcastError} naming it. Registrations are thread-safe, but
 * a registry is normally populated once at startup and then shared.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * UpcasterRegistry upcasters = new UpcasterRegistry()
 *     .register("InventoryAdded", 1, p -> { p.put("unit", "kg"); return p; })
 *     .register("InventoryAdded", 2, p -> { p.put("supplier", "Unknown"); return p; });
 * }</pre>
 */
public final class UpcasterRegistry {
  private static final Logger logger = Logger.getLogger(UpcasterRegistry.class.getName());

  private final Map<String, NavigableMap<Integer, Upcaster>> chains = new ConcurrentHashMap<>();
  private final Map<String, Integer> declaredVersions = new ConcurrentHashMap<>();

  /**
   * Registers the upcaster migrating {@code eventType} from {@code fromVersion} to
   * {@code fromVersion + 1}.
   *
   * @return this registry
   * @throws IllegalStateException if an upcaster is already registered for the pair
   * @throws IllegalArgumentException if {@code fromVersion < 1}
   */
  public UpcasterRegistry register(String eventType, int fromVersion, Upcaster upcaster) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(upcaster, "upcaster");
    if (fromVersion < 1) {
      throw new IllegalArgumentException("fromVersion must be >= 1, got: " + fromVersion);
    }
    NavigableMap<Integer, Upcaster> chain =
        chains.computeIfAbsent(eventType, k -> new ConcurrentSkipListMap<>());
    if (chain.putIfAbsent(fromVersion, upcaster) != null) {
      throw new IllegalStateException("Upcaster already registered for " + eventType
          + " v" + fromVersion);
    }
    return this;
  }

  /**
   * Declares the current schema version of a type that has no upcasters yet, or whose
   * newest version is not reached by a registered chain.
   *
   * @return this registry
   */
  public UpcasterRegistry declareCurrentVersion(String eventType, int version) {
    Objects.requireNonNull(eventType, "eventType");
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got: " + version);
    }
    declaredVersions.merge(eventType, version, Math::max);
    return this;
  }

  /**
   * Returns the schema version new events of this type are written at: one past the
   * highest registered upcaster, or the declared version if higher, or {@code 1}.
   */
  public int currentVersion(String eventType) {
    NavigableMap<Integer, Upcaster> chain = chains.get(eventType);
    int fromChain = chain == null || chain.isEmpty() ? 1 : chain.lastKey() + 1;
    return Math.max(fromChain, declaredVersions.getOrDefault(eventType, 1));
  }

  /**
   * Migrates a payload from {@code fromVersion} to {@code toVersion}.
   *
   * @return the migrated payload, or an {@link UpcastError} carrying the first missing link
   */
  public Result<Map<String, Object>> upcast(String eventType, int fromVersion, int toVersion,
      Map<String, Object> payload) {
    Objects.requireNonNull(eventType, "eventType");
    if (fromVersion < 1) {
      return Result.err(new UpcastError(eventType, fromVersion, toVersion, fromVersion,
          "unknown schema version " + fromVersion));
    }
    if (fromVersion > toVersion) {
      return Result.err(new UpcastError(eventType, fromVersion, toVersion, -1,
          "cannot downcast to an older version"));
    }
    if (fromVersion == toVersion) {
      return Result.ok(Payloads.immutableCopy(payload));
    }

    NavigableMap<Integer, Upcaster> chain = chains.getOrDefault(eventType, new ConcurrentSkipListMap<>());
    Map<String, Object> current = Payloads.mutableCopy(payload);
    for (int version = fromVersion; version < toVersion; version++) {
      Upcaster upcaster = chain.get(version);
      if (upcaster == null) {
        return Result.err(new UpcastError(eventType, fromVersion, toVersion, version,
            "no upcaster registered for v" + version));
      }
      Map<String, Object> next;
      try {
        next = upcaster.upcast(current);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Upcaster for " + eventType + " v" + version + " failed", e);
        return Result.err(new UpcastError(eventType, fromVersion, toVersion, -1,
            "upcaster for v" + version + " threw " + e));
      }
      if (next == null) {
        return Result.err(new UpcastError(eventType, fromVersion, toVersion, -1,
            "upcaster for v" + version + " returned null"));
      }
      current = Payloads.mutableCopy(next);
    }
    return Result.ok(Payloads.immutableCopy(current));
  }

  /**
   * Upcasts an event to the current version of its type. Events already at the current
   * version are returned unchanged.
   */
  public Result<Event> upcast(Event event) {
    Objects.requireNonNull(event, "event");
    int target = currentVersion(event.eventType());
    if (event.schemaVersion() == target) {
      return Result.ok(event);
    }
    if (event.schemaVersion() > target) {
      return Result.err(new UpcastError(event.eventType(), event.schemaVersion(), target, -1,
          "event is newer than the registered schema"));
    }
    return upcast(event.eventType(), event.schemaVersion(), target, event.payload())
        .map(payload -> event.withPayload(target, payload));
  }
}
