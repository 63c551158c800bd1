package eventsource.bus;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Processed-key store held in memory. Keys survive only as long as the process.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryProcessedKeyStore implements ProcessedKeyStore {
  private final Map<String, Instant> keys = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryProcessedKeyStore() {
    this(Clock.systemUTC());
  }

  public InMemoryProcessedKeyStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean isProcessed(String consumer, String key) {
    return keys.containsKey(compositeKey(consumer, key));
  }

  @Override
  public boolean markProcessed(String consumer, String key) {
    return keys.putIfAbsent(compositeKey(consumer, key), clock.instant()) == null;
  }

  @Override
  public int purge(Instant olderThan) {
    int before = keys.size();
    keys.values().removeIf(processedAt -> processedAt.isBefore(olderThan));
    return before - keys.size();
  }

  public int size() {
    return keys.size();
  }

  private static String compositeKey(String consumer, String key) {
    return Objects.requireNonNull(consumer, "consumer") + "\u0000" + Objects.requireNonNull(key, "key");
  }
}
