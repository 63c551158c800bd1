package eventsource.bus;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default), a delivery key remains claimed until
 * explicitly released. When positive, a claim older than the TTL may be taken over,
 * so a delivery stuck in a hung handler does not block redelivery forever.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Long> inflight = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final AtomicInteger evictCounter = new AtomicInteger();

    /**
     * Creates a tracker with no TTL (claims persist until released).
     */
    public DefaultInFlightTracker() {
        this(0L);
    }

    /**
     * @param ttlMs time-to-live in milliseconds after which a claim may be taken over
     */
    public DefaultInFlightTracker(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0, got: " + ttlMs);
        }
        this.ttlMs = ttlMs;
    }

    @Override
    public boolean tryAcquire(String deliveryKey) {
        long now = System.currentTimeMillis();
        maybeEvictExpired(now);
        for (int attempt = 0; attempt < 10; attempt++) {
            Long claimedAt = inflight.putIfAbsent(deliveryKey, now);
            if (claimedAt == null) {
                return true;
            }
            if (ttlMs > 0 && now - claimedAt > ttlMs) {
                now = System.currentTimeMillis();
                if (inflight.replace(deliveryKey, claimedAt, now)) {
                    return true;
                }
                // lost the race to another taker
                continue;
            }
            return false;
        }
        return false;
    }

    /**
     * Number of keys currently claimed.
     */
    public int size() {
        return inflight.size();
    }

    private void maybeEvictExpired(long now) {
        if (ttlMs <= 0) return;
        // sample roughly every 1024 acquires
        if ((evictCounter.incrementAndGet() & 0x3FF) != 0) return;
        inflight.entrySet().removeIf(e -> now - e.getValue() > ttlMs * 2);
    }

    @Override
    public void release(String deliveryKey) {
        inflight.remove(deliveryKey);
    }
}
