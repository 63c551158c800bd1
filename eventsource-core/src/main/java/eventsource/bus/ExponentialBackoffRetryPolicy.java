package eventsource.bus;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay},
 * with random jitter in the range [0.5, 1.5). Used by
 * {@link eventsource.bus.middleware.RetryMiddleware} between in-process attempts and
 * by saga command retries.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long exponential;
    if (attempts >= 31) {
      exponential = Long.MAX_VALUE;
    } else {
      long factor = 1L << (attempts - 1);
      exponential = factor > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * factor;
    }
    long capped = Math.min(maxDelayMs, exponential);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }
}
