package eventsource.bus.middleware;

import eventsource.bus.Delivery;
import eventsource.bus.EventMiddleware;
import eventsource.bus.ExponentialBackoffRetryPolicy;
import eventsource.bus.RetryPolicy;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retries a failing delivery in place, sleeping between attempts as the
 * {@link RetryPolicy} dictates. The last failure is rethrown once attempts run out.
 *
 * <p>Place it after middlewares that should see only the final outcome.
 */
public final class RetryMiddleware implements EventMiddleware {
  private static final Logger logger = Logger.getLogger(RetryMiddleware.class.getName());

  private final int maxAttempts;
  private final RetryPolicy retryPolicy;

  /**
   * Retries with exponential backoff from 50 ms, capped at 2 s.
   */
  public RetryMiddleware(int maxAttempts) {
    this(maxAttempts, new ExponentialBackoffRetryPolicy(50, 2_000));
  }

  /**
   * @param maxAttempts total attempts including the first, must be &ge; 1
   */
  public RetryMiddleware(int maxAttempts, RetryPolicy retryPolicy) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public void invoke(Delivery delivery, Next next) throws Exception {
    for (int attempt = 1; ; attempt++) {
      try {
        next.proceed();
        return;
      } catch (Exception e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.FINE, "Retrying {0} on {1} in {2} ms (attempt {3}/{4})",
            new Object[]{delivery.handlerName(), delivery.event().eventId(), delayMs, attempt + 1, maxAttempts});
        Thread.sleep(delayMs);
      }
    }
  }
}
