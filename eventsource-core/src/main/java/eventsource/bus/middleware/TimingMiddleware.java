package eventsource.bus.middleware;

import eventsource.bus.Delivery;
import eventsource.bus.EventMiddleware;
import eventsource.spi.MetricsExporter;

import java.util.Objects;

/**
 * Records the wall-clock time of every delivery, successful or not.
 */
public final class TimingMiddleware implements EventMiddleware {
  private final MetricsExporter metrics;

  public TimingMiddleware(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void invoke(Delivery delivery, Next next) throws Exception {
    long start = System.nanoTime();
    try {
      next.proceed();
    } finally {
      metrics.recordHandlerDurationMs(delivery.handlerName(), (System.nanoTime() - start) / 1_000_000L);
    }
  }
}
