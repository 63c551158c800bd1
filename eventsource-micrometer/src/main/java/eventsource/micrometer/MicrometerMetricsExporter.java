package eventsource.micrometer;

import eventsource.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventsource.events.appended}</li>
 *   <li>{@code eventsource.append.conflicts}</li>
 *   <li>{@code eventsource.dispatch.success}, {@code .failure}, {@code .skipped}</li>
 *   <li>{@code eventsource.commands.dispatched} tagged {@code outcome=success|failure}</li>
 *   <li>{@code eventsource.snapshots.taken}, {@code eventsource.snapshots.fallbacks}</li>
 *   <li>{@code eventsource.saga.transitions} tagged {@code saga}, {@code status}</li>
 *   <li>{@code eventsource.saga.compensations}</li>
 *   <li>{@code eventsource.queue.redelivered}, {@code eventsource.queue.parked} tagged {@code queue}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventsource.queue.depth} tagged {@code queue}</li>
 *   <li>{@code eventsource.queue.lag.oldest.ms} tagged {@code queue}</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code eventsource.handler.duration} tagged {@code handler}</li>
 * </ul>
 *
 * <p>Tagged meters are registered on first use. {@link #close()} removes every meter
 * this exporter registered.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String prefix;
  private final Counter eventsAppended;
  private final Counter conflicts;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter dispatchSkipped;
  private final Counter snapshotsTaken;
  private final Counter snapshotFallbacks;
  private final Counter compensations;

  private final Map<String, Meter> tagged = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> depths = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> lags = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventsource"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventsource");
  }

  /**
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.es"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.prefix = namePrefix;

    this.eventsAppended = counter("events.appended", "Events appended to the event store");
    this.conflicts = counter("append.conflicts", "Appends rejected by optimistic concurrency");
    this.dispatchSuccess = counter("dispatch.success", "Successful handler deliveries");
    this.dispatchFailure = counter("dispatch.failure", "Failed handler deliveries");
    this.dispatchSkipped = counter("dispatch.skipped", "Deliveries skipped while already in flight");
    this.snapshotsTaken = counter("snapshots.taken", "Snapshots written");
    this.snapshotFallbacks = counter("snapshots.fallbacks", "Incompatible snapshots replaced by a full replay");
    this.compensations = counter("saga.compensations", "Compensating commands issued");
  }

  private Counter counter(String name, String description) {
    Counter counter = Counter.builder(prefix + "." + name)
        .description(description)
        .register(registry);
    tagged.put(name, counter);
    return counter;
  }

  private Counter taggedCounter(String name, String... tags) {
    String key = name + ":" + String.join(",", tags);
    return (Counter) tagged.computeIfAbsent(key, k -> Counter.builder(prefix + "." + name)
        .tags(tags)
        .register(registry));
  }

  private AtomicLong queueGauge(Map<String, AtomicLong> values, String name, String queue) {
    return values.computeIfAbsent(queue, q -> {
      AtomicLong value = new AtomicLong();
      Gauge gauge = Gauge.builder(prefix + "." + name, value, AtomicLong::get)
          .tag("queue", q)
          .register(registry);
      tagged.put(name + ":" + q, gauge);
      return value;
    });
  }

  @Override
  public void incrementEventsAppended(int count) {
    if (closed) return;
    eventsAppended.increment(count);
  }

  @Override
  public void incrementConcurrencyConflicts() {
    if (closed) return;
    conflicts.increment();
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementDispatchSkipped() {
    if (closed) return;
    dispatchSkipped.increment();
  }

  @Override
  public void recordHandlerDurationMs(String handlerName, long durationMs) {
    if (closed) return;
    String key = "handler.duration:" + handlerName;
    Timer timer = (Timer) tagged.computeIfAbsent(key, k -> Timer.builder(prefix + ".handler.duration")
        .tag("handler", handlerName)
        .register(registry));
    timer.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementCommandsDispatched(boolean success) {
    if (closed) return;
    taggedCounter("commands.dispatched", "outcome", success ? "success" : "failure").increment();
  }

  @Override
  public void incrementSnapshotsTaken() {
    if (closed) return;
    snapshotsTaken.increment();
  }

  @Override
  public void incrementSnapshotFallbacks() {
    if (closed) return;
    snapshotFallbacks.increment();
  }

  @Override
  public void recordSagaTransition(String sagaType, String status) {
    if (closed) return;
    taggedCounter("saga.transitions", "saga", sagaType, "status", status).increment();
  }

  @Override
  public void incrementCompensations() {
    if (closed) return;
    compensations.increment();
  }

  @Override
  public void incrementRedelivered(String queueName) {
    if (closed) return;
    taggedCounter("queue.redelivered", "queue", queueName).increment();
  }

  @Override
  public void incrementParked(String queueName) {
    if (closed) return;
    taggedCounter("queue.parked", "queue", queueName).increment();
  }

  @Override
  public void recordUnprocessedDepth(String queueName, long depth) {
    if (closed) return;
    queueGauge(depths, "queue.depth", queueName).set(depth);
  }

  @Override
  public void recordOldestLagMs(String queueName, long lagMs) {
    if (closed) return;
    queueGauge(lags, "queue.lag.oldest.ms", queueName).set(lagMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    List<Meter> meters = new ArrayList<>(tagged.values());
    tagged.clear();
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
