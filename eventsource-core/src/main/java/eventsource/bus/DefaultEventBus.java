package eventsource.bus;

import com.github.f4b6a3.ulid.UlidCreator;
import eventsource.Event;
import eventsource.Result;
import eventsource.error.EventSourcingError.HandlerError;
import eventsource.error.EventSourcingError.HandlerFailures;
import eventsource.spi.MetricsExporter;
import eventsource.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event bus that delivers batches on a bounded pool of worker threads.
 *
 * <p>A batch is split into per-aggregate groups. Each group runs on one worker and
 * delivers its events in order, so handlers observe a stream in sequence order, while
 * groups for different aggregates run concurrently. Every delivery passes through the
 * middleware chain and the {@link InFlightTracker}. The caller blocks until the whole
 * batch has completed; interrupting the caller cancels the outstanding groups.
 *
 * <p>A publish issued from inside a handler runs inline on the worker thread, so nested
 * publishing cannot exhaust the pool.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 */
public final class DefaultEventBus implements EventBus, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DefaultEventBus.class.getName());

  private static final ThreadLocal<Boolean> ON_WORKER = ThreadLocal.withInitial(() -> Boolean.FALSE);

  private static final Comparator<Subscription> DELIVERY_ORDER =
      Comparator.comparingInt(Subscription::priority).reversed()
          .thenComparingLong(Subscription::order);

  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicLong registrationCounter = new AtomicLong();
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final ExecutorService workers;
  private final List<EventMiddleware> middlewares;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final int batchSize;
  private final long drainTimeoutMs;

  private DefaultEventBus(Builder builder) {
    if (builder.concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    this.middlewares = Collections.unmodifiableList(new ArrayList<>(builder.middlewares));
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.batchSize = builder.batchSize;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = Executors.newFixedThreadPool(builder.concurrency,
        new DaemonThreadFactory("eventsource-bus-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Subscription subscribe(String topicPattern, String handlerName, EventHandler handler, int priority) {
    Subscription subscription = new Subscription(UlidCreator.getMonotonicUlid().toString(),
        topicPattern, handlerName, handler, priority, registrationCounter.incrementAndGet());
    synchronized (subscriptions) {
      for (Subscription existing : subscriptions) {
        if (existing.handlerName().equals(handlerName)) {
          throw new IllegalStateException("Handler already subscribed: " + handlerName);
        }
      }
      subscriptions.add(subscription);
    }
    logger.log(Level.FINE, "Subscribed {0} to {1} (priority {2})",
        new Object[]{handlerName, topicPattern, priority});
    return subscription;
  }

  @Override
  public boolean unsubscribe(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    synchronized (subscriptions) {
      return subscriptions.remove(subscription);
    }
  }

  @Override
  public List<Subscription> subscriptions() {
    return List.copyOf(subscriptions);
  }

  @Override
  public Result<DispatchReport> publish(Event event) {
    Objects.requireNonNull(event, "event");
    return publishMany(List.of(event), batchSize);
  }

  @Override
  public Result<DispatchReport> publishMany(List<Event> events) {
    return publishMany(events, batchSize);
  }

  @Override
  public Result<DispatchReport> publishMany(List<Event> events, int batchSize) {
    Objects.requireNonNull(events, "events");
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (!accepting.get()) {
      throw new IllegalStateException("Event bus is closed");
    }
    List<Failure> failures = Collections.synchronizedList(new ArrayList<>());
    DispatchReport report = DispatchReport.EMPTY;
    for (int from = 0; from < events.size(); from += batchSize) {
      int to = Math.min(events.size(), from + batchSize);
      report = report.plus(dispatchBatch(events.subList(from, to), from, failures));
    }

    if (failures.isEmpty()) {
      return Result.ok(report);
    }
    List<HandlerError> errors = new ArrayList<>(failures.size());
    synchronized (failures) {
      failures.sort(Comparator.comparingInt(Failure::eventIndex)
          .thenComparingLong(Failure::subscriptionOrder));
      for (Failure failure : failures) {
        errors.add(failure.error());
      }
    }
    return Result.err(new HandlerFailures(errors));
  }

  private DispatchReport dispatchBatch(List<Event> batch, int offset, List<Failure> failures) {
    Map<String, List<Integer>> groups = new LinkedHashMap<>();
    for (int i = 0; i < batch.size(); i++) {
      groups.computeIfAbsent(batch.get(i).aggregateId(), k -> new ArrayList<>()).add(i);
    }
    AtomicInteger deliveries = new AtomicInteger();
    AtomicInteger skipped = new AtomicInteger();

    if (ON_WORKER.get() || groups.size() == 1) {
      for (List<Integer> group : groups.values()) {
        deliverGroup(batch, offset, group, failures, deliveries, skipped);
      }
      return new DispatchReport(batch.size(), deliveries.get(), skipped.get());
    }

    List<CompletableFuture<Void>> futures = new ArrayList<>(groups.size());
    for (List<Integer> group : groups.values()) {
      futures.add(CompletableFuture.runAsync(() -> {
        ON_WORKER.set(Boolean.TRUE);
        try {
          deliverGroup(batch, offset, group, failures, deliveries, skipped);
        } finally {
          ON_WORKER.set(Boolean.FALSE);
        }
      }, workers));
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get();
    } catch (InterruptedException e) {
      for (CompletableFuture<Void> future : futures) {
        future.cancel(true);
      }
      Thread.currentThread().interrupt();
      throw new CancellationException("Publish interrupted with " + batch.size() + " event(s) in flight");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Event delivery failed unexpectedly", cause);
    }
    return new DispatchReport(batch.size(), deliveries.get(), skipped.get());
  }

  private void deliverGroup(List<Event> batch, int offset, List<Integer> group, List<Failure> failures,
      AtomicInteger deliveries, AtomicInteger skipped) {
    List<Subscription> snapshot = new ArrayList<>(subscriptions);
    snapshot.sort(DELIVERY_ORDER);
    for (int index : group) {
      Event event = batch.get(index);
      for (Subscription subscription : snapshot) {
        if (!subscription.matches(event.eventType())) {
          continue;
        }
        Failure failure = deliver(new Delivery(event, subscription), offset + index, deliveries, skipped);
        if (failure != null) {
          failures.add(failure);
        }
      }
    }
  }

  private Failure deliver(Delivery delivery, int eventIndex, AtomicInteger deliveries, AtomicInteger skipped) {
    Event event = delivery.event();
    String key = InFlightTracker.key(delivery.handlerName(), event.eventId());
    if (!inFlightTracker.tryAcquire(key)) {
      skipped.incrementAndGet();
      metrics.incrementDispatchSkipped();
      logger.log(Level.FINE, "Skipping {0}: already in flight", key);
      return null;
    }
    try {
      invokeChain(delivery, 0);
      deliveries.incrementAndGet();
      metrics.incrementDispatchSuccess();
      return null;
    } catch (Exception e) {
      metrics.incrementDispatchFailure();
      logger.log(Level.WARNING, "Handler " + delivery.handlerName() + " failed on "
          + event.eventType() + " [" + event.eventId() + "]", e);
      return new Failure(eventIndex, delivery.subscription().order(),
          new HandlerError(delivery.handlerName(), event.eventId(), event.eventType(), e));
    } finally {
      inFlightTracker.release(key);
    }
  }

  private void invokeChain(Delivery delivery, int index) throws Exception {
    if (index == middlewares.size()) {
      delivery.subscription().handler().handle(delivery.event());
      return;
    }
    middlewares.get(index).invoke(delivery, () -> invokeChain(delivery, index + 1));
  }

  /**
   * Stops accepting publishes and waits for in-flight batches up to the drain timeout.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing bus shutdown");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record Failure(int eventIndex, long subscriptionOrder, HandlerError error) {
  }

  /** Builder for {@link DefaultEventBus}. */
  public static final class Builder {
    private int concurrency = 4;
    private int batchSize = 10;
    private final List<EventMiddleware> middlewares = new ArrayList<>();
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the number of worker threads delivering aggregate groups concurrently.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param concurrency worker thread count
     * @return this builder
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Sets the default number of events per batch for {@link EventBus#publishMany(List)}.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param batchSize events per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Appends a middleware. Middlewares wrap the handler in registration order.
     *
     * @param middleware the middleware to add
     * @return this builder
     */
    public Builder middleware(EventMiddleware middleware) {
      this.middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    public Builder middlewares(List<EventMiddleware> middlewares) {
      middlewares.forEach(this::middleware);
      return this;
    }

    /**
     * Sets a custom in-flight tracker for skipping concurrent duplicate deliveries.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the tracker implementation
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the metrics exporter for recording dispatch counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for in-flight batches on close.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the bus and starts its worker pool.
     *
     * @throws IllegalArgumentException if {@code concurrency < 1} or {@code batchSize < 1}
     */
    public DefaultEventBus build() {
      return new DefaultEventBus(this);
    }
  }
}
