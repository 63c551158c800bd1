package eventsource;

import eventsource.bus.DefaultEventBus;
import eventsource.bus.EventBus;
import eventsource.bus.EventMiddleware;
import eventsource.bus.ProcessedKeyStore;
import eventsource.command.CommandBus;
import eventsource.command.DefaultCommandBus;
import eventsource.command.QueueingCommandBus;
import eventsource.queue.EventQueueHandler;
import eventsource.queue.QueuePoller;
import eventsource.queue.QueuePurgeScheduler;
import eventsource.replay.ReplayEngine;
import eventsource.saga.InMemorySagaStore;
import eventsource.saga.Saga;
import eventsource.saga.SagaManager;
import eventsource.saga.SagaStore;
import eventsource.snapshot.SnapshotStore;
import eventsource.snapshot.SnapshotStrategy;
import eventsource.spi.MessageQueue;
import eventsource.spi.MetricsExporter;
import eventsource.spi.TxContext;
import eventsource.store.EventStore;
import eventsource.uow.UnitOfWork;
import eventsource.upcast.UpcasterRegistry;
import eventsource.util.JsonCodec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the replay engine, event bus, command bus, saga
 * manager, unit of work and queue pollers into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventSourcing es = EventSourcing.builder()
 *     .eventStore(new InMemoryEventStore(eventQueue))
 *     .eventQueue(eventQueue)
 *     .build()) {
 *   es.commandBus().register("PlaceOrder", placeOrderHandler);
 *   es.sagaManager().register(new OrderSaga());
 *   es.start();
 *   ...
 * }
 * }</pre>
 *
 * <p>The saga manager is subscribed to the bus at build time. Pollers only run after
 * {@link #start()}.
 */
public final class EventSourcing implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventSourcing.class.getName());

  private final ReplayEngine replayEngine;
  private final DefaultEventBus eventBus;
  private final CommandBus commandBus;
  private final SagaManager sagaManager;
  private final UnitOfWork unitOfWork;
  private final QueuePoller eventPoller;
  private final QueuePoller commandPoller;
  private final QueuePurgeScheduler purgeScheduler;
  private final MetricsExporter metrics;
  private final AtomicBoolean started = new AtomicBoolean();

  private EventSourcing(Builder builder) {
    Objects.requireNonNull(builder.eventStore, "eventStore");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();

    this.replayEngine = ReplayEngine.builder()
        .eventStore(builder.eventStore)
        .snapshotStore(builder.snapshotStore)
        .snapshotStrategy(builder.snapshotStrategy)
        .upcasters(builder.upcasters)
        .metrics(metrics)
        .build();
    this.eventBus = DefaultEventBus.builder()
        .concurrency(builder.busConcurrency)
        .batchSize(builder.busBatchSize)
        .middlewares(builder.middlewares)
        .metrics(metrics)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .build();

    DefaultCommandBus local = DefaultCommandBus.builder().metrics(metrics).build();
    if (builder.commandQueue != null) {
      QueueingCommandBus queueing = new QueueingCommandBus(builder.commandQueue, local, jsonCodec);
      this.commandBus = queueing;
      this.commandPoller = QueuePoller.builder()
          .queue(builder.commandQueue)
          .handler(queueing.queueHandler())
          .intervalMs(builder.pollIntervalMs)
          .maxAttempts(builder.maxAttempts)
          .wakeOnEnqueue(true)
          .metrics(metrics)
          .build();
    } else {
      this.commandBus = local;
      this.commandPoller = null;
    }

    this.sagaManager = SagaManager.builder()
        .store(builder.sagaStore != null ? builder.sagaStore : new InMemorySagaStore())
        .commandBus(commandBus)
        .metrics(metrics)
        .build();
    for (Saga saga : builder.sagas) {
      sagaManager.register(saga);
    }
    sagaManager.subscribeTo(eventBus);

    this.unitOfWork = UnitOfWork.builder()
        .eventStore(builder.eventStore)
        .eventBus(eventBus)
        .eventQueue(builder.eventQueue)
        .replayEngine(replayEngine)
        .txContext(builder.txContext)
        .metrics(metrics)
        .build();

    this.eventPoller = builder.eventQueue == null ? null : QueuePoller.builder()
        .queue(builder.eventQueue)
        .handler(new EventQueueHandler(eventBus, replayEngine.upcasters(), jsonCodec))
        .skipRecent(builder.skipRecent)
        .intervalMs(builder.pollIntervalMs)
        .maxAttempts(builder.maxAttempts)
        .metrics(metrics)
        .build();

    if (builder.purgeRetention != null) {
      QueuePurgeScheduler.Builder purge = QueuePurgeScheduler.builder()
          .retention(builder.purgeRetention)
          .processedKeys(builder.processedKeys);
      if (builder.eventQueue != null) {
        purge.queue(builder.eventQueue);
      }
      if (builder.commandQueue != null) {
        purge.queue(builder.commandQueue);
      }
      this.purgeScheduler = purge.build();
    } else {
      this.purgeScheduler = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public ReplayEngine replayEngine() {
    return replayEngine;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public CommandBus commandBus() {
    return commandBus;
  }

  public SagaManager sagaManager() {
    return sagaManager;
  }

  public UnitOfWork unitOfWork() {
    return unitOfWork;
  }

  /**
   * Starts the configured pollers and purge scheduler. Subsequent calls are no-ops.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (eventPoller != null) {
      eventPoller.start();
    }
    if (commandPoller != null) {
      commandPoller.start();
    }
    if (purgeScheduler != null) {
      purgeScheduler.start();
    }
    logger.log(Level.INFO, "Event sourcing started (event poller: {0}, command poller: {1})",
        new Object[]{eventPoller != null, commandPoller != null});
  }

  /**
   * Shuts down components in order: purge scheduler, pollers, event bus.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    List<AutoCloseable> components = new ArrayList<>();
    if (purgeScheduler != null) {
      components.add(purgeScheduler);
    }
    if (eventPoller != null) {
      components.add(eventPoller);
    }
    if (commandPoller != null) {
      components.add(commandPoller);
    }
    components.add(eventBus);
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link EventSourcing}. */
  public static final class Builder {
    private EventStore eventStore;
    private MessageQueue eventQueue;
    private MessageQueue commandQueue;
    private SnapshotStore snapshotStore;
    private SnapshotStrategy snapshotStrategy;
    private UpcasterRegistry upcasters = new UpcasterRegistry();
    private SagaStore sagaStore;
    private final List<Saga> sagas = new ArrayList<>();
    private final List<EventMiddleware> middlewares = new ArrayList<>();
    private ProcessedKeyStore processedKeys;
    private TxContext txContext;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private int busConcurrency = 4;
    private int busBatchSize = 10;
    private long drainTimeoutMs = 5000;
    private long pollIntervalMs = 5000;
    private int maxAttempts = 10;
    private Duration skipRecent = Duration.ofSeconds(1);
    private Duration purgeRetention;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the queue the event store writes to. Enables the recovery poller.
     *
     * <p>Optional.
     */
    public Builder eventQueue(MessageQueue eventQueue) {
      this.eventQueue = eventQueue;
      return this;
    }

    /**
     * Routes commands through a durable queue instead of dispatching them in-process.
     *
     * <p>Optional.
     */
    public Builder commandQueue(MessageQueue commandQueue) {
      this.commandQueue = commandQueue;
      return this;
    }

    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    public Builder snapshotStrategy(SnapshotStrategy snapshotStrategy) {
      this.snapshotStrategy = snapshotStrategy;
      return this;
    }

    /**
     * Optional. Defaults to an empty registry.
     */
    public Builder upcasters(UpcasterRegistry upcasters) {
      this.upcasters = Objects.requireNonNull(upcasters, "upcasters");
      return this;
    }

    /**
     * Optional. Defaults to an {@link InMemorySagaStore}.
     */
    public Builder sagaStore(SagaStore sagaStore) {
      this.sagaStore = sagaStore;
      return this;
    }

    public Builder saga(Saga saga) {
      this.sagas.add(Objects.requireNonNull(saga, "saga"));
      return this;
    }

    public Builder middleware(EventMiddleware middleware) {
      this.middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    /**
     * Sets a dedup key store purged alongside the queues.
     */
    public Builder processedKeys(ProcessedKeyStore processedKeys) {
      this.processedKeys = processedKeys;
      return this;
    }

    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Optional. Defaults to {@code 4}.
     */
    public Builder busConcurrency(int busConcurrency) {
      this.busConcurrency = busConcurrency;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10}.
     */
    public Builder busBatchSize(int busBatchSize) {
      this.busBatchSize = busBatchSize;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5000} ms.
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10}.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets how long the event poller leaves new rows to the hot path.
     *
     * <p>Optional. Defaults to {@code 1s}.
     */
    public Builder skipRecent(Duration skipRecent) {
      this.skipRecent = skipRecent;
      return this;
    }

    /**
     * Enables the purge scheduler with the given retention.
     *
     * <p>Optional. Without it processed rows are kept.
     */
    public Builder purgeRetention(Duration purgeRetention) {
      this.purgeRetention = purgeRetention;
      return this;
    }

    /**
     * @throws NullPointerException if {@code eventStore} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     * @throws IllegalStateException if two sagas share a type
     */
    public EventSourcing build() {
      return new EventSourcing(this);
    }
  }
}
