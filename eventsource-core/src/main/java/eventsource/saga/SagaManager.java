package eventsource.saga;

import eventsource.Event;
import eventsource.Result;
import eventsource.bus.EventBus;
import eventsource.bus.Subscription;
import eventsource.command.Command;
import eventsource.command.CommandBus;
import eventsource.error.EventSourcingError;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.HandlerError;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.error.EventSourcingError.SagaCompensationError;
import eventsource.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes events to saga instances, persists their state and dispatches the commands
 * they issue.
 *
 * <p>For each registered {@link Saga} consuming the event type, the manager:
 * <ol>
 *   <li>derives {@code sagaId = sagaType + ":" + correlationKey} and takes the stripe
 *       lock for it, so events of one saga are handled one at a time in this process;</li>
 *   <li>loads the instance, or starts one if {@link Saga#startsWith} accepts the event;</li>
 *   <li>ignores the event if the saga is terminal or already handled it;</li>
 *   <li>runs the saga and saves the result against the loaded version, reloading and
 *       re-running on a {@code ConcurrencyConflict} from another process;</li>
 *   <li>dispatches the issued commands in order. A failed command moves the saga to
 *       {@code COMPENSATING};</li>
 *   <li>compensates completed steps last-in first-out, saving after each one, and ends
 *       in {@code COMPENSATED}, or in {@code FAILED} if a compensating command fails.</li>
 * </ol>
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class SagaManager {
  private static final Logger logger = Logger.getLogger(SagaManager.class.getName());

  /** Handler name used by {@link #subscribeTo(EventBus)}. */
  public static final String HANDLER_NAME = "saga-manager";

  private final SagaStore store;
  private final CommandBus commandBus;
  private final int maxConflictRetries;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ReentrantLock[] stripes;
  private final Map<String, Saga> sagas = new ConcurrentHashMap<>();

  private SagaManager(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.commandBus = Objects.requireNonNull(builder.commandBus, "commandBus");
    if (builder.maxConflictRetries < 0) {
      throw new IllegalArgumentException("maxConflictRetries must be >= 0");
    }
    if (builder.lockStripes <= 0) {
      throw new IllegalArgumentException("lockStripes must be > 0");
    }
    this.maxConflictRetries = builder.maxConflictRetries;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.stripes = new ReentrantLock[builder.lockStripes];
    for (int i = 0; i < stripes.length; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a saga definition.
   *
   * @throws IllegalStateException if a saga of the same type is already registered
   */
  public void register(Saga saga) {
    Objects.requireNonNull(saga, "saga");
    if (sagas.putIfAbsent(saga.sagaType(), saga) != null) {
      throw new IllegalStateException("Saga already registered for " + saga.sagaType());
    }
  }

  /**
   * Subscribes this manager to every topic of the bus. A failed {@link #handle} makes the
   * delivery fail so the event queue redelivers it.
   */
  public Subscription subscribeTo(EventBus bus) {
    return bus.subscribe(Subscription.ALL_TOPICS, HANDLER_NAME, event -> handle(event).orElseThrow());
  }

  /**
   * Delivers one event to every saga that consumes its type.
   *
   * @return one outcome per saga instance the event reached, or the first failure. A
   *     failed compensation is returned as {@code SagaCompensationError} after the
   *     instance has been saved as {@code FAILED}.
   */
  public Result<List<SagaOutcome>> handle(Event event) {
    Objects.requireNonNull(event, "event");
    List<SagaOutcome> outcomes = new ArrayList<>();
    EventSourcingError firstError = null;
    for (Saga saga : sagas.values()) {
      if (!saga.eventTypes().contains(event.eventType())) {
        continue;
      }
      Optional<Result<SagaOutcome>> result = process(saga, event);
      if (result.isEmpty()) {
        continue;
      }
      if (result.get().isOk()) {
        outcomes.add(result.get().orElseThrow());
      } else if (firstError == null) {
        firstError = result.get().failure().orElseThrow();
      } else {
        logger.log(Level.WARNING, "Saga {0} failed on {1}: {2}",
            new Object[]{saga.sagaType(), event.eventId(), result.get().failure().orElseThrow().message()});
      }
    }
    return firstError == null ? Result.ok(outcomes) : Result.err(firstError);
  }

  /**
   * Finishes compensation of instances left in {@code COMPENSATING}, for example after
   * a crash between two compensating commands.
   *
   * @return outcomes of the resumed instances
   */
  public List<SagaOutcome> resumeCompensations() {
    List<SagaOutcome> outcomes = new ArrayList<>();
    for (SagaInstance stale : store.findByStatus(SagaStatus.COMPENSATING)) {
      ReentrantLock lock = lockFor(stale.sagaId());
      lock.lock();
      try {
        Result<SagaInstance> current = store.load(stale.sagaId());
        if (current.isErr() || current.orElseThrow().status() != SagaStatus.COMPENSATING) {
          continue;
        }
        List<Command> dispatched = new ArrayList<>();
        compensate(current.orElseThrow(), null, dispatched)
            .ifOk(outcomes::add)
            .ifErr(error -> logger.log(Level.SEVERE, "Resumed compensation failed: {0}", error.message()));
      } finally {
        lock.unlock();
      }
    }
    return outcomes;
  }

  private Optional<Result<SagaOutcome>> process(Saga saga, Event event) {
    String key = saga.correlationKey(event);
    if (key == null) {
      return Optional.empty();
    }
    String sagaId = saga.sagaType() + ":" + key;
    ReentrantLock lock = lockFor(sagaId);
    lock.lock();
    try {
      for (int attempt = 0; ; attempt++) {
        Result<SagaInstance> loaded = store.load(sagaId);
        SagaInstance current;
        if (loaded.isOk()) {
          current = loaded.orElseThrow();
        } else if (loaded.failure().orElseThrow() instanceof NotFound) {
          if (!saga.startsWith(event)) {
            logger.log(Level.FINE, "No {0} saga for {1}; {2} does not start one",
                new Object[]{saga.sagaType(), key, event.eventType()});
            return Optional.empty();
          }
          current = SagaInstance.start(sagaId, saga.sagaType(), clock.instant());
        } else {
          return Optional.of(loaded.<SagaOutcome>map(ignored -> null));
        }

        if (current.status().isTerminal() || current.hasHandled(event.eventId())) {
          logger.log(Level.FINE, "Saga {0} ignores {1} [{2}] in status {3}",
              new Object[]{sagaId, event.eventType(), event.eventId(), current.status()});
          return Optional.of(Result.ok(SagaOutcome.ignored(current)));
        }

        SagaContext context = new SagaContext(current, event, saga.maxRetries());
        try {
          saga.handle(context, event);
        } catch (Exception e) {
          if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          logger.log(Level.WARNING, "Saga " + sagaId + " failed to handle " + event.eventType(), e);
          return Optional.of(Result.<SagaOutcome>err(
              new HandlerError(saga.sagaType(), event.eventId(), event.eventType(), e)));
        }

        Result<SagaInstance> saved = persist(context.toInstance(clock.instant()), current);
        if (saved.isErr()) {
          if (saved.failure().orElseThrow() instanceof ConcurrencyConflict && attempt < maxConflictRetries) {
            logger.log(Level.FINE, "Saga {0} changed concurrently; retrying {1}",
                new Object[]{sagaId, event.eventType()});
            continue;
          }
          return Optional.of(saved.<SagaOutcome>map(ignored -> null));
        }
        return Optional.of(advance(saved.orElseThrow(), context.commands(), event));
      }
    } finally {
      lock.unlock();
    }
  }

  private Result<SagaOutcome> advance(SagaInstance instance, List<Command> commands, Event event) {
    List<Command> dispatched = new ArrayList<>();
    SagaInstance current = instance;
    for (Command command : commands) {
      Result<Object> result = commandBus.dispatch(command);
      dispatched.add(command);
      if (result.isErr()) {
        String reason = command.commandType() + " failed: " + result.failure().orElseThrow().message();
        logger.log(Level.WARNING, "Saga {0}: {1}; compensating", new Object[]{current.sagaId(), reason});
        Result<SagaInstance> saved = persist(current.failing(reason, clock.instant()), current);
        if (saved.isErr()) {
          return saved.map(ignored -> null);
        }
        current = saved.orElseThrow();
        break;
      }
    }
    if (current.status() == SagaStatus.COMPENSATING) {
      return compensate(current, event, dispatched);
    }
    return Result.ok(new SagaOutcome(current.sagaId(), current.sagaType(), current.status(), dispatched, false));
  }

  private Result<SagaOutcome> compensate(SagaInstance instance, Event cause, List<Command> dispatched) {
    SagaInstance current = instance;
    while (!current.completedSteps().isEmpty()) {
      CompletedStep step = current.completedSteps().get(current.completedSteps().size() - 1);
      String entry;
      if (step.compensation() == null) {
        entry = "skipped " + step.name() + ": no compensation";
      } else {
        Command command = cause == null ? step.compensation() : step.compensation().causedBy(cause);
        Result<Object> result = commandBus.dispatch(command);
        dispatched.add(command);
        metrics.incrementCompensations();
        if (result.isErr()) {
          EventSourcingError error = result.failure().orElseThrow();
          Result<SagaInstance> failed = persist(current.compensationFailed(
              "compensation of " + step.name() + " failed: " + error.message(), clock.instant()), current);
          if (failed.isErr()) {
            return failed.map(ignored -> null);
          }
          logger.log(Level.SEVERE, "Saga {0} failed: compensation of {1} failed: {2}",
              new Object[]{current.sagaId(), step.name(), error.message()});
          return Result.err(new SagaCompensationError(current.sagaId(), step.name(), error,
              failed.orElseThrow().compensationLog()));
        }
        entry = "compensated " + step.name() + " with " + command.commandType();
      }
      logger.log(Level.INFO, "Saga {0}: {1}", new Object[]{current.sagaId(), entry});
      Result<SagaInstance> saved = persist(current.compensated(entry, SagaStatus.COMPENSATING, clock.instant()),
          current);
      if (saved.isErr()) {
        return saved.map(ignored -> null);
      }
      current = saved.orElseThrow();
    }
    Result<SagaInstance> done = persist(current.withStatus(SagaStatus.COMPENSATED, clock.instant()), current);
    return done.map(saga -> new SagaOutcome(saga.sagaId(), saga.sagaType(), saga.status(), dispatched, false));
  }

  private Result<SagaInstance> persist(SagaInstance next, SagaInstance previous) {
    Result<SagaInstance> saved = store.save(next, previous.version());
    if (saved.isOk() && (previous.version() == 0L || next.status() != previous.status())) {
      metrics.recordSagaTransition(next.sagaType(), next.status().name());
      logger.log(Level.FINE, "Saga {0} -> {1}", new Object[]{next.sagaId(), next.status()});
    }
    return saved;
  }

  private ReentrantLock lockFor(String sagaId) {
    return stripes[(sagaId.hashCode() & 0x7fffffff) % stripes.length];
  }

  /** Builder for {@link SagaManager}. */
  public static final class Builder {
    private SagaStore store;
    private CommandBus commandBus;
    private int maxConflictRetries = 3;
    private int lockStripes = 64;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder store(SagaStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the bus that forward and compensating commands are dispatched on.
     *
     * <p><b>Required.</b>
     */
    public Builder commandBus(CommandBus commandBus) {
      this.commandBus = commandBus;
      return this;
    }

    /**
     * Sets how often an event is re-run after a concurrent save of the same saga.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder maxConflictRetries(int maxConflictRetries) {
      this.maxConflictRetries = maxConflictRetries;
      return this;
    }

    /**
     * Optional. Defaults to {@code 64}. Must be &gt; 0.
     */
    public Builder lockStripes(int lockStripes) {
      this.lockStripes = lockStripes;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public SagaManager build() {
      return new SagaManager(this);
    }
  }
}
