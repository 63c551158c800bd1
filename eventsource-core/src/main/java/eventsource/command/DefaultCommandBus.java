package eventsource.command;

import eventsource.Result;
import eventsource.error.EventSourcingError.HandlerError;
import eventsource.error.EventSourcingError.NotFound;
import eventsource.spi.MetricsExporter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process command bus. Commands run synchronously on the caller's thread; async
 * handlers are awaited up to {@code asyncTimeout}.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultCommandBus implements CommandBus {
  private static final Logger logger = Logger.getLogger(DefaultCommandBus.class.getName());

  private final Map<String, Registration> handlers = new ConcurrentHashMap<>();
  private final Duration asyncTimeout;
  private final MetricsExporter metrics;

  private DefaultCommandBus(Builder builder) {
    this.asyncTimeout = Objects.requireNonNull(builder.asyncTimeout, "asyncTimeout");
    if (asyncTimeout.isNegative() || asyncTimeout.isZero()) {
      throw new IllegalArgumentException("asyncTimeout must be positive");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void register(String commandType, CommandHandler handler) {
    Objects.requireNonNull(handler, "handler");
    add(commandType, new Registration(nameOf(handler, commandType), handler, null));
  }

  @Override
  public void registerAsync(String commandType, AsyncCommandHandler handler) {
    Objects.requireNonNull(handler, "handler");
    add(commandType, new Registration(nameOf(handler, commandType), null, handler));
  }

  private void add(String commandType, Registration registration) {
    Objects.requireNonNull(commandType, "commandType");
    if (handlers.putIfAbsent(commandType, registration) != null) {
      throw new IllegalStateException("Command handler already registered for " + commandType);
    }
  }

  @Override
  public boolean hasHandler(String commandType) {
    return handlers.containsKey(commandType);
  }

  @Override
  public Result<Object> dispatch(Command command) {
    Objects.requireNonNull(command, "command");
    Registration registration = handlers.get(command.commandType());
    if (registration == null) {
      metrics.incrementCommandsDispatched(false);
      return Result.err(new NotFound("CommandHandler", command.commandType()));
    }
    Result<Object> result;
    try {
      result = widen(registration.sync() != null
          ? registration.sync().handle(command)
          : registration.async().handle(command).toCompletableFuture()
              .get(asyncTimeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = failed(registration, command, e);
    } catch (ExecutionException e) {
      result = failed(registration, command, e.getCause() != null ? e.getCause() : e);
    } catch (TimeoutException e) {
      result = failed(registration, command, e);
    } catch (Exception e) {
      result = failed(registration, command, e);
    }
    metrics.incrementCommandsDispatched(result.isOk());
    if (result.isErr()) {
      logger.log(Level.WARNING, "Command {0} [{1}] failed: {2}", new Object[]{
          command.commandType(), command.commandId(), result.failure().orElseThrow().message()});
    } else {
      logger.log(Level.FINE, "Command {0} [{1}] handled",
          new Object[]{command.commandType(), command.commandId()});
    }
    return result;
  }

  private static Result<Object> failed(Registration registration, Command command, Throwable cause) {
    return Result.err(new HandlerError(registration.name(), command.commandId(), command.commandType(), cause));
  }

  @SuppressWarnings("unchecked")
  private static Result<Object> widen(Result<?> result) {
    return result == null ? Result.ok(null) : (Result<Object>) result;
  }

  private static String nameOf(Object handler, String commandType) {
    Class<?> type = handler.getClass();
    return type.isSynthetic() || type.isAnonymousClass() ? commandType + "Handler" : type.getSimpleName();
  }

  private record Registration(String name, CommandHandler sync, AsyncCommandHandler async) {
  }

  /** Builder for {@link DefaultCommandBus}. */
  public static final class Builder {
    private Duration asyncTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets how long {@link DefaultCommandBus#dispatch} waits for an async handler.
     *
     * <p>Optional. Defaults to 30 seconds. Must be positive.
     */
    public Builder asyncTimeout(Duration asyncTimeout) {
      this.asyncTimeout = asyncTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public DefaultCommandBus build() {
      return new DefaultCommandBus(this);
    }
  }
}
