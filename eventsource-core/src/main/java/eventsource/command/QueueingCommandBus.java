package eventsource.command;

import eventsource.Result;
import eventsource.queue.CommandQueueHandler;
import eventsource.queue.QueueHandler;
import eventsource.spi.MessageQueue;
import eventsource.util.JsonCodec;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command bus that writes every command to a durable queue instead of running it.
 *
 * <p>{@link #dispatch} returns as soon as the command is enqueued, with the command id as
 * its value. Handlers registered here go to a local bus, which a
 * {@link eventsource.queue.QueuePoller} built with {@link #queueHandler()} drains,
 * possibly in another process sharing the same queue table. Handler failures are
 * therefore retried by the poller rather than reported to the caller.
 */
public final class QueueingCommandBus implements CommandBus {
  private static final Logger logger = Logger.getLogger(QueueingCommandBus.class.getName());

  private final MessageQueue commandQueue;
  private final CommandBus local;
  private final JsonCodec jsonCodec;

  public QueueingCommandBus(MessageQueue commandQueue, CommandBus local) {
    this(commandQueue, local, JsonCodec.getDefault());
  }

  public QueueingCommandBus(MessageQueue commandQueue, CommandBus local, JsonCodec jsonCodec) {
    this.commandQueue = Objects.requireNonNull(commandQueue, "commandQueue");
    this.local = Objects.requireNonNull(local, "local");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void register(String commandType, CommandHandler handler) {
    local.register(commandType, handler);
  }

  @Override
  public void registerAsync(String commandType, AsyncCommandHandler handler) {
    local.registerAsync(commandType, handler);
  }

  @Override
  public boolean hasHandler(String commandType) {
    return local.hasHandler(commandType);
  }

  @Override
  public Result<Object> dispatch(Command command) {
    Objects.requireNonNull(command, "command");
    commandQueue.enqueue(command.commandId(), command.commandType(), jsonCodec.encodeCommand(command));
    logger.log(Level.FINE, "Queued command {0} [{1}]", new Object[]{command.commandType(), command.commandId()});
    return Result.ok(command.commandId());
  }

  /**
   * Handler that runs queued commands on the local bus.
   */
  public QueueHandler queueHandler() {
    return new CommandQueueHandler(local, jsonCodec);
  }
}
