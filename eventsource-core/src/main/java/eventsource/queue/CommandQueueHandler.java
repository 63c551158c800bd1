package eventsource.queue;

import eventsource.Result;
import eventsource.command.CommandBus;
import eventsource.spi.QueuedMessage;
import eventsource.util.JsonCodec;

import java.util.Objects;

/**
 * Dispatches queued commands to a local command bus.
 */
public final class CommandQueueHandler implements QueueHandler {
  private final CommandBus commandBus;
  private final JsonCodec jsonCodec;

  public CommandQueueHandler(CommandBus commandBus) {
    this(commandBus, JsonCodec.getDefault());
  }

  public CommandQueueHandler(CommandBus commandBus, JsonCodec jsonCodec) {
    this.commandBus = Objects.requireNonNull(commandBus, "commandBus");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Result<?> handle(QueuedMessage message) {
    return commandBus.dispatch(jsonCodec.decodeCommand(message.payload()));
  }
}
