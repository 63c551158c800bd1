package eventsource.command;

import eventsource.Result;

/**
 * Handles one command type. Expected failures are returned as {@link Result#err};
 * thrown exceptions are reported by the bus as a {@code HandlerError}.
 */
@FunctionalInterface
public interface CommandHandler {

  Result<?> handle(Command command) throws Exception;
}
