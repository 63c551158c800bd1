package eventsource.command;

import eventsource.Result;

/**
 * Routes each command to the single handler registered for its type.
 *
 * @see DefaultCommandBus
 * @see QueueingCommandBus
 */
public interface CommandBus {

  /**
   * @throws IllegalStateException if a handler is already registered for the type
   */
  void register(String commandType, CommandHandler handler);

  /**
   * @throws IllegalStateException if a handler is already registered for the type
   */
  void registerAsync(String commandType, AsyncCommandHandler handler);

  boolean hasHandler(String commandType);

  /**
   * Dispatches a command.
   *
   * @return the handler's result; {@code NotFound} when no handler is registered, or
   *     {@code HandlerError} when the handler throws or times out
   */
  Result<Object> dispatch(Command command);
}
