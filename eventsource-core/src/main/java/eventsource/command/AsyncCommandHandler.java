package eventsource.command;

import eventsource.Result;

import java.util.concurrent.CompletionStage;

/**
 * Command handler that completes asynchronously. {@link CommandBus#dispatch} waits for
 * the returned stage up to the bus's timeout.
 */
@FunctionalInterface
public interface AsyncCommandHandler {

  CompletionStage<? extends Result<?>> handle(Command command);
}
