package eventsource.saga;

import eventsource.Event;

import java.util.Set;

/**
 * Definition of a process manager: which events it reacts to and how.
 *
 * <p>One instance of the definition serves every running saga of its type; per-saga
 * state lives in {@link SagaContext#data()}.
 */
public interface Saga {

  /**
   * Unique type name, used as the saga id prefix.
   */
  String sagaType();

  /**
   * Event types this saga consumes.
   */
  Set<String> eventTypes();

  /**
   * Whether this event may create a new saga instance when none exists for its key.
   */
  boolean startsWith(Event event);

  /**
   * Key that routes an event to its saga instance. Defaults to the correlation id;
   * {@code null} means the event does not concern this saga.
   */
  default String correlationKey(Event event) {
    return event.correlationId();
  }

  /**
   * Advances the saga. Throwing leaves the instance unchanged so the event can be
   * redelivered.
   */
  void handle(SagaContext context, Event event) throws Exception;

  /**
   * Retries allowed by {@link SagaContext#timeout} before the saga fails.
   */
  default int maxRetries() {
    return 3;
  }
}
