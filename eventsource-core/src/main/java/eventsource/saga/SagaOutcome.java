package eventsource.saga;

import eventsource.command.Command;

import java.util.List;

/**
 * What one saga instance did with one event.
 *
 * @param commands forward and compensating commands dispatched, in order
 * @param ignored  {@code true} if the saga was already terminal or had seen the event
 */
public record SagaOutcome(String sagaId, String sagaType, SagaStatus status, List<Command> commands,
    boolean ignored) {
  public SagaOutcome {
    commands = List.copyOf(commands);
  }

  static SagaOutcome ignored(SagaInstance instance) {
    return new SagaOutcome(instance.sagaId(), instance.sagaType(), instance.status(), List.of(), true);
  }
}
