package eventsource.command;

import com.github.f4b6a3.ulid.UlidCreator;
import eventsource.Event;
import eventsource.util.Payloads;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable request for a state change, routed by {@code commandType} to exactly one
 * {@link CommandHandler}.
 *
 * @param commandId     unique id (ULID by default)
 * @param commandType   routing key
 * @param payload       structured arguments
 * @param correlationId business transaction the command belongs to
 * @param causationId   id of the event or command that caused this one, or {@code null}
 * @param issuedAt      creation time
 */
public record Command(
    String commandId,
    String commandType,
    Map<String, Object> payload,
    String correlationId,
    String causationId,
    Instant issuedAt
) {
  public Command {
    Objects.requireNonNull(commandId, "commandId");
    Objects.requireNonNull(commandType, "commandType");
    if (commandType.isEmpty()) {
      throw new IllegalArgumentException("commandType cannot be empty");
    }
    payload = Payloads.immutableCopy(payload);
    correlationId = correlationId == null ? commandId : correlationId;
    issuedAt = issuedAt == null ? Instant.now() : issuedAt;
  }

  /**
   * Creates a command with a fresh id, correlated to itself.
   */
  public static Command of(String commandType, Map<String, ?> payload) {
    String id = UlidCreator.getMonotonicUlid().toString();
    return new Command(id, commandType, Payloads.immutableCopy(payload), id, null, Instant.now());
  }

  /**
   * Returns a copy correlated to the given event and caused by it.
   */
  public Command causedBy(Event event) {
    Objects.requireNonNull(event, "event");
    return new Command(commandId, commandType, payload, event.correlationId(), event.eventId(), issuedAt);
  }
}
