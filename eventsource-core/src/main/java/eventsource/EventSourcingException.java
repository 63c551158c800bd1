package eventsource;

import eventsource.error.EventSourcingError;

import java.util.Objects;

/**
 * Unchecked exception carrying an {@link EventSourcingError}, thrown when a caller
 * unwraps a failed {@link Result} with {@link Result#orElseThrow()}.
 */
public class EventSourcingException extends RuntimeException {
  private final EventSourcingError error;

  public EventSourcingException(EventSourcingError error) {
    super(Objects.requireNonNull(error, "error").message());
    this.error = error;
  }

  public EventSourcingError error() {
    return error;
  }
}
