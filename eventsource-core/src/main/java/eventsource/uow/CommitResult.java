package eventsource.uow;

import eventsource.Event;
import eventsource.error.EventSourcingError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a successful append. Publishing problems are reported here; they never
 * undo the append.
 *
 * @param version      stream version after the append
 * @param events       the appended events, with their stream positions
 * @param status       what happened after the append
 * @param publishError the bus failure when {@code status} is {@link Status#PUBLISH_FAILED}
 */
public record CommitResult(long version, List<Event> events, Status status, EventSourcingError publishError) {

  public enum Status {
    /** Nothing was uncommitted. */
    NOTHING_TO_COMMIT,
    /** Appended and delivered to every handler. */
    PUBLISHED,
    /** Appended; at least one delivery failed and is left to the recovery sweep. */
    PUBLISH_FAILED,
    /** Appended inside an open transaction; publishing runs after it commits. */
    DEFERRED
  }

  public CommitResult {
    Objects.requireNonNull(status, "status");
    events = List.copyOf(events);
    if (status == Status.PUBLISH_FAILED && publishError == null) {
      throw new IllegalArgumentException("publishError is required when publishing failed");
    }
  }

  public boolean isPublished() {
    return status == Status.PUBLISHED;
  }

  public Optional<EventSourcingError> publishFailure() {
    return Optional.ofNullable(publishError);
  }
}
