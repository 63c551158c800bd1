package eventsource.error;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Domain-level failures returned inside {@link eventsource.Result.Err}.
 *
 * <ul>
 *   <li>{@link ValidationError}: malformed event, command or batch.</li>
 *   <li>{@link ConcurrencyConflict}: expected version did not match; reload and retry.</li>
 *   <li>{@link UpcastError}: no migration path for an event version.</li>
 *   <li>{@link NotFound}: missing aggregate, snapshot, saga or handler.</li>
 *   <li>{@link HandlerError}: a bus or command handler threw.</li>
 *   <li>{@link HandlerFailures}: every handler failure of one publish call.</li>
 *   <li>{@link SagaCompensationError}: a compensating command failed.</li>
 *   <li>{@link SnapshotIncompatible}: snapshot schema differs from the aggregate's.</li>
 * </ul>
 */
public sealed interface EventSourcingError {

  /**
   * Human-readable description of the failure.
   */
  String message();

  record ValidationError(String field, String reason) implements EventSourcingError {
    public ValidationError {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String message() {
      return "Invalid " + field + ": " + reason;
    }
  }

  record ConcurrencyConflict(String aggregateId, long expectedVersion, long actualVersion)
      implements EventSourcingError {
    public ConcurrencyConflict {
      Objects.requireNonNull(aggregateId, "aggregateId");
    }

    @Override
    public String message() {
      return "Concurrency conflict on '" + aggregateId + "': expected version "
          + expectedVersion + " but was " + actualVersion;
    }
  }

  /**
   * @param missingLink the first version with no registered upcaster, or {@code -1}
   *     when the failure was not a gap in the chain
   */
  record UpcastError(String eventType, int fromVersion, int toVersion, int missingLink, String reason)
      implements EventSourcingError {
    public UpcastError {
      Objects.requireNonNull(eventType, "eventType");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String message() {
      return "Failed to upcast event '" + eventType + "' from v" + fromVersion
          + " to v" + toVersion + ": " + reason;
    }
  }

  record NotFound(String kind, String id) implements EventSourcingError {
    public NotFound {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(id, "id");
    }

    @Override
    public String message() {
      return kind + " not found: " + id;
    }
  }

  /**
   * @param handlerName name of the failing handler
   * @param messageId id of the event or command being handled
   * @param messageType type of the event or command being handled
   * @param cause the exception raised by the handler
   */
  record HandlerError(String handlerName, String messageId, String messageType, Throwable cause)
      implements EventSourcingError {
    public HandlerError {
      Objects.requireNonNull(handlerName, "handlerName");
      Objects.requireNonNull(messageId, "messageId");
      Objects.requireNonNull(messageType, "messageType");
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public String message() {
      return "Handler '" + handlerName + "' failed on " + messageType + " [" + messageId + "]: "
          + cause;
    }
  }

  record HandlerFailures(List<HandlerError> failures) implements EventSourcingError {
    public HandlerFailures {
      failures = List.copyOf(failures);
      if (failures.isEmpty()) {
        throw new IllegalArgumentException("failures cannot be empty");
      }
    }

    /**
     * Returns {@code true} if any failure concerns the given event or command id.
     */
    public boolean concerns(String messageId) {
      for (HandlerError failure : failures) {
        if (failure.messageId().equals(messageId)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String message() {
      return failures.size() + " handler failure(s): " + failures.stream()
          .map(HandlerError::message)
          .collect(Collectors.joining("; "));
    }
  }

  /**
   * @param failedStep step whose compensation failed
   * @param cause the failure returned by the compensating command
   * @param compensationLog every compensation recorded before the failure
   */
  record SagaCompensationError(String sagaId, String failedStep, EventSourcingError cause,
      List<String> compensationLog) implements EventSourcingError {
    public SagaCompensationError {
      Objects.requireNonNull(sagaId, "sagaId");
      Objects.requireNonNull(failedStep, "failedStep");
      Objects.requireNonNull(cause, "cause");
      compensationLog = List.copyOf(compensationLog);
    }

    @Override
    public String message() {
      return "Compensation of step '" + failedStep + "' failed for saga " + sagaId + ": "
          + cause.message();
    }
  }

  record SnapshotIncompatible(String aggregateId, int expectedSchemaVersion, int actualSchemaVersion)
      implements EventSourcingError {
    public SnapshotIncompatible {
      Objects.requireNonNull(aggregateId, "aggregateId");
    }

    @Override
    public String message() {
      return "Snapshot of '" + aggregateId + "' has schema v" + actualSchemaVersion
          + " but v" + expectedSchemaVersion + " is required";
    }
  }
}
