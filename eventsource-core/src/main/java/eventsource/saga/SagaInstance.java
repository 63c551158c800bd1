package eventsource.saga;

import eventsource.util.Payloads;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of one running saga.
 *
 * @param sagaId          {@code sagaType + ":" + correlationKey}
 * @param completedSteps  steps in completion order; compensation runs from the last
 * @param compensationLog one entry per compensation attempt, in order
 * @param handledEvents   ids of events already applied, for redelivery detection
 * @param failureReason   why the saga left the happy path, or {@code null}
 * @param version         optimistic lock; 0 means never saved
 */
public record SagaInstance(
    String sagaId,
    String sagaType,
    SagaStatus status,
    Map<String, Object> data,
    List<CompletedStep> completedSteps,
    List<String> compensationLog,
    List<String> handledEvents,
    int retryCount,
    String failureReason,
    long version,
    Instant createdAt,
    Instant updatedAt
) {
  public SagaInstance {
    Objects.requireNonNull(sagaId, "sagaId");
    Objects.requireNonNull(sagaType, "sagaType");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    data = Payloads.immutableCopy(data);
    completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
    compensationLog = compensationLog == null ? List.of() : List.copyOf(compensationLog);
    handledEvents = handledEvents == null ? List.of() : List.copyOf(handledEvents);
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    if (version < 0) {
      throw new IllegalArgumentException("version must be >= 0");
    }
  }

  /**
   * A saga that has not been saved yet.
   */
  public static SagaInstance start(String sagaId, String sagaType, Instant now) {
    return new SagaInstance(sagaId, sagaType, SagaStatus.STARTED, Map.of(), List.of(), List.of(), List.of(),
        0, null, 0L, now, now);
  }

  public boolean hasHandled(String eventId) {
    return handledEvents.contains(eventId);
  }

  public SagaInstance withStatus(SagaStatus next, Instant now) {
    return new SagaInstance(sagaId, sagaType, next, data, completedSteps, compensationLog, handledEvents,
        retryCount, failureReason, version, createdAt, now);
  }

  public SagaInstance withVersion(long next) {
    return new SagaInstance(sagaId, sagaType, status, data, completedSteps, compensationLog, handledEvents,
        retryCount, failureReason, next, createdAt, updatedAt);
  }

  SagaInstance failing(String reason, Instant now) {
    return new SagaInstance(sagaId, sagaType, SagaStatus.COMPENSATING, data, completedSteps, compensationLog,
        handledEvents, retryCount, reason, version, createdAt, now);
  }

  /**
   * Pops the most recent completed step and records how its compensation went.
   */
  SagaInstance compensated(String logEntry, SagaStatus next, Instant now) {
    List<CompletedStep> remaining = new ArrayList<>(completedSteps);
    remaining.remove(remaining.size() - 1);
    List<String> log = new ArrayList<>(compensationLog);
    log.add(logEntry);
    return new SagaInstance(sagaId, sagaType, next, data, remaining, log, handledEvents, retryCount,
        failureReason, version, createdAt, now);
  }

  SagaInstance compensationFailed(String logEntry, Instant now) {
    List<String> log = new ArrayList<>(compensationLog);
    log.add(logEntry);
    return new SagaInstance(sagaId, sagaType, SagaStatus.FAILED, data, completedSteps, log, handledEvents,
        retryCount, failureReason, version, createdAt, now);
  }
}
