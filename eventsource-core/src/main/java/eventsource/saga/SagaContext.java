package eventsource.saga;

import eventsource.Event;
import eventsource.command.Command;
import eventsource.util.Payloads;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Working copy of a saga instance while it handles one event.
 *
 * <p>Commands passed to {@link #send} are dispatched by the {@link SagaManager} in call
 * order, after the new state has been saved. Each command is stamped as caused by the
 * event being handled.
 */
public final class SagaContext {
  private final SagaInstance instance;
  private final Event event;
  private final int maxRetries;
  private final Map<String, Object> data;
  private final List<CompletedStep> completedSteps;
  private final List<Command> commands = new ArrayList<>();
  private SagaStatus status;
  private int retryCount;
  private String failureReason;

  SagaContext(SagaInstance instance, Event event, int maxRetries) {
    this.instance = instance;
    this.event = event;
    this.maxRetries = maxRetries;
    this.data = Payloads.mutableCopy(instance.data());
    this.completedSteps = new ArrayList<>(instance.completedSteps());
    this.status = instance.status();
    this.retryCount = instance.retryCount();
    this.failureReason = instance.failureReason();
  }

  public String sagaId() {
    return instance.sagaId();
  }

  public Event event() {
    return event;
  }

  public SagaStatus status() {
    return status;
  }

  /**
   * Mutable saga data, persisted with the instance.
   */
  public Map<String, Object> data() {
    return data;
  }

  public int retryCount() {
    return retryCount;
  }

  public List<CompletedStep> completedSteps() {
    return Collections.unmodifiableList(completedSteps);
  }

  /**
   * Queues a forward command.
   */
  public void send(Command command) {
    Objects.requireNonNull(command, "command");
    commands.add(command.causedBy(event));
  }

  /**
   * Records that a step took effect.
   *
   * @param compensation command that undoes the step, or {@code null} if none is needed
   */
  public void stepCompleted(String step, Command compensation) {
    completedSteps.add(new CompletedStep(step, compensation));
  }

  /**
   * Marks the saga as waiting for its next event.
   */
  public void waitFor() {
    status = SagaStatus.WAITING;
  }

  public void complete() {
    status = SagaStatus.COMPLETED;
  }

  /**
   * Leaves the happy path. Completed steps are compensated in reverse order.
   */
  public void fail(String reason) {
    status = SagaStatus.COMPENSATING;
    failureReason = reason;
  }

  /**
   * Handles a timeout of the current step: re-sends {@code retryCommand} and keeps
   * waiting while retries remain, otherwise fails the saga without compensation.
   *
   * @return {@code true} if the step was retried
   */
  public boolean timeout(Command retryCommand) {
    if (retryCount < maxRetries) {
      retryCount++;
      status = SagaStatus.WAITING;
      send(retryCommand);
      return true;
    }
    status = SagaStatus.FAILED;
    failureReason = "timed out after " + retryCount + " retr" + (retryCount == 1 ? "y" : "ies");
    return false;
  }

  List<Command> commands() {
    return List.copyOf(commands);
  }

  SagaInstance toInstance(Instant now) {
    List<String> handled = new ArrayList<>(instance.handledEvents());
    handled.add(event.eventId());
    return new SagaInstance(instance.sagaId(), instance.sagaType(), status, data, completedSteps,
        instance.compensationLog(), handled, retryCount, failureReason, instance.version(),
        instance.createdAt(), now);
  }
}
