package eventsource.saga;

/**
 * Lifecycle of a saga instance.
 *
 * <pre>
 * STARTED -> WAITING -> {WAITING | COMPENSATING | COMPLETED} -> {COMPLETED | COMPENSATED | FAILED}
 * </pre>
 */
public enum SagaStatus {
  STARTED,
  WAITING,
  COMPENSATING,
  COMPENSATED,
  COMPLETED,
  FAILED;

  /**
   * Terminal sagas ignore further events.
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == COMPENSATED || this == FAILED;
  }
}
