package eventsource.bus.middleware;

/**
 * Thrown instead of invoking a handler while its circuit is open. The delivery is
 * reported as failed so the durable queue redelivers it later.
 */
public final class CircuitOpenException extends RuntimeException {
  private final String circuit;

  public CircuitOpenException(String circuit) {
    super("Circuit open: " + circuit);
    this.circuit = circuit;
  }

  public String circuit() {
    return circuit;
  }
}
