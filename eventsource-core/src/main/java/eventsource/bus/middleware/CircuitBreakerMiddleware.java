package eventsource.bus.middleware;

import eventsource.bus.Delivery;
import eventsource.bus.EventMiddleware;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stops calling a handler after repeated failures.
 *
 * <p>One circuit exists per {@code handlerName + ":" + eventType}. A circuit opens after
 * {@code failureThreshold} consecutive failures; while open, deliveries fail fast with
 * {@link CircuitOpenException}. Once {@code recoveryTimeout} has elapsed the circuit is
 * half-open and lets deliveries through; {@code successThreshold} successes close it
 * again and a single failure reopens it.
 */
public final class CircuitBreakerMiddleware implements EventMiddleware {
  private static final Logger logger = Logger.getLogger(CircuitBreakerMiddleware.class.getName());

  public enum State { CLOSED, OPEN, HALF_OPEN }

  private final int failureThreshold;
  private final int successThreshold;
  private final Duration recoveryTimeout;
  private final Clock clock;
  private final Map<String, Circuit> circuits = new ConcurrentHashMap<>();

  public CircuitBreakerMiddleware() {
    this(5, 1, Duration.ofSeconds(30), Clock.systemUTC());
  }

  public CircuitBreakerMiddleware(int failureThreshold, int successThreshold, Duration recoveryTimeout,
      Clock clock) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    if (successThreshold < 1) {
      throw new IllegalArgumentException("successThreshold must be >= 1");
    }
    this.failureThreshold = failureThreshold;
    this.successThreshold = successThreshold;
    this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void invoke(Delivery delivery, Next next) throws Exception {
    String name = delivery.handlerName() + ":" + delivery.event().eventType();
    Circuit circuit = circuits.computeIfAbsent(name, k -> new Circuit());
    if (!circuit.allow()) {
      throw new CircuitOpenException(name);
    }
    try {
      next.proceed();
    } catch (Exception e) {
      if (circuit.recordFailure()) {
        logger.log(Level.WARNING, "Circuit {0} opened after {1} consecutive failure(s)",
            new Object[]{name, failureThreshold});
      }
      throw e;
    }
    circuit.recordSuccess();
  }

  /**
   * Current state of a circuit; {@link State#CLOSED} if it has never been used.
   */
  public State state(String handlerName, String eventType) {
    Circuit circuit = circuits.get(handlerName + ":" + eventType);
    return circuit == null ? State.CLOSED : circuit.state();
  }

  private final class Circuit {
    private State state = State.CLOSED;
    private int failures;
    private int successes;
    private long openedAtMs;

    synchronized State state() {
      return state;
    }

    synchronized boolean allow() {
      if (state == State.OPEN) {
        if (clock.millis() - openedAtMs < recoveryTimeout.toMillis()) {
          return false;
        }
        state = State.HALF_OPEN;
        successes = 0;
      }
      return true;
    }

    synchronized void recordSuccess() {
      if (state == State.HALF_OPEN) {
        if (++successes >= successThreshold) {
          state = State.CLOSED;
          failures = 0;
          successes = 0;
        }
      } else {
        failures = 0;
      }
    }

    /** Returns true if this failure opened the circuit. */
    synchronized boolean recordFailure() {
      failures++;
      if (state == State.HALF_OPEN || (state == State.CLOSED && failures >= failureThreshold)) {
        state = State.OPEN;
        openedAtMs = clock.millis();
        return true;
      }
      return false;
    }
  }
}
