package eventsource.saga;

import eventsource.Result;

import java.util.List;

/**
 * Durable storage of saga instances with optimistic locking on {@link SagaInstance#version()}.
 *
 * @see InMemorySagaStore
 */
public interface SagaStore {

  /**
   * @return the instance, or {@code NotFound}
   */
  Result<SagaInstance> load(String sagaId);

  /**
   * Saves an instance if the stored version equals {@code expectedVersion} (0 for an
   * instance that was never saved).
   *
   * @return the saved instance carrying {@code expectedVersion + 1}, or a
   *     {@code ConcurrencyConflict}
   */
  Result<SagaInstance> save(SagaInstance instance, long expectedVersion);

  List<SagaInstance> findByStatus(SagaStatus status);

  /**
   * @return {@code true} if an instance was deleted
   */
  boolean delete(String sagaId);
}
