package eventsource.saga;

import eventsource.Result;
import eventsource.error.EventSourcingError.ConcurrencyConflict;
import eventsource.error.EventSourcingError.NotFound;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Saga store held in memory. This class is thread-safe.
 */
public final class InMemorySagaStore implements SagaStore {
  private final Map<String, SagaInstance> instances = new ConcurrentHashMap<>();

  @Override
  public Result<SagaInstance> load(String sagaId) {
    SagaInstance instance = instances.get(sagaId);
    return instance == null ? Result.err(new NotFound("Saga", sagaId)) : Result.ok(instance);
  }

  @Override
  public Result<SagaInstance> save(SagaInstance instance, long expectedVersion) {
    AtomicReference<Result<SagaInstance>> outcome = new AtomicReference<>();
    instances.compute(instance.sagaId(), (id, current) -> {
      long actual = current == null ? 0L : current.version();
      if (actual != expectedVersion) {
        outcome.set(Result.err(new ConcurrencyConflict(id, expectedVersion, actual)));
        return current;
      }
      SagaInstance saved = instance.withVersion(expectedVersion + 1);
      outcome.set(Result.ok(saved));
      return saved;
    });
    return outcome.get();
  }

  @Override
  public List<SagaInstance> findByStatus(SagaStatus status) {
    return instances.values().stream()
        .filter(instance -> instance.status() == status)
        .sorted(Comparator.comparing(SagaInstance::updatedAt))
        .collect(Collectors.toList());
  }

  @Override
  public boolean delete(String sagaId) {
    return instances.remove(sagaId) != null;
  }
}
