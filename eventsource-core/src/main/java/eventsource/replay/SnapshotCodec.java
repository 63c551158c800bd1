package eventsource.replay;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Converts aggregate state to and from its snapshot form.
 *
 * <p>{@link #schemaVersion()} tags every snapshot written through this codec; a
 * snapshot with a different tag is treated as incompatible on load.
 *
 * @param <S> the aggregate state type
 */
public interface SnapshotCodec<S> {

  int schemaVersion();

  Map<String, Object> toSnapshot(S state);

  S fromSnapshot(Map<String, Object> snapshot);

  static <S> SnapshotCodec<S> of(int schemaVersion,
      Function<? super S, Map<String, Object>> toSnapshot,
      Function<Map<String, Object>, ? extends S> fromSnapshot) {
    Objects.requireNonNull(toSnapshot, "toSnapshot");
    Objects.requireNonNull(fromSnapshot, "fromSnapshot");
    if (schemaVersion < 1) {
      throw new IllegalArgumentException("schemaVersion must be >= 1");
    }
    return new SnapshotCodec<>() {
      @Override
      public int schemaVersion() {
        return schemaVersion;
      }

      @Override
      public Map<String, Object> toSnapshot(S state) {
        return toSnapshot.apply(state);
      }

      @Override
      public S fromSnapshot(Map<String, Object> snapshot) {
        return fromSnapshot.apply(snapshot);
      }
    };
  }
}
