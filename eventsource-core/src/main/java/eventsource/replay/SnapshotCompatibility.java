package eventsource.replay;

/**
 * What the replay engine does with a snapshot whose schema version differs from the
 * aggregate's snapshot codec.
 */
public enum SnapshotCompatibility {
  /** Ignore the snapshot, log a warning and replay the stream from the first event. */
  FALLBACK_TO_FULL_REPLAY,
  /** Fail the load with {@code SnapshotIncompatible}. */
  STRICT
}
