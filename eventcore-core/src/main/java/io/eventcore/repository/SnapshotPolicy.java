package io.eventcore.repository;

/**
 * Decides, after a successful save, whether the repository takes a snapshot.
 */
@FunctionalInterface
public interface SnapshotPolicy {

  /**
   * @param previousVersion stream version before the save
   * @param newVersion      stream version after the save
   * @return {@code true} to snapshot the state at {@code newVersion}
   */
  boolean shouldSnapshot(long previousVersion, long newVersion);

  /**
   * Snapshots whenever a save crosses a multiple of {@code interval}, so that replay after
   * the latest snapshot never exceeds {@code interval} events plus one save batch.
   *
   * @param interval events between snapshots (must be &ge; 1)
   * @return the policy
   */
  static SnapshotPolicy everyNEvents(long interval) {
    if (interval < 1) {
      throw new IllegalArgumentException("interval must be >= 1, got: " + interval);
    }
    return (previous, current) -> current / interval > previous / interval;
  }

  static SnapshotPolicy never() {
    return (previous, current) -> false;
  }
}
