package io.eventcore.snapshot;

import java.util.Optional;

/**
 * Stores aggregate snapshots keyed by {@code (aggregateId, version)}.
 *
 * <p>Implementations: {@link InMemorySnapshotStore} and {@code io.eventcore.jdbc.JdbcSnapshotStore}.
 */
public interface SnapshotStore {

  /**
   * Saves a snapshot. Saving a second snapshot for an existing {@code (aggregateId, version)}
   * is a no-op.
   *
   * @param snapshot the snapshot
   */
  void save(Snapshot snapshot);

  /**
   * Saves a snapshot taken now.
   *
   * @see #save(Snapshot)
   */
  default void save(String aggregateId, String aggregateType, long version, String state) {
    save(Snapshot.of(aggregateId, aggregateType, version, state));
  }

  /**
   * Returns the snapshot with the highest version for an aggregate.
   *
   * @param aggregateId the aggregate identifier
   * @return the latest snapshot, or empty if none was saved
   */
  Optional<Snapshot> getLatest(String aggregateId);

  /**
   * Returns the snapshot with the highest version not greater than {@code maxVersion}.
   *
   * @param aggregateId the aggregate identifier
   * @param maxVersion  inclusive upper bound on the version
   * @return the matching snapshot, or empty
   */
  Optional<Snapshot> getLatest(String aggregateId, long maxVersion);

  /**
   * Deletes all but the newest {@code keepLatest} snapshots of an aggregate.
   *
   * @param aggregateId the aggregate identifier
   * @param keepLatest  how many snapshots to keep (must be &ge; 1)
   * @return number of snapshots deleted
   */
  int prune(String aggregateId, int keepLatest);

  /**
   * Deletes every snapshot of an aggregate whose version is greater than {@code version}.
   * Used to drop snapshots of events that were never committed.
   *
   * @param aggregateId the aggregate identifier
   * @param version     the highest version to keep
   * @return number of snapshots deleted
   */
  int deleteAfter(String aggregateId, long version);
}
