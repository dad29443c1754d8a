package io.eventcore.repository;

import io.eventcore.snapshot.SnapshotStore;

/**
 * How many snapshots per aggregate the repository keeps after writing a new one.
 */
public final class SnapshotRetention {
  private static final SnapshotRetention KEEP_ALL = new SnapshotRetention(0);

  private final int keepLatest;

  private SnapshotRetention(int keepLatest) {
    this.keepLatest = keepLatest;
  }

  public static SnapshotRetention keepAll() {
    return KEEP_ALL;
  }

  /**
   * @param count snapshots to keep per aggregate (must be &ge; 1)
   * @return the retention
   */
  public static SnapshotRetention keepLatest(int count) {
    if (count < 1) {
      throw new IllegalArgumentException("count must be >= 1, got: " + count);
    }
    return new SnapshotRetention(count);
  }

  public boolean keepsAll() {
    return keepLatest == 0;
  }

  int apply(SnapshotStore store, String aggregateId) {
    return keepsAll() ? 0 : store.prune(aggregateId, keepLatest);
  }

  @Override
  public String toString() {
    return keepsAll() ? "SnapshotRetention{keepAll}" : "SnapshotRetention{keepLatest=" + keepLatest + '}';
  }
}
