package io.eventcore.snapshot;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link SnapshotStore} kept in memory.
 */
public final class InMemorySnapshotStore implements SnapshotStore {
  private final Map<String, NavigableMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();

  @Override
  public void save(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    snapshots.computeIfAbsent(snapshot.aggregateId(), id -> new ConcurrentSkipListMap<>())
        .putIfAbsent(snapshot.version(), snapshot);
  }

  @Override
  public Optional<Snapshot> getLatest(String aggregateId) {
    return getLatest(aggregateId, Long.MAX_VALUE);
  }

  @Override
  public Optional<Snapshot> getLatest(String aggregateId, long maxVersion) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
    if (versions == null) {
      return Optional.empty();
    }
    Map.Entry<Long, Snapshot> entry = versions.floorEntry(maxVersion);
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  @Override
  public int prune(String aggregateId, int keepLatest) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    if (keepLatest < 1) {
      throw new IllegalArgumentException("keepLatest must be >= 1");
    }
    NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
    if (versions == null) {
      return 0;
    }
    int removed = 0;
    while (versions.size() > keepLatest) {
      if (versions.pollFirstEntry() != null) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public int deleteAfter(String aggregateId, long version) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
    if (versions == null) {
      return 0;
    }
    NavigableMap<Long, Snapshot> ahead = versions.tailMap(version, false);
    int removed = ahead.size();
    ahead.clear();
    return removed;
  }
}
