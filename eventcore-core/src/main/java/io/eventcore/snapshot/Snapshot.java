package io.eventcore.snapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * Serialized aggregate state as of a specific stream version.
 *
 * <p>Snapshots are an optimization: an aggregate rebuilt from a snapshot plus the events
 * after it is identical to one rebuilt from the full stream. A newer snapshot supersedes
 * older ones; none is ever modified.
 */
public final class Snapshot {
  private final String aggregateId;
  private final String aggregateType;
  private final long version;
  private final String state;
  private final Instant takenAt;

  public Snapshot(String aggregateId, String aggregateType, long version, String state, Instant takenAt) {
    this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
    this.aggregateType = aggregateType;
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got: " + version);
    }
    this.version = version;
    this.state = Objects.requireNonNull(state, "state");
    this.takenAt = Objects.requireNonNull(takenAt, "takenAt");
  }

  public static Snapshot of(String aggregateId, String aggregateType, long version, String state) {
    return new Snapshot(aggregateId, aggregateType, version, state, Instant.now());
  }

  public String aggregateId() {
    return aggregateId;
  }

  public String aggregateType() {
    return aggregateType;
  }

  /**
   * Returns the version of the last event folded into {@link #state()}.
   */
  public long version() {
    return version;
  }

  public String state() {
    return state;
  }

  public Instant takenAt() {
    return takenAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Snapshot)) return false;
    Snapshot that = (Snapshot) o;
    return version == that.version && aggregateId.equals(that.aggregateId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(aggregateId, version);
  }

  @Override
  public String toString() {
    return "Snapshot{aggregateId=" + aggregateId + ", version=" + version + ", takenAt=" + takenAt + '}';
  }
}
