package io.eventcore;

/**
 * Thrown when an append declares an expected stream version that does not match the
 * stream's actual version, or when a concurrent writer claimed the same version first.
 *
 * <p>Nothing from the rejected append is written. The usual recovery is to reload the
 * aggregate and re-run the command.
 */
public final class ConcurrencyException extends EventCoreException {

  /** Marker for {@link #actualVersion()} when the conflicting version is not known. */
  public static final long UNKNOWN_VERSION = -1L;

  private final String aggregateId;
  private final long expectedVersion;
  private final long actualVersion;

  public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
    super("Concurrency conflict on aggregate " + aggregateId
        + ": expected version " + expectedVersion + " but was " + actualVersion);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * Creates an exception for a conflict detected by the storage uniqueness constraint,
   * where the winning writer's version is not known.
   *
   * @param aggregateId     the aggregate identifier
   * @param expectedVersion the version the caller expected
   * @param cause           the underlying storage failure
   */
  public ConcurrencyException(String aggregateId, long expectedVersion, Throwable cause) {
    super("Concurrency conflict on aggregate " + aggregateId
        + ": version " + (expectedVersion + 1) + " was appended concurrently", cause);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = UNKNOWN_VERSION;
  }

  public String aggregateId() {
    return aggregateId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }

  /**
   * Returns the stream version observed at append time, or {@link #UNKNOWN_VERSION}.
   *
   * @return the actual version
   */
  public long actualVersion() {
    return actualVersion;
  }
}
