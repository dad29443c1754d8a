package io.eventcore;

/**
 * Thrown when an aggregate cannot be rebuilt from its stream: a reducer failed, no reducer
 * is registered for a stored event type, or the stream has a version gap.
 */
public final class ReplayException extends EventCoreException {

  private final String aggregateId;
  private final long version;

  public ReplayException(String aggregateId, long version, String message) {
    this(aggregateId, version, message, null);
  }

  public ReplayException(String aggregateId, long version, String message, Throwable cause) {
    super("Replay of aggregate " + aggregateId + " failed at version " + version + ": " + message, cause);
    this.aggregateId = aggregateId;
    this.version = version;
  }

  public String aggregateId() {
    return aggregateId;
  }

  /**
   * Returns the version of the event that could not be applied.
   *
   * @return the offending version
   */
  public long version() {
    return version;
  }
}
