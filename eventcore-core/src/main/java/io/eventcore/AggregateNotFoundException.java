package io.eventcore;

/**
 * Thrown by {@link io.eventcore.repository.EventSourcedRepository#load(String)} when the
 * aggregate has neither a snapshot nor any stored events.
 */
public final class AggregateNotFoundException extends EventCoreException {

  private final String aggregateId;

  public AggregateNotFoundException(String aggregateId) {
    super("Aggregate not found: " + aggregateId);
    this.aggregateId = aggregateId;
  }

  public String aggregateId() {
    return aggregateId;
  }
}
