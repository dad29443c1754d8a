package io.eventcore.repository;

import io.eventcore.ConfigurationException;
import io.eventcore.Event;
import io.eventcore.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One aggregate instance: its current state, the stream version that state reflects,
 * and the events raised since it was loaded.
 *
 * <p>State changes only through {@link #raise}, which applies the event's reducer
 * immediately and queues the event until the repository saves it. Instances are not
 * thread-safe; load a separate instance per unit of work.
 *
 * @param <S> the aggregate state type
 */
public final class Aggregate<S> {
  private final String id;
  private final AggregateDefinition<S> definition;
  private final List<Event> uncommitted = new ArrayList<>();
  private S state;
  private long version;
  private long committedVersion;

  Aggregate(String id, AggregateDefinition<S> definition, S state, long version) {
    this.id = Objects.requireNonNull(id, "id");
    this.definition = Objects.requireNonNull(definition, "definition");
    this.state = state;
    this.version = version;
    this.committedVersion = version;
  }

  public String id() {
    return id;
  }

  public String aggregateType() {
    return definition.aggregateType();
  }

  public S state() {
    return state;
  }

  /**
   * Returns the version including uncommitted events.
   */
  public long version() {
    return version;
  }

  /**
   * Returns the stream version this instance was loaded at (or last saved at). Used as
   * the expected version when saving.
   */
  public long committedVersion() {
    return committedVersion;
  }

  public List<Event> uncommittedEvents() {
    return Collections.unmodifiableList(uncommitted);
  }

  public boolean hasUncommittedChanges() {
    return !uncommitted.isEmpty();
  }

  /**
   * Raises an event with a JSON payload.
   *
   * @see #raise(Event.Builder)
   */
  public Event raise(String eventType, String payloadJson) {
    return raise(Event.builder(eventType).payloadJson(payloadJson));
  }

  public Event raise(EventType eventType, String payloadJson) {
    return raise(Event.builder(eventType).payloadJson(payloadJson));
  }

  /**
   * Stamps the event with this aggregate's id, type and next version, applies its reducer
   * and queues it for saving. If the reducer throws, nothing changes and the exception
   * propagates.
   *
   * @param builder the event to raise
   * @return the raised event
   * @throws ConfigurationException if no reducer is registered for the event type
   */
  public Event raise(Event.Builder builder) {
    Objects.requireNonNull(builder, "builder");
    Event event = builder
        .aggregateId(id)
        .aggregateType(definition.aggregateType())
        .version(version + 1)
        .build();
    Reducer<S> reducer = definition.reducerFor(event.eventType());
    if (reducer == null) {
      throw new ConfigurationException("No reducer for event type " + event.eventType()
          + " on aggregate " + definition.aggregateType());
    }
    state = reducer.apply(state, event);
    uncommitted.add(event);
    version = event.version();
    return event;
  }

  void markCommitted() {
    uncommitted.clear();
    committedVersion = version;
  }

  @Override
  public String toString() {
    return "Aggregate{type=" + definition.aggregateType() + ", id=" + id
        + ", version=" + version + ", uncommitted=" + uncommitted.size() + '}';
  }
}
