package io.eventcore.store;

import io.eventcore.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validation and version assignment shared by {@link EventStore} implementations.
 */
public final class EventStreams {

  /**
   * Validates an append request and returns the events positioned at
   * {@code expectedVersion + 1}, {@code expectedVersion + 2}, and so on.
   *
   * @param aggregateId     the target stream
   * @param events          the events to append
   * @param expectedVersion the version the caller last observed
   * @return the events with versions assigned, in the same order
   * @throws IllegalArgumentException if the aggregate id is empty, the expected version is
   *     negative, an event is null, or an event belongs to another aggregate
   */
  public static List<Event> prepare(String aggregateId, List<Event> events, long expectedVersion) {
    if (aggregateId == null || aggregateId.isEmpty()) {
      throw new IllegalArgumentException("aggregateId cannot be null or empty");
    }
    Objects.requireNonNull(events, "events");
    if (expectedVersion < 0) {
      throw new IllegalArgumentException("expectedVersion must be >= 0, got: " + expectedVersion);
    }
    List<Event> prepared = new ArrayList<>(events.size());
    long version = expectedVersion;
    for (Event event : events) {
      Objects.requireNonNull(event, "events cannot contain null");
      if (event.aggregateId() != null && !event.aggregateId().equals(aggregateId)) {
        throw new IllegalArgumentException("Event " + event.eventId() + " belongs to aggregate "
            + event.aggregateId() + ", not " + aggregateId);
      }
      version++;
      Event positioned = event.aggregateId() == null
          ? event.toBuilder().aggregateId(aggregateId).version(version).build()
          : event.withVersion(version);
      prepared.add(positioned);
    }
    return List.copyOf(prepared);
  }

  private EventStreams() {}
}
