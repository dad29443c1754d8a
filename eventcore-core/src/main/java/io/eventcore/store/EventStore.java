package io.eventcore.store;

import io.eventcore.ConcurrencyException;
import io.eventcore.Event;

import java.time.Instant;
import java.util.List;

/**
 * Append-only, per-aggregate event log with optimistic concurrency.
 *
 * <p>Each aggregate owns a stream whose versions run 1, 2, 3... without gaps. An append
 * names the version the caller last saw; if the stream has moved on, the append fails with
 * {@link ConcurrencyException} and writes nothing. Stored events are never updated or
 * deleted.
 *
 * <p>Implementations: {@link InMemoryEventStore} and {@code io.eventcore.jdbc.JdbcEventStore}.
 */
public interface EventStore {

  /**
   * Appends one event to the stream of {@code event.aggregateId()}.
   *
   * @param event           the event; must carry an aggregate id
   * @param expectedVersion the stream version the caller last observed ({@code 0} for a new stream)
   * @return the new stream version
   * @throws ConcurrencyException if the stream version differs from {@code expectedVersion}
   * @throws IllegalArgumentException if the event has no aggregate id or the expected version is negative
   */
  default long append(Event event, long expectedVersion) {
    if (event == null || event.aggregateId() == null) {
      throw new IllegalArgumentException("event must carry an aggregateId");
    }
    return appendAll(event.aggregateId(), List.of(event), expectedVersion);
  }

  /**
   * Appends events atomically to one stream. They receive versions
   * {@code expectedVersion + 1}, {@code expectedVersion + 2}, and so on.
   *
   * <p>An empty list writes nothing and returns {@code expectedVersion}.
   *
   * @param aggregateId     the stream to append to
   * @param events          events whose aggregate id is {@code null} or equal to {@code aggregateId}
   * @param expectedVersion the stream version the caller last observed
   * @return the new stream version
   * @throws ConcurrencyException if the stream version differs from {@code expectedVersion}
   *     or a concurrent writer claimed one of the versions first
   */
  long appendAll(String aggregateId, List<Event> events, long expectedVersion);

  /**
   * Returns the whole stream of an aggregate in version order.
   *
   * @param aggregateId the aggregate identifier
   * @return the events, possibly empty
   */
  default List<Event> getEvents(String aggregateId) {
    return getEvents(aggregateId, 0L);
  }

  /**
   * Returns the events of an aggregate with a version strictly greater than {@code sinceVersion}.
   *
   * @param aggregateId  the aggregate identifier
   * @param sinceVersion exclusive lower bound
   * @return the events in version order, possibly empty
   */
  List<Event> getEvents(String aggregateId, long sinceVersion);

  /**
   * Returns all events of one type, across aggregates, in log order.
   *
   * @param eventType the event type
   * @param since     inclusive lower bound on {@code occurredAt}, or {@code null} for no bound
   * @return a finite, restartable sequence bounded by the log position at call time
   */
  EventSequence getEventsByType(String eventType, Instant since);

  /**
   * Returns every event sharing a correlation id, in log order.
   *
   * @param correlationId the correlation identifier
   * @return the correlated events, possibly empty
   */
  List<Event> getEventsByCorrelationId(String correlationId);

  /**
   * Returns the most recent events of the whole log, across aggregates.
   *
   * @param limit maximum number of events (must be &ge; 1)
   * @return up to {@code limit} events in log order, oldest first
   * @throws IllegalArgumentException if {@code limit} is less than 1
   */
  List<Event> getLatestEvents(int limit);

  /**
   * Returns the current version of a stream, {@code 0} if it has no events.
   *
   * @param aggregateId the aggregate identifier
   * @return the stream version
   */
  long currentVersion(String aggregateId);
}
