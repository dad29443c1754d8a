package io.eventcore.store;

import io.eventcore.ConcurrencyException;
import io.eventcore.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventStore} kept in memory. Intended for tests, prototypes and single-process tools.
 *
 * <p>Appends are serialized by a write lock that covers the version check and the insert,
 * which makes each append an atomic compare-and-write. There is no enclosing transaction,
 * so {@link AppendListener#afterCommit} fires as soon as the append returns.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(InMemoryEventStore.class.getName());
  private static final int PAGE_SIZE = 256;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<StoredEvent> log = new ArrayList<>();
  private final Map<String, List<StoredEvent>> streams = new HashMap<>();
  private final AppendListener listener;

  public InMemoryEventStore() {
    this(AppendListener.NOOP);
  }

  /**
   * @param listener append lifecycle hook; {@code null} defaults to {@link AppendListener#NOOP}
   */
  public InMemoryEventStore(AppendListener listener) {
    this.listener = listener == null ? AppendListener.NOOP : listener;
  }

  @Override
  public long appendAll(String aggregateId, List<Event> events, long expectedVersion) {
    List<Event> prepared = EventStreams.prepare(aggregateId, events, expectedVersion);
    if (prepared.isEmpty()) {
      return expectedVersion;
    }
    lock.writeLock().lock();
    try {
      List<StoredEvent> stream = streams.get(aggregateId);
      long actual = stream == null ? 0L : stream.size();
      if (actual != expectedVersion) {
        throw new ConcurrencyException(aggregateId, expectedVersion, actual);
      }
      if (stream == null) {
        stream = new ArrayList<>();
        streams.put(aggregateId, stream);
      }
      for (Event event : prepared) {
        StoredEvent stored = new StoredEvent(log.size() + 1L, event);
        log.add(stored);
        stream.add(stored);
      }
    } finally {
      lock.writeLock().unlock();
    }
    runSafely("afterAppend", () -> listener.afterAppend(prepared));
    runSafely("afterCommit", () -> listener.afterCommit(prepared));
    return expectedVersion + prepared.size();
  }

  @Override
  public List<Event> getEvents(String aggregateId, long sinceVersion) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    lock.readLock().lock();
    try {
      List<StoredEvent> stream = streams.get(aggregateId);
      if (stream == null || sinceVersion >= stream.size()) {
        return List.of();
      }
      List<Event> events = new ArrayList<>();
      // versions are 1-based and contiguous, so version v sits at index v - 1
      for (int i = (int) Math.max(0L, sinceVersion); i < stream.size(); i++) {
        events.add(stream.get(i).event());
      }
      return events;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public EventSequence getEventsByType(String eventType, Instant since) {
    Objects.requireNonNull(eventType, "eventType");
    long upperBound;
    lock.readLock().lock();
    try {
      upperBound = log.size();
    } finally {
      lock.readLock().unlock();
    }
    return new EventSequence((after, upTo, limit) -> readPage(eventType, since, after, upTo, limit),
        upperBound, PAGE_SIZE);
  }

  private List<StoredEvent> readPage(String eventType, Instant since, long after, long upTo, int limit) {
    lock.readLock().lock();
    try {
      List<StoredEvent> page = new ArrayList<>();
      for (long position = after + 1; position <= upTo && page.size() < limit; position++) {
        StoredEvent stored = log.get((int) (position - 1));
        Event event = stored.event();
        if (event.eventType().equals(eventType)
            && (since == null || !event.occurredAt().isBefore(since))) {
          page.add(stored);
        }
      }
      return page;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<Event> getEventsByCorrelationId(String correlationId) {
    Objects.requireNonNull(correlationId, "correlationId");
    lock.readLock().lock();
    try {
      List<Event> events = new ArrayList<>();
      for (StoredEvent stored : log) {
        if (correlationId.equals(stored.event().correlationId())) {
          events.add(stored.event());
        }
      }
      return events;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<Event> getLatestEvents(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
    }
    lock.readLock().lock();
    try {
      List<Event> events = new ArrayList<>(Math.min(limit, log.size()));
      for (StoredEvent stored : log.subList(Math.max(0, log.size() - limit), log.size())) {
        events.add(stored.event());
      }
      return events;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long currentVersion(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    lock.readLock().lock();
    try {
      List<StoredEvent> stream = streams.get(aggregateId);
      return stream == null ? 0L : stream.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private void runSafely(String phase, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "AppendListener." + phase + " failed", ex);
    }
  }
}
