package io.eventcore.store;

import io.eventcore.Event;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finite, restartable view over a store query, read lazily in pages.
 *
 * <p>The sequence is bounded by the store's highest log position at the moment it was
 * created: events appended later are never included. Every call to {@link #iterator()}
 * starts again from the beginning and re-reads the store.
 */
public final class EventSequence implements Iterable<Event> {

  /**
   * Reads one page of matching events.
   */
  @FunctionalInterface
  public interface PageReader {

    /**
     * @param afterPosition exclusive lower bound on the log position
     * @param upToPosition  inclusive upper bound on the log position
     * @param limit         maximum number of events to return
     * @return matching events ordered by ascending position
     */
    List<StoredEvent> read(long afterPosition, long upToPosition, int limit);
  }

  private final PageReader reader;
  private final long upperBound;
  private final int pageSize;

  public EventSequence(PageReader reader, long upperBound, int pageSize) {
    this.reader = Objects.requireNonNull(reader, "reader");
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be >= 1");
    }
    this.upperBound = upperBound;
    this.pageSize = pageSize;
  }

  /**
   * Returns the highest log position this sequence may include.
   */
  public long upperBound() {
    return upperBound;
  }

  @Override
  public Iterator<Event> iterator() {
    return new PagingIterator();
  }

  public Stream<Event> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /**
   * Reads the whole sequence into memory.
   *
   * @return all events, in log order
   */
  public List<Event> toList() {
    List<Event> events = new ArrayList<>();
    for (Event event : this) {
      events.add(event);
    }
    return events;
  }

  private final class PagingIterator implements Iterator<Event> {
    private List<StoredEvent> page = List.of();
    private int index;
    private long lastPosition;
    private boolean exhausted;

    @Override
    public boolean hasNext() {
      if (index < page.size()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      page = reader.read(lastPosition, upperBound, pageSize);
      index = 0;
      if (page.size() < pageSize) {
        exhausted = true;
      }
      if (!page.isEmpty()) {
        lastPosition = page.get(page.size() - 1).position();
      }
      return !page.isEmpty();
    }

    @Override
    public Event next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return page.get(index++).event();
    }
  }
}
