package io.eventcore.bus;

import io.eventcore.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Collects events and publishes them to an {@link EventBus} as one batch.
 *
 * <p>Collected events bypass the event store: use it for notifications that are not part of
 * an aggregate's history. Publishing takes the pending batch atomically, so events collected
 * while a batch is being published go into the next one.
 *
 * <pre>{@code
 * EventPublisher publisher = new EventPublisher(bus);
 * publisher.collect(Event.ofJson("CacheWarmed", "{}"));
 * publisher.collectAll(notifications);
 * List<PublishResult> results = publisher.publishCollected();
 * }</pre>
 */
public final class EventPublisher {
  private static final Logger logger = Logger.getLogger(EventPublisher.class.getName());

  private final EventBus eventBus;
  private final List<Event> collected = new ArrayList<>();

  public EventPublisher(EventBus eventBus) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
  }

  public synchronized void collect(Event event) {
    collected.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Collects events in iteration order.
   *
   * @throws NullPointerException if the list or any event is {@code null}; nothing is collected then
   */
  public synchronized void collectAll(List<Event> events) {
    Objects.requireNonNull(events, "events");
    for (Event event : events) {
      Objects.requireNonNull(event, "event");
    }
    collected.addAll(events);
  }

  public synchronized int pendingCount() {
    return collected.size();
  }

  /**
   * Publishes every collected event synchronously, in collection order, and clears the batch.
   *
   * @return one result per event, empty if nothing was collected
   */
  public List<PublishResult> publishCollected() {
    List<Event> batch = drain();
    if (batch.isEmpty()) {
      return List.of();
    }
    List<PublishResult> results = eventBus.publishAll(batch);
    logFailures(results);
    return results;
  }

  /**
   * Publishes every collected event asynchronously and clears the batch. Events of the batch
   * may be delivered concurrently.
   *
   * @return a future completed with one result per event, in collection order
   */
  public CompletableFuture<List<PublishResult>> publishCollectedAsync() {
    List<Event> batch = drain();
    if (batch.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    List<CompletableFuture<PublishResult>> futures = new ArrayList<>(batch.size());
    for (Event event : batch) {
      futures.add(eventBus.publishAsync(event));
    }
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .thenApply(ignored -> {
          List<PublishResult> results = new ArrayList<>(futures.size());
          for (CompletableFuture<PublishResult> future : futures) {
            results.add(future.join());
          }
          logFailures(results);
          return List.copyOf(results);
        });
  }

  /**
   * Discards collected events without publishing them.
   *
   * @return the number of events discarded
   */
  public synchronized int clearCollected() {
    int discarded = collected.size();
    collected.clear();
    return discarded;
  }

  private synchronized List<Event> drain() {
    List<Event> batch = List.copyOf(collected);
    collected.clear();
    return batch;
  }

  private static void logFailures(List<PublishResult> results) {
    long failed = results.stream().filter(result -> !result.succeeded()).count();
    if (failed > 0) {
      logger.warning(failed + " of " + results.size() + " collected event(s) failed in at least one handler");
    }
  }
}
