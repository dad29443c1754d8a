package io.eventcore.bus;

import io.eventcore.Event;
import io.eventcore.HandlerExecutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-handler outcome of one publish, in delivery order.
 *
 * <p>A publish with no matching subscription yields an empty result, which counts as
 * {@linkplain #succeeded() succeeded}.
 */
public final class PublishResult {
  private final Event event;
  private final List<Delivery> deliveries;

  PublishResult(Event event, List<Delivery> deliveries) {
    this.event = Objects.requireNonNull(event, "event");
    this.deliveries = Collections.unmodifiableList(new ArrayList<>(deliveries));
  }

  public Event event() {
    return event;
  }

  public List<Delivery> deliveries() {
    return deliveries;
  }

  /**
   * Returns the failures captured during this publish, in delivery order.
   *
   * @return failed handler errors (never {@code null})
   */
  public List<HandlerExecutionException> failures() {
    List<HandlerExecutionException> failures = new ArrayList<>();
    for (Delivery delivery : deliveries) {
      if (!delivery.succeeded()) {
        failures.add(delivery.error());
      }
    }
    return failures;
  }

  public int deliveredCount() {
    int count = 0;
    for (Delivery delivery : deliveries) {
      if (delivery.succeeded()) count++;
    }
    return count;
  }

  /**
   * Returns {@code true} if every matched handler completed normally.
   */
  public boolean succeeded() {
    return deliveredCount() == deliveries.size();
  }

  @Override
  public String toString() {
    return "PublishResult{eventId=" + event.eventId()
        + ", delivered=" + deliveredCount()
        + ", failed=" + (deliveries.size() - deliveredCount()) + '}';
  }
}
