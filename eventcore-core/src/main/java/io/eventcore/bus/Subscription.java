package io.eventcore.bus;

import io.eventcore.Event;
import io.eventcore.EventHandler;

import java.util.Comparator;
import java.util.Objects;

/**
 * Handle for a handler registered with an {@link EventBus}. Pass it to
 * {@link EventBus#unsubscribe(Subscription)} to remove the registration.
 *
 * <p>Subscriptions are ordered by {@link Priority} and then by registration sequence;
 * that order is the delivery order.
 */
public final class Subscription {
  static final Comparator<Subscription> DELIVERY_ORDER =
      Comparator.comparing(Subscription::priority).thenComparingLong(Subscription::id);

  private final long id;
  private final String eventType;
  private final TopicPattern topicPattern;
  private final Priority priority;
  private final EventHandler handler;
  private final boolean exclusive;

  Subscription(long id, String eventType, TopicPattern topicPattern, Priority priority,
      EventHandler handler, boolean exclusive) {
    this.id = id;
    this.eventType = eventType;
    this.topicPattern = topicPattern;
    this.priority = priority;
    this.handler = handler;
    this.exclusive = exclusive;
  }

  /**
   * Returns the registration sequence number, unique within one bus.
   */
  public long id() {
    return id;
  }

  public String eventType() {
    return eventType;
  }

  /**
   * Returns the topic filter, or {@code null} if this subscription accepts every topic.
   */
  public TopicPattern topicPattern() {
    return topicPattern;
  }

  public Priority priority() {
    return priority;
  }

  public EventHandler handler() {
    return handler;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  boolean matches(Event event) {
    if (!eventType.equals(event.eventType())) {
      return false;
    }
    return topicPattern == null || topicPattern.matches(event.topic());
  }

  boolean sameRegistration(String eventType, TopicPattern topicPattern, EventHandler handler) {
    return this.handler == handler
        && this.eventType.equals(eventType)
        && Objects.equals(this.topicPattern, topicPattern);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Subscription{id=").append(id)
        .append(", eventType=").append(eventType)
        .append(", priority=").append(priority);
    if (topicPattern != null) {
      sb.append(", topicPattern=").append(topicPattern);
    }
    if (exclusive) {
      sb.append(", exclusive");
    }
    return sb.append('}').toString();
  }
}
