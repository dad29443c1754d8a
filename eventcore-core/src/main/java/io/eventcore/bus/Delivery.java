package io.eventcore.bus;

import io.eventcore.HandlerExecutionException;

import java.time.Duration;

/**
 * Result of delivering one event to one subscription.
 *
 * @param subscription the subscription the event was delivered to
 * @param status       delivery outcome
 * @param duration     time spent in the handler ({@link Duration#ZERO} if it never ran)
 * @param error        the captured failure, or {@code null} when {@link DeliveryStatus#DELIVERED}
 */
public record Delivery(Subscription subscription, DeliveryStatus status, Duration duration,
    HandlerExecutionException error) {

  static Delivery delivered(Subscription subscription, Duration duration) {
    return new Delivery(subscription, DeliveryStatus.DELIVERED, duration, null);
  }

  static Delivery failed(Subscription subscription, Duration duration, HandlerExecutionException error) {
    return new Delivery(subscription, DeliveryStatus.FAILED, duration, error);
  }

  public boolean succeeded() {
    return status == DeliveryStatus.DELIVERED;
  }
}
