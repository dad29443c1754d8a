package io.eventcore.dispatch;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time handler statistics of one managed subscription.
 *
 * @param name          the subscription name
 * @param invocations   handler invocations so far
 * @param successes     invocations that returned normally
 * @param failures      invocations that threw
 * @param totalDuration time spent in the handler across all invocations
 * @param minDuration   fastest invocation, {@link Duration#ZERO} before the first one
 * @param maxDuration   slowest invocation, {@link Duration#ZERO} before the first one
 * @param lastInvokedAt start of the most recent invocation, or {@code null}
 */
public record SubscriptionStats(String name, long invocations, long successes, long failures,
    Duration totalDuration, Duration minDuration, Duration maxDuration, Instant lastInvokedAt) {

  public Duration averageDuration() {
    return invocations == 0 ? Duration.ZERO : totalDuration.dividedBy(invocations);
  }
}
