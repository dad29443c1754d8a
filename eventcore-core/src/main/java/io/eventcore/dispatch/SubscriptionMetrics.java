package io.eventcore.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated statistics across all subscriptions of a {@link SubscriptionManager}.
 *
 * @param registered      number of registered subscriptions
 * @param active          number of active subscriptions
 * @param invocations     handler invocations across all subscriptions
 * @param successes       successful invocations
 * @param failures        failed invocations
 * @param bySubscription  per-subscription statistics keyed by name, in registration order
 */
public record SubscriptionMetrics(int registered, int active, long invocations, long successes,
    long failures, Map<String, SubscriptionStats> bySubscription) {

  public SubscriptionMetrics {
    bySubscription = Collections.unmodifiableMap(new LinkedHashMap<>(bySubscription));
  }
}
