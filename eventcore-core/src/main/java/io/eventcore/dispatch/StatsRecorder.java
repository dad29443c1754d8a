package io.eventcore.dispatch;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Lock-free accumulator behind {@link SubscriptionStats}. */
final class StatsRecorder {
  private final AtomicLong invocations = new AtomicLong();
  private final AtomicLong successes = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();
  private final AtomicLong totalNanos = new AtomicLong();
  private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong maxNanos = new AtomicLong();
  private final AtomicReference<Instant> lastInvokedAt = new AtomicReference<>();

  void started(Instant at) {
    lastInvokedAt.set(at);
  }

  void finished(long nanos, boolean success) {
    invocations.incrementAndGet();
    (success ? successes : failures).incrementAndGet();
    totalNanos.addAndGet(nanos);
    minNanos.accumulateAndGet(nanos, Math::min);
    maxNanos.accumulateAndGet(nanos, Math::max);
  }

  SubscriptionStats snapshot(String name) {
    long count = invocations.get();
    long min = minNanos.get();
    return new SubscriptionStats(name, count, successes.get(), failures.get(),
        Duration.ofNanos(totalNanos.get()),
        Duration.ofNanos(min == Long.MAX_VALUE ? 0L : min),
        Duration.ofNanos(maxNanos.get()),
        lastInvokedAt.get());
  }
}
