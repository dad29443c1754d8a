package io.eventcore.bus;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Doubles the backoff after every failure, from {@code baseDelayMs} up to {@code maxDelayMs}.
 *
 * <p>Each delay is drawn uniformly from {@code [d/2, 3d/2)} around the nominal delay {@code d}
 * and never exceeds {@code maxDelayMs}. Failures rejected by the {@code retryable} predicate
 * are not retried at all.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final Predicate<? super Exception> retryable;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, failure -> true);
  }

  /**
   * @param baseDelayMs nominal delay after the first failure, &gt; 0
   * @param maxDelayMs  upper bound for any delay, &ge; {@code baseDelayMs}
   * @param retryable   selects the failures worth retrying
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, Predicate<? super Exception> retryable) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.retryable = Objects.requireNonNull(retryable, "retryable");
  }

  @Override
  public long backoffMs(int failedAttempts, Exception failure) {
    if (!retryable.test(failure)) {
      return GIVE_UP;
    }
    if (failedAttempts <= 0) {
      return 0L;
    }
    long nominal = nominalDelayMs(failedAttempts - 1);
    long spread = nominal / 2;
    if (spread == 0) {
      return nominal;
    }
    long jittered = ThreadLocalRandom.current().nextLong(nominal - spread, nominal + spread);
    return Math.min(maxDelayMs, jittered);
  }

  private long nominalDelayMs(int doublings) {
    // baseDelayMs << doublings stays positive only below this shift
    int safeShift = Long.numberOfLeadingZeros(baseDelayMs) - 1;
    if (doublings >= safeShift) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs << doublings);
  }
}
