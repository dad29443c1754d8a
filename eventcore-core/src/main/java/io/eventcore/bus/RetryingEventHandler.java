package io.eventcore.bus;

import io.eventcore.Event;
import io.eventcore.EventHandler;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decorator that retries a failing handler in place before reporting the failure to the bus.
 *
 * <p>The bus itself never retries. Wrapping a handler keeps the retry budget local to that
 * subscription:
 * <pre>{@code
 * bus.subscribe("PaymentCaptured",
 *     new RetryingEventHandler(ledgerWriter, new ExponentialBackoffRetryPolicy(50, 2000), 5));
 * }</pre>
 *
 * <p>Retries stop after {@code maxAttempts} attempts or as soon as the policy returns
 * {@link RetryPolicy#GIVE_UP}; the last failure is then rethrown to the bus.
 * Retries sleep on the handler thread. An interrupt during the backoff (for example an
 * asynchronous publish timing out) ends the retries immediately.
 */
public final class RetryingEventHandler implements EventHandler {
  private static final Logger logger = Logger.getLogger(RetryingEventHandler.class.getName());

  private final EventHandler delegate;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;

  /**
   * @param delegate    the handler to retry
   * @param retryPolicy decides whether and when to try again
   * @param maxAttempts total attempts including the first (must be &ge; 1)
   */
  public RetryingEventHandler(EventHandler delegate, RetryPolicy retryPolicy, int maxAttempts) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
  }

  @Override
  public void handle(Event event) throws Exception {
    int failed = 0;
    while (true) {
      try {
        delegate.handle(event);
        return;
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        failed++;
        long backoffMs = failed < maxAttempts ? retryPolicy.backoffMs(failed, e) : RetryPolicy.GIVE_UP;
        if (backoffMs < 0) {
          throw e;
        }
        logger.log(Level.FINE, "Handler failed " + failed + "x for eventId=" + event.eventId()
            + "; next attempt in " + backoffMs + "ms", e);
        Thread.sleep(backoffMs);
      }
    }
  }

  @Override
  public String toString() {
    return "RetryingEventHandler{" + delegate + ", maxAttempts=" + maxAttempts + '}';
  }
}
