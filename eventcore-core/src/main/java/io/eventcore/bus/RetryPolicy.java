package io.eventcore.bus;

/**
 * Decides whether, and after how long, {@link RetryingEventHandler} tries a failed handler again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /** Returned by {@link #backoffMs} to stop retrying and report the failure. */
    long GIVE_UP = -1L;

    /**
     * @param failedAttempts how many times the handler has failed for this event, starting at 1
     * @param failure        the failure of the latest attempt
     * @return milliseconds to wait before the next attempt, or {@link #GIVE_UP}
     */
    long backoffMs(int failedAttempts, Exception failure);
}
