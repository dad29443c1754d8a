/**
 * Bridges committed appends to the bus.
 *
 * <p>{@link io.eventcore.dispatch.EventDispatcher} is an
 * {@link io.eventcore.store.AppendListener} that publishes events only after their append
 * commits, inline or through a bounded worker queue.
 * {@link io.eventcore.dispatch.SubscriptionManager} manages named subscriptions, their
 * activation and statistics, and the orderly shutdown of dispatcher and bus.
 *
 * @see io.eventcore.dispatch.EventDispatcher
 * @see io.eventcore.dispatch.SubscriptionManager
 * @see io.eventcore.dispatch.ProcessingState
 */
package io.eventcore.dispatch;
