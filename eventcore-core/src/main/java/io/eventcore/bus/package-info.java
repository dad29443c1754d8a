/**
 * In-process publish/subscribe with priority tiers and topic routing.
 *
 * <p>{@link io.eventcore.bus.EventBus} delivers each event to its matching subscriptions in
 * {@link io.eventcore.bus.Priority} order, either on the caller's thread or asynchronously
 * with a per-publish concurrency limit and timeout. Handler failures are isolated and
 * reported in a {@link io.eventcore.bus.PublishResult}.
 *
 * @see io.eventcore.bus.EventBus
 * @see io.eventcore.bus.TopicPattern
 * @see io.eventcore.bus.RetryingEventHandler
 */
package io.eventcore.bus;
