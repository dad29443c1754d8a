/**
 * Append-only event streams with optimistic concurrency.
 *
 * @see io.eventcore.store.EventStore
 * @see io.eventcore.store.AppendListener
 */
package io.eventcore.store;
