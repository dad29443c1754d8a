/**
 * Event-sourced aggregates: definitions (initial state, reducers, serializer), the
 * {@link io.eventcore.repository.Aggregate} working copy, and
 * {@link io.eventcore.repository.EventSourcedRepository} which rebuilds aggregates from
 * snapshots plus replay and saves them with optimistic concurrency.
 *
 * @see io.eventcore.repository.SnapshotPolicy
 * @see io.eventcore.repository.SnapshotRetention
 */
package io.eventcore.repository;
