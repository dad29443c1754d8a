/**
 * Database-specific SQL for the events and snapshots tables.
 *
 * <p>{@link io.eventcore.jdbc.store.JdbcEventStreamStores} discovers the built-in H2,
 * PostgreSQL and MySQL stores through {@link java.util.ServiceLoader}.
 */
package io.eventcore.jdbc.store;
