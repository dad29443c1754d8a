/**
 * JDBC implementations of the event and snapshot stores.
 *
 * <p>{@link io.eventcore.jdbc.JdbcEventStore} and {@link io.eventcore.jdbc.JdbcSnapshotStore}
 * delegate SQL to an {@link io.eventcore.jdbc.store.AbstractJdbcEventStreamStore}. DDL for
 * H2, PostgreSQL and MySQL ships as the classpath resources {@code schema/h2.sql},
 * {@code schema/postgresql.sql} and {@code schema/mysql.sql}.
 *
 * <p>JDBC failures are unchecked: connectivity problems surface as
 * {@link io.eventcore.StoreUnavailableException}, version conflicts as
 * {@link io.eventcore.ConcurrencyException}, anything else as
 * {@link io.eventcore.jdbc.EventStoreException}.
 */
package io.eventcore.jdbc;
