/**
 * Spring transaction integration.
 *
 * <p>{@link io.eventcore.spring.SpringTxContext} lets {@code JdbcEventStore} and
 * {@code JdbcSnapshotStore} join transactions started by a Spring
 * {@code PlatformTransactionManager}.
 */
package io.eventcore.spring;
