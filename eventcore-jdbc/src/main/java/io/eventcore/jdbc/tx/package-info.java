/**
 * Manual JDBC transactions.
 *
 * <p>{@link io.eventcore.jdbc.tx.JdbcTransactionManager} binds a connection to a
 * {@link io.eventcore.jdbc.tx.ThreadLocalTxContext}; a
 * {@link io.eventcore.jdbc.JdbcEventStore} configured with the same context joins it.
 */
package io.eventcore.jdbc.tx;
