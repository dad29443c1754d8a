package io.eventcore.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of connections for JDBC store work done outside a caller transaction.
 *
 * <p>Each call hands out a connection the store owns until it closes it, e.g.
 * {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
