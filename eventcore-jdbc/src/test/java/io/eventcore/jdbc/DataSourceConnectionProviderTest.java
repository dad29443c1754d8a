package io.eventcore.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void eachCallHandsOutAFreshConnection() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:provider_test;DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    assertSame(ds, provider.dataSource());
    Connection first = provider.getConnection();
    try (Connection second = provider.getConnection()) {
      assertNotSame(first, second);
      first.close();
      assertTrue(first.isClosed());
      assertFalse(second.isClosed());
    }
  }

  @Test
  void acquisitionFailurePropagatesAsSqlException() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:./target/no-such-dir/provider_missing;IFEXISTS=TRUE");

    assertThrows(SQLException.class, () -> new DataSourceConnectionProvider(ds).getConnection());
  }

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
