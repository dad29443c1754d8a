package io.eventcore.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Loads the DDL resources shipped in {@code schema/} into test databases.
 */
public final class Schemas {

  public static JdbcDataSource newH2() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:eventcore_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    apply(ds, "/schema/h2.sql");
    return ds;
  }

  public static void apply(DataSource dataSource, String resource) throws SQLException {
    String ddl;
    try (InputStream is = Schemas.class.getResourceAsStream(resource)) {
      if (is == null) throw new IllegalStateException("Resource not found: " + resource);
      ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : ddl.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  public static int count(DataSource dataSource, String table) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private Schemas() {}
}
