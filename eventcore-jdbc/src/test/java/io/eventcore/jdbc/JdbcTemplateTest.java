package io.eventcore.jdbc;

import io.eventcore.StoreUnavailableException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {

  @Test
  void connectionClassStateIsStoreUnavailable() {
    assertInstanceOf(StoreUnavailableException.class,
        JdbcTemplate.translate("op", new SQLException("lost", "08S01")));
    assertInstanceOf(StoreUnavailableException.class,
        JdbcTemplate.translate("op", new SQLTransientConnectionException("pool exhausted")));
  }

  @Test
  void otherStatesAreEventStoreException() {
    SQLException cause = new SQLException("syntax", "42000");
    EventStoreException ex = assertInstanceOf(EventStoreException.class,
        JdbcTemplate.translate("op", cause));
    assertSame(cause, ex.getCause());
    assertInstanceOf(EventStoreException.class, JdbcTemplate.translate("op", new SQLException("none")));
  }

  @Test
  void bindsAndMapsParameters() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:template_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    Instant at = Instant.parse("2024-05-01T12:00:00Z");

    try (Connection conn = ds.getConnection()) {
      JdbcTemplate.update(conn, "CREATE TABLE t (id BIGINT, name VARCHAR(20), n INT, at TIMESTAMP)");
      assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO t VALUES (?,?,?,?)",
          7L, "seven", 7, Timestamp.from(at)));
      assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO t VALUES (?,?,?,?)", 8L, null, 8, null));

      List<String> names = JdbcTemplate.query(conn, "SELECT name FROM t ORDER BY id",
          rs -> rs.getString(1));
      assertEquals(Arrays.asList("seven", null), names);
      assertEquals(at, JdbcTemplate.queryOne(conn, "SELECT at FROM t WHERE id=?",
          rs -> rs.getTimestamp(1).toInstant(), 7L).orElseThrow());
      assertTrue(JdbcTemplate.queryOne(conn, "SELECT id FROM t WHERE id=?", rs -> rs.getLong(1), 99L)
          .isEmpty());
    }
  }

  @Test
  void badSqlIsEventStoreException() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:template_" + UUID.randomUUID());
    try (Connection conn = ds.getConnection()) {
      assertThrows(EventStoreException.class, () -> JdbcTemplate.update(conn, "UPDATE missing SET x=1"));
    }
  }
}
