package io.eventcore.jdbc;

import io.eventcore.EventCoreException;
import io.eventcore.StoreUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper shared by the event and snapshot stores.
 *
 * <p>Every {@link SQLException} is translated by {@link #translate(String, SQLException)}:
 * connectivity failures become {@link StoreUnavailableException}, anything else
 * {@link EventStoreException}. The original exception is kept as the cause.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw translate("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw translate("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to return at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  /**
   * Maps a JDBC failure onto the eventcore error hierarchy.
   *
   * @param message context for the resulting exception
   * @param e       the JDBC failure
   * @return {@link StoreUnavailableException} for connection-class failures, otherwise
   *     {@link EventStoreException}
   */
  public static EventCoreException translate(String message, SQLException e) {
    if (isConnectionFailure(e)) {
      return new StoreUnavailableException(message + ": " + e.getMessage(), e);
    }
    return new EventStoreException(message, e);
  }

  /**
   * Returns {@code true} for SQLState class {@code 08} (connection exception) and for the
   * JDBC connection exception subclasses.
   */
  public static boolean isConnectionFailure(SQLException e) {
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException) {
      return true;
    }
    String state = e.getSQLState();
    return state != null && state.startsWith("08");
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
