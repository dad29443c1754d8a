package io.eventcore.jdbc.store;

import io.eventcore.jdbc.JdbcTemplate;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * MySQL event stream store. Also compatible with TiDB.
 *
 * <p>MySQL reports duplicate keys as SQLState {@code 23000} with vendor code {@code 1062}
 * rather than {@code 23505}. Snapshot inserts use {@code INSERT IGNORE}.
 */
public final class MySqlEventStreamStore extends AbstractJdbcEventStreamStore {
  private static final int ER_DUP_ENTRY = 1062;

  public MySqlEventStreamStore() {
    super();
  }

  public MySqlEventStreamStore(String eventTable, String snapshotTable) {
    super(eventTable, snapshotTable);
  }

  public MySqlEventStreamStore(String eventTable, String snapshotTable, JsonCodec jsonCodec) {
    super(eventTable, snapshotTable, jsonCodec);
  }

  @Override
  public AbstractJdbcEventStreamStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlEventStreamStore(eventTable(), snapshotTable(), jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql
          && ("23000".equals(sql.getSQLState()) && sql.getErrorCode() == ER_DUP_ENTRY)) {
        return true;
      }
    }
    return super.isUniqueViolation(e);
  }

  @Override
  public boolean insertSnapshot(Connection conn, Snapshot snapshot) {
    String sql = "INSERT IGNORE INTO " + snapshotTable() + " (" + SNAPSHOT_COLUMNS + ") VALUES (?,?,?,?,?)";
    return JdbcTemplate.update(conn, sql, snapshotParams(snapshot)) > 0;
  }
}
