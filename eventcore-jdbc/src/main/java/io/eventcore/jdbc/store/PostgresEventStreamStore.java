package io.eventcore.jdbc.store;

import io.eventcore.jdbc.JdbcTemplate;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL event stream store.
 *
 * <p>Snapshot inserts use {@code ON CONFLICT DO NOTHING}: a failed statement would abort
 * the caller's transaction on PostgreSQL, so duplicates must not raise.
 */
public final class PostgresEventStreamStore extends AbstractJdbcEventStreamStore {

  public PostgresEventStreamStore() {
    super();
  }

  public PostgresEventStreamStore(String eventTable, String snapshotTable) {
    super(eventTable, snapshotTable);
  }

  public PostgresEventStreamStore(String eventTable, String snapshotTable, JsonCodec jsonCodec) {
    super(eventTable, snapshotTable, jsonCodec);
  }

  @Override
  public AbstractJdbcEventStreamStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresEventStreamStore(eventTable(), snapshotTable(), jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertSnapshot(Connection conn, Snapshot snapshot) {
    String sql = "INSERT INTO " + snapshotTable() + " (" + SNAPSHOT_COLUMNS + ") VALUES (?,?,?,?,?)" +
        " ON CONFLICT (aggregate_id, version) DO NOTHING";
    return JdbcTemplate.update(conn, sql, snapshotParams(snapshot)) > 0;
  }
}
