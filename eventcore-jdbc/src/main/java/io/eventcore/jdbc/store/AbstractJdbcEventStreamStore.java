package io.eventcore.jdbc.store;

import io.eventcore.Event;
import io.eventcore.SerializationException;
import io.eventcore.jdbc.EventStoreException;
import io.eventcore.jdbc.JdbcTemplate;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.store.StoredEvent;
import io.eventcore.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SQL for the events and snapshots tables, with standard implementations that subclasses
 * override where a database needs its own syntax.
 *
 * <p>Instances are stateless apart from table names and the metadata codec, and may be
 * shared. Register custom implementations via
 * {@code META-INF/services/io.eventcore.jdbc.store.AbstractJdbcEventStreamStore}.
 *
 * @see JdbcEventStreamStores
 */
public abstract class AbstractJdbcEventStreamStore {
  protected static final String DEFAULT_EVENT_TABLE = "eventcore_event";
  protected static final String DEFAULT_SNAPSHOT_TABLE = "eventcore_snapshot";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  protected static final String EVENT_COLUMNS = "position, event_id, aggregate_id, aggregate_type, "
      + "version, event_type, occurred_at, correlation_id, causation_id, topic, metadata, payload";

  protected static final String SNAPSHOT_COLUMNS = "aggregate_id, aggregate_type, version, state, taken_at";

  private final String eventTable;
  private final String snapshotTable;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcEventStreamStore() {
    this(DEFAULT_EVENT_TABLE, DEFAULT_SNAPSHOT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcEventStreamStore(String eventTable, String snapshotTable) {
    this(eventTable, snapshotTable, JsonCodec.getDefault());
  }

  protected AbstractJdbcEventStreamStore(String eventTable, String snapshotTable, JsonCodec jsonCodec) {
    this.eventTable = validateTableName(eventTable, "eventTable");
    this.snapshotTable = validateTableName(snapshotTable, "snapshotTable");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store that encodes event metadata with {@code jsonCodec}.
   */
  public abstract AbstractJdbcEventStreamStore withJsonCodec(JsonCodec jsonCodec);

  /**
   * Returns {@code true} if the failure is a violation of a unique or primary key
   * constraint. Walks chained and nested exceptions, since batch drivers wrap the original.
   */
  public boolean isUniqueViolation(SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql) {
        for (SQLException s = sql; s != null; s = s.getNextException()) {
          if ("23505".equals(s.getSQLState())) {
            return true;
          }
        }
      }
    }
    return false;
  }

  public String eventTable() {
    return eventTable;
  }

  public String snapshotTable() {
    return snapshotTable;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  // ── events ──

  /**
   * Returns the highest version stored for an aggregate, {@code 0} if it has none.
   */
  public long currentVersion(Connection conn, String aggregateId) {
    String sql = "SELECT MAX(version) FROM " + eventTable + " WHERE aggregate_id=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1), aggregateId).orElse(0L);
  }

  /**
   * Inserts events that already carry their versions. A duplicate
   * {@code (aggregate_id, version)} fails with {@link EventStoreException} whose cause
   * satisfies {@link #isUniqueViolation}.
   */
  public void insertEvents(Connection conn, List<Event> events) {
    String sql = "INSERT INTO " + eventTable + " (" +
        "event_id, aggregate_id, aggregate_type, version, event_type, occurred_at, " +
        "correlation_id, causation_id, topic, metadata, payload" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    for (Event event : events) {
      JdbcTemplate.update(conn, sql,
          event.eventId(), event.aggregateId(), event.aggregateType(), event.version(),
          event.eventType(), Timestamp.from(event.occurredAt()),
          event.correlationId(), event.causationId(), event.topic(),
          jsonCodec.encode(event.metadata()), event.payloadJson());
    }
  }

  public List<StoredEvent> selectStream(Connection conn, String aggregateId, long sinceVersion) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + eventTable +
        " WHERE aggregate_id=? AND version>? ORDER BY version";
    return JdbcTemplate.query(conn, sql, this::mapEvent, aggregateId, sinceVersion);
  }

  /**
   * Reads one page of events of a type with {@code afterPosition < position <= upToPosition}.
   *
   * @param since inclusive lower bound on {@code occurred_at}, or {@code null}
   */
  public List<StoredEvent> selectByType(Connection conn, String eventType, Instant since,
      long afterPosition, long upToPosition, int limit) {
    StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS)
        .append(" FROM ").append(eventTable)
        .append(" WHERE event_type=? AND position>? AND position<=?");
    if (since == null) {
      sql.append(" ORDER BY position LIMIT ?");
      return JdbcTemplate.query(conn, sql.toString(), this::mapEvent,
          eventType, afterPosition, upToPosition, limit);
    }
    sql.append(" AND occurred_at>=? ORDER BY position LIMIT ?");
    return JdbcTemplate.query(conn, sql.toString(), this::mapEvent,
        eventType, afterPosition, upToPosition, Timestamp.from(since), limit);
  }

  public List<StoredEvent> selectByCorrelationId(Connection conn, String correlationId) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + eventTable +
        " WHERE correlation_id=? ORDER BY position";
    return JdbcTemplate.query(conn, sql, this::mapEvent, correlationId);
  }

  /**
   * Reads the {@code limit} most recent events of the whole log, newest first.
   */
  public List<StoredEvent> selectLatest(Connection conn, int limit) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + eventTable +
        " ORDER BY position DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapEvent, limit);
  }

  /**
   * Returns the highest log position, {@code 0} for an empty table.
   */
  public long maxPosition(Connection conn) {
    String sql = "SELECT MAX(position) FROM " + eventTable;
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1)).orElse(0L);
  }

  /**
   * Maps one event row.
   *
   * @throws SerializationException if the row does not form a valid event
   */
  protected StoredEvent mapEvent(ResultSet rs) throws SQLException {
    long position = rs.getLong("position");
    String aggregateId = rs.getString("aggregate_id");
    try {
      Event event = Event.builder(rs.getString("event_type"))
          .eventId(rs.getString("event_id"))
          .aggregateId(aggregateId)
          .aggregateType(rs.getString("aggregate_type"))
          .version(rs.getLong("version"))
          .occurredAt(rs.getTimestamp("occurred_at").toInstant())
          .correlationId(rs.getString("correlation_id"))
          .causationId(rs.getString("causation_id"))
          .topic(rs.getString("topic"))
          .metadata(jsonCodec.decode(rs.getString("metadata")))
          .payloadJson(rs.getString("payload"))
          .build();
      return new StoredEvent(position, event);
    } catch (IllegalArgumentException | SerializationException e) {
      throw new SerializationException("Malformed event row at position " + position
          + " of aggregate " + aggregateId + ": " + e.getMessage(), e);
    }
  }

  // ── snapshots ──

  /**
   * Inserts a snapshot unless one already exists for its {@code (aggregate_id, version)}.
   *
   * @return {@code true} if a row was written
   */
  public boolean insertSnapshot(Connection conn, Snapshot snapshot) {
    String sql = "INSERT INTO " + snapshotTable + " (" + SNAPSHOT_COLUMNS + ") VALUES (?,?,?,?,?)";
    try {
      return JdbcTemplate.update(conn, sql, snapshotParams(snapshot)) > 0;
    } catch (EventStoreException e) {
      if (e.getCause() instanceof SQLException sqlEx && isUniqueViolation(sqlEx)) {
        return false;
      }
      throw e;
    }
  }

  public Optional<Snapshot> selectLatestSnapshot(Connection conn, String aggregateId, long maxVersion) {
    String sql = "SELECT " + SNAPSHOT_COLUMNS + " FROM " + snapshotTable +
        " WHERE aggregate_id=? AND version<=? ORDER BY version DESC LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, rs -> new Snapshot(
        rs.getString("aggregate_id"),
        rs.getString("aggregate_type"),
        rs.getLong("version"),
        rs.getString("state"),
        rs.getTimestamp("taken_at").toInstant()), aggregateId, maxVersion);
  }

  /**
   * Deletes all but the newest {@code keepLatest} snapshots of an aggregate.
   *
   * @return rows deleted
   */
  public int deleteSnapshotsBeyond(Connection conn, String aggregateId, int keepLatest) {
    String select = "SELECT version FROM " + snapshotTable +
        " WHERE aggregate_id=? ORDER BY version DESC LIMIT 1 OFFSET ?";
    Optional<Long> newestDropped = JdbcTemplate.queryOne(conn, select,
        rs -> rs.getLong(1), aggregateId, keepLatest);
    if (newestDropped.isEmpty()) {
      return 0;
    }
    String delete = "DELETE FROM " + snapshotTable + " WHERE aggregate_id=? AND version<=?";
    return JdbcTemplate.update(conn, delete, aggregateId, newestDropped.get());
  }

  public int deleteSnapshotsAfter(Connection conn, String aggregateId, long version) {
    String sql = "DELETE FROM " + snapshotTable + " WHERE aggregate_id=? AND version>?";
    return JdbcTemplate.update(conn, sql, aggregateId, version);
  }

  protected Object[] snapshotParams(Snapshot snapshot) {
    return new Object[] {
        snapshot.aggregateId(), snapshot.aggregateType(), snapshot.version(),
        snapshot.state(), Timestamp.from(snapshot.takenAt())};
  }

  private static String validateTableName(String tableName, String label) {
    Objects.requireNonNull(tableName, label);
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid " + label + ": " + tableName);
    }
    return tableName;
  }
}
