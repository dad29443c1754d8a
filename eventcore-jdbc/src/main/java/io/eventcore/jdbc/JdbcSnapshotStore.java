package io.eventcore.jdbc;

import io.eventcore.StoreUnavailableException;
import io.eventcore.jdbc.store.AbstractJdbcEventStreamStore;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.snapshot.SnapshotStore;
import io.eventcore.spi.ConnectionProvider;
import io.eventcore.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link SnapshotStore} backed by a relational snapshots table keyed by
 * {@code (aggregate_id, version)}.
 *
 * <p>With a {@link TxContext} whose transaction is active, snapshots are written on the
 * transaction's connection, so a snapshot never outlives a rolled-back append of the events
 * it covers. Otherwise each call uses its own auto-commit connection.
 */
public final class JdbcSnapshotStore implements SnapshotStore {
  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcEventStreamStore streamStore;
  private final TxContext txContext;

  public JdbcSnapshotStore(ConnectionProvider connectionProvider, AbstractJdbcEventStreamStore streamStore) {
    this(connectionProvider, streamStore, null);
  }

  /**
   * @param txContext transaction context to join when active; may be {@code null}
   */
  public JdbcSnapshotStore(ConnectionProvider connectionProvider, AbstractJdbcEventStreamStore streamStore,
      TxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.streamStore = Objects.requireNonNull(streamStore, "streamStore");
    this.txContext = txContext;
  }

  @Override
  public void save(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    withConnection(conn -> streamStore.insertSnapshot(conn, snapshot));
  }

  @Override
  public Optional<Snapshot> getLatest(String aggregateId) {
    return getLatest(aggregateId, Long.MAX_VALUE);
  }

  @Override
  public Optional<Snapshot> getLatest(String aggregateId, long maxVersion) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    return withConnection(conn -> streamStore.selectLatestSnapshot(conn, aggregateId, maxVersion));
  }

  @Override
  public int prune(String aggregateId, int keepLatest) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    if (keepLatest < 1) {
      throw new IllegalArgumentException("keepLatest must be >= 1");
    }
    return withConnection(conn -> streamStore.deleteSnapshotsBeyond(conn, aggregateId, keepLatest));
  }

  @Override
  public int deleteAfter(String aggregateId, long version) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    return withConnection(conn -> streamStore.deleteSnapshotsAfter(conn, aggregateId, version));
  }

  private <T> T withConnection(Function<Connection, T> work) {
    if (txContext != null && txContext.isTransactionActive()) {
      return work.apply(txContext.currentConnection());
    }
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to obtain connection", e);
    }
    try (conn) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw JdbcTemplate.translate("Failed to release connection", e);
    }
  }
}
