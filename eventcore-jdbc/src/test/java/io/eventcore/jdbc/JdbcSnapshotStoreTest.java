package io.eventcore.jdbc;

import io.eventcore.jdbc.store.H2EventStreamStore;
import io.eventcore.jdbc.tx.JdbcTransactionManager;
import io.eventcore.jdbc.tx.ThreadLocalTxContext;
import io.eventcore.snapshot.Snapshot;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSnapshotStoreTest {

  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private ThreadLocalTxContext txContext;
  private JdbcSnapshotStore store;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = Schemas.newH2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    store = new JdbcSnapshotStore(connectionProvider, new H2EventStreamStore(), txContext);
  }

  @Test
  void latestReturnsHighestVersion() {
    store.save("order-1", "Order", 5, "{\"total\":5}");
    store.save("order-1", "Order", 10, "{\"total\":10}");
    store.save("order-2", "Order", 20, "{\"total\":20}");

    Snapshot latest = store.getLatest("order-1").orElseThrow();
    assertEquals(10, latest.version());
    assertEquals("Order", latest.aggregateType());
    assertEquals("{\"total\":10}", latest.state());
    assertTrue(store.getLatest("order-3").isEmpty());
  }

  @Test
  void latestAtOrBelowMaxVersion() {
    store.save("order-1", "Order", 5, "five");
    store.save("order-1", "Order", 10, "ten");

    assertEquals(5, store.getLatest("order-1", 9).orElseThrow().version());
    assertEquals(10, store.getLatest("order-1", 10).orElseThrow().version());
    assertTrue(store.getLatest("order-1", 4).isEmpty());
  }

  @Test
  void savingSameVersionAgainKeepsFirst() throws SQLException {
    Instant takenAt = Instant.parse("2024-01-01T00:00:00Z");
    store.save(new Snapshot("order-1", "Order", 3, "first", takenAt));
    store.save(new Snapshot("order-1", "Order", 3, "second", takenAt.plusSeconds(5)));

    Snapshot latest = store.getLatest("order-1").orElseThrow();
    assertEquals("first", latest.state());
    assertEquals(takenAt, latest.takenAt());
    assertEquals(1, Schemas.count(dataSource, "eventcore_snapshot"));
  }

  @Test
  void pruneKeepsNewest() {
    for (int v = 1; v <= 5; v++) {
      store.save("order-1", "Order", v, "s" + v);
    }
    store.save("order-2", "Order", 1, "other");

    assertEquals(3, store.prune("order-1", 2));
    assertEquals(0, store.prune("order-1", 2));
    assertEquals(0, store.prune("missing", 1));

    assertEquals(4, store.getLatest("order-1", 4).orElseThrow().version());
    assertTrue(store.getLatest("order-1", 3).isEmpty());
    assertTrue(store.getLatest("order-2").isPresent());
  }

  @Test
  void deleteAfterDropsSnapshotsAheadOfVersion() {
    for (int v = 1; v <= 4; v++) {
      store.save("order-1", "Order", v, "s" + v);
    }
    store.save("order-2", "Order", 9, "other");

    assertEquals(2, store.deleteAfter("order-1", 2));
    assertEquals(2, store.getLatest("order-1").orElseThrow().version());
    assertEquals(9, store.getLatest("order-2").orElseThrow().version());

    store.save("order-1", "Order", 3, "rewritten");
    assertEquals("rewritten", store.getLatest("order-1").orElseThrow().state());
  }

  @Test
  void pruneRejectsKeepBelowOne() {
    assertThrows(IllegalArgumentException.class, () -> store.prune("order-1", 0));
  }

  @Test
  void snapshotInRolledBackTransactionIsDiscarded() throws SQLException {
    JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      store.save("order-1", "Order", 7, "state");
      assertTrue(store.getLatest("order-1").isPresent());
      tx.rollback();
    }

    Optional<Snapshot> afterRollback = store.getLatest("order-1");
    assertTrue(afterRollback.isEmpty());
  }
}
