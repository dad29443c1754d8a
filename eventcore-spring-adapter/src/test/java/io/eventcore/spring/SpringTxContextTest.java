package io.eventcore.spring;

import io.eventcore.ConcurrencyException;
import io.eventcore.Event;
import io.eventcore.EventCore;
import io.eventcore.dispatch.SubscriptionSpec;
import io.eventcore.jdbc.DataSourceConnectionProvider;
import io.eventcore.jdbc.JdbcEventStore;
import io.eventcore.jdbc.JdbcSnapshotStore;
import io.eventcore.jdbc.store.AbstractJdbcEventStreamStore;
import io.eventcore.jdbc.store.H2EventStreamStore;
import io.eventcore.repository.Aggregate;
import io.eventcore.repository.AggregateDefinition;
import io.eventcore.repository.EventSourcedRepository;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.store.AppendListener;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SpringTxContextTest {

  private static final AggregateDefinition<Integer> COUNTER = AggregateDefinition
      .<Integer>builder("Counter", () -> 0)
      .on("Incremented", (count, event) -> count + 1)
      .build();

  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private AbstractJdbcEventStreamStore streamStore;
  private SpringTxContext txContext;
  private TransactionTemplate tx;
  private JdbcTemplate jdbc;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:eventcore_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    new ResourceDatabasePopulator(new ClassPathResource("schema/h2.sql")).execute(dataSource);

    jdbc = new JdbcTemplate(dataSource);
    jdbc.execute("CREATE TABLE ledger (id VARCHAR(64) PRIMARY KEY)");

    connectionProvider = new DataSourceConnectionProvider(dataSource);
    streamStore = new H2EventStreamStore();
    txContext = new SpringTxContext(dataSource);
    tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
  }

  private JdbcEventStore store(AppendListener listener) {
    return JdbcEventStore.builder()
        .connectionProvider(connectionProvider)
        .streamStore(streamStore)
        .txContext(txContext)
        .listener(listener)
        .build();
  }

  private int count(String table) {
    Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    return n == null ? 0 : n;
  }

  // ── outside a transaction ──

  @Test
  void inactiveOutsideSpringTransaction() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, txContext::currentConnection);
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> {}));
    assertThrows(IllegalStateException.class, () -> txContext.afterRollback(() -> {}));
  }

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new SpringTxContext(null));
  }

  // ── inside a transaction ──

  @Test
  void currentConnectionIsTheSpringBoundConnection() {
    tx.executeWithoutResult(status -> {
      assertTrue(txContext.isTransactionActive());
      Connection bound = DataSourceUtils.getConnection(dataSource);
      assertSame(bound, txContext.currentConnection());
    });
  }

  @Test
  void callbacksFollowTheOutcome() {
    List<String> calls = new CopyOnWriteArrayList<>();

    tx.executeWithoutResult(status -> {
      txContext.afterCommit(() -> calls.add("commit-1"));
      txContext.afterRollback(() -> calls.add("rollback-1"));
    });
    tx.executeWithoutResult(status -> {
      txContext.afterCommit(() -> calls.add("commit-2"));
      txContext.afterRollback(() -> calls.add("rollback-2"));
      status.setRollbackOnly();
    });

    assertEquals(List.of("commit-1", "rollback-2"), calls);
  }

  @Test
  void committedAppendNotifiesListenerAfterCommit() {
    RecordingListener listener = new RecordingListener();
    JdbcEventStore store = store(listener);

    tx.executeWithoutResult(status -> {
      store.append(Event.builder("Incremented").aggregateId("c-1").build(), 0);
      assertEquals(1, listener.appended.size());
      assertTrue(listener.committed.isEmpty());
    });

    assertEquals(1, listener.committed.size());
    assertTrue(listener.rolledBack.isEmpty());
    assertEquals(1, store.currentVersion("c-1"));
  }

  @Test
  void rollbackDiscardsEventsAndCallerWrites() {
    RecordingListener listener = new RecordingListener();
    JdbcEventStore store = store(listener);

    assertThrows(IllegalStateException.class, () -> tx.executeWithoutResult(status -> {
      jdbc.update("INSERT INTO ledger (id) VALUES (?)", "entry-1");
      store.append(Event.builder("Incremented").aggregateId("c-2").build(), 0);
      throw new IllegalStateException("business failure");
    }));

    assertEquals(0, count("ledger"));
    assertEquals(0, count("eventcore_event"));
    assertTrue(listener.committed.isEmpty());
    assertEquals(1, listener.rolledBack.size());
  }

  @Test
  void conflictInsideTransactionRollsBackCallerWrites() {
    JdbcEventStore store = store(AppendListener.NOOP);
    store.append(Event.builder("Incremented").aggregateId("c-3").build(), 0);

    assertThrows(ConcurrencyException.class, () -> tx.executeWithoutResult(status -> {
      jdbc.update("INSERT INTO ledger (id) VALUES (?)", "entry-2");
      store.append(Event.builder("Incremented").aggregateId("c-3").build(), 0);
    }));

    assertEquals(0, count("ledger"));
    assertEquals(1, store.currentVersion("c-3"));
  }

  @Test
  void snapshotWrittenInRolledBackTransactionIsDiscarded() {
    JdbcSnapshotStore snapshots = new JdbcSnapshotStore(connectionProvider, streamStore, txContext);

    tx.executeWithoutResult(status -> {
      snapshots.save(Snapshot.of("c-4", "Counter", 1, "1"));
      assertTrue(snapshots.getLatest("c-4").isPresent());
      status.setRollbackOnly();
    });

    assertTrue(snapshots.getLatest("c-4").isEmpty());
  }

  // ── end to end ──

  @Test
  void repositorySavePublishesOnlyAfterSpringCommit() {
    List<Event> delivered = new CopyOnWriteArrayList<>();
    try (EventCore core = EventCore.builder()
        .eventStore(listener -> store(listener))
        .snapshotStore(new JdbcSnapshotStore(connectionProvider, streamStore, txContext))
        .build()) {
      core.subscriptions().register(SubscriptionSpec.builder("audit")
          .eventType("Incremented")
          .handler(delivered::add)
          .build());
      core.subscriptions().start();
      EventSourcedRepository<Integer> counters = core.repository(COUNTER);

      tx.executeWithoutResult(status -> {
        Aggregate<Integer> counter = counters.create("c-5");
        counter.raise("Incremented", "{}");
        counter.raise("Incremented", "{}");
        counters.save(counter);
        assertTrue(delivered.isEmpty());
      });
      assertEquals(2, delivered.size());

      tx.executeWithoutResult(status -> {
        Aggregate<Integer> counter = counters.load("c-5");
        counter.raise("Incremented", "{}");
        counters.save(counter);
        status.setRollbackOnly();
      });
      assertEquals(2, delivered.size());
      assertEquals(2, counters.load("c-5").state());
    }
  }

  private static final class RecordingListener implements AppendListener {
    final List<Event> appended = new CopyOnWriteArrayList<>();
    final List<Event> committed = new CopyOnWriteArrayList<>();
    final List<Event> rolledBack = new CopyOnWriteArrayList<>();

    @Override
    public void afterAppend(List<Event> events) {
      appended.addAll(events);
    }

    @Override
    public void afterCommit(List<Event> events) {
      committed.addAll(events);
    }

    @Override
    public void afterRollback(List<Event> events) {
      rolledBack.addAll(events);
    }
  }
}
