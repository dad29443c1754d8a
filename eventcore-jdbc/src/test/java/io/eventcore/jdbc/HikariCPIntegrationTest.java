package io.eventcore.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.eventcore.ConcurrencyException;
import io.eventcore.Event;
import io.eventcore.EventCore;
import io.eventcore.dispatch.SubscriptionSpec;
import io.eventcore.jdbc.store.AbstractJdbcEventStreamStore;
import io.eventcore.jdbc.store.JdbcEventStreamStores;
import io.eventcore.jdbc.tx.JdbcTransactionManager;
import io.eventcore.jdbc.tx.ThreadLocalTxContext;
import io.eventcore.repository.Aggregate;
import io.eventcore.repository.AggregateDefinition;
import io.eventcore.repository.EventSourcedRepository;
import io.eventcore.repository.SnapshotPolicy;
import io.eventcore.repository.StateSerializer;
import io.eventcore.snapshot.InMemorySnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {

  private static final AggregateDefinition<Integer> ACCOUNT = AggregateDefinition
      .<Integer>builder("Account", () -> 0)
      .on("Deposited", (balance, event) -> balance + Integer.parseInt(event.payloadJson()))
      .serializer(new StateSerializer<>() {
        @Override
        public String serialize(Integer state) {
          return state.toString();
        }

        @Override
        public Integer deserialize(String data) {
          return Integer.valueOf(data);
        }
      })
      .build();

  private HikariDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private ThreadLocalTxContext txContext;
  private AbstractJdbcEventStreamStore streamStore;

  @BeforeEach
  void setUp() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("eventcore-test-pool");
    dataSource = new HikariDataSource(config);
    Schemas.apply(dataSource, "/schema/h2.sql");

    connectionProvider = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    streamStore = JdbcEventStreamStores.detect(dataSource);
  }

  @AfterEach
  void tearDown() {
    if (dataSource != null && !dataSource.isClosed()) {
      dataSource.close();
    }
  }

  private EventCore newCore() {
    return EventCore.builder()
        .eventStore(listener -> JdbcEventStore.builder()
            .connectionProvider(connectionProvider)
            .streamStore(streamStore)
            .txContext(txContext)
            .listener(listener)
            .build())
        .snapshotStore(new JdbcSnapshotStore(connectionProvider, streamStore, txContext))
        .build();
  }

  @Test
  void saveLoadAndPublishThroughPool() {
    List<Event> published = new CopyOnWriteArrayList<>();
    try (EventCore core = newCore()) {
      core.subscriptions().register(SubscriptionSpec.builder("audit")
          .eventType("Deposited")
          .handler(published::add)
          .build());
      core.subscriptions().start();

      EventSourcedRepository<Integer> accounts = core.repository(ACCOUNT, SnapshotPolicy.everyNEvents(2));
      Aggregate<Integer> account = accounts.create("acc-1");
      account.raise("Deposited", "10");
      account.raise("Deposited", "15");
      accounts.save(account);
      account.raise("Deposited", "5");
      accounts.save(account);

      Aggregate<Integer> loaded = accounts.load("acc-1");
      assertEquals(30, loaded.state());
      assertEquals(3, loaded.version());
      assertEquals(2, core.snapshotStore().getLatest("acc-1").orElseThrow().version());
      assertEquals(List.of(1L, 2L, 3L), published.stream().map(Event::version).toList());
    }
  }

  @Test
  void rolledBackSaveNeverPublishes() throws Exception {
    AtomicInteger delivered = new AtomicInteger();
    JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);
    try (EventCore core = newCore()) {
      core.subscriptions().register(SubscriptionSpec.builder("counter")
          .eventType("Deposited")
          .handler(event -> delivered.incrementAndGet())
          .build());
      core.subscriptions().start();
      EventSourcedRepository<Integer> accounts = core.repository(ACCOUNT);

      try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
        Aggregate<Integer> account = accounts.create("acc-2");
        account.raise("Deposited", "100");
        accounts.save(account);
        assertEquals(0, delivered.get());
        tx.rollback();
      }

      assertEquals(0, delivered.get());
      assertTrue(accounts.getById("acc-2").isEmpty());
    }
  }

  @Test
  void rolledBackSaveWithOutOfTxSnapshotsLeavesAggregateUsable() throws Exception {
    JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);
    InMemorySnapshotStore snapshots = new InMemorySnapshotStore();
    try (EventCore core = EventCore.builder()
        .eventStore(listener -> JdbcEventStore.builder()
            .connectionProvider(connectionProvider)
            .streamStore(streamStore)
            .txContext(txContext)
            .listener(listener)
            .build())
        .snapshotStore(snapshots)
        .build()) {
      EventSourcedRepository<Integer> accounts = core.repository(ACCOUNT, SnapshotPolicy.everyNEvents(1));
      Aggregate<Integer> account = accounts.create("acc-3");
      account.raise("Deposited", "1");
      account.raise("Deposited", "1");
      accounts.save(account);

      try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
        Aggregate<Integer> inTx = accounts.load("acc-3");
        inTx.raise("Deposited", "1");
        accounts.save(inTx);
        tx.rollback();
      }
      assertEquals(3, snapshots.getLatest("acc-3").orElseThrow().version());

      Aggregate<Integer> reloaded = accounts.load("acc-3");
      assertEquals(2, reloaded.version());
      assertEquals(2, reloaded.state());
      reloaded.raise("Deposited", "5");
      assertDoesNotThrow(() -> accounts.save(reloaded));
      assertEquals(7, accounts.load("acc-3").state());
    }
  }

  @Test
  void concurrentWritersOnOneStreamHaveSingleWinner() throws Exception {
    int writers = 8;
    JdbcEventStore store = JdbcEventStore.builder()
        .connectionProvider(connectionProvider)
        .streamStore(streamStore)
        .build();
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger conflicts = new AtomicInteger();
    try {
      List<Future<?>> futures = new CopyOnWriteArrayList<>();
      for (int i = 0; i < writers; i++) {
        int n = i;
        futures.add(pool.submit(() -> {
          start.await();
          try {
            store.append(Event.builder("Deposited").aggregateId("shared").payloadJson(String.valueOf(n)).build(), 0);
          } catch (ConcurrencyException e) {
            conflicts.incrementAndGet();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(writers - 1, conflicts.get());
    assertEquals(1, store.currentVersion("shared"));
    assertEquals(1, store.getEvents("shared").size());
  }
}
