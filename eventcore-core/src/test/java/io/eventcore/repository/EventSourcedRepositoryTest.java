package io.eventcore.repository;

import io.eventcore.AggregateNotFoundException;
import io.eventcore.ConcurrencyException;
import io.eventcore.ConfigurationException;
import io.eventcore.Event;
import io.eventcore.RecordingMetrics;
import io.eventcore.ReplayException;
import io.eventcore.snapshot.InMemorySnapshotStore;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.snapshot.SnapshotStore;
import io.eventcore.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventSourcedRepositoryTest {

  private static final StateSerializer<Integer> INT_SERIALIZER = new StateSerializer<>() {
    @Override
    public String serialize(Integer state) {
      return String.valueOf(state);
    }

    @Override
    public Integer deserialize(String data) {
      return Integer.valueOf(data);
    }
  };

  private static final AggregateDefinition<Integer> COUNTER = AggregateDefinition
      .<Integer>builder("Counter", () -> 0)
      .on("Incremented", (state, event) -> state + 1)
      .on("Added", (state, event) -> state + Integer.parseInt(event.metadata().get("amount")))
      .serializer(INT_SERIALIZER)
      .build();

  private final InMemoryEventStore eventStore = new InMemoryEventStore();
  private final InMemorySnapshotStore snapshotStore = new InMemorySnapshotStore();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private EventSourcedRepository<Integer> repository(SnapshotPolicy policy, SnapshotRetention retention) {
    return EventSourcedRepository.<Integer>builder()
        .eventStore(eventStore)
        .snapshotStore(snapshotStore)
        .definition(COUNTER)
        .snapshotPolicy(policy)
        .retention(retention)
        .metrics(metrics)
        .build();
  }

  private EventSourcedRepository<Integer> repository() {
    return repository(SnapshotPolicy.never(), SnapshotRetention.keepAll());
  }

  private static void increment(Aggregate<Integer> aggregate, int times) {
    for (int i = 0; i < times; i++) {
      aggregate.raise("Incremented", "{}");
    }
  }

  // ── Save and load ──

  @Test
  void saveThenLoadRebuildsState() {
    EventSourcedRepository<Integer> repository = repository();
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 3);
    counter.raise(Event.builder("Added").metadata(Map.of("amount", "10")));

    repository.save(counter);
    Aggregate<Integer> loaded = repository.load("c-1");

    assertEquals(13, loaded.state());
    assertEquals(4, loaded.version());
    assertFalse(loaded.hasUncommittedChanges());
    assertEquals(4, metrics.appended.get());
    assertEquals(4, metrics.replayed.get());
  }

  @Test
  void raiseStampsAggregateFieldsAndAppliesImmediately() {
    Aggregate<Integer> counter = repository().create("c-1");

    Event raised = counter.raise("Incremented", "{}");

    assertEquals("c-1", raised.aggregateId());
    assertEquals("Counter", raised.aggregateType());
    assertEquals(1, raised.version());
    assertEquals(1, counter.state());
    assertEquals(0, counter.committedVersion());
    assertEquals(List.of(raised), counter.uncommittedEvents());
  }

  @Test
  void raiseWithoutReducerIsRejected() {
    Aggregate<Integer> counter = repository().create("c-1");

    assertThrows(ConfigurationException.class, () -> counter.raise("Unknown", "{}"));
    assertEquals(0, counter.version());
  }

  @Test
  void saveWithoutChangesIsNoOp() {
    EventSourcedRepository<Integer> repository = repository();

    repository.save(repository.create("c-1"));

    assertEquals(0, eventStore.currentVersion("c-1"));
  }

  @Test
  void getByIdOfUnknownAggregateIsEmpty() {
    assertEquals(Optional.empty(), repository().getById("missing"));
    assertThrows(AggregateNotFoundException.class, () -> repository().load("missing"));
  }

  @Test
  void staleAggregateSaveThrowsConcurrencyException() {
    EventSourcedRepository<Integer> repository = repository();
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 1);
    repository.save(counter);

    Aggregate<Integer> first = repository.load("c-1");
    Aggregate<Integer> second = repository.load("c-1");
    increment(first, 1);
    increment(second, 1);
    repository.save(first);

    ConcurrencyException ex = assertThrows(ConcurrencyException.class, () -> repository.save(second));
    assertEquals(1, ex.expectedVersion());
    assertEquals(2, ex.actualVersion());
    assertTrue(second.hasUncommittedChanges());
    assertEquals(1, metrics.conflicts.get());
    assertEquals(2, repository.load("c-1").state());
  }

  @Test
  void createOverExistingStreamConflicts() {
    EventSourcedRepository<Integer> repository = repository();
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 1);
    repository.save(counter);

    Aggregate<Integer> duplicate = repository.create("c-1");
    increment(duplicate, 1);

    assertThrows(ConcurrencyException.class, () -> repository.save(duplicate));
  }

  // ── Snapshots ──

  @Test
  void snapshotIsTakenEveryNEvents() {
    EventSourcedRepository<Integer> repository = repository(SnapshotPolicy.everyNEvents(5), SnapshotRetention.keepAll());
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 4);
    repository.save(counter);
    assertTrue(snapshotStore.getLatest("c-1").isEmpty());

    increment(counter, 3);
    repository.save(counter);

    Snapshot snapshot = snapshotStore.getLatest("c-1").orElseThrow();
    assertEquals(7, snapshot.version());
    assertEquals("7", snapshot.state());
    assertEquals(1, metrics.snapshotsSaved.get());
  }

  @Test
  void loadStartsFromSnapshotAndReplaysTail() {
    EventSourcedRepository<Integer> repository = repository(SnapshotPolicy.everyNEvents(5), SnapshotRetention.keepAll());
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 5);
    repository.save(counter);
    increment(counter, 2);
    repository.save(counter);
    metrics.replayed.set(0);

    Aggregate<Integer> loaded = repository.load("c-1");

    assertEquals(7, loaded.state());
    assertEquals(7, loaded.version());
    assertEquals(2, metrics.replayed.get());
  }

  @Test
  void snapshotPlusTailEqualsFullReplay() {
    EventSourcedRepository<Integer> snapshotting = repository(SnapshotPolicy.everyNEvents(3), SnapshotRetention.keepAll());
    Aggregate<Integer> counter = snapshotting.create("c-1");
    for (int i = 0; i < 10; i++) {
      increment(counter, 1);
      snapshotting.save(counter);
    }
    EventSourcedRepository<Integer> plain = EventSourcedRepository.<Integer>builder()
        .eventStore(eventStore)
        .definition(COUNTER)
        .build();

    assertEquals(plain.load("c-1").state(), snapshotting.load("c-1").state());
    assertEquals(plain.load("c-1").version(), snapshotting.load("c-1").version());
  }

  @Test
  void corruptSnapshotFallsBackToFullReplay() {
    EventSourcedRepository<Integer> repository = repository();
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 4);
    repository.save(counter);
    snapshotStore.save("c-1", "Counter", 4, "not-a-number");

    Aggregate<Integer> loaded = repository.load("c-1");

    assertEquals(4, loaded.state());
    assertEquals(4, loaded.version());
  }

  @Test
  void snapshotAheadOfStreamIsIgnored() {
    EventSourcedRepository<Integer> repository = repository(SnapshotPolicy.everyNEvents(1), SnapshotRetention.keepAll());
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 2);
    repository.save(counter);
    // left behind by a save whose events were rolled back
    snapshotStore.save("c-1", "Counter", 3, "3");

    Aggregate<Integer> loaded = repository.load("c-1");
    assertEquals(2, loaded.state());
    assertEquals(2, loaded.version());
    assertEquals(2, snapshotStore.getLatest("c-1").orElseThrow().version());

    loaded.raise(Event.builder("Added").metadata(Map.of("amount", "10")));
    assertDoesNotThrow(() -> repository.save(loaded));
    assertEquals(3, eventStore.currentVersion("c-1"));
    assertEquals("12", snapshotStore.getLatest("c-1").orElseThrow().state());
    assertEquals(12, repository.load("c-1").state());
  }

  @Test
  void snapshotWithoutStreamDoesNotResurrectAggregate() {
    snapshotStore.save("ghost", "Counter", 5, "5");

    assertTrue(repository().getById("ghost").isEmpty());
  }

  @Test
  void failingSnapshotStoreDoesNotFailSaveOrLoad() {
    SnapshotStore broken = new SnapshotStore() {
      @Override
      public void save(Snapshot snapshot) {
        throw new IllegalStateException("disk full");
      }

      @Override
      public Optional<Snapshot> getLatest(String aggregateId) {
        throw new IllegalStateException("unreachable");
      }

      @Override
      public Optional<Snapshot> getLatest(String aggregateId, long maxVersion) {
        throw new IllegalStateException("unreachable");
      }

      @Override
      public int prune(String aggregateId, int keepLatest) {
        return 0;
      }

      @Override
      public int deleteAfter(String aggregateId, long version) {
        return 0;
      }
    };
    EventSourcedRepository<Integer> repository = EventSourcedRepository.<Integer>builder()
        .eventStore(eventStore)
        .snapshotStore(broken)
        .definition(COUNTER)
        .snapshotPolicy(SnapshotPolicy.everyNEvents(1))
        .build();
    Aggregate<Integer> counter = repository.create("c-1");
    increment(counter, 2);

    assertDoesNotThrow(() -> repository.save(counter));
    assertEquals(2, repository.load("c-1").state());
  }

  @Test
  void retentionKeepsNewestSnapshots() {
    EventSourcedRepository<Integer> repository = repository(SnapshotPolicy.everyNEvents(1), SnapshotRetention.keepLatest(2));
    Aggregate<Integer> counter = repository.create("c-1");
    for (int i = 0; i < 5; i++) {
      increment(counter, 1);
      repository.save(counter);
    }

    assertEquals(5, snapshotStore.getLatest("c-1").orElseThrow().version());
    assertEquals(4, snapshotStore.getLatest("c-1", 4).orElseThrow().version());
    assertTrue(snapshotStore.getLatest("c-1", 3).isEmpty());
  }

  // ── Replay failures ──

  @Test
  void reducerFailureIsReplayException() {
    AggregateDefinition<Integer> fragile = AggregateDefinition.<Integer>builder("Counter", () -> 0)
        .on("Incremented", (state, event) -> {
          if (event.version() == 2) {
            throw new IllegalStateException("bad event");
          }
          return state + 1;
        })
        .build();
    eventStore.appendAll("c-1", List.of(Event.ofJson("Incremented", "{}"), Event.ofJson("Incremented", "{}")), 0);
    EventSourcedRepository<Integer> repository = EventSourcedRepository.<Integer>builder()
        .eventStore(eventStore)
        .definition(fragile)
        .build();

    ReplayException ex = assertThrows(ReplayException.class, () -> repository.load("c-1"));

    assertEquals("c-1", ex.aggregateId());
    assertEquals(2, ex.version());
    assertInstanceOf(IllegalStateException.class, ex.getCause());
  }

  @Test
  void missingReducerDuringReplayIsReplayException() {
    eventStore.appendAll("c-1", List.of(Event.ofJson("Incremented", "{}"), Event.ofJson("Renamed", "{}")), 0);

    ReplayException ex = assertThrows(ReplayException.class, () -> repository().load("c-1"));

    assertEquals(2, ex.version());
  }

  @Test
  void otherAggregatesStillLoadAfterReplayFailure() {
    eventStore.appendAll("bad", List.of(Event.ofJson("Renamed", "{}")), 0);
    eventStore.appendAll("good", List.of(Event.ofJson("Incremented", "{}")), 0);

    assertThrows(ReplayException.class, () -> repository().load("bad"));
    assertEquals(1, repository().load("good").state());
  }

  // ── Configuration ──

  @Test
  void snapshotPolicyRequiresStoreAndSerializer() {
    assertThrows(ConfigurationException.class, () -> EventSourcedRepository.<Integer>builder()
        .eventStore(eventStore)
        .definition(COUNTER)
        .snapshotPolicy(SnapshotPolicy.everyNEvents(5))
        .build());

    AggregateDefinition<Integer> noSerializer = AggregateDefinition.<Integer>builder("Counter", () -> 0)
        .on("Incremented", (state, event) -> state + 1)
        .build();
    assertThrows(ConfigurationException.class, () -> EventSourcedRepository.<Integer>builder()
        .eventStore(eventStore)
        .snapshotStore(snapshotStore)
        .definition(noSerializer)
        .snapshotPolicy(SnapshotPolicy.everyNEvents(5))
        .build());
  }

  @Test
  void builderRequiresStoreAndDefinition() {
    assertThrows(NullPointerException.class, () -> EventSourcedRepository.<Integer>builder().definition(COUNTER).build());
    assertThrows(NullPointerException.class, () -> EventSourcedRepository.<Integer>builder().eventStore(eventStore).build());
  }

  @Test
  void definitionRejectsDuplicateAndMissingReducers() {
    assertThrows(ConfigurationException.class, () -> AggregateDefinition.<Integer>builder("Counter", () -> 0)
        .on("A", (s, e) -> s)
        .on("A", (s, e) -> s));
    assertThrows(ConfigurationException.class, () -> AggregateDefinition.<Integer>builder("Counter", () -> 0).build());
  }

  @Test
  void everyNEventsTriggersOnBoundaryCrossing() {
    SnapshotPolicy policy = SnapshotPolicy.everyNEvents(5);

    assertFalse(policy.shouldSnapshot(0, 4));
    assertTrue(policy.shouldSnapshot(4, 5));
    assertTrue(policy.shouldSnapshot(3, 12));
    assertFalse(policy.shouldSnapshot(5, 9));
    assertThrows(IllegalArgumentException.class, () -> SnapshotPolicy.everyNEvents(0));
  }
}
