package io.eventcore.repository;

import io.eventcore.AggregateNotFoundException;
import io.eventcore.ConcurrencyException;
import io.eventcore.ConfigurationException;
import io.eventcore.Event;
import io.eventcore.ReplayException;
import io.eventcore.snapshot.Snapshot;
import io.eventcore.snapshot.SnapshotStore;
import io.eventcore.spi.MetricsExporter;
import io.eventcore.store.EventStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads aggregates by folding their event stream (optionally starting from a snapshot)
 * and saves them by appending their uncommitted events with optimistic concurrency.
 *
 * <h2>Load</h2>
 * <ol>
 *   <li>Read the stream's current version; an empty stream means the aggregate does not exist</li>
 *   <li>Read the newest snapshot at or below that version, if a snapshot store and serializer
 *       are configured. Snapshots ahead of the stream, left by a save whose events were
 *       rolled back, are deleted and never used.</li>
 *   <li>Read the events after the snapshot version (or the whole stream)</li>
 *   <li>Fold them through the definition's reducers in version order</li>
 * </ol>
 * <p>A snapshot that cannot be read or deserialized is logged and ignored; the aggregate is
 * then rebuilt from the full stream. A reducer failure, a missing reducer, or a version gap
 * fails the load with {@link ReplayException}.
 *
 * <h2>Save</h2>
 * <p>Uncommitted events are appended with the aggregate's
 * {@linkplain Aggregate#committedVersion() committed version} as the expected version.
 * {@link ConcurrencyException} propagates unchanged and leaves the aggregate untouched.
 * After a successful append the {@link SnapshotPolicy} decides whether to snapshot; a failed
 * snapshot write is logged only, since the events are already durable.
 *
 * @param <S> the aggregate state type
 */
public final class EventSourcedRepository<S> {
  private static final Logger logger = Logger.getLogger(EventSourcedRepository.class.getName());

  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final AggregateDefinition<S> definition;
  private final SnapshotPolicy snapshotPolicy;
  private final SnapshotRetention retention;
  private final MetricsExporter metrics;

  private EventSourcedRepository(Builder<S> builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.definition = Objects.requireNonNull(builder.definition, "definition");
    this.snapshotStore = builder.snapshotStore;
    this.snapshotPolicy = builder.snapshotPolicy != null ? builder.snapshotPolicy : SnapshotPolicy.never();
    this.retention = builder.retention != null ? builder.retention : SnapshotRetention.keepAll();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.snapshotPolicy != null && snapshotStore == null) {
      throw new ConfigurationException("snapshotPolicy requires a snapshotStore");
    }
    if (builder.snapshotPolicy != null && definition.serializer() == null) {
      throw new ConfigurationException("snapshotPolicy requires a StateSerializer on aggregate "
          + definition.aggregateType());
    }
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  public AggregateDefinition<S> definition() {
    return definition;
  }

  /**
   * Creates a new, empty aggregate at version 0. Saving it fails with
   * {@link ConcurrencyException} if a stream with this id already exists.
   *
   * @param aggregateId the new aggregate's identifier
   * @return an aggregate in its initial state
   */
  public Aggregate<S> create(String aggregateId) {
    return new Aggregate<>(aggregateId, definition, definition.initialState(), 0L);
  }

  /**
   * Rebuilds an aggregate from its snapshot and stream.
   *
   * @param aggregateId the aggregate identifier
   * @return the aggregate, or empty if its stream has no events
   * @throws ReplayException if the stream cannot be folded
   */
  public Optional<Aggregate<S>> getById(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    long head = eventStore.currentVersion(aggregateId);
    if (head == 0L) {
      return Optional.empty();
    }
    S state = definition.initialState();
    long version = 0L;

    Optional<Snapshot> snapshot = latestSnapshot(aggregateId, head);
    if (snapshot.isPresent()) {
      try {
        state = definition.serializer().deserialize(snapshot.get().state());
        version = snapshot.get().version();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Ignoring unreadable snapshot " + snapshot.get()
            + "; replaying full stream", e);
        state = definition.initialState();
        version = 0L;
      }
    }

    List<Event> events = eventStore.getEvents(aggregateId, version);
    for (Event event : events) {
      if (event.version() != version + 1) {
        throw new ReplayException(aggregateId, event.version(),
            "expected version " + (version + 1) + " in stream");
      }
      Reducer<S> reducer = definition.reducerFor(event.eventType());
      if (reducer == null) {
        throw new ReplayException(aggregateId, event.version(),
            "no reducer for event type " + event.eventType());
      }
      try {
        state = reducer.apply(state, event);
      } catch (RuntimeException e) {
        throw new ReplayException(aggregateId, event.version(),
            "reducer for " + event.eventType() + " failed", e);
      }
      version = event.version();
    }
    metrics.recordReplayedEvents(events.size());
    return Optional.of(new Aggregate<>(aggregateId, definition, state, version));
  }

  /**
   * Rebuilds an aggregate that must exist.
   *
   * @throws AggregateNotFoundException if the aggregate's stream has no events
   * @throws ReplayException if the stream cannot be folded
   */
  public Aggregate<S> load(String aggregateId) {
    return getById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId));
  }

  /**
   * Appends the aggregate's uncommitted events and marks them committed. Does nothing if
   * there are none.
   *
   * @param aggregate the aggregate to save
   * @throws ConcurrencyException if the stream moved past the aggregate's committed version
   */
  public void save(Aggregate<S> aggregate) {
    Objects.requireNonNull(aggregate, "aggregate");
    if (!aggregate.hasUncommittedChanges()) {
      return;
    }
    List<Event> pending = aggregate.uncommittedEvents();
    long previousVersion = aggregate.committedVersion();
    long newVersion;
    try {
      newVersion = eventStore.appendAll(aggregate.id(), List.copyOf(pending), previousVersion);
    } catch (ConcurrencyException e) {
      metrics.incrementConcurrencyConflicts();
      throw e;
    }
    metrics.incrementAppended(pending.size());
    aggregate.markCommitted();

    if (snapshotStore != null && snapshotPolicy.shouldSnapshot(previousVersion, newVersion)) {
      takeSnapshot(aggregate, newVersion);
    }
  }

  private Optional<Snapshot> latestSnapshot(String aggregateId, long streamVersion) {
    if (snapshotStore == null || definition.serializer() == null) {
      return Optional.empty();
    }
    try {
      Optional<Snapshot> latest = snapshotStore.getLatest(aggregateId);
      if (latest.isEmpty() || latest.get().version() <= streamVersion) {
        return latest;
      }
      // the stream may have grown since it was read
      long head = eventStore.currentVersion(aggregateId);
      if (latest.get().version() > head) {
        int dropped = snapshotStore.deleteAfter(aggregateId, head);
        logger.warning("Dropped " + dropped + " snapshot(s) of aggregate " + aggregateId
            + " ahead of stream version " + head);
        latest = snapshotStore.getLatest(aggregateId, head);
      }
      return latest;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Snapshot lookup failed for aggregate " + aggregateId
          + "; replaying full stream", e);
      return Optional.empty();
    }
  }

  private void takeSnapshot(Aggregate<S> aggregate, long version) {
    try {
      String state = definition.serializer().serialize(aggregate.state());
      snapshotStore.save(Snapshot.of(aggregate.id(), aggregate.aggregateType(), version, state));
      metrics.incrementSnapshotsSaved();
      int pruned = retention.apply(snapshotStore, aggregate.id());
      if (pruned > 0) {
        logger.fine(() -> "Pruned " + pruned + " snapshot(s) of aggregate " + aggregate.id());
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Snapshot of aggregate " + aggregate.id() + " at version "
          + version + " failed", e);
    }
  }

  /** Builder for {@link EventSourcedRepository}. */
  public static final class Builder<S> {
    private EventStore eventStore;
    private SnapshotStore snapshotStore;
    private AggregateDefinition<S> definition;
    private SnapshotPolicy snapshotPolicy;
    private SnapshotRetention retention;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the event store holding the aggregate streams.
     *
     * <p><b>Required.</b>
     *
     * @param eventStore the event store
     * @return this builder
     */
    public Builder<S> eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the aggregate definition (reducers, initial state, serializer).
     *
     * <p><b>Required.</b>
     *
     * @param definition the aggregate definition
     * @return this builder
     */
    public Builder<S> definition(AggregateDefinition<S> definition) {
      this.definition = definition;
      return this;
    }

    /**
     * Sets the snapshot store used for loading and, with a policy, for writing snapshots.
     *
     * <p>Optional. Without one the aggregate is always rebuilt from its full stream.
     *
     * @param snapshotStore the snapshot store
     * @return this builder
     */
    public Builder<S> snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /**
     * Sets when snapshots are taken after a save.
     *
     * <p>Optional. Defaults to {@link SnapshotPolicy#never()}. Setting a policy requires a
     * snapshot store and a serializer on the definition.
     *
     * @param snapshotPolicy the snapshot policy
     * @return this builder
     */
    public Builder<S> snapshotPolicy(SnapshotPolicy snapshotPolicy) {
      this.snapshotPolicy = snapshotPolicy;
      return this;
    }

    /**
     * Sets how many snapshots per aggregate survive after a new one is written.
     *
     * <p>Optional. Defaults to {@link SnapshotRetention#keepAll()}.
     *
     * @param retention the retention
     * @return this builder
     */
    public Builder<S> retention(SnapshotRetention retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the metrics exporter for append, conflict, snapshot and replay metrics.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder<S> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException if {@code eventStore} or {@code definition} is null
     * @throws ConfigurationException if a snapshot policy is set without a snapshot store
     *     or without a serializer
     */
    public EventSourcedRepository<S> build() {
      return new EventSourcedRepository<>(this);
    }
  }
}
