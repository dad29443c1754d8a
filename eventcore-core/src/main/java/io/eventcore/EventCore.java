package io.eventcore;

import io.eventcore.bus.EventBus;
import io.eventcore.bus.EventPublisher;
import io.eventcore.dispatch.DispatchListener;
import io.eventcore.dispatch.DispatchMode;
import io.eventcore.dispatch.EventDispatcher;
import io.eventcore.dispatch.SubscriptionManager;
import io.eventcore.repository.AggregateDefinition;
import io.eventcore.repository.EventSourcedRepository;
import io.eventcore.repository.SnapshotPolicy;
import io.eventcore.repository.SnapshotRetention;
import io.eventcore.snapshot.InMemorySnapshotStore;
import io.eventcore.snapshot.SnapshotStore;
import io.eventcore.spi.MetricsExporter;
import io.eventcore.store.AppendListener;
import io.eventcore.store.EventStore;
import io.eventcore.store.InMemoryEventStore;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Composite entry point that wires an {@link EventBus}, an {@link EventStore}, a
 * {@link SnapshotStore}, an {@link EventDispatcher} and a {@link SubscriptionManager} into a
 * single {@link AutoCloseable} unit.
 *
 * <p>The event store is created through a factory that receives the dispatcher as its
 * {@link AppendListener}, so every committed append is published on the bus.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventCore core = EventCore.builder()
 *     .eventStore(listener -> JdbcEventStore.builder()
 *         .connectionProvider(connectionProvider)
 *         .streamStore(new PostgresEventStreamStore())
 *         .listener(listener)
 *         .build())
 *     .build()) {
 *   core.subscriptions().register(SubscriptionSpec.builder("audit")
 *       .eventType("OrderPlaced").handler(audit::record).build());
 *   core.subscriptions().start();
 *
 *   EventSourcedRepository<Order> orders = core.repository(Order.DEFINITION);
 *   Aggregate<Order> order = orders.create("order-1");
 *   order.raise("OrderPlaced", "{\"total\":42}");
 *   orders.save(order);
 * }
 * }</pre>
 */
public final class EventCore implements AutoCloseable {

  private final EventBus bus;
  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final EventDispatcher dispatcher;
  private final SubscriptionManager subscriptions;
  private final MetricsExporter metrics;

  private EventCore(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.bus = builder.eventBus != null
        ? builder.eventBus
        : EventBus.builder().metrics(metrics).build();
    this.dispatcher = EventDispatcher.builder()
        .eventBus(bus)
        .mode(builder.dispatchMode)
        .metrics(metrics)
        .listener(builder.dispatchListener)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .build();
    Function<AppendListener, EventStore> factory = builder.eventStoreFactory != null
        ? builder.eventStoreFactory : InMemoryEventStore::new;
    this.eventStore = Objects.requireNonNull(factory.apply(dispatcher), "eventStore factory returned null");
    this.snapshotStore = builder.snapshotStore != null ? builder.snapshotStore : new InMemorySnapshotStore();
    this.subscriptions = SubscriptionManager.builder()
        .eventBus(bus)
        .dispatcher(dispatcher)
        .stopTimeout(builder.stopTimeout)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public EventBus bus() {
    return bus;
  }

  public EventStore eventStore() {
    return eventStore;
  }

  public SnapshotStore snapshotStore() {
    return snapshotStore;
  }

  public EventDispatcher dispatcher() {
    return dispatcher;
  }

  public SubscriptionManager subscriptions() {
    return subscriptions;
  }

  /**
   * Returns a new collector publishing straight to the shared bus, bypassing the event store.
   */
  public EventPublisher newPublisher() {
    return new EventPublisher(bus);
  }

  /**
   * Returns a repository over the shared stores that never snapshots.
   *
   * @param definition the aggregate definition
   * @param <S>        the aggregate state type
   * @return a new repository
   */
  public <S> EventSourcedRepository<S> repository(AggregateDefinition<S> definition) {
    return EventSourcedRepository.<S>builder()
        .eventStore(eventStore)
        .snapshotStore(snapshotStore)
        .definition(definition)
        .metrics(metrics)
        .build();
  }

  /**
   * Returns a repository over the shared stores that snapshots according to {@code policy}
   * and keeps every snapshot.
   *
   * @param definition the aggregate definition; must carry a serializer
   * @param policy     when to snapshot
   * @param <S>        the aggregate state type
   * @return a new repository
   * @throws ConfigurationException if the definition has no serializer
   */
  public <S> EventSourcedRepository<S> repository(AggregateDefinition<S> definition, SnapshotPolicy policy) {
    return repository(definition, policy, SnapshotRetention.keepAll());
  }

  public <S> EventSourcedRepository<S> repository(AggregateDefinition<S> definition, SnapshotPolicy policy,
      SnapshotRetention retention) {
    return EventSourcedRepository.<S>builder()
        .eventStore(eventStore)
        .snapshotStore(snapshotStore)
        .definition(definition)
        .snapshotPolicy(policy)
        .retention(retention)
        .metrics(metrics)
        .build();
  }

  /**
   * Stops the subscription manager (which drains the dispatcher and closes the bus), then
   * closes the metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      subscriptions.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new EventCoreException("Failed to close metrics", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link EventCore}. */
  public static final class Builder {
    private EventBus eventBus;
    private Function<AppendListener, EventStore> eventStoreFactory;
    private SnapshotStore snapshotStore;
    private DispatchMode dispatchMode = DispatchMode.SYNC;
    private DispatchListener dispatchListener;
    private long drainTimeoutMs = 5000;
    private Duration stopTimeout = Duration.ofSeconds(5);
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the bus. The composite takes ownership and closes it.
     *
     * <p>Optional. Defaults to a bus with default settings and this builder's metrics.
     *
     * @param eventBus the event bus
     * @return this builder
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the factory creating the event store around the dispatcher's append listener.
     *
     * <p>Optional. Defaults to {@link InMemoryEventStore}.
     *
     * @param eventStoreFactory factory receiving the listener the store must call
     * @return this builder
     */
    public Builder eventStore(Function<AppendListener, EventStore> eventStoreFactory) {
      this.eventStoreFactory = eventStoreFactory;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link InMemorySnapshotStore}.
     */
    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DispatchMode#SYNC}.
     */
    public Builder dispatchMode(DispatchMode dispatchMode) {
      this.dispatchMode = Objects.requireNonNull(dispatchMode, "dispatchMode");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DispatchListener#NOOP}.
     */
    public Builder dispatchListener(DispatchListener dispatchListener) {
      this.dispatchListener = dispatchListener;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder stopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter shared by every component. Closed with the composite when
     * it is {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws IllegalStateException if build() was already called
     */
    public EventCore build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new EventCore(this);
    }
  }
}
