package io.eventcore.dispatch;

import io.eventcore.ConfigurationException;
import io.eventcore.Event;
import io.eventcore.EventHandler;
import io.eventcore.bus.EventBus;
import io.eventcore.bus.Subscription;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns a set of named subscriptions and their lifecycle on an {@link EventBus}.
 *
 * <p>Subscriptions are registered as {@link SubscriptionSpec}s and bound to the bus while the
 * manager is started and the spec is active. Each managed handler is wrapped to collect
 * {@link SubscriptionStats}; statistics survive deactivation and are dropped on
 * {@link #remove(String)}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #start()}: binds every active subscription</li>
 *   <li>{@link #stop()}: drains the dispatcher, waits up to the stop timeout for in-flight
 *       asynchronous publishes, unbinds every subscription and closes the bus</li>
 * </ol>
 * A stopped manager cannot be started again. {@link #update(SubscriptionSpec)} may be called
 * while started and rebinds the subscription in place.
 *
 * <p>The manager also keeps a catalog of known event types ({@link EventTypeInfo}).
 * Registering a subscription to a type catalogued as deprecated logs a warning.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionManager manager = SubscriptionManager.builder()
 *     .eventBus(bus)
 *     .dispatcher(dispatcher)
 *     .build();
 * manager.register(SubscriptionSpec.builder("order-projection")
 *     .eventType("OrderPlaced")
 *     .handler(projection::apply)
 *     .build());
 * manager.start();
 * }</pre>
 */
public final class SubscriptionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SubscriptionManager.class.getName());

  private enum State { NEW, STARTED, STOPPED }

  private final EventBus eventBus;
  private final EventDispatcher dispatcher;
  private final Duration stopTimeout;
  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private final Map<String, EventTypeInfo> eventTypes = new LinkedHashMap<>();
  private State state = State.NEW;

  private SubscriptionManager(Builder builder) {
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    this.dispatcher = builder.dispatcher;
    this.stopTimeout = Objects.requireNonNull(builder.stopTimeout, "stopTimeout");
    if (stopTimeout.isNegative()) {
      throw new IllegalArgumentException("stopTimeout must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a subscription. If the manager is started and the spec is active, the
   * subscription is bound to the bus immediately.
   *
   * @param spec the subscription
   * @return this manager for chaining
   * @throws ConfigurationException if the name is taken or the bus rejects the subscription
   */
  public synchronized SubscriptionManager register(SubscriptionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    if (entries.containsKey(spec.name())) {
      throw new ConfigurationException("Subscription already registered: " + spec.name());
    }
    warnIfDeprecated(spec);
    Entry entry = new Entry(spec);
    if (state == State.STARTED && spec.isActive()) {
      bind(entry);
    }
    entries.put(spec.name(), entry);
    logger.fine(() -> "Registered " + spec);
    return this;
  }

  /**
   * Replaces the spec of a registered subscription, keeping its statistics. If the manager is
   * started the old binding is removed and the new spec is bound when active. If the bus
   * rejects the new spec the old one stays in place.
   *
   * @param spec the new spec; its name selects the subscription
   * @return the spec it replaced
   * @throws IllegalArgumentException if no subscription has this name
   * @throws ConfigurationException if the bus rejects the new spec
   */
  public synchronized SubscriptionSpec update(SubscriptionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    Entry entry = require(spec.name());
    SubscriptionSpec previous = entry.spec;
    boolean wasBound = entry.binding != null;
    unbind(entry);
    entry.use(spec);
    if (state == State.STARTED && spec.isActive()) {
      try {
        bind(entry);
      } catch (RuntimeException e) {
        entry.use(previous);
        if (wasBound) {
          bind(entry);
        }
        throw e;
      }
    }
    warnIfDeprecated(spec);
    logger.fine(() -> "Updated " + previous + " to " + spec);
    return previous;
  }

  /**
   * Marks a subscription active, binding it to the bus if the manager is started.
   *
   * @return {@code false} if it was already active
   * @throws IllegalArgumentException if no subscription has this name
   */
  public synchronized boolean activate(String name) {
    Entry entry = require(name);
    if (entry.spec.isActive()) {
      return false;
    }
    if (state == State.STARTED) {
      bind(entry);
    }
    entry.spec = entry.spec.withActive(true);
    return true;
  }

  /**
   * Marks a subscription inactive and unbinds it from the bus.
   *
   * @return {@code false} if it was already inactive
   * @throws IllegalArgumentException if no subscription has this name
   */
  public synchronized boolean deactivate(String name) {
    Entry entry = require(name);
    if (!entry.spec.isActive()) {
      return false;
    }
    unbind(entry);
    entry.spec = entry.spec.withActive(false);
    return true;
  }

  /**
   * Unbinds and forgets a subscription, including its statistics.
   *
   * @return {@code false} if no subscription has this name
   */
  public synchronized boolean remove(String name) {
    Entry entry = entries.remove(name);
    if (entry == null) {
      return false;
    }
    unbind(entry);
    return true;
  }

  /**
   * Returns the registered subscriptions in registration order, with their current
   * active flag.
   */
  public synchronized List<SubscriptionSpec> subscriptions() {
    List<SubscriptionSpec> specs = new ArrayList<>(entries.size());
    for (Entry entry : entries.values()) {
      specs.add(entry.spec);
    }
    return List.copyOf(specs);
  }

  /**
   * Adds an event type to the catalog, replacing any entry with the same name.
   *
   * @return the entry it replaced, if any
   */
  public synchronized Optional<EventTypeInfo> registerEventType(EventTypeInfo info) {
    Objects.requireNonNull(info, "info");
    EventTypeInfo previous = eventTypes.put(info.name(), info);
    logger.fine(() -> "Registered event type " + info.name()
        + (info.domain() != null ? " in domain " + info.domain() : ""));
    return Optional.ofNullable(previous);
  }

  /**
   * Returns the catalogued event types in registration order.
   */
  public synchronized List<EventTypeInfo> eventTypes() {
    return List.copyOf(eventTypes.values());
  }

  public synchronized Optional<EventTypeInfo> eventType(String name) {
    return Optional.ofNullable(eventTypes.get(name));
  }

  public synchronized boolean isBound(String name) {
    Entry entry = entries.get(name);
    return entry != null && entry.binding != null;
  }

  public synchronized Optional<SubscriptionStats> stats(String name) {
    Entry entry = entries.get(name);
    return entry == null ? Optional.empty() : Optional.of(entry.stats.snapshot(name));
  }

  /**
   * Returns totals across all registered subscriptions together with each one's statistics.
   */
  public synchronized SubscriptionMetrics metricsSnapshot() {
    Map<String, SubscriptionStats> bySubscription = new LinkedHashMap<>();
    int active = 0;
    long invocations = 0;
    long successes = 0;
    long failures = 0;
    for (Entry entry : entries.values()) {
      SubscriptionStats stats = entry.stats.snapshot(entry.spec.name());
      bySubscription.put(entry.spec.name(), stats);
      if (entry.spec.isActive()) active++;
      invocations += stats.invocations();
      successes += stats.successes();
      failures += stats.failures();
    }
    return new SubscriptionMetrics(entries.size(), active, invocations, successes, failures,
        bySubscription);
  }

  public synchronized boolean isStarted() {
    return state == State.STARTED;
  }

  /**
   * Binds every active subscription to the bus. Calling it again while started does nothing.
   *
   * @throws IllegalStateException if the manager was stopped
   */
  public synchronized void start() {
    if (state == State.STOPPED) {
      throw new IllegalStateException("SubscriptionManager is stopped");
    }
    if (state == State.STARTED) {
      return;
    }
    List<Entry> bound = new ArrayList<>();
    try {
      for (Entry entry : entries.values()) {
        if (entry.spec.isActive()) {
          bind(entry);
          bound.add(entry);
        }
      }
    } catch (RuntimeException e) {
      bound.forEach(this::unbind);
      throw e;
    }
    state = State.STARTED;
    logger.info("SubscriptionManager started with " + bound.size() + " active subscription(s)");
  }

  /**
   * Drains the dispatcher, waits up to the stop timeout for in-flight asynchronous
   * publishes, unbinds all subscriptions and closes the bus. Idempotent.
   *
   * <p>The manager's lock is not held while waiting, so handlers still running may call
   * back into the manager.
   */
  public void stop() {
    synchronized (this) {
      if (state == State.STOPPED) {
        return;
      }
      state = State.STOPPED;
    }
    if (dispatcher != null) {
      runSafely("dispatcher close", dispatcher::close);
    }
    int cancelled = eventBus.awaitInFlight(stopTimeout);
    synchronized (this) {
      for (Entry entry : entries.values()) {
        unbind(entry);
      }
    }
    runSafely("bus close", eventBus::close);
    logger.info("SubscriptionManager stopped"
        + (cancelled > 0 ? "; cancelled " + cancelled + " in-flight publish(es)" : ""));
  }

  @Override
  public void close() {
    stop();
  }

  private Entry require(String name) {
    Entry entry = entries.get(name);
    if (entry == null) {
      throw new IllegalArgumentException("Unknown subscription: " + name);
    }
    return entry;
  }

  private void warnIfDeprecated(SubscriptionSpec spec) {
    EventTypeInfo info = eventTypes.get(spec.eventType());
    if (info != null && info.deprecated()) {
      logger.warning("Subscription " + spec.name() + " listens to deprecated event type "
          + spec.eventType());
    }
  }

  private void bind(Entry entry) {
    SubscriptionSpec spec = entry.spec;
    entry.binding = eventBus.subscribe(spec.eventType(), entry.handler, spec.priority(),
        spec.topicPattern());
  }

  private void unbind(Entry entry) {
    if (entry.binding != null) {
      eventBus.unsubscribe(entry.binding);
      entry.binding = null;
    }
  }

  private static void runSafely(String phase, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "SubscriptionManager " + phase + " failed", ex);
    }
  }

  private static final class Entry {
    private final StatsRecorder stats = new StatsRecorder();
    private EventHandler handler;
    private SubscriptionSpec spec;
    private Subscription binding;

    private Entry(SubscriptionSpec spec) {
      use(spec);
    }

    private void use(SubscriptionSpec spec) {
      this.spec = spec;
      EventHandler delegate = spec.handler();
      this.handler = event -> invoke(delegate, event);
    }

    private void invoke(EventHandler delegate, Event event) throws Exception {
      stats.started(Instant.now());
      long start = System.nanoTime();
      boolean success = false;
      try {
        delegate.handle(event);
        success = true;
      } finally {
        stats.finished(Math.max(0L, System.nanoTime() - start), success);
      }
    }
  }

  /** Builder for {@link SubscriptionManager}. */
  public static final class Builder {
    private EventBus eventBus;
    private EventDispatcher dispatcher;
    private Duration stopTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * Sets the bus subscriptions are bound to.
     *
     * <p><b>Required.</b>
     *
     * @param eventBus the event bus
     * @return this builder
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the dispatcher drained on {@link SubscriptionManager#stop()}.
     *
     * <p>Optional.
     *
     * @param dispatcher the dispatcher feeding the bus
     * @return this builder
     */
    public Builder dispatcher(EventDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Sets how long {@link SubscriptionManager#stop()} waits for in-flight asynchronous
     * publishes before cancelling them.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param stopTimeout the stop timeout
     * @return this builder
     */
    public Builder stopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
      return this;
    }

    public SubscriptionManager build() {
      return new SubscriptionManager(this);
    }
  }
}
