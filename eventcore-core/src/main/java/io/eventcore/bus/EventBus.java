package io.eventcore.bus;

import io.eventcore.ConfigurationException;
import io.eventcore.Event;
import io.eventcore.EventHandler;
import io.eventcore.EventType;
import io.eventcore.HandlerExecutionException;
import io.eventcore.spi.MetricsExporter;
import io.eventcore.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe hub with priority tiers and topic filtering.
 *
 * <p>Handlers subscribe to an event type, optionally narrowed by a {@link TopicPattern}.
 * A publish delivers the event to every matching subscription in {@link Priority} order
 * ({@code HIGH}, then {@code NORMAL}, then {@code LOW}), and in registration order within
 * a tier. A failing handler never prevents delivery to the others; its failure is captured
 * in the returned {@link PublishResult}.
 *
 * <h2>Synchronous and asynchronous publish</h2>
 * <p>{@link #publish(Event)} runs every handler on the calling thread and returns when all
 * have finished. {@link #publishAsync(Event, int, Duration)} returns immediately; tiers still
 * run one after another, but handlers inside a tier run concurrently on the handler executor,
 * at most {@code maxConcurrency} at a time. When the timeout elapses, running handlers are
 * interrupted, remaining handlers never start, and all of them are reported as
 * {@link DeliveryStatus#FAILED}.
 *
 * <h2>Registry</h2>
 * <p>The subscription list is an immutable snapshot replaced atomically on every change.
 * A publish works on the snapshot taken when it starts, so subscribing or unsubscribing
 * concurrently with a publish never exposes a partially updated registry.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}; closing waits for in-flight asynchronous publishes up to the
 * configured close timeout, then cancels the rest.
 *
 * @see Subscription
 * @see PublishResult
 */
public final class EventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventBus.class.getName());

  private final AtomicReference<List<Subscription>> subscriptions = new AtomicReference<>(List.of());
  private final Object registrationLock = new Object();
  private final AtomicLong sequence = new AtomicLong();
  private final Map<Future<?>, AsyncPublish> inFlight = new ConcurrentHashMap<>();
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final ExecutorService handlerExecutor;
  private final boolean ownsHandlerExecutor;
  private final ExecutorService coordinators;
  private final int defaultMaxConcurrency;
  private final Duration defaultTimeout;
  private final MetricsExporter metrics;
  private final long closeTimeoutMs;

  private EventBus(Builder builder) {
    if (builder.defaultMaxConcurrency < 1) {
      throw new IllegalArgumentException("defaultMaxConcurrency must be >= 1");
    }
    Objects.requireNonNull(builder.defaultTimeout, "defaultTimeout");
    if (builder.defaultTimeout.isZero() || builder.defaultTimeout.isNegative()) {
      throw new IllegalArgumentException("defaultTimeout must be positive");
    }
    if (builder.closeTimeoutMs < 0) {
      throw new IllegalArgumentException("closeTimeoutMs must be >= 0");
    }
    this.defaultMaxConcurrency = builder.defaultMaxConcurrency;
    this.defaultTimeout = builder.defaultTimeout;
    this.closeTimeoutMs = builder.closeTimeoutMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.handlerExecutor != null) {
      this.handlerExecutor = builder.handlerExecutor;
      this.ownsHandlerExecutor = false;
    } else {
      this.handlerExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("eventcore-bus-"));
      this.ownsHandlerExecutor = true;
    }
    // Coordinators block on handler futures, so they never share the handler pool
    this.coordinators = Executors.newCachedThreadPool(new DaemonThreadFactory("eventcore-publish-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Registration ──

  /**
   * Subscribes a handler at {@link Priority#NORMAL} without topic filtering.
   *
   * @param eventType the event type to receive
   * @param handler   the handler
   * @return the subscription handle
   * @throws ConfigurationException if the arguments are invalid or conflict with existing subscriptions
   */
  public Subscription subscribe(String eventType, EventHandler handler) {
    return register(eventType, handler, Priority.NORMAL, null, false);
  }

  public Subscription subscribe(EventType eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    return register(eventType.name(), handler, Priority.NORMAL, null, false);
  }

  public Subscription subscribe(String eventType, EventHandler handler, Priority priority) {
    return register(eventType, handler, priority, null, false);
  }

  /**
   * Subscribes a handler to events of one type whose topic matches a pattern.
   *
   * @param eventType    the event type to receive
   * @param handler      the handler
   * @param priority     the delivery tier
   * @param topicPattern the topic filter, or {@code null} to accept every topic
   * @return the subscription handle
   * @throws ConfigurationException if the handler is null, the pattern is malformed, the same
   *     handler is already subscribed with the same type and pattern, or the type has an
   *     exclusive subscription
   */
  public Subscription subscribe(String eventType, EventHandler handler, Priority priority, String topicPattern) {
    return register(eventType, handler, priority, topicPattern, false);
  }

  public Subscription subscribeExclusive(String eventType, EventHandler handler) {
    return register(eventType, handler, Priority.NORMAL, null, true);
  }

  /**
   * Subscribes the only handler allowed for an event type.
   *
   * @throws ConfigurationException if any subscription for {@code eventType} already exists,
   *     or if any of the arguments is invalid
   */
  public Subscription subscribeExclusive(String eventType, EventHandler handler, Priority priority,
      String topicPattern) {
    return register(eventType, handler, priority, topicPattern, true);
  }

  private Subscription register(String eventType, EventHandler handler, Priority priority,
      String topicPattern, boolean exclusive) {
    if (eventType == null || eventType.isEmpty()) {
      throw new ConfigurationException("eventType cannot be null or empty");
    }
    if (handler == null) {
      throw new ConfigurationException("handler cannot be null");
    }
    if (priority == null) {
      throw new ConfigurationException("priority cannot be null");
    }
    TopicPattern pattern = topicPattern == null ? null : TopicPattern.compile(topicPattern);

    synchronized (registrationLock) {
      List<Subscription> current = subscriptions.get();
      for (Subscription existing : current) {
        if (!existing.eventType().equals(eventType)) {
          continue;
        }
        if (existing.isExclusive()) {
          throw new ConfigurationException("Event type " + eventType
              + " already has an exclusive subscription: " + existing);
        }
        if (exclusive) {
          throw new ConfigurationException("Cannot subscribe exclusively to " + eventType
              + ": other subscriptions exist");
        }
        if (existing.sameRegistration(eventType, pattern, handler)) {
          throw new ConfigurationException("Handler already subscribed: " + existing);
        }
      }
      Subscription subscription = new Subscription(
          sequence.incrementAndGet(), eventType, pattern, priority, handler, exclusive);
      List<Subscription> next = new ArrayList<>(current.size() + 1);
      next.addAll(current);
      next.add(subscription);
      next.sort(Subscription.DELIVERY_ORDER);
      subscriptions.set(List.copyOf(next));
      logger.fine(() -> "Subscribed " + subscription);
      return subscription;
    }
  }

  /**
   * Removes a subscription. In-progress publishes that already took their snapshot
   * may still deliver to it.
   *
   * @param subscription the handle returned at subscribe time
   * @return {@code true} if it was registered, {@code false} if already removed
   */
  public boolean unsubscribe(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    synchronized (registrationLock) {
      List<Subscription> current = subscriptions.get();
      if (!current.contains(subscription)) {
        return false;
      }
      List<Subscription> next = new ArrayList<>(current);
      next.remove(subscription);
      subscriptions.set(List.copyOf(next));
      logger.fine(() -> "Unsubscribed " + subscription);
      return true;
    }
  }

  /**
   * Returns the current subscriptions in delivery order.
   *
   * @return an immutable snapshot
   */
  public List<Subscription> subscriptions() {
    return subscriptions.get();
  }

  /**
   * Returns the subscriptions that would receive the given event, in delivery order.
   *
   * @param event the event to route
   * @return matching subscriptions (never {@code null})
   */
  public List<Subscription> subscriptionsFor(Event event) {
    Objects.requireNonNull(event, "event");
    List<Subscription> matching = new ArrayList<>();
    for (Subscription subscription : subscriptions.get()) {
      if (subscription.matches(event)) {
        matching.add(subscription);
      }
    }
    return matching;
  }

  // ── Publishing ──

  /**
   * Delivers an event to every matching handler on the calling thread.
   *
   * @param event the event to publish
   * @return per-handler outcomes; handler failures are reported here, never thrown
   */
  public PublishResult publish(Event event) {
    List<Subscription> matching = subscriptionsFor(event);
    List<Delivery> deliveries = new ArrayList<>(matching.size());
    for (Subscription subscription : matching) {
      deliveries.add(invoke(subscription, event));
    }
    return complete(event, deliveries);
  }

  /**
   * Publishes events one after another, each synchronously.
   *
   * @param events the events in publish order
   * @return one result per event, in the same order
   */
  public List<PublishResult> publishAll(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<PublishResult> results = new ArrayList<>(events.size());
    for (Event event : events) {
      results.add(publish(event));
    }
    return results;
  }

  /**
   * Publishes asynchronously with the configured default concurrency and timeout.
   *
   * @param event the event to publish
   * @return a future completed with per-handler outcomes
   */
  public CompletableFuture<PublishResult> publishAsync(Event event) {
    return publishAsync(event, defaultMaxConcurrency, defaultTimeout);
  }

  /**
   * Publishes asynchronously. Tiers run strictly in order; within a tier at most
   * {@code maxConcurrency} handlers run at once.
   *
   * <p>The returned future always completes normally once the publish has finished or
   * timed out, unless the bus is closed, in which case it completes exceptionally with
   * {@link IllegalStateException}.
   *
   * @param event          the event to publish
   * @param maxConcurrency maximum handlers running at once (must be &ge; 1)
   * @param timeout        overall budget for the whole publish (must be positive)
   * @return a future completed with per-handler outcomes
   */
  public CompletableFuture<PublishResult> publishAsync(Event event, int maxConcurrency, Duration timeout) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(timeout, "timeout");
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (!accepting.get()) {
      return CompletableFuture.failedFuture(new IllegalStateException("EventBus is closed"));
    }
    AsyncPublish publish = new AsyncPublish(event, subscriptionsFor(event), maxConcurrency, timeout);
    try {
      Future<?> task = coordinators.submit(publish);
      inFlight.put(task, publish);
      publish.result.whenComplete((r, e) -> inFlight.remove(task));
    } catch (RejectedExecutionException e) {
      publish.result.completeExceptionally(new IllegalStateException("EventBus is closed", e));
    }
    return publish.result;
  }

  private Delivery invoke(Subscription subscription, Event event) {
    long start = System.nanoTime();
    try {
      subscription.handler().handle(event);
      return Delivery.delivered(subscription, elapsedSince(start));
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      logger.log(Level.WARNING, "Handler failed for eventId=" + event.eventId() + ", " + subscription, e);
      return Delivery.failed(subscription, elapsedSince(start), new HandlerExecutionException(
          subscription.id(), event.eventId(), "Handler failed: " + e, e));
    }
  }

  private PublishResult complete(Event event, List<Delivery> deliveries) {
    metrics.incrementPublished();
    for (Delivery delivery : deliveries) {
      if (delivery.succeeded()) {
        metrics.incrementDelivered();
      } else {
        metrics.incrementHandlerFailed();
      }
      metrics.recordHandlerDurationMs(delivery.duration().toMillis());
    }
    return new PublishResult(event, deliveries);
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
  }

  // ── Lifecycle ──

  /**
   * Waits for in-flight asynchronous publishes, cancelling whatever is still running
   * when the timeout elapses. Cancelled publishes complete with their unfinished handlers
   * reported as failed.
   *
   * @param timeout how long to wait
   * @return the number of publishes that had to be cancelled
   */
  public int awaitInFlight(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    long deadline = System.nanoTime() + timeout.toNanos();
    for (Future<?> task : List.copyOf(inFlight.keySet())) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        break;
      }
      try {
        task.get(remaining, TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        break;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (ExecutionException | CancellationException e) {
        logger.log(Level.FINE, "Async publish ended abnormally", e);
      }
    }
    int cancelled = 0;
    for (Map.Entry<Future<?>, AsyncPublish> entry : List.copyOf(inFlight.entrySet())) {
      if (entry.getKey().isDone()) {
        continue;
      }
      entry.getKey().cancel(true);
      entry.getValue().abandon(new CancellationException("EventBus shutting down"));
      cancelled++;
    }
    if (cancelled > 0) {
      logger.warning("Cancelled " + cancelled + " in-flight async publish(es)");
    }
    return cancelled;
  }

  /**
   * Stops accepting asynchronous publishes, waits up to the close timeout for in-flight
   * ones, cancels the remainder and shuts down the bus-owned executors. Synchronous
   * {@link #publish(Event)} keeps working after close.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    awaitInFlight(Duration.ofMillis(closeTimeoutMs));
    shutdown(coordinators, "coordinator");
    if (ownsHandlerExecutor) {
      shutdown(handlerExecutor, "handler");
    }
  }

  private static void shutdown(ExecutorService executor, String name) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
        logger.warning("EventBus " + name + " pool did not terminate; forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * One asynchronous publish. Runs on a coordinator thread and fans handlers out to the
   * handler executor, tier by tier.
   */
  private final class AsyncPublish implements Runnable {
    private final Event event;
    private final List<Subscription> matching;
    private final Semaphore permits;
    private final Duration timeout;
    private final CompletableFuture<PublishResult> result = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final Delivery[] deliveries;

    private AsyncPublish(Event event, List<Subscription> matching, int maxConcurrency, Duration timeout) {
      this.event = event;
      this.matching = matching;
      this.permits = new Semaphore(maxConcurrency);
      this.timeout = timeout;
      this.deliveries = new Delivery[matching.size()];
    }

    @Override
    public void run() {
      if (!started.compareAndSet(false, true)) {
        return;
      }
      try {
        long deadline = System.nanoTime() + timeout.toNanos();
        Throwable abort = null;
        int index = 0;
        while (index < matching.size()) {
          Priority tier = matching.get(index).priority();
          int end = index;
          while (end < matching.size() && matching.get(end).priority() == tier) {
            end++;
          }
          if (abort == null) {
            abort = runTier(index, end, deadline);
          } else {
            failRange(index, end, "not started", abort);
          }
          index = end;
        }
        result.complete(complete(event, Arrays.asList(deliveries)));
      } catch (RuntimeException | Error e) {
        logger.log(Level.SEVERE, "Async publish failed for eventId=" + event.eventId(), e);
        result.completeExceptionally(e);
      }
    }

    /** Runs one tier; returns the abort cause if the publish timed out or was interrupted. */
    private Throwable runTier(int start, int end, long deadline) {
      List<Future<Delivery>> futures = new ArrayList<>(end - start);
      Throwable abort = null;
      for (int i = start; i < end; i++) {
        Subscription subscription = matching.get(i);
        try {
          long remaining = deadline - System.nanoTime();
          if (remaining <= 0 || !permits.tryAcquire(remaining, TimeUnit.NANOSECONDS)) {
            abort = timeoutCause();
            break;
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          abort = e;
          break;
        }
        try {
          futures.add(handlerExecutor.submit(() -> {
            try {
              return invoke(subscription, event);
            } finally {
              permits.release();
            }
          }));
        } catch (RejectedExecutionException e) {
          permits.release();
          abort = e;
          break;
        }
      }

      for (int j = 0; j < futures.size(); j++) {
        Future<Delivery> future = futures.get(j);
        Subscription subscription = matching.get(start + j);
        if (abort == null) {
          try {
            deliveries[start + j] = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            continue;
          } catch (TimeoutException e) {
            abort = timeoutCause();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort = e;
          } catch (ExecutionException e) {
            deliveries[start + j] = Delivery.failed(subscription, Duration.ZERO, new HandlerExecutionException(
                subscription.id(), event.eventId(), "Handler failed: " + e.getCause(), e.getCause()));
            continue;
          }
        }
        deliveries[start + j] = cancel(future, subscription, abort);
      }
      failRange(start + futures.size(), end, "not started", abort);
      return abort;
    }

    private Delivery cancel(Future<Delivery> future, Subscription subscription, Throwable cause) {
      if (future.isDone() && !future.isCancelled()) {
        try {
          return future.get();
        } catch (InterruptedException | ExecutionException e) {
          logger.log(Level.FINE, "Completed handler future could not be read", e);
        }
      }
      future.cancel(true);
      logger.warning("Handler cancelled for eventId=" + event.eventId() + ", " + subscription + ": " + cause);
      return Delivery.failed(subscription, Duration.ZERO, new HandlerExecutionException(
          subscription.id(), event.eventId(), "Handler cancelled: " + cause.getMessage(), cause));
    }

    private void failRange(int start, int end, String reason, Throwable cause) {
      for (int i = start; i < end; i++) {
        Subscription subscription = matching.get(i);
        deliveries[i] = Delivery.failed(subscription, Duration.ZERO, new HandlerExecutionException(
            subscription.id(), event.eventId(), "Handler " + reason + ": " + cause.getMessage(), cause));
      }
    }

    private TimeoutException timeoutCause() {
      return new TimeoutException("Publish of eventId=" + event.eventId() + " exceeded " + timeout);
    }

    void abandon(Throwable cause) {
      if (started.compareAndSet(false, true)) {
        failRange(0, deliveries.length, "not started", cause);
        result.complete(complete(event, Arrays.asList(deliveries)));
      }
    }
  }

  /** Builder for {@link EventBus}. */
  public static final class Builder {
    private ExecutorService handlerExecutor;
    private int defaultMaxConcurrency = 10;
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private long closeTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the executor that runs handlers for asynchronous publishes. A caller-supplied
     * executor is not shut down by {@link EventBus#close()}.
     *
     * <p>Optional. Defaults to a cached pool of daemon threads named {@code eventcore-bus-N}.
     *
     * @param handlerExecutor the handler executor
     * @return this builder
     */
    public Builder handlerExecutor(ExecutorService handlerExecutor) {
      this.handlerExecutor = handlerExecutor;
      return this;
    }

    /**
     * Sets the concurrency limit used by {@link EventBus#publishAsync(Event)}.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param defaultMaxConcurrency maximum concurrent handlers per publish
     * @return this builder
     */
    public Builder defaultMaxConcurrency(int defaultMaxConcurrency) {
      this.defaultMaxConcurrency = defaultMaxConcurrency;
      return this;
    }

    /**
     * Sets the timeout used by {@link EventBus#publishAsync(Event)}.
     *
     * <p>Optional. Defaults to 30 seconds. Must be positive.
     *
     * @param defaultTimeout the per-publish budget
     * @return this builder
     */
    public Builder defaultTimeout(Duration defaultTimeout) {
      this.defaultTimeout = defaultTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter for publish and handler counters.
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
     * Sets how long {@link EventBus#close()} waits for in-flight asynchronous publishes.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param closeTimeoutMs close timeout in milliseconds
     * @return this builder
     */
    public Builder closeTimeoutMs(long closeTimeoutMs) {
      this.closeTimeoutMs = closeTimeoutMs;
      return this;
    }

    /**
     * Builds the bus.
     *
     * @return a new {@link EventBus}
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public EventBus build() {
      return new EventBus(this);
    }
  }
}
