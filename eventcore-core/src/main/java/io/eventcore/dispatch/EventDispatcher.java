package io.eventcore.dispatch;

import io.eventcore.Event;
import io.eventcore.bus.Delivery;
import io.eventcore.bus.EventBus;
import io.eventcore.bus.PublishResult;
import io.eventcore.spi.MetricsExporter;
import io.eventcore.store.AppendListener;
import io.eventcore.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes events to an {@link EventBus} once the append that produced them has committed.
 *
 * <p>Install it as the {@link AppendListener} of an event store. Rolled-back appends are never
 * published. In {@link DispatchMode#SYNC} mode (the default) committed events are published on
 * the committing thread, so handlers have run when the append returns. In
 * {@link DispatchMode#ASYNC} mode they are offered to a bounded queue drained by daemon
 * workers; when the queue is full or the dispatcher is closing, the committing thread
 * publishes the event itself.
 *
 * <p>Events from one commit are queued in version order. With a single worker (the default)
 * that order is kept across commits as well.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see DispatchListener
 */
public final class EventDispatcher implements AppendListener, AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final EventBus eventBus;
  private final DispatchMode mode;
  private final MetricsExporter metrics;
  private final DispatchListener listener;
  private final long drainTimeoutMs;
  private final BlockingQueue<Event> queue;
  private final ExecutorService workers;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private EventDispatcher(Builder builder) {
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    this.mode = builder.mode != null ? builder.mode : DispatchMode.SYNC;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.listener = builder.listener != null ? builder.listener : DispatchListener.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }

    if (mode == DispatchMode.ASYNC) {
      this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
      this.workers = Executors.newFixedThreadPool(builder.workerCount,
          new DaemonThreadFactory("eventcore-dispatcher-"));
      for (int i = 0; i < builder.workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      this.queue = null;
      this.workers = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public DispatchMode mode() {
    return mode;
  }

  /**
   * Returns the number of committed events waiting for a worker; always {@code 0} in
   * {@link DispatchMode#SYNC} mode.
   */
  public int queueDepth() {
    return queue == null ? 0 : queue.size();
  }

  @Override
  public void afterCommit(List<Event> events) {
    for (Event event : events) {
      notifyListener(event, ProcessingState.APPENDED);
      if (mode == DispatchMode.SYNC || !enqueue(event)) {
        if (mode == DispatchMode.ASYNC) {
          metrics.incrementDispatchCallerRuns();
          logger.fine(() -> "Dispatch queue full or closed; publishing on caller thread: "
              + event.eventId());
        }
        publish(event);
      }
    }
  }

  @Override
  public void afterRollback(List<Event> events) {
    logger.fine(() -> "Append rolled back; not publishing " + events.size() + " event(s)");
  }

  private boolean enqueue(Event event) {
    if (!accepting.get()) return false;
    boolean enqueued = queue.offer(event);
    metrics.recordDispatchQueueDepth(queue.size());
    return enqueued;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        Event event = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (event == null) {
          if (!running.get()) break;
          continue;
        }
        publish(event);
        metrics.recordDispatchQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatcher loop error", t);
      }
    }
  }

  private void publish(Event event) {
    PublishResult result = eventBus.publish(event);
    notifyListener(event, ProcessingState.PUBLISHED);
    for (Delivery delivery : result.deliveries()) {
      notifyDelivery(event, delivery);
    }
    if (result.succeeded()) {
      notifyListener(event, ProcessingState.DELIVERED);
    } else {
      logger.warning("Event " + event.eventId() + " failed in " + result.failures().size()
          + " of " + result.deliveries().size() + " handler(s)");
      notifyListener(event, ProcessingState.FAILED);
    }
  }

  private void notifyListener(Event event, ProcessingState state) {
    try {
      listener.onStateChange(event, state);
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "DispatchListener failed for " + state + " of eventId="
          + event.eventId(), ex);
    }
  }

  private void notifyDelivery(Event event, Delivery delivery) {
    try {
      listener.onDelivery(event, delivery);
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "DispatchListener failed for " + delivery.status()
          + " delivery to subscription " + delivery.subscription().id() + " of eventId="
          + event.eventId(), ex);
    }
  }

  /**
   * Initiates graceful shutdown: stops accepting new events, drains remaining queued
   * events within the configured drain timeout, then shuts down worker threads.
   * Events committed after close are published on the committing thread.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    if (workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Queue remaining: " + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private EventBus eventBus;
    private DispatchMode mode;
    private int workerCount = 1;
    private int queueCapacity = 1000;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;
    private DispatchListener listener;

    private Builder() {}

    /**
     * Sets the bus committed events are published to.
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
     * Sets whether committed events are published inline or by background workers.
     *
     * <p>Optional. Defaults to {@link DispatchMode#SYNC}.
     *
     * @param mode the dispatch mode
     * @return this builder
     */
    public Builder mode(DispatchMode mode) {
      this.mode = mode;
      return this;
    }

    /**
     * Sets the number of worker threads in {@link DispatchMode#ASYNC} mode.
     *
     * <p>Optional. Defaults to {@code 1}. Must be &ge; 1. More than one worker gives up
     * publish order across events.
     *
     * @param workerCount number of dispatch worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of the dispatch queue in {@link DispatchMode#ASYNC} mode.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued events
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for queued events during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the metrics exporter for queue depth and caller-runs fallbacks.
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
     * Sets the observer of {@link ProcessingState} transitions.
     *
     * <p>Optional. Defaults to {@link DispatchListener#NOOP}.
     *
     * @param listener the dispatch listener
     * @return this builder
     */
    public Builder listener(DispatchListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Builds the dispatcher. In {@link DispatchMode#ASYNC} mode worker threads start
     * immediately.
     *
     * @return a new {@link EventDispatcher}
     * @throws NullPointerException if {@code eventBus} is null
     * @throws IllegalArgumentException if {@code workerCount < 1}, {@code queueCapacity <= 0}
     *     or {@code drainTimeoutMs < 0}
     */
    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
