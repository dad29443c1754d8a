package io.eventcore.micrometer;

import io.eventcore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventcore.bus.published}: events published on the bus</li>
 *   <li>{@code eventcore.bus.delivered}: successful handler invocations</li>
 *   <li>{@code eventcore.bus.failed}: failed or cancelled handler invocations</li>
 *   <li>{@code eventcore.store.appended}: events appended to the event store</li>
 *   <li>{@code eventcore.store.conflicts}: appends rejected by optimistic concurrency</li>
 *   <li>{@code eventcore.dispatch.caller.runs}: committed events published on the committing
 *       thread because the dispatch queue was full</li>
 *   <li>{@code eventcore.snapshot.saved}: snapshots written</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventcore.dispatch.queue.depth}: events waiting for a dispatcher worker</li>
 * </ul>
 *
 * <h3>Timers and summaries</h3>
 * <ul>
 *   <li>{@code eventcore.bus.handler.duration}: time spent in one handler</li>
 *   <li>{@code eventcore.replay.events}: events replayed per aggregate load</li>
 * </ul>
 *
 * <p>The prefix is configurable so that several instances can share a registry.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter delivered;
  private final Counter handlerFailed;
  private final Counter appended;
  private final Counter conflicts;
  private final Counter callerRuns;
  private final Counter snapshotsSaved;
  private final Timer handlerDuration;
  private final Gauge queueDepthGauge;
  private final DistributionSummary replayedEvents;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventcore");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventcore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty() || namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must be non-empty and not end with '.': " + namePrefix);
    }
    this.registry = registry;

    this.published = counter(namePrefix + ".bus.published", "Events published on the bus");
    this.delivered = counter(namePrefix + ".bus.delivered", "Successful handler invocations");
    this.handlerFailed = counter(namePrefix + ".bus.failed", "Failed or cancelled handler invocations");
    this.appended = counter(namePrefix + ".store.appended", "Events appended to the event store");
    this.conflicts = counter(namePrefix + ".store.conflicts", "Appends rejected with a concurrency conflict");
    this.callerRuns = counter(namePrefix + ".dispatch.caller.runs",
        "Committed events published on the committing thread");
    this.snapshotsSaved = counter(namePrefix + ".snapshot.saved", "Snapshots written");

    this.handlerDuration = Timer.builder(namePrefix + ".bus.handler.duration")
        .description("Handler execution time")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".dispatch.queue.depth", queueDepth, AtomicInteger::get)
        .description("Events waiting for a dispatcher worker")
        .register(registry);
    this.replayedEvents = DistributionSummary.builder(namePrefix + ".replay.events")
        .description("Events replayed per aggregate load")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementHandlerFailed() {
    if (closed) return;
    handlerFailed.increment();
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementAppended(int count) {
    if (closed) return;
    appended.increment(count);
  }

  @Override
  public void incrementConcurrencyConflicts() {
    if (closed) return;
    conflicts.increment();
  }

  @Override
  public void recordDispatchQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void incrementDispatchCallerRuns() {
    if (closed) return;
    callerRuns.increment();
  }

  @Override
  public void incrementSnapshotsSaved() {
    if (closed) return;
    snapshotsSaved.increment();
  }

  @Override
  public void recordReplayedEvents(int count) {
    if (closed) return;
    replayedEvents.record(count);
  }

  /**
   * Stops recording and removes every meter this exporter registered. Called by
   * {@code EventCore.close()} when the exporter was passed to its builder.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, delivered, handlerFailed, appended, conflicts,
        callerRuns, snapshotsSaved, handlerDuration, queueDepthGauge, replayedEvents)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
