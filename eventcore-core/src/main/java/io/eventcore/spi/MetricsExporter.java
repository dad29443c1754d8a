package io.eventcore.spi;

/**
 * Observability hook for exporting eventcore counters, gauges and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events published on the bus (sync or async).
     */
    void incrementPublished();

    /**
     * Increments the count of handler invocations that completed successfully.
     */
    void incrementDelivered();

    /**
     * Increments the count of handler invocations that failed or were cancelled.
     */
    void incrementHandlerFailed();

    /**
     * Records the time spent executing a single handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Increments the count of events appended to an event store.
     *
     * @param count number of events appended in one atomic batch
     */
    void incrementAppended(int count);

    /**
     * Increments the count of appends rejected with a concurrency conflict.
     */
    void incrementConcurrencyConflicts();

    /**
     * Records the current depth of the dispatcher's asynchronous queue.
     *
     * @param depth number of committed events waiting to be published
     */
    default void recordDispatchQueueDepth(int depth) {
    }

    /**
     * Increments the count of committed events published on the committing thread
     * because the asynchronous dispatch queue was full or closed.
     */
    default void incrementDispatchCallerRuns() {
    }

    /**
     * Increments the count of snapshots written.
     */
    default void incrementSnapshotsSaved() {
    }

    /**
     * Records how many events were replayed to rebuild one aggregate.
     *
     * @param count replayed events (may be zero when a snapshot is current)
     */
    default void recordReplayedEvents(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementHandlerFailed() {
        }

        @Override
        public void incrementAppended(int count) {
        }

        @Override
        public void incrementConcurrencyConflicts() {
        }
    }
}
