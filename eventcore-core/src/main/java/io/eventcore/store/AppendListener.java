package io.eventcore.store;

import io.eventcore.Event;

import java.util.List;

/**
 * Lifecycle hook for {@link EventStore} appends.
 *
 * <p>Use {@link io.eventcore.dispatch.EventDispatcher} to publish committed events to an
 * {@link io.eventcore.bus.EventBus}. The {@link #NOOP} instance does nothing.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Store checks the expected version and inserts events</li>
 *   <li>{@link #afterAppend}: observational, exceptions swallowed</li>
 *   <li>Transaction commits or rolls back</li>
 *   <li>{@link #afterCommit} or {@link #afterRollback}: exceptions swallowed</li>
 * </ol>
 *
 * <p>Events passed to every callback carry their store-assigned versions.
 */
public interface AppendListener {

    /**
     * Called after events are inserted but before the enclosing transaction commits.
     * Exceptions are swallowed and logged.
     *
     * @param events the events that were inserted
     */
    default void afterAppend(List<Event> events) {
    }

    /**
     * Called after the enclosing transaction commits successfully.
     * Exceptions are swallowed and logged.
     *
     * @param events the events that were committed
     */
    default void afterCommit(List<Event> events) {
    }

    /**
     * Called after the enclosing transaction rolls back.
     * Exceptions are swallowed and logged.
     *
     * @param events the events that were rolled back
     */
    default void afterRollback(List<Event> events) {
    }

    /**
     * No-op listener.
     */
    AppendListener NOOP = new AppendListener() {
    };
}
