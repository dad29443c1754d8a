package io.eventcore.repository;

import io.eventcore.Event;

/**
 * Pure state transition for one event type: given the current state and an event,
 * returns the next state. Must not perform I/O or depend on anything but its arguments,
 * so that replaying the same stream always yields the same state.
 *
 * @param <S> the aggregate state type
 */
@FunctionalInterface
public interface Reducer<S> {

  S apply(S state, Event event);
}
