package io.eventcore.dispatch;

import io.eventcore.Event;
import io.eventcore.bus.Delivery;

/**
 * Observes {@link ProcessingState} transitions reported by an {@link EventDispatcher}.
 *
 * <p>Called on the thread doing the work (the committing thread or a dispatch worker).
 * Exceptions are logged and swallowed.
 */
@FunctionalInterface
public interface DispatchListener {

  void onStateChange(Event event, ProcessingState state);

  /**
   * Called once per subscription that received the event, in delivery order, before the
   * event's own terminal state is reported.
   */
  default void onDelivery(Event event, Delivery delivery) {
  }

  DispatchListener NOOP = (event, state) -> {
  };
}
