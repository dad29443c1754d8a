package io.eventcore.bus;

/**
 * Delivery tier of a subscription. All handlers of a higher tier complete before any
 * handler of a lower tier starts, for both synchronous and asynchronous publishes.
 */
public enum Priority {
  HIGH,
  NORMAL,
  LOW
}
