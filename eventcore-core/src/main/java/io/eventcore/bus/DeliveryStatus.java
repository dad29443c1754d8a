package io.eventcore.bus;

/**
 * Outcome of one handler invocation within a publish.
 */
public enum DeliveryStatus {
  /** The handler returned normally. */
  DELIVERED,
  /** The handler threw, was cancelled by the publish timeout, or never started before it. */
  FAILED
}
