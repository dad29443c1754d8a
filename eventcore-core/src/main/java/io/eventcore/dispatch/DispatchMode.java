package io.eventcore.dispatch;

/**
 * How an {@link EventDispatcher} publishes committed events.
 */
public enum DispatchMode {
  /** Publish on the committing thread before the append call returns. */
  SYNC,
  /** Enqueue for publication by background workers. */
  ASYNC
}
