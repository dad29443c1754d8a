package io.eventcore.dispatch;

/**
 * Lifecycle of an event as it moves from the store to its handlers.
 *
 * <p>{@code CREATED -> APPENDED -> PUBLISHED -> DELIVERED | FAILED}. An event is
 * {@code FAILED} when at least one handler failed or was cancelled.
 */
public enum ProcessingState {
  CREATED,
  APPENDED,
  PUBLISHED,
  DELIVERED,
  FAILED;

  public boolean isTerminal() {
    return this == DELIVERED || this == FAILED;
  }
}
