package io.eventcore;

/**
 * Thrown when the backing store cannot be reached (connection refused, lost,
 * or not obtainable from the pool). The operation may be retried.
 */
public final class StoreUnavailableException extends EventCoreException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
