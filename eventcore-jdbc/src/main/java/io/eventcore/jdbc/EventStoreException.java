package io.eventcore.jdbc;

import io.eventcore.EventCoreException;

/**
 * Unchecked exception wrapping JDBC errors raised by the JDBC event and snapshot stores
 * that are not connectivity failures or version conflicts.
 *
 * @see io.eventcore.StoreUnavailableException
 * @see io.eventcore.ConcurrencyException
 */
public final class EventStoreException extends EventCoreException {
  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
