package io.eventcore;

/**
 * Captures a failure of a single handler during a publish. Never thrown to the
 * publisher; reported through {@link io.eventcore.bus.PublishResult#failures()}.
 */
public final class HandlerExecutionException extends EventCoreException {

  private final long subscriptionId;
  private final String eventId;

  public HandlerExecutionException(long subscriptionId, String eventId, String message, Throwable cause) {
    super(message, cause);
    this.subscriptionId = subscriptionId;
    this.eventId = eventId;
  }

  public long subscriptionId() {
    return subscriptionId;
  }

  public String eventId() {
    return eventId;
  }
}
