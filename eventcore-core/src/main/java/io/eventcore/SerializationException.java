package io.eventcore;

/**
 * Thrown when a payload, metadata map or aggregate state cannot be encoded or decoded.
 */
public final class SerializationException extends EventCoreException {

  public SerializationException(String message) {
    super(message);
  }

  public SerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
