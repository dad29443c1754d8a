package io.eventcore;

/**
 * Thrown for invalid wiring: a null handler, a malformed topic pattern, a duplicate or
 * conflicting exclusive subscription, or a repository definition that cannot work.
 */
public final class ConfigurationException extends EventCoreException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
