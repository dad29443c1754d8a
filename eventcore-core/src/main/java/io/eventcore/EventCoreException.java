package io.eventcore;

/**
 * Base class of all failures raised by eventcore components.
 *
 * <p>All subclasses are unchecked. Callers that need to react to a specific failure
 * (for example retrying a command after a {@link ConcurrencyException}) catch the subclass.
 */
public class EventCoreException extends RuntimeException {

    public EventCoreException(String message) {
        super(message);
    }

    public EventCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
