package io.eventcore;

/**
 * Represents an event type identifier.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum AccountEvents implements EventType {
 *   ACCOUNT_OPENED,
 *   FUNDS_DEPOSITED,
 *   ACCOUNT_CLOSED
 * }
 * }</pre>
 *
 * <p>Names known only at runtime use {@link #of(String)}:
 * <pre>{@code
 * EventType type = EventType.of("FundsDeposited");
 * }</pre>
 *
 * <p>Routing compares names only, so an enum constant and {@code EventType.of} with the same
 * name address the same subscribers and reducers.
 */
public interface EventType {

    /**
     * Returns the string representation of this event type.
     * This value is persisted with every event and used for routing and replay.
     *
     * @return the event type name, never null
     */
    String name();

    /**
     * @throws NullPointerException if {@code name} is null
     * @throws IllegalArgumentException if {@code name} is empty
     */
    static EventType of(String name) {
        return StringEventType.of(name);
    }
}
