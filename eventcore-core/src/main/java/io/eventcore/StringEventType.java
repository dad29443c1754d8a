package io.eventcore;

import java.util.Objects;

/**
 * {@link EventType} for names only known at runtime, such as types read back from a store
 * or configured per subscription.
 *
 * @param name the event type name, never empty
 */
public record StringEventType(String name) implements EventType {

  public StringEventType {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Event type name cannot be empty");
    }
  }

  public static StringEventType of(String name) {
    return new StringEventType(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
