package io.eventcore.dispatch;

import java.util.Objects;

/**
 * Catalog entry describing an event type known to a {@link SubscriptionManager}.
 *
 * @param name        the event type name
 * @param description free-form description, never {@code null}
 * @param domain      owning domain, or {@code null}
 * @param deprecated  whether new subscriptions to this type should be avoided
 */
public record EventTypeInfo(String name, String description, String domain, boolean deprecated) {

  public EventTypeInfo {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    description = description == null ? "" : description;
  }

  public static EventTypeInfo of(String name) {
    return new EventTypeInfo(name, "", null, false);
  }

  public EventTypeInfo deprecate() {
    return new EventTypeInfo(name, description, domain, true);
  }
}
