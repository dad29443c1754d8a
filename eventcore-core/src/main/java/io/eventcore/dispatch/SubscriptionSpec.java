package io.eventcore.dispatch;

import io.eventcore.EventHandler;
import io.eventcore.EventType;
import io.eventcore.bus.Priority;

import java.util.Objects;

/**
 * Named, declarative description of a bus subscription managed by a {@link SubscriptionManager}.
 */
public final class SubscriptionSpec {
  private final String name;
  private final String eventType;
  private final EventHandler handler;
  private final Priority priority;
  private final String topicPattern;
  private final boolean active;

  private SubscriptionSpec(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.priority = Objects.requireNonNull(builder.priority, "priority");
    this.topicPattern = builder.topicPattern;
    this.active = builder.active;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public String eventType() {
    return eventType;
  }

  public EventHandler handler() {
    return handler;
  }

  public Priority priority() {
    return priority;
  }

  /**
   * Returns the topic pattern, or {@code null} to match every topic.
   */
  public String topicPattern() {
    return topicPattern;
  }

  public boolean isActive() {
    return active;
  }

  SubscriptionSpec withActive(boolean active) {
    if (active == this.active) {
      return this;
    }
    return new Builder(name)
        .eventType(eventType)
        .handler(handler)
        .priority(priority)
        .topicPattern(topicPattern)
        .active(active)
        .build();
  }

  @Override
  public String toString() {
    return "SubscriptionSpec{name=" + name + ", eventType=" + eventType + ", priority=" + priority
        + (topicPattern == null ? "" : ", topicPattern=" + topicPattern)
        + ", active=" + active + '}';
  }

  /** Builder for {@link SubscriptionSpec}. */
  public static final class Builder {
    private final String name;
    private String eventType;
    private EventHandler handler;
    private Priority priority = Priority.NORMAL;
    private String topicPattern;
    private boolean active = true;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventType(String eventType) {
      this.eventType = eventType;
      return this;
    }

    public Builder eventType(EventType eventType) {
      this.eventType = Objects.requireNonNull(eventType, "eventType").name();
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder handler(EventHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Priority#NORMAL}.
     */
    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code null} (every topic).
     */
    public Builder topicPattern(String topicPattern) {
      this.topicPattern = topicPattern;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public SubscriptionSpec build() {
      return new SubscriptionSpec(this);
    }
  }
}
