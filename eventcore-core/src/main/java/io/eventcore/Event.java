package io.eventcore;

import com.github.f4b6a3.ulid.UlidCreator;
import io.eventcore.bus.TopicPattern;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain event: a fact that happened, with routing and tracing metadata.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default. Equality is defined
 * by {@code eventId} alone. The payload is opaque JSON text limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes (UTF-8). {@code occurredAt} is kept at microsecond
 * precision so that it survives a round trip through any supported store unchanged.
 *
 * <p>Events that belong to an aggregate carry {@code aggregateId}, {@code aggregateType}
 * and a {@code version}. The version is {@code 0} until an
 * {@linkplain io.eventcore.store.EventStore event store} assigns the stream position.
 *
 * @see EventType
 * @see io.eventcore.store.EventStore
 */
public final class Event {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB
    public static final String EMPTY_PAYLOAD = "{}";

    private final String eventId;
    private final String eventType;
    private final Instant occurredAt;
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final String correlationId;
    private final String causationId;
    private final String topic;
    private final Map<String, String> metadata;
    private final String payloadJson;

    private Event(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        if (this.eventId.isEmpty()) {
            throw new IllegalArgumentException("eventId cannot be empty");
        }
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        this.occurredAt = (builder.occurredAt == null ? Instant.now() : builder.occurredAt)
                .truncatedTo(ChronoUnit.MICROS);
        this.aggregateId = builder.aggregateId;
        this.aggregateType = builder.aggregateType;
        if (builder.version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got: " + builder.version);
        }
        this.version = builder.version;
        this.correlationId = builder.correlationId;
        this.causationId = builder.causationId;
        if (builder.topic != null && !TopicPattern.isValidTopic(builder.topic)) {
            throw new IllegalArgumentException("Invalid topic: " + builder.topic);
        }
        this.topic = builder.topic;

        Map<String, String> metadataCopy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (metadataCopy.containsKey(null)) {
            throw new IllegalArgumentException("metadata cannot contain null keys");
        }
        if (metadataCopy.containsValue(null)) {
            throw new IllegalArgumentException("metadata cannot contain null values");
        }
        this.metadata = metadataCopy;

        String payload = builder.payloadJson == null ? EMPTY_PAYLOAD : builder.payloadJson;
        if (payload.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payloadJson = payload;
    }

    /**
     * Creates a builder with a type-safe event type.
     *
     * @param eventType the event type (enum or other EventType implementation)
     * @return a new builder
     */
    public static Builder builder(EventType eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return new Builder(eventType.name());
    }

    /**
     * Creates a builder with a string event type.
     *
     * @param eventType the event type name
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    /**
     * Creates an event with a type-safe event type and JSON payload.
     *
     * @param eventType   the event type
     * @param payloadJson the JSON payload
     * @return a new event
     */
    public static Event ofJson(EventType eventType, String payloadJson) {
        return builder(eventType).payloadJson(payloadJson).build();
    }

    /**
     * Creates an event with a string event type and JSON payload.
     *
     * @param eventType   the event type name
     * @param payloadJson the JSON payload
     * @return a new event
     */
    public static Event ofJson(String eventType, String payloadJson) {
        return builder(eventType).payloadJson(payloadJson).build();
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    /**
     * Returns the position of this event within its aggregate stream, or {@code 0}
     * if it has not been appended yet.
     *
     * @return the stream version
     */
    public long version() {
        return version;
    }

    public String correlationId() {
        return correlationId;
    }

    public String causationId() {
        return causationId;
    }

    /**
     * Returns the dot-delimited routing topic, or {@code null} if the event has none.
     *
     * @return the topic, or {@code null}
     */
    public String topic() {
        return topic;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public String payloadJson() {
        return payloadJson;
    }

    /**
     * Returns a copy of this event with tracing and routing metadata replaced.
     * A {@code null} argument keeps the current value.
     *
     * @param correlationId the correlation identifier, or {@code null} to keep
     * @param causationId   the causation identifier, or {@code null} to keep
     * @param topic         the routing topic, or {@code null} to keep
     * @return a new event with the same {@code eventId}
     */
    public Event withMetadata(String correlationId, String causationId, String topic) {
        Builder copy = toBuilder();
        if (correlationId != null) {
            copy.correlationId(correlationId);
        }
        if (causationId != null) {
            copy.causationId(causationId);
        }
        if (topic != null) {
            copy.topic(topic);
        }
        return copy.build();
    }

    /**
     * Returns a copy of this event positioned at the given stream version.
     *
     * @param version the stream version (must be &ge; 0)
     * @return a new event with the same {@code eventId}
     */
    public Event withVersion(long version) {
        if (version == this.version) {
            return this;
        }
        return toBuilder().version(version).build();
    }

    /**
     * Returns a builder pre-populated with every field of this event.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(eventType)
                .eventId(eventId)
                .occurredAt(occurredAt)
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .version(version)
                .correlationId(correlationId)
                .causationId(causationId)
                .topic(topic)
                .metadata(metadata)
                .payloadJson(payloadJson);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        return eventId.equals(((Event) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Event{eventId=").append(eventId)
                .append(", eventType=").append(eventType);
        if (aggregateId != null) {
            sb.append(", aggregateType=").append(aggregateType)
                    .append(", aggregateId=").append(aggregateId)
                    .append(", version=").append(version);
        }
        if (topic != null) {
            sb.append(", topic=").append(topic);
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link Event}.
     */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private Instant occurredAt;
        private String aggregateId;
        private String aggregateType;
        private long version;
        private String correlationId;
        private String causationId;
        private String topic;
        private Map<String, String> metadata;
        private String payloadJson;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the event timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}. Truncated to microseconds.
         *
         * @param occurredAt the event timestamp
         * @return this builder
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        /**
         * Sets the identifier of the aggregate this event belongs to.
         *
         * <p>Optional for bus-only events; required before appending to an event store.
         *
         * @param aggregateId the aggregate identifier
         * @return this builder
         */
        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        /**
         * Sets the aggregate type name.
         *
         * <p>Optional. Defaults to {@code null}.
         *
         * @param aggregateType the aggregate type name
         * @return this builder
         */
        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * Sets the stream version. Normally assigned by the event store.
         *
         * <p>Optional. Defaults to {@code 0}.
         *
         * @param version the stream version
         * @return this builder
         */
        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        /**
         * Sets the dot-delimited routing topic (e.g. {@code "orders.eu.created"}).
         * Segments must be non-empty and must not contain {@code *} or {@code #}.
         *
         * <p>Optional. Defaults to {@code null}.
         *
         * @param topic the routing topic
         * @return this builder
         */
        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        /**
         * Sets custom key-value metadata. The map is defensively copied at build time.
         *
         * <p>Optional. Defaults to an empty map. Null keys and values are rejected at build time.
         *
         * @param metadata the metadata entries
         * @return this builder
         */
        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Sets the event payload as a JSON string.
         *
         * <p>Optional. Defaults to {@value Event#EMPTY_PAYLOAD}.
         * Maximum size: {@value Event#MAX_PAYLOAD_BYTES} bytes (UTF-8).
         *
         * @param payloadJson the JSON payload
         * @return this builder
         */
        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        /**
         * Builds an immutable {@link Event}.
         *
         * @return a new event
         * @throws IllegalArgumentException if {@code eventType} is empty, the payload is too large,
         *                                  the topic is malformed, the version is negative,
         *                                  or metadata contains null keys or values
         */
        public Event build() {
            return new Event(this);
        }
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
