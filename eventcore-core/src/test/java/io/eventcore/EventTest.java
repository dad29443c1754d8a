package io.eventcore;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

  @Test
  void builderAssignsDefaults() {
    Event event = Event.builder("OrderPlaced").build();

    assertNotNull(event.eventId());
    assertEquals(26, event.eventId().length());
    assertEquals("OrderPlaced", event.eventType());
    assertNotNull(event.occurredAt());
    assertEquals(0L, event.version());
    assertEquals(Event.EMPTY_PAYLOAD, event.payloadJson());
    assertTrue(event.metadata().isEmpty());
    assertNull(event.topic());
    assertNull(event.aggregateId());
  }

  @Test
  void eventIdsAreUniqueAndOrdered() {
    Event first = Event.ofJson("A", "{}");
    Event second = Event.ofJson("A", "{}");

    assertNotEquals(first.eventId(), second.eventId());
    assertTrue(first.eventId().compareTo(second.eventId()) < 0);
  }

  @Test
  void typeSafeEventTypeUsesName() {
    Event event = Event.ofJson(StringEventType.of("UserCreated"), "{\"id\":1}");

    assertEquals("UserCreated", event.eventType());
    assertEquals("{\"id\":1}", event.payloadJson());
  }

  @Test
  void runtimeEventTypesCompareByName() {
    assertEquals(EventType.of("UserCreated"), StringEventType.of("UserCreated"));
    assertEquals("UserCreated", EventType.of("UserCreated").toString());
    assertThrows(IllegalArgumentException.class, () -> EventType.of(""));
    assertThrows(NullPointerException.class, () -> EventType.of(null));
  }

  @Test
  void occurredAtIsTruncatedToMicros() {
    Instant instant = Instant.parse("2024-01-01T00:00:00.123456789Z");

    Event event = Event.builder("A").occurredAt(instant).build();

    assertEquals(instant.truncatedTo(ChronoUnit.MICROS), event.occurredAt());
  }

  @Test
  void rejectsEmptyEventType() {
    assertThrows(IllegalArgumentException.class, () -> Event.builder("").build());
  }

  @Test
  void rejectsNullEventType() {
    assertThrows(NullPointerException.class, () -> Event.builder((String) null).build());
  }

  @Test
  void rejectsNegativeVersion() {
    assertThrows(IllegalArgumentException.class, () -> Event.builder("A").version(-1).build());
  }

  @Test
  void rejectsOversizedPayload() {
    String big = "\"" + "x".repeat(Event.MAX_PAYLOAD_BYTES) + "\"";

    assertThrows(IllegalArgumentException.class, () -> Event.ofJson("A", big));
  }

  @Test
  void rejectsMalformedTopic() {
    assertThrows(IllegalArgumentException.class, () -> Event.builder("A").topic("orders..eu").build());
    assertThrows(IllegalArgumentException.class, () -> Event.builder("A").topic("orders.*").build());
    assertThrows(IllegalArgumentException.class, () -> Event.builder("A").topic("").build());
  }

  @Test
  void rejectsNullMetadataEntries() {
    Map<String, String> withNullValue = new HashMap<>();
    withNullValue.put("k", null);

    assertThrows(IllegalArgumentException.class, () -> Event.builder("A").metadata(withNullValue).build());
  }

  @Test
  void metadataIsCopiedAndUnmodifiable() {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("tenant", "acme");
    Event event = Event.builder("A").metadata(metadata).build();

    metadata.put("tenant", "other");

    assertEquals("acme", event.metadata().get("tenant"));
    assertThrows(UnsupportedOperationException.class, () -> event.metadata().put("x", "y"));
  }

  @Test
  void withMetadataReturnsNewValueAndKeepsOriginal() {
    Event original = Event.builder("A").correlationId("c1").topic("orders.eu").build();

    Event derived = original.withMetadata(null, "cause-1", null);

    assertNotSame(original, derived);
    assertEquals(original.eventId(), derived.eventId());
    assertEquals("c1", derived.correlationId());
    assertEquals("cause-1", derived.causationId());
    assertEquals("orders.eu", derived.topic());
    assertNull(original.causationId());
  }

  @Test
  void withVersionReturnsSameInstanceWhenUnchanged() {
    Event event = Event.builder("A").version(3).build();

    assertSame(event, event.withVersion(3));
    assertEquals(4, event.withVersion(4).version());
    assertEquals(3, event.version());
  }

  @Test
  void toBuilderCopiesEveryField() {
    Event original = Event.builder("A")
        .aggregateId("agg-1")
        .aggregateType("Order")
        .version(2)
        .correlationId("corr")
        .causationId("cause")
        .topic("orders.eu.created")
        .metadata(Map.of("k", "v"))
        .payloadJson("{\"a\":1}")
        .build();

    Event copy = original.toBuilder().build();

    assertEquals(original.eventId(), copy.eventId());
    assertEquals(original.occurredAt(), copy.occurredAt());
    assertEquals("agg-1", copy.aggregateId());
    assertEquals("Order", copy.aggregateType());
    assertEquals(2, copy.version());
    assertEquals("corr", copy.correlationId());
    assertEquals("cause", copy.causationId());
    assertEquals("orders.eu.created", copy.topic());
    assertEquals(Map.of("k", "v"), copy.metadata());
    assertEquals("{\"a\":1}", copy.payloadJson());
  }

  @Test
  void equalityIsByEventId() {
    Event a = Event.builder("A").eventId("same").build();
    Event b = Event.builder("B").eventId("same").build();

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }
}
