package io.eventcore.bus;

import io.eventcore.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicPatternTest {

  @Test
  void literalPatternMatchesExactTopicOnly() {
    TopicPattern pattern = TopicPattern.compile("orders.eu.created");

    assertTrue(pattern.matches("orders.eu.created"));
    assertFalse(pattern.matches("orders.eu"));
    assertFalse(pattern.matches("orders.eu.created.v2"));
    assertFalse(pattern.matches("orders.us.created"));
  }

  @Test
  void starMatchesExactlyOneSegment() {
    TopicPattern pattern = TopicPattern.compile("orders.*.created");

    assertTrue(pattern.matches("orders.eu.created"));
    assertTrue(pattern.matches("orders.us.created"));
    assertFalse(pattern.matches("orders.created"));
    assertFalse(pattern.matches("orders.eu.west.created"));
  }

  @Test
  void hashMatchesZeroOrMoreTrailingSegments() {
    TopicPattern pattern = TopicPattern.compile("orders.#");

    assertTrue(pattern.matches("orders"));
    assertTrue(pattern.matches("orders.eu"));
    assertTrue(pattern.matches("orders.eu.created"));
    assertFalse(pattern.matches("payments.eu"));
  }

  @Test
  void loneHashMatchesEveryTopic() {
    TopicPattern pattern = TopicPattern.compile("#");

    assertTrue(pattern.matches("a"));
    assertTrue(pattern.matches("a.b.c"));
  }

  @Test
  void nullTopicNeverMatches() {
    assertFalse(TopicPattern.compile("#").matches(null));
  }

  @Test
  void rejectsMalformedPatterns() {
    assertThrows(ConfigurationException.class, () -> TopicPattern.compile(""));
    assertThrows(ConfigurationException.class, () -> TopicPattern.compile(null));
    assertThrows(ConfigurationException.class, () -> TopicPattern.compile("orders..eu"));
    assertThrows(ConfigurationException.class, () -> TopicPattern.compile("orders.#.eu"));
    assertThrows(ConfigurationException.class, () -> TopicPattern.compile("orders.e*"));
    assertThrows(ConfigurationException.class, () -> TopicPattern.compile("orders."));
  }

  @Test
  void validTopicsHaveNoWildcardsOrEmptySegments() {
    assertTrue(TopicPattern.isValidTopic("orders.eu"));
    assertFalse(TopicPattern.isValidTopic("orders.*"));
    assertFalse(TopicPattern.isValidTopic(".orders"));
    assertFalse(TopicPattern.isValidTopic(null));
  }

  @Test
  void equalityFollowsPatternText() {
    assertEquals(TopicPattern.compile("a.*"), TopicPattern.compile("a.*"));
    assertEquals(TopicPattern.compile("a.*").hashCode(), TopicPattern.compile("a.*").hashCode());
    assertNotEquals(TopicPattern.compile("a.*"), TopicPattern.compile("a.#"));
  }
}
