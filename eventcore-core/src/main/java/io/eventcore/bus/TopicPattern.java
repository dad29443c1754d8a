package io.eventcore.bus;

import io.eventcore.ConfigurationException;

/**
 * Compiled subscription filter over dot-delimited event topics.
 *
 * <p>Pattern segments match topic segments one to one, with two wildcards:
 * <ul>
 *   <li>{@code *} matches exactly one segment</li>
 *   <li>{@code #} as the last segment matches zero or more remaining segments</li>
 * </ul>
 *
 * <pre>{@code
 * TopicPattern.compile("orders.*.created").matches("orders.eu.created");   // true
 * TopicPattern.compile("orders.#").matches("orders");                      // true
 * TopicPattern.compile("orders.#").matches("orders.eu.created");           // true
 * TopicPattern.compile("orders.*").matches("orders.eu.created");           // false
 * }</pre>
 *
 * <p>A pattern never matches an event without a topic.
 */
public final class TopicPattern {
  private static final String SINGLE = "*";
  private static final String REST = "#";

  private final String pattern;
  private final String[] segments;

  private TopicPattern(String pattern, String[] segments) {
    this.pattern = pattern;
    this.segments = segments;
  }

  /**
   * Compiles a topic pattern.
   *
   * @param pattern the pattern text
   * @return the compiled pattern
   * @throws ConfigurationException if the pattern is null, empty, has an empty segment,
   *     mixes a wildcard with other characters in one segment, or uses {@code #} before the end
   */
  public static TopicPattern compile(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new ConfigurationException("Topic pattern cannot be null or empty");
    }
    String[] segments = pattern.split("\\.", -1);
    for (int i = 0; i < segments.length; i++) {
      String segment = segments[i];
      if (segment.isEmpty()) {
        throw new ConfigurationException("Topic pattern has an empty segment: " + pattern);
      }
      if (REST.equals(segment) && i != segments.length - 1) {
        throw new ConfigurationException("'#' is only allowed as the last segment: " + pattern);
      }
      if (!SINGLE.equals(segment) && !REST.equals(segment)
          && (segment.contains(SINGLE) || segment.contains(REST))) {
        throw new ConfigurationException("Wildcards must occupy a whole segment: " + pattern);
      }
    }
    return new TopicPattern(pattern, segments);
  }

  /**
   * Returns {@code true} if the given text is a valid concrete topic: non-empty
   * dot-delimited segments without wildcard characters.
   *
   * @param topic the topic to check
   * @return whether the topic is valid
   */
  public static boolean isValidTopic(String topic) {
    if (topic == null || topic.isEmpty()) {
      return false;
    }
    for (String segment : topic.split("\\.", -1)) {
      if (segment.isEmpty() || segment.contains(SINGLE) || segment.contains(REST)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Tests a topic against this pattern.
   *
   * @param topic the event topic, possibly {@code null}
   * @return {@code true} if the topic matches; always {@code false} for a {@code null} topic
   */
  public boolean matches(String topic) {
    if (topic == null) {
      return false;
    }
    String[] parts = topic.split("\\.", -1);
    for (int i = 0; i < segments.length; i++) {
      String segment = segments[i];
      if (REST.equals(segment)) {
        return true;
      }
      if (i >= parts.length) {
        return false;
      }
      if (!SINGLE.equals(segment) && !segment.equals(parts[i])) {
        return false;
      }
    }
    return parts.length == segments.length;
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TopicPattern)) return false;
    return pattern.equals(((TopicPattern) o).pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return pattern;
  }
}
