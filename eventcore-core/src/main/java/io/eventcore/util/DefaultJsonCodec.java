package io.eventcore.util;

import io.eventcore.SerializationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} for flat string maps.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. Stateless and thread-safe.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private DefaultJsonCodec() {
  }

  @Override
  public String encode(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder(metadata.size() * 24);
    sb.append('{');
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new SerializationException("metadata cannot contain null keys or values");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      quote(sb, entry.getKey());
      sb.append(':');
      quote(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> decode(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(json);
    in.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (in.peekSkippingWhitespace() == '}') {
      in.next();
      in.expectEnd();
      return result;
    }
    while (true) {
      in.skipWhitespace();
      String key = in.readString();
      in.expect(':');
      in.skipWhitespace();
      String value = in.readString();
      result.put(key, value);
      char separator = in.peekSkippingWhitespace();
      in.next();
      if (separator == '}') {
        in.expectEnd();
        return result;
      }
      if (separator != ',') {
        throw in.error("Expected ',' or '}'");
      }
    }
  }

  private static void quote(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    char peekSkippingWhitespace() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw error("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    char next() {
      if (pos >= input.length()) {
        throw error("Unexpected end of JSON object");
      }
      return input.charAt(pos++);
    }

    void expect(char expected) {
      if (peekSkippingWhitespace() != expected) {
        throw error("Expected '" + expected + "'");
      }
      pos++;
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw error("Unexpected trailing content");
      }
    }

    String readString() {
      if (next() != '"') {
        pos--;
        throw error("Expected string");
      }
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char escaped = next();
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw error("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new SerializationException("Invalid unicode escape at index " + pos, ex);
            }
            pos += 4;
          }
          default -> throw error("Unsupported escape sequence: \\" + escaped);
        }
      }
    }

    SerializationException error(String message) {
      return new SerializationException(message + " at index " + pos);
    }
  }
}
