package mailqueue.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} limited to flat string objects and string arrays.
 * Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("map cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendQuoted(sb, entry.getKey()).append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendQuoted(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public String toJsonArray(List<String> values) {
    StringBuilder sb = new StringBuilder("[");
    if (values != null) {
      for (int i = 0; i < values.size(); i++) {
        String value = values.get(i);
        if (value == null) {
          throw new IllegalArgumentException("array cannot contain null elements");
        }
        if (i > 0) {
          sb.append(',');
        }
        appendQuoted(sb, value);
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    String trimmed = trimOrNull(json);
    if (trimmed == null) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(trimmed);
    in.expect('{', "Expected JSON object");
    Map<String, String> result = new LinkedHashMap<>();
    if (in.skipWhitespace().peek() == '}') {
      in.pos++;
      return in.end(result);
    }
    while (true) {
      in.skipWhitespace();
      if (in.peek() != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      in.pos++;
      String key = in.readString();
      in.skipWhitespace().expect(':', "Expected ':' after key");
      in.skipWhitespace();
      if (in.startsWith("null")) {
        // null values are dropped; stored maps never carry them
        in.pos += 4;
      } else if (in.peek() == '"') {
        in.pos++;
        result.put(key, in.readString());
      } else {
        throw new IllegalArgumentException("Expected string value or null");
      }
      char next = in.skipWhitespace().next("Unexpected end of JSON object");
      if (next == '}') {
        return in.end(result);
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or '}'");
      }
    }
  }

  @Override
  public List<String> parseArray(String json) {
    String trimmed = trimOrNull(json);
    if (trimmed == null) {
      return Collections.emptyList();
    }
    Cursor in = new Cursor(trimmed);
    in.expect('[', "Expected JSON array");
    List<String> result = new ArrayList<>();
    if (in.skipWhitespace().peek() == ']') {
      in.pos++;
      return in.end(result);
    }
    while (true) {
      in.skipWhitespace();
      if (in.peek() != '"') {
        throw new IllegalArgumentException("Expected string element");
      }
      in.pos++;
      result.add(in.readString());
      char next = in.skipWhitespace().next("Unexpected end of JSON array");
      if (next == ']') {
        return in.end(result);
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or ']'");
      }
    }
  }

  private static String trimOrNull(String json) {
    if (json == null) {
      return null;
    }
    String trimmed = json.trim();
    return trimmed.isEmpty() || "null".equals(trimmed) ? null : trimmed;
  }

  private static StringBuilder appendQuoted(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(pos);
    }

    char next(String eofMessage) {
      if (pos >= input.length()) {
        throw new IllegalArgumentException(eofMessage);
      }
      return input.charAt(pos++);
    }

    boolean startsWith(String token) {
      return input.startsWith(token, pos);
    }

    void expect(char c, String message) {
      if (pos >= input.length() || input.charAt(pos) != c) {
        throw new IllegalArgumentException(message);
      }
      pos++;
    }

    Cursor skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        pos++;
      }
      return this;
    }

    <T> T end(T result) {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON value");
      }
      return result;
    }

    /** Reads string content; {@code pos} must be just past the opening quote. */
    String readString() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '"') {
          pos++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          pos++;
          continue;
        }
        if (pos + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char esc = input.charAt(pos + 1);
        switch (esc) {
          case '"':
          case '\\':
          case '/':
            sb.append(esc);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (pos + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos + 2, pos + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
        }
        pos += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
