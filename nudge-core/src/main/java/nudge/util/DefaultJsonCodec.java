package nudge.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON encoder/decoder over plain Java values.
 *
 * <p>Integral numbers that fit in a {@code long} decode as {@link Long}; every other
 * number decodes as {@link Double}. Decoded maps keep member order.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value);
    return sb.toString();
  }

  @Override
  public Object parse(String json) {
    if (json == null) {
      return null;
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    Parser parser = new Parser(trimmed);
    Object value = parser.readValue();
    parser.skipWhitespace();
    if (parser.index != trimmed.length()) {
      throw new IllegalArgumentException("Unexpected trailing content at " + parser.index);
    }
    return value;
  }

  private static void write(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        sb.append("null");
      } else if (d == Math.rint(d) && Math.abs(d) < 1e15) {
        sb.append((long) d);
      } else {
        sb.append(d);
      }
    } else if (value instanceof Number) {
      sb.append(value);
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("JSON object keys must be strings");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(key)).append('"').append(':');
        write(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Collection<?> collection) {
      sb.append('[');
      boolean first = true;
      for (Object item : collection) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, item);
      }
      sb.append(']');
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
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
    return sb.toString();
  }

  private static final class Parser {
    private final String input;
    private int index;

    private Parser(String input) {
      this.input = input;
    }

    Object readValue() {
      skipWhitespace();
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      char ch = input.charAt(index);
      switch (ch) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          index++;
          return readString();
        case 't':
          expectLiteral("true");
          return Boolean.TRUE;
        case 'f':
          expectLiteral("false");
          return Boolean.FALSE;
        case 'n':
          expectLiteral("null");
          return null;
        default:
          if (ch == '-' || (ch >= '0' && ch <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + ch + "' at " + index);
      }
    }

    private Map<String, Object> readObject() {
      index++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        index++;
        return Collections.unmodifiableMap(result);
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at " + index);
        }
        index++;
        String key = readString();
        skipWhitespace();
        if (peek() != ':') {
          throw new IllegalArgumentException("Expected ':' after key at " + index);
        }
        index++;
        result.put(key, readValue());
        skipWhitespace();
        char next = peek();
        index++;
        if (next == ',') {
          continue;
        }
        if (next == '}') {
          return Collections.unmodifiableMap(result);
        }
        throw new IllegalArgumentException("Expected ',' or '}' at " + (index - 1));
      }
    }

    private List<Object> readArray() {
      index++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        index++;
        return Collections.unmodifiableList(result);
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        char next = peek();
        index++;
        if (next == ',') {
          continue;
        }
        if (next == ']') {
          return Collections.unmodifiableList(result);
        }
        throw new IllegalArgumentException("Expected ',' or ']' at " + (index - 1));
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '"') {
          index++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          index++;
          continue;
        }
        if (index + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(index + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
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
            if (index + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(index + 2, index + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            index += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        index += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private Object readNumber() {
      int start = index;
      boolean integral = true;
      if (peek() == '-') {
        index++;
      }
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c >= '0' && c <= '9') {
          index++;
        } else if (c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-') {
          integral = false;
          index++;
        } else {
          break;
        }
      }
      String text = input.substring(start, index);
      try {
        if (integral) {
          try {
            return Long.parseLong(text);
          } catch (NumberFormatException overflow) {
            return Double.parseDouble(text);
          }
        }
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + text, e);
      }
    }

    private void expectLiteral(String literal) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Expected '" + literal + "' at " + index);
      }
      index += literal.length();
    }

    private char peek() {
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(index);
    }

    void skipWhitespace() {
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        index++;
      }
    }
  }
}
