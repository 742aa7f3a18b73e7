package io.vision.util;

import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight JSON encoder/decoder with no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private static final String CIRCULAR = "[Circular]";

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value, Collections.newSetFromMap(new IdentityHashMap<>()));
    return sb.toString();
  }

  private void write(StringBuilder sb, Object value, Set<Object> inProgress) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence || value instanceof Character) {
      writeString(sb, value.toString());
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Double d) {
      writeFloating(sb, d);
    } else if (value instanceof Float f) {
      writeFloating(sb, f.doubleValue());
    } else if (value instanceof Number) {
      sb.append(value);
    } else if (value instanceof Enum<?> e) {
      writeString(sb, e.name());
    } else if (value instanceof Date date) {
      writeString(sb, date.toInstant().toString());
    } else if (value instanceof TemporalAccessor) {
      writeString(sb, value.toString());
    } else if (value instanceof Throwable t) {
      write(sb, ErrorSerializer.serialize(t), inProgress);
    } else if (value instanceof Map<?, ?> map) {
      if (!inProgress.add(map)) {
        writeString(sb, CIRCULAR);
        return;
      }
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeString(sb, String.valueOf(entry.getKey()));
        sb.append(':');
        write(sb, entry.getValue(), inProgress);
      }
      sb.append('}');
      inProgress.remove(map);
    } else if (value instanceof Iterable<?> iterable) {
      if (!inProgress.add(iterable)) {
        writeString(sb, CIRCULAR);
        return;
      }
      sb.append('[');
      boolean first = true;
      for (Object element : iterable) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, element, inProgress);
      }
      sb.append(']');
      inProgress.remove(iterable);
    } else if (value.getClass().isArray()) {
      if (!inProgress.add(value)) {
        writeString(sb, CIRCULAR);
        return;
      }
      sb.append('[');
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(',');
        }
        write(sb, Array.get(value, i), inProgress);
      }
      sb.append(']');
      inProgress.remove(value);
    } else {
      writeString(sb, value.toString());
    }
  }

  private static void writeFloating(StringBuilder sb, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      sb.append("null");
    } else if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      sb.append((long) value);
    } else {
      sb.append(value);
    }
  }

  private static void writeString(StringBuilder sb, String value) {
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
    sb.append('"');
  }

  @Override
  public Object parse(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON input is null");
    }
    Parser parser = new Parser(json);
    Object value = parser.readValue();
    parser.skipWhitespace();
    if (parser.index < json.length()) {
      throw new IllegalArgumentException("Unexpected trailing content at index " + parser.index);
    }
    return value;
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
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char c = input.charAt(index);
      switch (c) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          index++;
          return readString();
        case 't':
          return readLiteral("true", Boolean.TRUE);
        case 'f':
          return readLiteral("false", Boolean.FALSE);
        case 'n':
          return readLiteral("null", null);
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + c + "' at index " + index);
      }
    }

    private Map<String, Object> readObject() {
      index++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        index++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at index " + index);
        }
        index++;
        String key = readString();
        skipWhitespace();
        if (peek() != ':') {
          throw new IllegalArgumentException("Expected ':' after key at index " + index);
        }
        index++;
        result.put(key, readValue());
        skipWhitespace();
        char next = peek();
        index++;
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at index " + (index - 1));
        }
      }
    }

    private List<Object> readArray() {
      index++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        index++;
        return result;
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        char next = peek();
        index++;
        if (next == ']') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']' at index " + (index - 1));
        }
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
      boolean floating = false;
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '.' || c == 'e' || c == 'E') {
          floating = true;
        } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
          break;
        }
        index++;
      }
      String text = input.substring(start, index);
      try {
        if (!floating) {
          try {
            return Long.parseLong(text);
          } catch (NumberFormatException overflow) {
            return Double.parseDouble(text);
          }
        }
        return Double.parseDouble(text);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number: " + text, ex);
      }
    }

    private Object readLiteral(String literal, Object value) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Unexpected token at index " + index);
      }
      index += literal.length();
      return value;
    }

    private char peek() {
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
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
