package ca.gc.cra.lumen.domain.wire;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors over the untyped object graph carried by {@link WireMessage#payload()}.
 *
 * <p>Debuggee runtimes are inconsistent about number and boolean encodings (LuaPanda sends most scalars as
 * strings), so every accessor accepts both forms and falls back to a default instead of throwing.</p>
 *
 * @since 0.1.0
 */
public final class Payloads {

  private Payloads() {}

  public static String string(Map<String, ?> node, String key) {
    Object value = node == null ? null : node.get(key);
    return value == null ? null : value.toString();
  }

  public static String string(Map<String, ?> node, String key, String defaultValue) {
    String value = string(node, key);
    return value == null ? defaultValue : value;
  }

  public static int integer(Map<String, ?> node, String key, int defaultValue) {
    Object value = node == null ? null : node.get(key);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return (int) Double.parseDouble(text.trim());
      } catch (NumberFormatException ex) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  public static long longValue(Map<String, ?> node, String key, long defaultValue) {
    Object value = node == null ? null : node.get(key);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  public static boolean bool(Map<String, ?> node, String key, boolean defaultValue) {
    Object value = node == null ? null : node.get(key);
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof Number number) {
      return number.intValue() != 0;
    }
    if (value instanceof String text && !text.isBlank()) {
      return Boolean.parseBoolean(text.trim()) || "1".equals(text.trim());
    }
    return defaultValue;
  }

  /**
   * Returns a nested object as a string-keyed map, or an empty map when absent or of another type.
   */
  public static Map<String, Object> map(Map<String, ?> node, String key) {
    Object value = node == null ? null : node.get(key);
    return asMap(value);
  }

  /**
   * Returns a nested array, or an empty list when absent. A single object is wrapped in a list, and a
   * map keyed by array indices ({@code "1"}, {@code "2"}, ...) is returned as its values.
   */
  public static List<Object> list(Map<String, ?> node, String key) {
    Object value = node == null ? null : node.get(key);
    if (value instanceof List<?> raw) {
      return new ArrayList<>(raw);
    }
    if (value instanceof Map<?, ?> raw && !raw.isEmpty()) {
      // Lua tables with numeric keys arrive as JSON objects
      boolean indexed = raw.keySet().stream().allMatch(k -> k != null && k.toString().matches("\\d+"));
      if (indexed) {
        List<Object> ordered = new ArrayList<>();
        raw.entrySet().stream()
            .sorted((a, b) -> Integer.compare(
                Integer.parseInt(a.getKey().toString()), Integer.parseInt(b.getKey().toString())))
            .forEach(entry -> ordered.add(entry.getValue()));
        return ordered;
      }
      return List.of(raw);
    }
    return List.of();
  }

  public static Map<String, Object> asMap(Object value) {
    if (!(value instanceof Map<?, ?> raw)) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    raw.forEach((k, v) -> {
      if (k != null) {
        copy.put(k.toString(), v);
      }
    });
    return copy;
  }
}
