package io.statebridge.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Typed accessors over SnakeYAML's untyped node graph. */
final class YamlNodes {
  private YamlNodes() {}

  static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  static void rejectUnknownKeys(Map<String, Object> map, Set<String> allowed, String context) {
    for (String key : map.keySet()) {
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException(context + " contains unknown key '" + key + "'");
      }
    }
  }

  static String requireString(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException(context + '.' + key + " is required");
    }
    String text = scalar(value, context + '.' + key).trim();
    if (text.isEmpty()) {
      throw new IllegalArgumentException(context + '.' + key + " must not be blank");
    }
    return text;
  }

  static String optionalString(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    return value == null ? null : scalar(value, context + '.' + key);
  }

  static long requireLong(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException(context + '.' + key + " is required");
    }
    return toLong(value, context + '.' + key);
  }

  static long toLong(Object value, String context) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(context + " must be an integer (was " + text + ")", ex);
      }
    }
    throw new IllegalArgumentException(context + " must be an integer");
  }

  /**
   * Reads a string or list of strings; single strings become one-element lists.
   */
  static List<String> stringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    List<String> values = new ArrayList<>();
    if (node instanceof String single) {
      values.add(requireEntry(single, context));
    } else if (node instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        if (value == null) {
          throw new IllegalArgumentException(context + " contains a null entry");
        }
        values.add(requireEntry(scalar(value, context), context));
      }
    } else {
      throw new IllegalArgumentException(context + " must be a string or a list of strings");
    }
    return values;
  }

  private static String requireEntry(String value, String context) {
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(context + " contains a blank entry");
    }
    return trimmed;
  }

  private static String scalar(Object value, String context) {
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException(context + " must be a scalar value");
    }
    return value.toString();
  }
}
