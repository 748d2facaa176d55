package io.statebridge.api;

import io.statebridge.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Utility for turning {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}; a repeated key keeps its
   * last value.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the argument prefix prior to {@code '='}
   * @throws IllegalArgumentException if an argument is not {@code key=value}
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    toMultiMap(args).forEach((key, values) -> map.put(key, values.get(values.size() - 1)));
    return map;
  }

  /**
   * Converts arguments into a mutable map that keeps every value of a repeated key in order.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable multi-map
   * @throws IllegalArgumentException if an argument is not {@code key=value}
   */
  public static Map<String, List<String>> toMultiMap(String[] args) {
    Map<String, List<String>> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      map.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    Strings.requireNonBlank(key, value);
  }
}
