package io.statebridge.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from bridge configuration and CLI options.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Check Kafka topic names against the broker's legal character set and length.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  /** Longest topic name a Kafka broker accepts. */
  public static final int MAX_TOPIC_LENGTH = 249;

  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name using the default label {@code "topic"}.
   *
   * @param topic candidate topic
   * @return trimmed topic
   * @throws IllegalArgumentException if the topic is blank, too long or uses illegal characters
   */
  public static String sanitizeTopic(String topic) {
    return sanitizeTopic("topic", topic);
  }

  /**
   * Validates a Kafka topic name with a custom diagnostic label.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic is blank, too long or uses illegal characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_TOPIC_LENGTH));
    }
    if (".".equals(sanitized) || "..".equals(sanitized)) {
      throw new IllegalArgumentException(message(name, "must not be '.' or '..'"));
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits the length limit.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return trimmed value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
