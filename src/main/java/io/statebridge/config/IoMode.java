package io.statebridge.config;

import java.util.Locale;

/** Where state-change events are read from. */
public enum IoMode {
  /** JSON lines from a file or standard input. */
  FILE,
  /** JSON records from a Kafka state-bus topic. */
  KAFKA;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw configured value
   * @return parsed mode
   * @throws IllegalArgumentException when the value names no mode
   */
  public static IoMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("source mode must not be blank");
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "FILE" -> FILE;
      case "KAFKA" -> KAFKA;
      default -> throw new IllegalArgumentException("source mode must be FILE or KAFKA (was " + raw + ")");
    };
  }
}
