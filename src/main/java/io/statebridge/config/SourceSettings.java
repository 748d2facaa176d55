package io.statebridge.config;

import java.util.Objects;

/**
 * Event input settings.
 *
 * @param mode input mode
 * @param topic state-bus topic for {@link IoMode#KAFKA}; {@code null} otherwise
 * @param path JSON-lines location for {@link IoMode#FILE}, {@code "-"} for standard input
 * @param groupId consumer group for {@link IoMode#KAFKA}, defaulting to {@value #DEFAULT_GROUP_ID};
 *     {@code null} otherwise
 * @since 0.1.0
 */
public record SourceSettings(IoMode mode, String topic, String path, String groupId) {
  /** Location value that selects standard input. */
  public static final String STDIN = "-";
  /** Consumer group used when the source block names none. */
  public static final String DEFAULT_GROUP_ID = "statebridge";

  public SourceSettings {
    Objects.requireNonNull(mode, "mode");
    if (mode == IoMode.KAFKA && (topic == null || topic.isBlank())) {
      throw new IllegalArgumentException("source.topic is required when source.mode is KAFKA");
    }
    if (mode == IoMode.FILE && (path == null || path.isBlank())) {
      path = STDIN;
    }
    if (mode == IoMode.FILE) {
      groupId = null;
    } else if (groupId == null || groupId.isBlank()) {
      groupId = DEFAULT_GROUP_ID;
    } else {
      groupId = groupId.trim();
    }
  }

  public SourceSettings(IoMode mode, String topic, String path) {
    this(mode, topic, path, null);
  }

  /**
   * Returns the default input: JSON lines on standard input.
   *
   * @return stdin file source
   */
  public static SourceSettings stdin() {
    return new SourceSettings(IoMode.FILE, null, STDIN);
  }

  /**
   * Returns a copy with the mode and location replaced by CLI overrides.
   *
   * @param modeOverride replacement mode, or {@code null} to keep the current one
   * @param locationOverride replacement path (FILE) or topic (KAFKA), or {@code null}
   * @return effective settings
   */
  public SourceSettings withOverrides(IoMode modeOverride, String locationOverride) {
    IoMode effectiveMode = modeOverride == null ? mode : modeOverride;
    if (effectiveMode == IoMode.FILE) {
      String effectivePath = locationOverride != null ? locationOverride
          : (effectiveMode == mode ? path : STDIN);
      return new SourceSettings(IoMode.FILE, null, effectivePath);
    }
    String effectiveTopic = locationOverride != null ? locationOverride : topic;
    return new SourceSettings(IoMode.KAFKA, effectiveTopic, null, groupId);
  }
}
