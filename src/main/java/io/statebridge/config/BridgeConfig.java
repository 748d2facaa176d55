package io.statebridge.config;

import io.statebridge.domain.filter.FilterSpecification;
import io.statebridge.domain.filter.TopicConfiguration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully validated bridge configuration.
 *
 * @param broker broker connection settings
 * @param globalFilter filter inherited by topics without their own
 * @param topics topics in configuration order; never empty
 * @param source event input settings
 * @param workers number of dispatch lanes
 * @since 0.1.0
 */
public record BridgeConfig(
    BrokerSettings broker,
    Optional<FilterSpecification> globalFilter,
    List<TopicConfiguration> topics,
    SourceSettings source,
    int workers) {

  public BridgeConfig {
    Objects.requireNonNull(broker, "broker");
    Objects.requireNonNull(globalFilter, "globalFilter");
    Objects.requireNonNull(source, "source");
    topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
    if (topics.isEmpty()) {
      throw new IllegalArgumentException("at least one topic must be configured");
    }
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
  }

  /**
   * Returns the default worker count for this host.
   *
   * @return {@code max(2, availableProcessors / 2)}
   */
  public static int defaultWorkers() {
    return Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
  }

  /**
   * Returns a copy with CLI overrides applied.
   *
   * @param effectiveSource replacement source settings
   * @param effectiveWorkers replacement worker count
   * @return new configuration
   */
  public BridgeConfig with(SourceSettings effectiveSource, int effectiveWorkers) {
    return new BridgeConfig(broker, globalFilter, topics, effectiveSource, effectiveWorkers);
  }
}
