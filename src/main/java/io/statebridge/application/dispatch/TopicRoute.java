package io.statebridge.application.dispatch;

import io.statebridge.application.filter.CompiledFilter;
import io.statebridge.domain.filter.FilterSpecification;
import java.util.Objects;

/**
 * A topic together with its resolved effective filter.
 *
 * @param topic topic name
 * @param origin where the effective filter came from
 * @param specification effective filter rules, {@link FilterSpecification#empty()} for match-all
 * @param filter compiled form of {@code specification}
 */
public record TopicRoute(
    String topic, FilterOrigin origin, FilterSpecification specification, CompiledFilter filter) {

  public TopicRoute {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(specification, "specification");
    Objects.requireNonNull(filter, "filter");
  }

  /** Source of a topic's effective filter. */
  public enum FilterOrigin {
    /** The topic declares its own filter. */
    TOPIC,
    /** The topic inherits the global filter. */
    GLOBAL,
    /** Neither the topic nor the configuration declares a filter. */
    MATCH_ALL
  }
}
