package io.statebridge.domain.filter;

import java.util.Objects;
import java.util.Optional;

/**
 * Binds a broker topic to an optional per-topic {@link FilterSpecification}.
 *
 * <p>An absent filter means the topic inherits the global filter; an empty filter means the topic
 * explicitly receives every entity. Instances are created once at startup and never change.</p>
 *
 * @since 0.1.0
 */
public final class TopicConfiguration {
  private final String name;
  private final FilterSpecification filter;

  private TopicConfiguration(String name, FilterSpecification filter) {
    this.name = Objects.requireNonNull(name, "name");
    this.filter = filter;
  }

  /**
   * Creates a topic that inherits the global filter.
   *
   * @param name topic name
   * @return topic configuration without its own filter
   */
  public static TopicConfiguration inheriting(String name) {
    return new TopicConfiguration(name, null);
  }

  /**
   * Creates a topic with its own filter, which fully replaces the global one.
   *
   * @param name topic name
   * @param filter topic filter; never {@code null}
   * @return topic configuration
   */
  public static TopicConfiguration filtered(String name, FilterSpecification filter) {
    return new TopicConfiguration(name, Objects.requireNonNull(filter, "filter"));
  }

  public String name() {
    return name;
  }

  public Optional<FilterSpecification> filter() {
    return Optional.ofNullable(filter);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TopicConfiguration other)) {
      return false;
    }
    return name.equals(other.name) && Objects.equals(filter, other.filter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, filter);
  }

  @Override
  public String toString() {
    return "TopicConfiguration[name=" + name + ", filter=" + (filter == null ? "<inherit>" : filter) + "]";
  }
}
