package io.statebridge.domain.filter;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable include/exclude rule bundle deciding which entities reach a topic.
 *
 * <p>Entity sets hold exact entity ids or glob patterns ({@code *}, {@code ?}) matched against the
 * full entity id; domain sets hold exact domains or glob patterns matched against the bare domain.
 * A specification with all four sets empty matches every entity. Whether a topic has a
 * specification at all is modelled separately by {@link TopicConfiguration#filter()}.</p>
 *
 * @param excludeDomains domains whose entities are rejected unless explicitly included by entity
 * @param excludeEntities entities that are always rejected
 * @param includeDomains domains on the allow-list
 * @param includeEntities entities on the allow-list
 * @since 0.1.0
 */
public record FilterSpecification(
    Set<String> excludeDomains,
    Set<String> excludeEntities,
    Set<String> includeDomains,
    Set<String> includeEntities) {

  private static final FilterSpecification EMPTY =
      new FilterSpecification(Set.of(), Set.of(), Set.of(), Set.of());

  public FilterSpecification {
    excludeDomains = freeze(excludeDomains, "excludeDomains");
    excludeEntities = freeze(excludeEntities, "excludeEntities");
    includeDomains = freeze(includeDomains, "includeDomains");
    includeEntities = freeze(includeEntities, "includeEntities");
  }

  /**
   * Returns the specification with no rules; it passes every entity.
   *
   * @return shared empty specification
   */
  public static FilterSpecification empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Indicates whether all four rule sets are empty.
   *
   * @return {@code true} for the capture-everything specification
   */
  public boolean isEmpty() {
    return excludeDomains.isEmpty()
        && excludeEntities.isEmpty()
        && includeDomains.isEmpty()
        && includeEntities.isEmpty();
  }

  /**
   * Indicates whether an allow-list exists, which makes the specification default-deny.
   *
   * @return {@code true} when {@code includeDomains} or {@code includeEntities} is non-empty
   */
  public boolean hasIncludeRules() {
    return !includeDomains.isEmpty() || !includeEntities.isEmpty();
  }

  private static Set<String> freeze(Set<String> values, String name) {
    if (values == null || values.isEmpty()) {
      return Set.of();
    }
    Set<String> copy = new LinkedHashSet<>(values.size());
    for (String value : values) {
      copy.add(Objects.requireNonNull(value, name + " entry"));
    }
    return Collections.unmodifiableSet(copy);
  }

  /** Mutable builder; each call appends to the named rule set. */
  public static final class Builder {
    private final Set<String> excludeDomains = new LinkedHashSet<>();
    private final Set<String> excludeEntities = new LinkedHashSet<>();
    private final Set<String> includeDomains = new LinkedHashSet<>();
    private final Set<String> includeEntities = new LinkedHashSet<>();

    private Builder() {}

    public Builder excludeDomains(String... domains) {
      return excludeDomains(Arrays.asList(domains));
    }

    public Builder excludeDomains(Collection<String> domains) {
      excludeDomains.addAll(domains);
      return this;
    }

    public Builder excludeEntities(String... entities) {
      return excludeEntities(Arrays.asList(entities));
    }

    public Builder excludeEntities(Collection<String> entities) {
      excludeEntities.addAll(entities);
      return this;
    }

    public Builder includeDomains(String... domains) {
      return includeDomains(Arrays.asList(domains));
    }

    public Builder includeDomains(Collection<String> domains) {
      includeDomains.addAll(domains);
      return this;
    }

    public Builder includeEntities(String... entities) {
      return includeEntities(Arrays.asList(entities));
    }

    public Builder includeEntities(Collection<String> entities) {
      includeEntities.addAll(entities);
      return this;
    }

    public FilterSpecification build() {
      return new FilterSpecification(excludeDomains, excludeEntities, includeDomains, includeEntities);
    }
  }
}
