package io.statebridge.application.filter;

import io.statebridge.domain.entity.EntityId;
import java.util.Objects;
import java.util.Optional;

/**
 * Executable form of a {@link io.statebridge.domain.filter.FilterSpecification}.
 *
 * <p>Rule categories are checked in a fixed precedence and the first deciding category wins:</p>
 * <ol>
 *   <li>entity in {@code excludeEntities}: reject</li>
 *   <li>domain in {@code excludeDomains} and entity not in {@code includeEntities}: reject</li>
 *   <li>entity in {@code includeEntities}: pass</li>
 *   <li>domain in {@code includeDomains}: pass</li>
 *   <li>any include rule configured: reject</li>
 *   <li>otherwise: pass</li>
 * </ol>
 * <p>Immutable and thread-safe; {@link #test(EntityId)} is pure.</p>
 *
 * @since 0.1.0
 */
public final class CompiledFilter {
  /** Filter without rules; passes every entity. */
  public static final CompiledFilter MATCH_ALL = new CompiledFilter(
      PatternMatcher.NONE, PatternMatcher.NONE, PatternMatcher.NONE, PatternMatcher.NONE, false);

  private final PatternMatcher excludeDomains;
  private final PatternMatcher excludeEntities;
  private final PatternMatcher includeDomains;
  private final PatternMatcher includeEntities;
  private final boolean defaultDeny;

  CompiledFilter(
      PatternMatcher excludeDomains,
      PatternMatcher excludeEntities,
      PatternMatcher includeDomains,
      PatternMatcher includeEntities,
      boolean defaultDeny) {
    this.excludeDomains = Objects.requireNonNull(excludeDomains, "excludeDomains");
    this.excludeEntities = Objects.requireNonNull(excludeEntities, "excludeEntities");
    this.includeDomains = Objects.requireNonNull(includeDomains, "includeDomains");
    this.includeEntities = Objects.requireNonNull(includeEntities, "includeEntities");
    this.defaultDeny = defaultDeny;
  }

  /**
   * Decides whether the entity passes this filter.
   *
   * @param entityId entity to test
   * @return {@code true} when the entity passes
   */
  public boolean test(EntityId entityId) {
    Objects.requireNonNull(entityId, "entityId");
    String id = entityId.value();
    if (excludeEntities.matches(id)) {
      return false;
    }
    Optional<String> domain = entityId.domain();
    boolean entityIncluded = includeEntities.matches(id);
    if (domain.isPresent() && excludeDomains.matches(domain.get()) && !entityIncluded) {
      return false;
    }
    if (entityIncluded) {
      return true;
    }
    if (domain.isPresent() && includeDomains.matches(domain.get())) {
      return true;
    }
    return !defaultDeny;
  }

  /**
   * Indicates whether the filter rejects entities that match no include rule.
   *
   * @return {@code true} when an allow-list is configured
   */
  public boolean defaultDeny() {
    return defaultDeny;
  }
}
