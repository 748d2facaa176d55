package io.statebridge.application.filter;

import io.statebridge.domain.entity.EntityId;
import io.statebridge.domain.filter.FilterSpecification;
import java.util.Objects;

/**
 * Pure entry point for one-off filter decisions.
 *
 * <p>The dispatcher evaluates pre-compiled filters; this facade compiles on each call and is meant
 * for dry runs and tests.</p>
 */
public final class FilterEvaluator {

  private FilterEvaluator() {}

  /**
   * Decides whether the entity passes the filter.
   *
   * @param entityId raw entity id
   * @param filter effective filter
   * @return {@code true} when the entity passes
   */
  public static boolean evaluate(String entityId, FilterSpecification filter) {
    return evaluate(EntityId.of(entityId), filter);
  }

  public static boolean evaluate(EntityId entityId, FilterSpecification filter) {
    Objects.requireNonNull(filter, "filter");
    return FilterCompiler.compile(filter).test(entityId);
  }
}
