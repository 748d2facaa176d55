package io.statebridge.application.filter;

import io.statebridge.domain.filter.FilterSpecification;
import java.util.Objects;

/**
 * Compiles filter specifications into executable {@link CompiledFilter}s.
 */
public final class FilterCompiler {

  private FilterCompiler() {}

  /**
   * Compiles the specification's rule sets into pattern matchers.
   *
   * @param specification rules to compile
   * @return compiled filter; {@link CompiledFilter#MATCH_ALL} for an empty specification
   */
  public static CompiledFilter compile(FilterSpecification specification) {
    Objects.requireNonNull(specification, "specification");
    if (specification.isEmpty()) {
      return CompiledFilter.MATCH_ALL;
    }
    return new CompiledFilter(
        PatternMatchers.anyOf(specification.excludeDomains()),
        PatternMatchers.anyOf(specification.excludeEntities()),
        PatternMatchers.anyOf(specification.includeDomains()),
        PatternMatchers.anyOf(specification.includeEntities()),
        specification.hasIncludeRules());
  }
}
