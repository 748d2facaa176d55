package io.statebridge.application.filter;

/**
 * Compiled matcher for a single filter pattern or a set of patterns.
 *
 * <p>Implementations are immutable and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PatternMatcher {
  /**
   * Tests the candidate against this matcher, case-sensitively.
   *
   * @param candidate entity id or bare domain; never {@code null}
   * @return {@code true} on a match
   */
  boolean matches(String candidate);

  /** Matcher that matches nothing; used for empty rule sets. */
  PatternMatcher NONE = candidate -> false;
}
