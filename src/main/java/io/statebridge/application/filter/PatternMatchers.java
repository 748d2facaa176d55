package io.statebridge.application.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiles filter patterns into {@link PatternMatcher}s.
 *
 * <p>A pattern without {@code *} or {@code ?} is an exact, case-sensitive string. Otherwise it is a
 * glob: {@code *} matches any run of characters (including {@code '.'}) and {@code ?} matches exactly
 * one character; every other character is literal.</p>
 */
public final class PatternMatchers {

  private PatternMatchers() {}

  /**
   * Compiles a single pattern.
   *
   * @param pattern exact value or glob; never {@code null}
   * @return compiled matcher
   */
  public static PatternMatcher compile(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    if (!isGlob(pattern)) {
      return new Exact(pattern);
    }
    return new Glob(pattern, Pattern.compile(toRegex(pattern), Pattern.DOTALL));
  }

  /**
   * Compiles a rule set into one matcher that succeeds when any pattern matches.
   *
   * <p>Exact patterns are looked up in a hash set; globs are tried in turn. The result does not
   * depend on the order of {@code patterns}.</p>
   *
   * @param patterns rule set; may be empty
   * @return compiled matcher, {@link PatternMatcher#NONE} for an empty set
   */
  public static PatternMatcher anyOf(Collection<String> patterns) {
    Objects.requireNonNull(patterns, "patterns");
    if (patterns.isEmpty()) {
      return PatternMatcher.NONE;
    }
    Set<String> exact = new HashSet<>();
    List<PatternMatcher> globs = new ArrayList<>();
    for (String pattern : patterns) {
      if (isGlob(pattern)) {
        globs.add(compile(pattern));
      } else {
        exact.add(pattern);
      }
    }
    return new AnyOf(Set.copyOf(exact), List.copyOf(globs));
  }

  /**
   * Indicates whether the pattern contains a wildcard.
   *
   * @param pattern candidate pattern
   * @return {@code true} when {@code *} or {@code ?} is present
   */
  public static boolean isGlob(String pattern) {
    return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
  }

  static String toRegex(String glob) {
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return regex.toString();
  }

  private record Exact(String value) implements PatternMatcher {
    @Override
    public boolean matches(String candidate) {
      return value.equals(candidate);
    }
  }

  private record Glob(String glob, Pattern regex) implements PatternMatcher {
    @Override
    public boolean matches(String candidate) {
      return regex.matcher(candidate).matches();
    }
  }

  private record AnyOf(Set<String> exact, List<PatternMatcher> globs) implements PatternMatcher {
    @Override
    public boolean matches(String candidate) {
      if (exact.contains(candidate)) {
        return true;
      }
      for (PatternMatcher glob : globs) {
        if (glob.matches(candidate)) {
          return true;
        }
      }
      return false;
    }
  }
}
