package io.statebridge.validation;

/**
 * Numeric validation helpers used by configuration parsing and CLI options.
 *
 * <p>Violations raise {@link IllegalArgumentException} with the parameter name and bounds.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates a TCP port number.
   *
   * @param name logical parameter name
   * @param value candidate port
   * @return the validated port
   * @throws IllegalArgumentException if the port is outside {@code 1..65535}
   */
  public static int requirePort(String name, long value) {
    return (int) requireRange(name, value, 1, 65535);
  }
}
