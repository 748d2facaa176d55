package io.statebridge.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the bridge commands.
 * <p><strong>Why:</strong> Lets service managers and scripts tell configuration mistakes apart from
 * broker or runtime failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The configuration file or event input could not be read. */
  IO_ERROR(3),
  /** Configuration was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
