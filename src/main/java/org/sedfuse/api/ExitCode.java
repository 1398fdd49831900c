package org.sedfuse.api;

/**
 * <strong>What:</strong> Process exit codes shared by the sedfuse commands.
 * <p><strong>Why:</strong> Lets batch scripts tell bad arguments, unreadable files, and broken configuration
 * apart without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the source list or writing results failed. */
  IO_ERROR(3),
  /** Grammar, template, or other configuration was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The run was interrupted before every source was processed. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
