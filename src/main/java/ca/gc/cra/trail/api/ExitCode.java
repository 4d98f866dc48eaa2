package ca.gc.cra.trail.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by TRAIL commands.
 * <p><strong>Why:</strong> Wrapper scripts distinguish a delivery run with failed records from an integrity halt
 * without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including runs that only produced warnings. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the command. */
  IO_ERROR(3),
  /** Keys or configuration were missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** At least one record could not be delivered. */
  DELIVERY_FAILURE(6),
  /** The hash chain is halted, inconsistent, or failed verification. */
  INTEGRITY_FAILURE(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
