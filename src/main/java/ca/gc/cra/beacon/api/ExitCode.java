package ca.gc.cra.beacon.api;

/**
 * <strong>What:</strong> Process exit codes returned by the BEACON command-line tools.
 * <p><strong>Why:</strong> Build scripts branch on the status: a bad configuration file is reported differently
 * from a missing directory or a mistyped argument.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The project directory or configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was rejected by the resolver. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

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
