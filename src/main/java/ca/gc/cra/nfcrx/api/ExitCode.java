package ca.gc.cra.nfcrx.api;

/**
 * <strong>What:</strong> Process exit codes of the receiver.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Capture finished by time limit, signal or stop request. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Configuration file was missing or malformed. */
  CONFIG_ERROR(4),
  /** Capture stopped on a fatal receiver or decoder condition, or failed unexpectedly. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
