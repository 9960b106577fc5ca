package ca.gc.cra.sqlconf.api;

/**
 * <strong>What:</strong> Canonical exit codes of the {@code sqlconf} command-line tool.
 * <p><strong>Why:</strong> Lets build scripts distinguish a missing configuration from a broken one.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The configuration file exists but could not be read. */
  IO_ERROR(3),
  /** Configuration was malformed, unparseable, or its location could not be determined. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** No configuration file exists at the candidate path. */
  NOT_FOUND(6);

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
