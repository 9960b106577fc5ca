package ca.gc.cra.sqlconf.config;

/**
 * Format-neutral parse failure raised by a {@link ConfigFormat}.
 *
 * <p>Wraps whatever the underlying parser throws and keeps the position it reported so that
 * {@link ConfigException.Parse} can render a diagnosable message without depending on the parser's
 * exception types.</p>
 *
 * @since 0.1.0
 */
public final class ConfigSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Value of {@link #line()} and {@link #column()} when the parser reported no position. */
  public static final int UNKNOWN = -1;

  private final int line;
  private final int column;

  /**
   * Creates an exception with a descriptive message and an optional position.
   *
   * @param msg human-readable parser message, without position information
   * @param line 1-based line, or {@link #UNKNOWN}
   * @param column 1-based column, or {@link #UNKNOWN}
   * @param cause parser exception
   */
  public ConfigSyntaxException(String msg, int line, int column, Throwable cause) {
    super(msg, cause);
    this.line = line > 0 ? line : UNKNOWN;
    this.column = column > 0 ? column : UNKNOWN;
  }

  /** @return 1-based line of the failure, or {@link #UNKNOWN} */
  public int line() {
    return line;
  }

  /** @return 1-based column of the failure, or {@link #UNKNOWN} */
  public int column() {
    return column;
  }

  /** @return {@code true} when the parser reported a line */
  public boolean hasLocation() {
    return line != UNKNOWN;
  }

  /**
   * Renders the message prefixed with its position, e.g. {@code line 3, column 9: Unexpected character}.
   *
   * @return diagnostic text suitable for operators
   */
  public String diagnostic() {
    if (!hasLocation()) {
      return getMessage();
    }
    StringBuilder sb = new StringBuilder("line ").append(line);
    if (column != UNKNOWN) {
      sb.append(", column ").append(column);
    }
    return sb.append(": ").append(getMessage()).toString();
  }
}
