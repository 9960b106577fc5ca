package ca.gc.cra.sqlconf.config;

import java.util.Objects;

/**
 * Unchecked failure raised by {@link ConfigLoader#loadOrDefault(ConfigPathStrategy)} when a configuration file
 * exists but cannot be used.
 *
 * <p>Proceeding with defaults in that situation could run migrations against the wrong table or directory, so
 * the strict entry point stops the caller instead.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoadFailure extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Wraps the fatal configuration failure.
   *
   * @param cause failure of any kind other than {@link ConfigException.NotFound}
   */
  public ConfigLoadFailure(ConfigException cause) {
    super(messageFor(Objects.requireNonNull(cause, "cause")), cause);
  }

  @Override
  public ConfigException getCause() {
    return (ConfigException) super.getCause();
  }

  private static String messageFor(ConfigException cause) {
    if (cause.kind() == ConfigException.Kind.PARSE_DISABLED) {
      return cause.getMessage();
    }
    return "failed to read sqlconf config: " + cause.getMessage();
  }
}
