package ca.gc.cra.sqlconf.config;

/**
 * Placeholder format used when no TOML support is on the classpath.
 *
 * @since 0.1.0
 */
public final class DisabledConfigFormat implements ConfigFormat {

  /**
   * Always {@code false}.
   *
   * @return {@code false}
   */
  @Override
  public boolean enabled() {
    return false;
  }

  /**
   * Always throws; the loader checks {@link #enabled()} first.
   *
   * @param text ignored
   * @return never returns normally
   */
  @Override
  public SqlConfig parse(String text) {
    throw new UnsupportedOperationException("TOML support is not available");
  }

  @Override
  public String toString() {
    return "disabled";
  }
}
