package ca.gc.cra.sqlconf.config;

/**
 * Port for turning the text of a configuration file into a {@link SqlConfig}.
 *
 * <p>Implementations must apply defaults for every section and key missing from the document and report
 * failures as {@link ConfigSyntaxException} with the best position the parser can provide.</p>
 *
 * @since 0.1.0
 */
public interface ConfigFormat {

  /**
   * Indicates whether this format can parse documents. A disabled format makes the loader report
   * {@link ConfigException.ParseDisabled} for files that exist.
   *
   * @return {@code true} when {@link #parse(String)} is supported
   */
  boolean enabled();

  /**
   * Parses a complete document.
   *
   * @param text document contents; never {@code null}
   * @return parsed configuration with defaults applied
   * @throws ConfigSyntaxException when the document is malformed or does not match the schema
   */
  SqlConfig parse(String text) throws ConfigSyntaxException;
}
