package ca.gc.cra.sqlconf.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the {@link ConfigFormat} available at runtime.
 *
 * <p>{@code jackson-dataformat-toml} is an optional dependency. When it is absent, files that exist are
 * reported as {@link ConfigException.ParseDisabled} instead of being parsed.</p>
 *
 * @since 0.1.0
 */
public final class ConfigFormats {
  private static final Logger log = LoggerFactory.getLogger(ConfigFormats.class);
  static final String TOML_MAPPER_CLASS = "com.fasterxml.jackson.dataformat.toml.TomlMapper";

  private ConfigFormats() {
    // Utility
  }

  /**
   * Returns the TOML format when its parser is on the classpath, otherwise a disabled format.
   *
   * @return active configuration format
   */
  public static ConfigFormat detect() {
    return detect(ConfigFormats.class.getClassLoader());
  }

  static ConfigFormat detect(ClassLoader loader) {
    if (isPresent(TOML_MAPPER_CLASS, loader)) {
      return new TomlConfigFormat();
    }
    log.debug("{} not found on classpath; configuration parsing disabled", TOML_MAPPER_CLASS);
    return new DisabledConfigFormat();
  }

  static boolean isPresent(String className, ClassLoader loader) {
    try {
      Class.forName(className, false, loader);
      return true;
    } catch (ClassNotFoundException | LinkageError ex) {
      return false;
    }
  }
}
