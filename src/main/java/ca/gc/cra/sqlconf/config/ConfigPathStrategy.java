package ca.gc.cra.sqlconf.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Produces the candidate path of {@code sqlconf.toml} before any filesystem access.
 *
 * <p>{@link ConfigLoader} invokes a strategy at most once per initialization attempt and never when the
 * configuration is already cached. Strategies must not call back into the loader.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConfigPathStrategy {

  /** File name looked up by the built-in strategies. */
  String FILE_NAME = "sqlconf.toml";

  /** Environment variable naming the root directory of the project being built. */
  String PROJECT_DIR_VAR = "SQLCONF_PROJECT_DIR";

  /**
   * Resolves the candidate path.
   *
   * @return path to read; need not exist
   * @throws ConfigException when the path cannot be determined, typically {@link ConfigException.EnvironmentMissing}
   */
  Path resolve() throws ConfigException;

  /**
   * {@code $SQLCONF_PROJECT_DIR/sqlconf.toml}, read from the process environment.
   *
   * @return project directory strategy
   */
  static ConfigPathStrategy projectDir() {
    return projectDir(System::getenv);
  }

  /**
   * {@code $SQLCONF_PROJECT_DIR/sqlconf.toml} using the supplied environment lookup.
   *
   * @param environment variable lookup returning {@code null} for unset variables
   * @return project directory strategy
   */
  static ConfigPathStrategy projectDir(Function<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    return () -> {
      String dir = environment.apply(PROJECT_DIR_VAR);
      if (dir == null || dir.isBlank()) {
        throw new ConfigException.EnvironmentMissing(PROJECT_DIR_VAR, null);
      }
      try {
        return Path.of(dir.trim()).resolve(FILE_NAME);
      } catch (InvalidPathException ex) {
        throw new ConfigException.EnvironmentMissing(PROJECT_DIR_VAR, ex);
      }
    };
  }

  /**
   * {@code sqlconf.toml} relative to the working directory.
   *
   * @return current directory strategy
   */
  static ConfigPathStrategy currentDir() {
    return () -> Path.of(FILE_NAME);
  }

  /**
   * Returns {@code path} unconditionally.
   *
   * @param path file to read
   * @return literal strategy
   */
  static ConfigPathStrategy literal(Path path) {
    Objects.requireNonNull(path, "path");
    return () -> path;
  }
}
