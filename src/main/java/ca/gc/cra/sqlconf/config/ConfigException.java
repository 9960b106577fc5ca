package ca.gc.cra.sqlconf.config;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of failures raised while locating, reading, or parsing {@code sqlconf.toml}.
 * <p><strong>Why:</strong> Lets callers tell "file absent, use defaults" apart from every failure that must stop
 * the caller, without parsing exception messages.</p>
 * <p><strong>Role:</strong> Checked exception thrown by {@link ConfigLoader} and {@link ConfigPathStrategy}.</p>
 * <p><strong>Thread-safety:</strong> Instances are effectively immutable once thrown.</p>
 * <p><strong>Observability:</strong> Messages always name the file involved, except {@link EnvironmentMissing}
 * which fails before any path exists.</p>
 *
 * @since 0.1.0
 */
public abstract sealed class ConfigException extends Exception
    permits ConfigException.EnvironmentMissing,
        ConfigException.NotFound,
        ConfigException.Io,
        ConfigException.Parse,
        ConfigException.ParseDisabled {

  private static final long serialVersionUID = 1L;

  /** Discriminator for switching on the taxonomy without {@code instanceof} chains. */
  public enum Kind {
    ENVIRONMENT_MISSING,
    NOT_FOUND,
    IO,
    PARSE,
    PARSE_DISABLED
  }

  private final transient Path path;

  private ConfigException(String message, Path path, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /**
   * Classifies a raw I/O failure encountered while touching {@code path}.
   *
   * @param path file that was being read; must not be {@code null}
   * @param error I/O failure reported by the filesystem; must not be {@code null}
   * @return {@link NotFound} when the error denotes a missing file, otherwise {@link Io}
   */
  public static ConfigException fromIo(Path path, IOException error) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(error, "error");
    if (error instanceof NoSuchFileException || error instanceof FileNotFoundException) {
      return new NotFound(path);
    }
    return new Io(path, error);
  }

  /**
   * Returns the taxonomy kind of this failure.
   *
   * @return kind discriminator
   */
  public abstract Kind kind();

  /**
   * Returns the file involved in the failure.
   *
   * @return attempted path; empty only for {@link EnvironmentMissing}
   */
  public Optional<Path> path() {
    return Optional.ofNullable(path);
  }

  /**
   * Returns the attempted path when this failure means the file does not exist.
   *
   * @return path for {@link NotFound}; empty for every other kind
   */
  public Optional<Path> notFoundPath() {
    return Optional.empty();
  }

  /**
   * A required environment variable was absent, blank, or did not form a valid path.
   */
  public static final class EnvironmentMissing extends ConfigException {
    private static final long serialVersionUID = 1L;

    private final String variable;

    /**
     * Creates the failure.
     *
     * @param variable name of the environment variable
     * @param cause underlying failure; {@code null} when the variable was simply unset
     */
    public EnvironmentMissing(String variable, Throwable cause) {
      super("environment variable `" + variable + "` must be set and valid", null, cause);
      this.variable = variable;
    }

    /** @return name of the missing or invalid variable */
    public String variable() {
      return variable;
    }

    @Override
    public Kind kind() {
      return Kind.ENVIRONMENT_MISSING;
    }
  }

  /**
   * The candidate file does not exist. Callers may treat this as "use defaults".
   */
  public static final class NotFound extends ConfigException {
    private static final long serialVersionUID = 1L;

    public NotFound(Path path) {
      super("config file " + quote(path) + " not found", Objects.requireNonNull(path, "path"), null);
    }

    @Override
    public Kind kind() {
      return Kind.NOT_FOUND;
    }

    @Override
    public Optional<Path> notFoundPath() {
      return path();
    }
  }

  /**
   * The candidate file exists but could not be read.
   */
  public static final class Io extends ConfigException {
    private static final long serialVersionUID = 1L;

    public Io(Path path, IOException cause) {
      super("error reading config file " + quote(path), Objects.requireNonNull(path, "path"),
          Objects.requireNonNull(cause, "cause"));
    }

    @Override
    public IOException getCause() {
      return (IOException) super.getCause();
    }

    @Override
    public Kind kind() {
      return Kind.IO;
    }
  }

  /**
   * The file was read but its contents are not a valid configuration document.
   */
  public static final class Parse extends ConfigException {
    private static final long serialVersionUID = 1L;

    public Parse(Path path, ConfigSyntaxException cause) {
      super("error parsing config file " + quote(path) + ": " + cause.diagnostic(),
          Objects.requireNonNull(path, "path"), cause);
    }

    @Override
    public ConfigSyntaxException getCause() {
      return (ConfigSyntaxException) super.getCause();
    }

    @Override
    public Kind kind() {
      return Kind.PARSE;
    }
  }

  /**
   * A configuration file exists but TOML support is not on the classpath.
   */
  public static final class ParseDisabled extends ConfigException {
    private static final long serialVersionUID = 1L;

    public ParseDisabled(Path path) {
      super("found config file at " + quote(path)
              + " but TOML support is not available (add jackson-dataformat-toml to the classpath)",
          Objects.requireNonNull(path, "path"), null);
    }

    @Override
    public Kind kind() {
      return Kind.PARSE_DISABLED;
    }
  }

  private static String quote(Path path) {
    return "\"" + path + "\"";
  }
}
