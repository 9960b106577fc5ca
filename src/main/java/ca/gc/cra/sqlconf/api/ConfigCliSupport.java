package ca.gc.cra.sqlconf.api;

import ca.gc.cra.sqlconf.config.ConfigException;
import ca.gc.cra.sqlconf.config.ConfigLoader;
import ca.gc.cra.sqlconf.config.ConfigPathStrategy;
import ca.gc.cra.sqlconf.config.SqlConfig;
import ca.gc.cra.sqlconf.config.TomlConfigFormat;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared helpers for the configuration subcommands: path selection, exit-code mapping, and rendering.
 */
final class ConfigCliSupport {

  private ConfigCliSupport() {}

  /**
   * Builds the path strategy selected by {@code config=PATH} or {@code source=project|cwd}, removing both keys.
   *
   * @param args mutable argument map
   * @param environment environment lookup used by the project directory strategy
   * @return selected strategy; {@code source=project} when neither key is present
   * @throws IllegalArgumentException when both keys are given or {@code source} is unknown
   */
  static ConfigPathStrategy strategyFor(Map<String, String> args, Function<String, String> environment) {
    String config = args.remove("config");
    String source = args.remove("source");
    if (config != null) {
      if (source != null) {
        throw new IllegalArgumentException("config and source are mutually exclusive");
      }
      return ConfigPathStrategy.literal(Path.of(config));
    }
    String normalized = source == null ? "project" : source.toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "project" -> ConfigPathStrategy.projectDir(environment);
      case "cwd" -> ConfigPathStrategy.currentDir();
      default -> throw new IllegalArgumentException("source must be project or cwd (was " + source + ")");
    };
  }

  static void rejectUnknown(Map<String, String> args) {
    if (!args.isEmpty()) {
      throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", args.keySet()));
    }
  }

  static ExitCode exitCodeFor(ConfigException ex) {
    return switch (ex.kind()) {
      case NOT_FOUND -> ExitCode.NOT_FOUND;
      case IO -> ExitCode.IO_ERROR;
      case ENVIRONMENT_MISSING, PARSE, PARSE_DISABLED -> ExitCode.CONFIG_ERROR;
    };
  }

  static String describeSource(ConfigLoader loader) {
    return loader.source().map(Path::toString).orElse("defaults (no config file)");
  }

  static String render(ConfigLoader loader, SqlConfig config) {
    if (loader.format() instanceof TomlConfigFormat toml) {
      return toml.render(config);
    }
    return config.toString();
  }
}
