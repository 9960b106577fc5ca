package ca.gc.cra.sqlconf.api;

import ca.gc.cra.sqlconf.config.ConfigException;
import ca.gc.cra.sqlconf.config.ConfigPathStrategy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the candidate configuration path without reading or caching anything.
 *
 * @since 0.1.0
 */
public final class PathCli {
  private static final Logger log = LoggerFactory.getLogger(PathCli.class);
  private static final String SUMMARY_USAGE = "usage: path [config=PATH | source=project|cwd]";

  private PathCli() {}

  static ExitCode run(String[] args) {
    return run(args, System::getenv);
  }

  static ExitCode run(String[] args, Function<String, String> environment) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }

    ConfigPathStrategy strategy;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.arguments()));
      strategy = ConfigCliSupport.strategyFor(kv, environment);
      ConfigCliSupport.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Path candidate = strategy.resolve().toAbsolutePath().normalize();
      CliPrinter.println(candidate + (Files.exists(candidate) ? " (exists)" : " (missing)"));
      return ExitCode.SUCCESS;
    } catch (ConfigException ex) {
      log.error("Unable to resolve configuration path: {}", ex.getMessage());
      CliPrinter.println("FAIL " + ex.getMessage());
      return ConfigCliSupport.exitCodeFor(ex);
    }
  }
}
