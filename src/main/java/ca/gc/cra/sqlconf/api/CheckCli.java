package ca.gc.cra.sqlconf.api;

import ca.gc.cra.sqlconf.config.ConfigException;
import ca.gc.cra.sqlconf.config.ConfigLoader;
import ca.gc.cra.sqlconf.config.ConfigPathStrategy;
import ca.gc.cra.sqlconf.config.SqlConfig;
import ca.gc.cra.sqlconf.logging.LoggingConfigurator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that a configuration file exists and parses, reporting the outcome through the exit code.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  private static final String SUMMARY_USAGE = "usage: check [config=PATH | source=project|cwd] [--verbose]";
  private static final String HELP_TEXT = """
      sqlconf check

      Usage:
        check [config=PATH | source=project|cwd]

      Options:
        config=PATH          Read this file instead of the default location
        source=project|cwd   project reads $SQLCONF_PROJECT_DIR/sqlconf.toml (default);
                             cwd reads ./sqlconf.toml
        --verbose            Enable DEBUG logging, including the file contents
        --help               Show this message

      Exit codes:
        0 valid, 3 unreadable, 4 invalid or location unknown, 6 not found
      """;

  private CheckCli() {}

  /**
   * Runs the check against the process-wide loader.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, ConfigLoader.global(), System::getenv);
  }

  static ExitCode run(String[] args, ConfigLoader loader, Function<String, String> environment) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for check");
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
      SqlConfig config = loader.load(strategy);
      CliPrinter.println("OK " + ConfigCliSupport.describeSource(loader));
      CliPrinter.println("  database-url-var = " + config.common().databaseUrlVar());
      CliPrinter.println("  migrations-dir   = " + config.migrate().migrationsDir());
      CliPrinter.println("  table-name       = " + config.migrate().tableName());
      return ExitCode.SUCCESS;
    } catch (ConfigException ex) {
      log.error("Configuration check failed: {}", ex.getMessage());
      CliPrinter.println("FAIL " + ex.getMessage());
      return ConfigCliSupport.exitCodeFor(ex);
    }
  }
}
