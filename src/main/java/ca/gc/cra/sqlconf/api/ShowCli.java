package ca.gc.cra.sqlconf.api;

import ca.gc.cra.sqlconf.config.ConfigLoadFailure;
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
 * Prints the effective configuration, with defaults filled in, as TOML.
 *
 * <p>A missing file is not an error here: the defaults are printed, mirroring what the tooling would use.</p>
 *
 * @since 0.1.0
 */
public final class ShowCli {
  private static final Logger log = LoggerFactory.getLogger(ShowCli.class);
  private static final String SUMMARY_USAGE = "usage: show [config=PATH | source=project|cwd] [--verbose]";
  private static final String HELP_TEXT = """
      sqlconf show

      Usage:
        show [config=PATH | source=project|cwd]

      Prints the effective configuration. Keys missing from the file are shown with their defaults;
      a missing file prints the defaults.

      Options:
        config=PATH          Read this file instead of the default location
        source=project|cwd   project reads $SQLCONF_PROJECT_DIR/sqlconf.toml (default);
                             cwd reads ./sqlconf.toml
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private ShowCli() {}

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
      log.debug("Verbose logging enabled for show");
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

    SqlConfig config;
    try {
      config = loader.loadOrDefault(strategy);
    } catch (ConfigLoadFailure ex) {
      CliPrinter.println("FAIL " + ex.getCause().getMessage());
      return ConfigCliSupport.exitCodeFor(ex.getCause());
    }

    try {
      CliPrinter.println("# source: " + ConfigCliSupport.describeSource(loader));
      CliPrinter.printBlock(ConfigCliSupport.render(loader, config));
      return ExitCode.SUCCESS;
    } catch (IllegalStateException ex) {
      log.error("Unable to render configuration", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
