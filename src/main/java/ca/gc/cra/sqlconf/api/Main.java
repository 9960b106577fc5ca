package ca.gc.cra.sqlconf.api;

import ca.gc.cra.sqlconf.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sqlconf CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sqlconf <check|show|path> [options]";
  private static final String HELP_TEXT = """
      sqlconf command dispatcher

      Usage:
        sqlconf <command> [options]

      Commands:
        check   Verify that sqlconf.toml exists and parses (check --help for details)
        show    Print the effective configuration with defaults filled in
        path    Print the candidate path of sqlconf.toml

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String[] remainder = input.arguments();
    if (input.help() && remainder.length == 0) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(remainder, 1, remainder.length);
    if (input.help()) {
      delegateArgs = append(delegateArgs, "--help");
    }

    try {
      return switch (command) {
        case "check" -> CheckCli.run(delegateArgs);
        case "show" -> ShowCli.run(delegateArgs);
        case "path" -> PathCli.run(delegateArgs);
        default -> {
          log.error("Unknown command: {}", command);
          CliPrinter.println(SUMMARY_USAGE);
          yield ExitCode.INVALID_ARGS;
        }
      };
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
