package ca.gc.cra.sqlconf.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Arguments of one {@code sqlconf} invocation: the {@code --help} and {@code --verbose} switches plus the
 * remaining positional and {@code key=value} tokens.
 */
final class CliInput {
  private final List<String> arguments;
  private final boolean help;
  private final boolean verbose;

  private CliInput(List<String> arguments, boolean help, boolean verbose) {
    this.arguments = arguments;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Splits raw arguments into switches and the remaining tokens.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   * @throws IllegalArgumentException for an option other than the help and verbose switches
   */
  static CliInput parse(String[] args) {
    List<String> remaining = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        switch (arg.toLowerCase(Locale.ROOT)) {
          case "--help", "-h", "help" -> help = true;
          case "--verbose", "-v" -> verbose = true;
          default -> {
            if (arg.startsWith("-")) {
              throw new IllegalArgumentException("unknown option: " + arg);
            }
            remaining.add(arg);
          }
        }
      }
    }
    return new CliInput(List.copyOf(remaining), help, verbose);
  }

  /** @return the command name and {@code key=value} tokens, in order */
  String[] arguments() {
    return arguments.toArray(String[]::new);
  }

  boolean help() {
    return help;
  }

  boolean verbose() {
    return verbose;
  }
}
