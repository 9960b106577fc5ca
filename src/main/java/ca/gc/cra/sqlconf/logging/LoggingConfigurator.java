package ca.gc.cra.sqlconf.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts sqlconf logging levels from the command line.
 * <p><strong>Why:</strong> Lets users see which file was read, and its contents, without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their configuration.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String BASE_LOGGER = "ca.gc.cra.sqlconf";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the sqlconf logger hierarchy to DEBUG so loader diagnostics become visible.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableVerboseLogging() {
    return setLevel(BASE_LOGGER, Level.DEBUG);
  }

  static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
