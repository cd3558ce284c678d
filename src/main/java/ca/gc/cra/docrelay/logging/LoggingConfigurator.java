package ca.gc.cra.docrelay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels from CLI flags.
 *
 * <p>Intended for single-threaded CLI start-up. Other SLF4J bindings keep their defaults and a warning is logged.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level by name ({@code TRACE}, {@code DEBUG}, {@code INFO}, {@code WARN}, {@code ERROR}).
   *
   * @param levelName level name; unknown names fall back to {@code INFO}
   */
  public static void setRootLevel(String levelName) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level level = Level.toLevel(levelName, Level.INFO);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        levelName, factory.getClass().getName());
  }
}
