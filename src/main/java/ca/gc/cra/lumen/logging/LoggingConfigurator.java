package ca.gc.cra.lumen.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures LUMEN runtime logging for CLI-driven debug sessions.
 * <p><strong>Why:</strong> Lets a user see wire traffic and attach diagnostics with {@code --verbose} without
 * editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the level of a named logger, e.g. {@code ca.gc.cra.lumen.infrastructure.transport}.
   *
   * @param loggerName logger name; {@code ROOT} addresses the root logger
   * @param level level name understood by Logback ({@code TRACE}..{@code ERROR}); unknown names map to DEBUG
   */
  public static void setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.DEBUG));
      return;
    }
    log.warn("Log level change for {} ignored; backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
