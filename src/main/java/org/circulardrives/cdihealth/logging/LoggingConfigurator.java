package org.circulardrives.cdihealth.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the root log level from CLI flags.
 * <p><strong>Role:</strong> Bridges {@code --verbose} and {@code --quiet} to the Logback backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Lowers the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG, "Verbose");
  }

  /** Raises the root logger to WARN so only problems reach stderr. */
  public static void enableQuietLogging() {
    setRootLevel(Level.WARN, "Quiet");
  }

  private static void setRootLevel(Level level, String mode) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("{} logging requested but backend {} does not support dynamic level updates",
        mode, factory.getClass().getName());
  }
}
