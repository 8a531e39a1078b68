package ca.gc.cra.snapline.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Raises snapshot logging verbosity at runtime when settings ask for it.
 *
 * <p>Only Logback supports dynamic level changes here; any other SLF4J binding keeps its configured levels and a
 * warning is logged.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger hierarchy owned by this library. */
  public static final String LIBRARY_LOGGER = "ca.gc.cra.snapline";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the library logger hierarchy to DEBUG.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(LIBRARY_LOGGER);
      if (!Level.DEBUG.equals(logger.getLevel())) {
        logger.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
