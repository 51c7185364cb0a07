package ca.gc.cra.nfcrx.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps the CLI verbosity counter onto the root logging level.
 * <p><strong>Why:</strong> Lets operators raise verbosity one {@code -v} at a time without editing
 * {@code logback.xml}.</p>
 * <p><strong>Levels:</strong> 0 = WARN (default), 1 = INFO, 2 = DEBUG, 3 or more = TRACE.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final Level[] LEVELS = {Level.WARN, Level.INFO, Level.DEBUG, Level.TRACE};

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Resolves the root level for a verbosity counter; saturates at TRACE.
   *
   * @param verbosity number of {@code -v} flags; negative values count as zero
   * @return logback level
   */
  public static Level levelFor(int verbosity) {
    int index = Math.max(0, Math.min(verbosity, LEVELS.length - 1));
    return LEVELS[index];
  }

  /**
   * Sets the root logger level for the supplied verbosity counter.
   *
   * @param verbosity number of {@code -v} flags
   * @return {@code true} when the backend accepted the change
   */
  public static boolean applyVerbosity(int verbosity) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level level = levelFor(verbosity);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Verbosity {} requested but backend {} does not support dynamic level updates",
        verbosity, factory.getClass().getName());
    return false;
  }
}
