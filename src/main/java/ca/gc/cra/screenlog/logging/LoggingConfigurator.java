package ca.gc.cra.screenlog.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime log level control for the CLI.
 * <p><strong>Why:</strong> {@code --verbose} raises SCREENLOG and root logging to DEBUG without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Call from the CLI startup thread.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String BASE_LOGGER = "ca.gc.cra.screenlog";

  private LoggingConfigurator() {}

  /**
   * Sets the root and {@code ca.gc.cra.screenlog} loggers to DEBUG. Logs a warning when the SLF4J backend is not
   * Logback.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
          factory.getClass().getName());
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.DEBUG);
    context.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled");
  }
}
