package org.sedfuse.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches sedfuse loggers to DEBUG for {@code --verbose} runs.
 * <p>Only the {@code org.sedfuse} hierarchy is raised, so per-row catalog rejections become visible while the
 * OpenTelemetry SDK and other libraries keep the levels from {@code logback.xml}.</p>
 *
 * @implNote Requires Logback; other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy raised by {@link #enableVerboseLogging()}. */
  public static final String APPLICATION_LOGGER = "org.sedfuse";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the {@value #APPLICATION_LOGGER} logger to DEBUG for the rest of the JVM's life.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} is not Logback", factory.getClass().getName());
      return;
    }
    Logger application = context.getLogger(APPLICATION_LOGGER);
    application.setLevel(Level.DEBUG);
  }
}
