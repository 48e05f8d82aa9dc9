package ca.gc.cra.lens.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches LENS loggers to DEBUG for {@code --verbose}. Third-party packages keep the levels from
 * {@code logback.xml} so exporter chatter does not bury per-conversation lines.
 *
 * <p>Only Logback supports the change; other bindings log a warning and keep their defaults. Call during CLI
 * startup, before worker pools exist.
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  /** Logger namespace that {@code --verbose} raises. */
  public static final String LENS_LOGGER = "ca.gc.cra.lens";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises {@value #LENS_LOGGER} to DEBUG.
   *
   * @return the level that was configured before, or {@code null} when it was inherited or the backend is not
   *     Logback
   */
  public static Level enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return null;
    }
    Logger lens = context.getLogger(LENS_LOGGER);
    Level previous = lens.getLevel();
    lens.setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled for {}", LENS_LOGGER);
    return previous;
  }

  /**
   * Puts {@value #LENS_LOGGER} back to an earlier level; {@code null} means inherit from the root again.
   *
   * @param level level returned by {@link #enableVerboseLogging()}
   */
  public static void restore(Level level) {
    if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      context.getLogger(LENS_LOGGER).setLevel(level);
    }
  }
}
