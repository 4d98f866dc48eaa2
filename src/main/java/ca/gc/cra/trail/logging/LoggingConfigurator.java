package ca.gc.cra.trail.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures TRAIL runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Lets operators raise verbosity with {@code --verbose} while diagnosing delivery or
 * classifier problems without editing {@code logback.xml}.</p>
 * <p>Client libraries stay at INFO in verbose mode: the AWS SDK and Kafka clients log request payloads at DEBUG,
 * and a payload may carry prompt text.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final List<String> QUIET_LOGGERS = List.of("software.amazon.awssdk", "org.apache.kafka", "io.opentelemetry");

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM, capping client libraries at INFO.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (Level.DEBUG.equals(root.getLevel())) {
        return;
      }
      root.setLevel(Level.DEBUG);
      for (String name : QUIET_LOGGERS) {
        Logger client = context.getLogger(name);
        Level configured = client.getLevel();
        if (configured == null || !configured.isGreaterOrEqual(Level.INFO)) {
          client.setLevel(Level.INFO);
        }
      }
      log.debug("Verbose logging enabled");
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
