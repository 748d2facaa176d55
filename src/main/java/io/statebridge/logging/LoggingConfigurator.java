package io.statebridge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the CLI {@code --verbose} flag to the Logback logger tree.
 *
 * <p>Verbose mode lowers the bridge's own loggers to DEBUG, which exposes per-topic filter decisions
 * and truncated payload previews, and the Kafka client loggers to INFO, which exposes connection and
 * consumer-group events. The root level is left as configured so third-party libraries stay
 * quiet.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String BRIDGE_LOGGER = "io.statebridge";
  static final String KAFKA_CLIENT_LOGGER = "org.apache.kafka";

  private LoggingConfigurator() {}

  /**
   * Switches the bridge and Kafka client loggers to their verbose levels.
   *
   * @return {@code true} when the levels were applied; {@code false} when the SLF4J backend is not
   *     Logback, in which case its own configuration stays in effect
   */
  public static boolean enableVerboseLogging() {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} is not Logback; keeping its levels",
          LoggerFactory.getILoggerFactory().getClass().getName());
      return false;
    }
    context.getLogger(BRIDGE_LOGGER).setLevel(Level.DEBUG);
    context.getLogger(KAFKA_CLIENT_LOGGER).setLevel(Level.INFO);
    log.debug("Verbose logging enabled: {} at DEBUG, {} at INFO", BRIDGE_LOGGER, KAFKA_CLIENT_LOGGER);
    return true;
  }
}
