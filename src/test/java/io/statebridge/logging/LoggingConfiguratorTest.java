package io.statebridge.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger bridge;
  private Logger kafka;
  private Logger root;
  private Level previousBridge;
  private Level previousKafka;
  private Level previousRoot;

  @BeforeEach
  void setUp() {
    bridge = (Logger) LoggerFactory.getLogger(LoggingConfigurator.BRIDGE_LOGGER);
    kafka = (Logger) LoggerFactory.getLogger(LoggingConfigurator.KAFKA_CLIENT_LOGGER);
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    previousBridge = bridge.getLevel();
    previousKafka = kafka.getLevel();
    previousRoot = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    bridge.setLevel(previousBridge);
    kafka.setLevel(previousKafka);
    root.setLevel(previousRoot);
  }

  @Test
  void verboseLoggingLowersBridgeAndKafkaClientLevels() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, bridge.getLevel());
    assertEquals(Level.INFO, kafka.getLevel());
    assertTrue(LoggerFactory.getLogger("io.statebridge.application.dispatch.EventDispatcher").isDebugEnabled());
  }

  @Test
  void verboseLoggingLeavesRootLevelAlone() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(previousRoot, root.getLevel());
    assertEquals(Level.INFO, root.getEffectiveLevel());
  }
}
