package org.circulardrives.cdihealth.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  private Level original;

  @BeforeEach
  void rememberLevel() {
    original = root.getLevel();
  }

  @AfterEach
  void restoreLevel() {
    root.setLevel(original);
  }

  @Test
  void verboseLowersRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void quietRaisesRootToWarn() {
    LoggingConfigurator.enableQuietLogging();
    assertEquals(Level.WARN, root.getLevel());
  }
}
