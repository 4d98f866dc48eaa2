package ca.gc.cra.trail.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final Map<String, Level> saved = new HashMap<>();

  @BeforeEach
  void saveLevels() {
    saved.put(org.slf4j.Logger.ROOT_LOGGER_NAME, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
    for (String name : LoggingConfigurator.QUIET_LOGGERS) {
      saved.put(name, context.getLogger(name).getLevel());
    }
  }

  @AfterEach
  void restoreLevels() {
    saved.forEach((name, level) -> context.getLogger(name).setLevel(level));
  }

  @Test
  void verboseRaisesRootButKeepsClientLibrariesQuiet() {
    context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
    context.getLogger("org.apache.kafka").setLevel(Level.ERROR);
    context.getLogger("software.amazon.awssdk").setLevel(null);

    LoggingConfigurator.enableVerboseLogging();

    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    assertEquals(Level.DEBUG, root.getLevel());
    assertEquals(Level.ERROR, context.getLogger("org.apache.kafka").getLevel());
    assertEquals(Level.INFO, context.getLogger("software.amazon.awssdk").getLevel());
    assertEquals(Level.INFO, context.getLogger("software.amazon.awssdk.request").getEffectiveLevel());
  }
}
