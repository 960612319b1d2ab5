package com.gentoro.toolbroker.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static YAMLConfiguration yaml(String text) throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(new StringReader(text));
    return config;
  }

  @Test
  void rootComesFirstAndInvalidLevelsAreSkipped() throws Exception {
    Map<String, Level> levels =
        LoggingService.levelOverrides(
            yaml(
                """
                logging:
                  level:
                    okhttp3: warn
                    root: INFO
                    com.example.noise: LOUD
                """));

    assertEquals(List.of(Logger.ROOT_LOGGER_NAME, "okhttp3"), List.copyOf(levels.keySet()));
    assertEquals(Level.INFO, levels.get(Logger.ROOT_LOGGER_NAME));
    assertEquals(Level.WARN, levels.get("okhttp3"));
  }

  @Test
  void noLoggingSectionMeansNoOverrides() throws Exception {
    assertTrue(LoggingService.levelOverrides(yaml("http:\n  port: 0\n")).isEmpty());
  }

  @Test
  void appliesLevelsToLogback() throws Exception {
    LoggingService.applyConfiguration(
        yaml(
            """
            logging:
              level:
                com.gentoro.toolbroker.testing.quiet: ERROR
            """));

    LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
    assertEquals(Level.ERROR, ctx.getLogger("com.gentoro.toolbroker.testing.quiet").getLevel());
  }
}
