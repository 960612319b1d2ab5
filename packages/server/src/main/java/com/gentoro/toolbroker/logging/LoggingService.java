package com.gentoro.toolbroker.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logger lookup for the broker, plus log levels overridden from the {@code logging.level} tree. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply log levels from the application configuration on top of {@code logback.xml}:
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.toolbroker.transport: DEBUG
   *     okhttp3: WARN
   * </pre>
   *
   * Does nothing when Logback is not the bound SLF4J backend.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.debug("Logback is not the active SLF4J backend; YAML log levels ignored");
      return;
    }
    for (Map.Entry<String, Level> e : levelOverrides(cfg).entrySet()) {
      ctx.getLogger(e.getKey()).setLevel(e.getValue());
      log.debug("Logger '{}' set to {}", e.getKey(), e.getValue());
    }
  }

  /**
   * Logger name to level, root first. Entries with a blank or unknown level are skipped with a
   * warning.
   */
  static Map<String, Level> levelOverrides(Configuration cfg) {
    Map<String, Level> result = new LinkedHashMap<>();
    Configuration levels = cfg.subset("logging.level");
    String root = levels.getString("root", null);
    putLevel(result, Logger.ROOT_LOGGER_NAME, root);

    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      if (!"root".equalsIgnoreCase(key)) {
        // dots inside a YAML key come back escaped as ".."
        putLevel(result, key.replace("..", "."), levels.getString(key, null));
      }
    }
    return result;
  }

  private static void putLevel(Map<String, Level> target, String loggerName, String value) {
    if (value == null || value.isBlank()) return;
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}' for logger {}; ignored", value, loggerName);
      return;
    }
    target.put(loggerName, level);
  }
}
