package com.gentoro.onepress.logging;

import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and to apply levels from the application settings. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure: logging: level: root: INFO com.gentoro.onepress: DEBUG
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext ctx)) {
      log.debug("Logging backend is not Logback; leaving levels untouched");
      return;
    }

    String rootLvl = cfg.getString("logging.level.root", null);
    if (rootLvl != null && !rootLvl.isBlank()) {
      setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
    }

    Configuration levels = cfg.subset("logging.level");
    Iterator<String> it = levels.getKeys();
    while (it.hasNext()) {
      String key = it.next();
      if ("root".equalsIgnoreCase(key)) continue;
      String lvl = levels.getString(key, null);
      if (lvl == null || lvl.isBlank()) continue;
      // hierarchical configurations escape the dots of package names as ".."
      setLevel(ctx.getLogger(key.replace("..", ".")), lvl);
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
