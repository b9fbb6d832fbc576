package com.gentoro.queuemgr.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.io.File;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and for applying logging settings from the application
 * configuration.
 *
 * <p>Recognized keys:
 *
 * <ul>
 *   <li>{@code logging.level.<logger>}: level for a logger name, {@code root} for the root logger
 *   <li>{@code logging.directory}: when set, a daily rolling file appender writes {@code
 *       queuemgr.log} into that directory
 * </ul>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";
  private static final String FILE_APPENDER = "QUEUEMGR_FILE";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.*} keys to the Logback context. No-op when Logback is not bound. */
  public static void applyConfiguration(Configuration configuration) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context) || configuration == null) {
      return;
    }

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String loggerName = key.substring(LEVEL_PREFIX.length());
      // dotted logger names come back with escaped (doubled) delimiters
      loggerName = StringUtils.removeStart(loggerName, ".").replace("..", ".");
      if (loggerName.isEmpty() || "root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      String value = configuration.getString(key);
      if (StringUtils.isNotBlank(value)) {
        context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
      }
    }

    String directory = configuration.getString("logging.directory", null);
    if (StringUtils.isNotBlank(directory)) {
      attachFileAppender(context, new File(directory));
    }
  }

  private static void attachFileAppender(LoggerContext context, File logsDir) {
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root.getAppender(FILE_APPENDER) != null) {
      return;
    }
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName(FILE_APPENDER);
    fileAppender.setFile(new File(logsDir, "queuemgr.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(new File(logsDir, "queuemgr.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    getLogger(LoggingService.class).info("File logging enabled at {}", fileAppender.getFile());
  }
}
