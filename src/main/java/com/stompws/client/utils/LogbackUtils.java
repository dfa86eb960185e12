package com.stompws.client.utils;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

public final class LogbackUtils {

  private LogbackUtils() {
    throw new UnsupportedOperationException("Do not instantiate libraries.");
  }

  public static void setLogLevel(String loggerName, String level) {
    Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
    logger.setLevel(Level.toLevel(level, Level.INFO));
  }
}
