package com.stompws.client.utils;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ClientUtils {
  private static final Logger log = LoggerFactory.getLogger(ClientUtils.class);

  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final ObjectMapper prettyObjectMapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static String toJsonString(Object o) {
    try {
      return objectMapper.writeValueAsString(o);
    } catch (Exception e) {
      log.error("", e);
    }
    return null;
  }

  /** @return indented JSON when the payload parses as JSON, otherwise the payload unchanged */
  public static String prettyJson(String payload) {
    if (payload == null) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(payload);
      if (node == null || node.isMissingNode()) {
        return payload;
      }
      return prettyObjectMapper.writeValueAsString(node);
    } catch (Exception e) {
      return payload;
    }
  }

  /**
   * Convert space-separated {@code key=value} pairs into a JSON object. Values that look like
   * integers or decimals become numbers; tokens without '=' are skipped.
   */
  public static String formatJsonPayload(String payload) {
    Map<String, Object> values = new LinkedHashMap<String, Object>();
    if (StringUtils.isBlank(payload)) {
      return toJsonString(values);
    }
    for (String pair : StringUtils.split(payload)) {
      int idx = pair.indexOf('=');
      if (idx < 0) {
        continue;
      }
      String key = pair.substring(0, idx);
      String value = pair.substring(idx + 1);
      values.put(key, parseNumber(value));
    }
    return toJsonString(values);
  }

  private static Object parseNumber(String value) {
    try {
      if (value.contains(".")) {
        return Double.parseDouble(value);
      }
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return value;
    }
  }

  /** @return subscription id as "sub-{epochSeconds}-{8 hex chars}" */
  public static String newSubscriptionId() {
    return "sub-"
        + (System.currentTimeMillis() / 1000)
        + "-"
        + UUID.randomUUID().toString().substring(0, 8);
  }

  public static Logger prefixLogger(Logger log, String logPrefix) {
    Level level = ((ch.qos.logback.classic.Logger) log).getEffectiveLevel();
    Logger newLog = LoggerFactory.getLogger(log.getName() + "[" + logPrefix + "]");
    ((ch.qos.logback.classic.Logger) newLog).setLevel(level);
    return newLog;
  }

  public static String maskString(String value) {
    return maskString(value, 3);
  }

  private static String maskString(String value, int startEnd) {
    if (value.length() <= startEnd) {
      return value;
    }
    return value.substring(0, Math.min(startEnd, value.length()))
        + "..."
        + value.substring(Math.max(0, value.length() - startEnd), value.length());
  }

  /** Escape control characters so that a frame can be logged on one line. */
  public static String printable(String wire) {
    if (wire == null) {
      return null;
    }
    return wire.replace("\r", "\\r").replace("\n", "\\n").replace("\u0000", "^@");
  }

  public static void setLogLevel(String mainLevel) {
    LogbackUtils.setLogLevel("com.stompws", mainLevel);
  }
}
