package com.stompws.client.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One STOMP frame. Headers keep their insertion order; a null body means "no body". */
public class StompFrame {
  private final String command;
  private final Map<String, String> headers;
  private final String body;

  public StompFrame(String command, Map<String, String> headers, String body) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command is required");
    }
    this.command = command;
    this.headers =
        Collections.unmodifiableMap(
            headers != null
                ? new LinkedHashMap<String, String>(headers)
                : new LinkedHashMap<String, String>());
    this.body = body;
  }

  public StompFrame(String command, Map<String, String> headers) {
    this(command, headers, null);
  }

  public String getCommand() {
    return command;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public String getHeader(String key) {
    return headers.get(key);
  }

  public String getBody() {
    return body;
  }

  public boolean hasBody() {
    return body != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StompFrame)) {
      return false;
    }
    StompFrame other = (StompFrame) o;
    // header order is part of the frame
    return command.equals(other.command)
        && new ArrayList<Map.Entry<String, String>>(headers.entrySet())
            .equals(new ArrayList<Map.Entry<String, String>>(other.headers.entrySet()))
        && (body == null ? other.body == null : body.equals(other.body));
  }

  @Override
  public int hashCode() {
    int result = command.hashCode();
    result = 31 * result + headers.hashCode();
    result = 31 * result + (body != null ? body.hashCode() : 0);
    return result;
  }

  @Override
  public String toString() {
    return "StompFrame{command="
        + command
        + ", headers="
        + headers
        + ", body="
        + (body != null ? body.length() + " chars" : "none")
        + "}";
  }
}
