package com.stompws.client;

import com.stompws.client.transport.TlsTrustPolicy;
import java.util.List;
import org.springframework.boot.ApplicationArguments;
import org.springframework.util.Assert;

/** Parsing command-line client arguments. */
public class ApplicationArgs {
  public static final String USAGE =
      "--host=<host> --topic=<destination> [--port=61614] [--username=<login>]"
          + " [--password=<passcode>] [--ssl] [--sockjs] [--insecure] [--send=<payload> [--json]]"
          + " [--heartbeat=<seconds>] [--debug]";

  private static final String ARG_HOST = "host";
  private static final String ARG_PORT = "port";
  private static final String ARG_TOPIC = "topic";
  private static final String ARG_USERNAME = "username";
  private static final String ARG_PASSWORD = "password";
  private static final String ARG_SSL = "ssl";
  private static final String ARG_SOCKJS = "sockjs";
  private static final String ARG_SEND = "send";
  private static final String ARG_JSON = "json";
  private static final String ARG_HEARTBEAT = "heartbeat";
  private static final String ARG_INSECURE = "insecure";
  private static final String ARG_DEBUG = "debug";

  private static final int PORT_DEFAULT = 61614;
  private static final int HEARTBEAT_DEFAULT = 10;

  private ApplicationArguments args;

  public ApplicationArgs(ApplicationArguments args) {
    this.args = args;
  }

  public String getHost() {
    return requireOption(ARG_HOST);
  }

  public int getPort() {
    return getIntOption(ARG_PORT, PORT_DEFAULT);
  }

  /** @return host:port as used in the websocket url */
  public String getHostWithPort() {
    return getHost() + ":" + getPort();
  }

  public String getTopic() {
    return requireOption(ARG_TOPIC);
  }

  public String getUsername() {
    return getOption(ARG_USERNAME);
  }

  public String getPassword() {
    return getOption(ARG_PASSWORD);
  }

  public boolean isSsl() {
    return args.containsOption(ARG_SSL);
  }

  public boolean isSockjs() {
    return args.containsOption(ARG_SOCKJS);
  }

  /** @return payload to send, or null to subscribe and listen */
  public String getSend() {
    return getOption(ARG_SEND);
  }

  public boolean isJson() {
    return args.containsOption(ARG_JSON);
  }

  /** @return heartbeat interval in seconds */
  public int getHeartbeat() {
    int heartbeat = getIntOption(ARG_HEARTBEAT, HEARTBEAT_DEFAULT);
    Assert.isTrue(heartbeat > 0, "--" + ARG_HEARTBEAT + " must be positive");
    return heartbeat;
  }

  public boolean isInsecure() {
    return args.containsOption(ARG_INSECURE);
  }

  public TlsTrustPolicy getTlsTrustPolicy() {
    return isInsecure() ? TlsTrustPolicy.TRUST_ALL : TlsTrustPolicy.VERIFY;
  }

  public boolean isDebug() {
    return args.containsOption(ARG_DEBUG);
  }

  private String getOption(String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(0);
  }

  private String requireOption(String name) {
    String value = getOption(name);
    Assert.hasText(value, "--" + name + " is required");
    return value;
  }

  private int getIntOption(String name, int defaultValue) {
    String value = getOption(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be a number: " + value);
    }
  }
}
