package com.stompws.client.frame;

/** STOMP commands, headers and wire constants used by this client. */
public final class StompProtocol {
  public static final String LF = "\n";
  public static final String NULL = "\u0000";
  public static final String HEARTBEAT = LF;

  public static final String ACCEPT_VERSIONS = "1.0,1.1";
  public static final String HEART_BEAT_CLIENT = "10000,10000";
  public static final String ACK_CLIENT = "client";

  // client commands
  public static final String COMMAND_CONNECT = "CONNECT";
  public static final String COMMAND_SEND = "SEND";
  public static final String COMMAND_SUBSCRIBE = "SUBSCRIBE";
  public static final String COMMAND_UNSUBSCRIBE = "UNSUBSCRIBE";
  public static final String COMMAND_DISCONNECT = "DISCONNECT";

  // server commands
  public static final String COMMAND_CONNECTED = "CONNECTED";
  public static final String COMMAND_MESSAGE = "MESSAGE";
  public static final String COMMAND_ERROR = "ERROR";

  public static final String HEADER_HOST = "host";
  public static final String HEADER_ACCEPT_VERSION = "accept-version";
  public static final String HEADER_HEART_BEAT = "heart-beat";
  public static final String HEADER_LOGIN = "login";
  public static final String HEADER_PASSCODE = "passcode";
  public static final String HEADER_ID = "id";
  public static final String HEADER_ACK = "ack";
  public static final String HEADER_DESTINATION = "destination";
  public static final String HEADER_CONTENT_LENGTH = "content-length";
  public static final String HEADER_MESSAGE = "message";
  public static final String HEADER_VERSION = "version";
  public static final String HEADER_SESSION = "session";

  private StompProtocol() {
    throw new UnsupportedOperationException("Do not instantiate libraries.");
  }
}
