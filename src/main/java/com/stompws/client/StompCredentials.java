package com.stompws.client;

/** Login and passcode sent with CONNECT. Both optional. */
public final class StompCredentials {
  private static final StompCredentials NONE = new StompCredentials(null, null);

  private final String username;
  private final String passcode;

  public StompCredentials(String username, String passcode) {
    this.username = username;
    this.passcode = passcode;
  }

  public static StompCredentials none() {
    return NONE;
  }

  public String getUsername() {
    return username;
  }

  public String getPasscode() {
    return passcode;
  }
}
