package com.stompws.client.exception;

public class ConnectTimeoutException extends StompException {
  private final long timeoutMillis;

  public ConnectTimeoutException(long timeoutMillis) {
    super("No CONNECTED frame received after " + timeoutMillis + "ms");
    this.timeoutMillis = timeoutMillis;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }
}
