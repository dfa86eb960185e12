package com.stompws.client.exception;

public class ConnectionLostException extends StompException {

  public ConnectionLostException(String message, Throwable cause) {
    super(message, cause);
  }

  public ConnectionLostException(String message) {
    this(message, null);
  }
}
