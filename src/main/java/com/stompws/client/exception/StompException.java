package com.stompws.client.exception;

public class StompException extends Exception {

  public StompException(String message, Throwable cause) {
    super(message, cause);
  }

  public StompException(String message) {
    this(message, null);
  }
}
