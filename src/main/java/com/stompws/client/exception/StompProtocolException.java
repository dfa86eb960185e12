package com.stompws.client.exception;

/** Frame received from the peer could not be parsed. */
public class StompProtocolException extends StompException {

  public StompProtocolException(String message) {
    super(message);
  }
}
