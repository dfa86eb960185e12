package com.stompws.client.exception;

import com.stompws.client.session.StompSessionState;

/** Frame refused because the session is not active. Nothing is queued. */
public class NotConnectedException extends StompException {
  private final StompSessionState state;

  public NotConnectedException(String command, StompSessionState state) {
    super("Cannot transmit " + command + ": session is " + state);
    this.state = state;
  }

  public StompSessionState getState() {
    return state;
  }
}
