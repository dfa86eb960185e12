package com.stompws.client.session;

public enum StompSessionState {
  DISCONNECTED,
  CONNECTING,
  ACTIVE,
  CLOSED,
  FAILED;

  /** @return true when connect() has nothing left to wait for */
  public boolean isSettled() {
    return this != DISCONNECTED && this != CONNECTING;
  }
}
