package com.stompws.client.exception;

/** Broker answered with an ERROR frame. */
public class BrokerErrorException extends StompException {
  private final String details;

  public BrokerErrorException(String message, String details) {
    super(message);
    this.details = details;
  }

  /** @return ERROR frame body, or null */
  public String getDetails() {
    return details;
  }
}
