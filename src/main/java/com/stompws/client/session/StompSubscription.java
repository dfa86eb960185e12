package com.stompws.client.session;

import com.stompws.client.frame.StompProtocol;
import com.stompws.client.utils.MessageListener;

public class StompSubscription {
  private final String destination;
  private final String id;
  private final String ackMode;
  private final MessageListener<String> callback;

  public StompSubscription(String destination, String id, MessageListener<String> callback) {
    this.destination = destination;
    this.id = id;
    this.ackMode = StompProtocol.ACK_CLIENT;
    this.callback = callback;
  }

  public String getDestination() {
    return destination;
  }

  public String getId() {
    return id;
  }

  public String getAckMode() {
    return ackMode;
  }

  /** Receives the MESSAGE body, null when the frame has none. */
  public MessageListener<String> getCallback() {
    return callback;
  }

  @Override
  public String toString() {
    return "StompSubscription{destination=" + destination + ", id=" + id + "}";
  }
}
