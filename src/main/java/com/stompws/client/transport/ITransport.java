package com.stompws.client.transport;

import com.stompws.client.exception.ConnectionLostException;

/** Text duplex link carrying STOMP frames (WebSocket, SockJS websocket endpoint...). */
public interface ITransport {

  /**
   * Open the link asynchronously. Lifecycle events and inbound messages are delivered to the
   * listener from the transport's own threads.
   */
  void open(String url, TlsTrustPolicy tlsTrustPolicy, ITransportListener listener);

  void send(String text) throws ConnectionLostException;

  boolean isOpen();

  void close();
}
