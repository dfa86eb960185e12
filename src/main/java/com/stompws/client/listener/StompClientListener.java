package com.stompws.client.listener;

import com.stompws.client.exception.BrokerErrorException;
import com.stompws.client.exception.ConnectTimeoutException;
import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.exception.StompProtocolException;
import com.stompws.client.frame.StompFrame;
import com.stompws.client.session.StompSessionState;

/** Asynchronous session events. Called from the transport threads. */
public interface StompClientListener {

  void onStateChanged(StompSessionState previous, StompSessionState state);

  void onBrokerError(BrokerErrorException error);

  void onConnectionLost(ConnectionLostException error);

  void onConnectTimeout(ConnectTimeoutException error);

  void onProtocolError(StompProtocolException error);

  /** MESSAGE received for a destination without subscription. The frame is dropped. */
  void onUnroutedMessage(String destination, StompFrame frame);
}
