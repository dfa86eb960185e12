package com.stompws.client.listener;

import com.stompws.client.exception.BrokerErrorException;
import com.stompws.client.exception.ConnectTimeoutException;
import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.exception.StompProtocolException;
import com.stompws.client.frame.StompFrame;
import com.stompws.client.session.StompSessionState;

public abstract class AbstractStompClientListener implements StompClientListener {
  private StompClientListener notifyListener;

  public AbstractStompClientListener(StompClientListener notifyListener) {
    this.notifyListener = notifyListener;
  }

  public AbstractStompClientListener() {
    this(null);
  }

  @Override
  public void onStateChanged(StompSessionState previous, StompSessionState state) {
    if (notifyListener != null) {
      notifyListener.onStateChanged(previous, state);
    }
  }

  @Override
  public void onBrokerError(BrokerErrorException error) {
    if (notifyListener != null) {
      notifyListener.onBrokerError(error);
    }
  }

  @Override
  public void onConnectionLost(ConnectionLostException error) {
    if (notifyListener != null) {
      notifyListener.onConnectionLost(error);
    }
  }

  @Override
  public void onConnectTimeout(ConnectTimeoutException error) {
    if (notifyListener != null) {
      notifyListener.onConnectTimeout(error);
    }
  }

  @Override
  public void onProtocolError(StompProtocolException error) {
    if (notifyListener != null) {
      notifyListener.onProtocolError(error);
    }
  }

  @Override
  public void onUnroutedMessage(String destination, StompFrame frame) {
    if (notifyListener != null) {
      notifyListener.onUnroutedMessage(destination, frame);
    }
  }
}
