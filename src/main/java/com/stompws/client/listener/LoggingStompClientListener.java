package com.stompws.client.listener;

import com.stompws.client.exception.BrokerErrorException;
import com.stompws.client.exception.ConnectTimeoutException;
import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.exception.StompProtocolException;
import com.stompws.client.frame.StompFrame;
import com.stompws.client.session.StompSessionState;
import com.stompws.client.utils.ClientUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingStompClientListener extends AbstractStompClientListener {
  private Logger log = LoggerFactory.getLogger(LoggingStompClientListener.class);

  public LoggingStompClientListener(StompClientListener notifyListener) {
    super(notifyListener);
  }

  public LoggingStompClientListener() {
    this(null);
  }

  public void setLogPrefix(String logPrefix) {
    log = ClientUtils.prefixLogger(log, logPrefix);
  }

  @Override
  public void onStateChanged(StompSessionState previous, StompSessionState state) {
    super.onStateChanged(previous, state);
    if (StompSessionState.ACTIVE.equals(state)) {
      log.info("Successfully connected to STOMP server");
    } else if (log.isDebugEnabled()) {
      log.debug("session " + previous + " -> " + state);
    }
  }

  @Override
  public void onBrokerError(BrokerErrorException error) {
    super.onBrokerError(error);
    log.error("ERROR: " + error.getMessage());
    if (error.getDetails() != null) {
      log.error("Details: " + error.getDetails());
    }
  }

  @Override
  public void onConnectionLost(ConnectionLostException error) {
    super.onConnectionLost(error);
    log.error("Connection to remote host was lost: " + error.getMessage());
  }

  @Override
  public void onConnectTimeout(ConnectTimeoutException error) {
    super.onConnectTimeout(error);
    log.error(error.getMessage());
  }

  @Override
  public void onProtocolError(StompProtocolException error) {
    super.onProtocolError(error);
    log.error("Protocol error, frame dropped: " + error.getMessage());
  }

  @Override
  public void onUnroutedMessage(String destination, StompFrame frame) {
    super.onUnroutedMessage(destination, frame);
    log.warn(
        "Warning: No callback registered for destination "
            + (destination != null ? destination : "unknown"));
  }
}
