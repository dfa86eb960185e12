package com.stompws.client;

import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.exception.NotConnectedException;
import com.stompws.client.exception.StompException;
import com.stompws.client.frame.StompProtocol;
import com.stompws.client.listener.LoggingStompClientListener;
import com.stompws.client.listener.StompClientListener;
import com.stompws.client.orchestrator.HeartbeatScheduler;
import com.stompws.client.session.StompSession;
import com.stompws.client.session.StompSessionState;
import com.stompws.client.session.StompSubscription;
import com.stompws.client.session.SubscriptionRegistry;
import com.stompws.client.utils.ClientUtils;
import com.stompws.client.utils.MessageListener;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * STOMP client: connect, subscribe, send, disconnect.
 *
 * <p>A client is good for one connection. There is no automatic reconnection: after a failure or
 * a disconnect, create a new client.
 */
public class StompClient {
  private Logger log;

  private final StompClientConfig config;
  private final LoggingStompClientListener listener;
  private final SubscriptionRegistry registry;
  private final StompSession session;
  private final HeartbeatScheduler heartbeatScheduler;

  private volatile boolean connected;

  public StompClient(StompClientConfig config) {
    this(config, null);
  }

  /**
   * @param config client configuration (host, credentials...)
   * @param notifyListener notified of asynchronous session events, may be null
   */
  public StompClient(StompClientConfig config, StompClientListener notifyListener) {
    String logPrefix = Long.toString(System.currentTimeMillis());
    this.log = ClientUtils.prefixLogger(LoggerFactory.getLogger(StompClient.class), logPrefix);
    this.config = config;
    this.listener = new LoggingStompClientListener(notifyListener);
    this.listener.setLogPrefix(logPrefix);
    this.registry = new SubscriptionRegistry();
    this.session = new StompSession(config, registry, listener, logPrefix);
    this.heartbeatScheduler = new HeartbeatScheduler(session, config.getHeartbeatDelay());
    this.connected = false;
  }

  /**
   * Connect to the STOMP server. Blocks until the server accepts or rejects the connection, or
   * the connect timeout elapses.
   *
   * @return true when connected
   */
  public boolean connect() {
    if (isConnected()) {
      return true;
    }
    StompSessionState current = session.getState();
    if (current.isSettled()) {
      // CLOSED or FAILED: a client is good for one connection
      log.error("Cannot connect: session is " + current);
      this.connected = false;
      return false;
    }
    if (log.isDebugEnabled()) {
      log.debug("connecting to " + config.computeUrl());
    }
    heartbeatScheduler.start(true);
    StompSessionState state = session.open();
    this.connected = StompSessionState.ACTIVE.equals(state);
    if (!connected) {
      log.error("Failed to connect to STOMP server (" + state + ")");
      heartbeatScheduler.stop();
    }
    return connected;
  }

  /**
   * Subscribe to a destination. A previous subscription on the same destination is replaced: its
   * callback stops receiving messages and the broker is asked to drop it.
   *
   * @return subscription id
   */
  public String subscribe(String destination, MessageListener<String> callback)
      throws StompException {
    Validate.notEmpty(destination, "destination is required");
    Validate.notNull(callback, "callback is required");
    checkConnected(StompProtocol.COMMAND_SUBSCRIBE);

    StompSubscription subscription =
        new StompSubscription(destination, ClientUtils.newSubscriptionId(), callback);
    StompSubscription previous = registry.register(subscription);
    boolean previousDropped = false;
    try {
      if (previous != null) {
        transmitUnsubscribe(previous);
        previousDropped = true;
      }
      Map<String, String> headers = new LinkedHashMap<String, String>();
      headers.put(StompProtocol.HEADER_ID, subscription.getId());
      headers.put(StompProtocol.HEADER_ACK, subscription.getAckMode());
      headers.put(StompProtocol.HEADER_DESTINATION, destination);
      session.transmit(StompProtocol.COMMAND_SUBSCRIBE, headers, null);
    } catch (StompException e) {
      if (previous != null && !previousDropped) {
        // broker still delivers to the previous subscription
        registry.replace(subscription, previous);
      } else {
        registry.unregister(subscription);
      }
      throw e;
    }
    if (log.isDebugEnabled()) {
      log.debug("subscribed: " + subscription);
    }
    return subscription.getId();
  }

  /** @return false when there was no subscription on this destination */
  public boolean unsubscribe(String destination) throws StompException {
    StompSubscription subscription = registry.unregister(destination);
    if (subscription == null) {
      return false;
    }
    if (connected) {
      transmitUnsubscribe(subscription);
    }
    return true;
  }

  private void transmitUnsubscribe(StompSubscription subscription)
      throws NotConnectedException, ConnectionLostException {
    Map<String, String> headers = new LinkedHashMap<String, String>();
    headers.put(StompProtocol.HEADER_ID, subscription.getId());
    session.transmit(StompProtocol.COMMAND_UNSUBSCRIBE, headers, null);
  }

  /** Send a message to a destination. Refused when not connected; nothing is queued. */
  public void send(String destination, String message) throws StompException {
    Validate.notEmpty(destination, "destination is required");
    Validate.notNull(message, "message is required");
    checkConnected(StompProtocol.COMMAND_SEND);

    Map<String, String> headers = new LinkedHashMap<String, String>();
    headers.put(StompProtocol.HEADER_DESTINATION, destination);
    headers.put(
        StompProtocol.HEADER_CONTENT_LENGTH,
        Integer.toString(message.getBytes(StandardCharsets.UTF_8).length));
    session.transmit(StompProtocol.COMMAND_SEND, headers, message);
  }

  /** Disconnect from the STOMP server. No-op when not connected. */
  public void disconnect() {
    if (!connected) {
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("Disconnecting...");
    }
    if (heartbeatScheduler.isStarted()) {
      heartbeatScheduler.stop();
    }
    session.disconnect();
    this.connected = false;
    if (log.isDebugEnabled()) {
      log.debug("Disconnected.");
    }
  }

  /** Disconnect if connected, then release the transport whatever the session state. */
  public void close() {
    disconnect();
    if (heartbeatScheduler.isStarted()) {
      heartbeatScheduler.stop();
    }
    session.close();
  }

  private void checkConnected(String command) throws NotConnectedException {
    if (!connected) {
      throw new NotConnectedException(command, session.getState());
    }
  }

  /** @return true when connect() succeeded and the session is still active */
  public boolean isConnected() {
    return connected && session.isActive();
  }

  public StompSessionState getState() {
    return session.getState();
  }

  public String getUrl() {
    return config.computeUrl();
  }

  public StompClientConfig getConfig() {
    return config;
  }

  protected StompSession __getSession() {
    return session;
  }

  protected HeartbeatScheduler __getHeartbeatScheduler() {
    return heartbeatScheduler;
  }
}
