package com.stompws.client.session;

import com.stompws.client.StompClientConfig;
import com.stompws.client.StompCredentials;
import com.stompws.client.exception.BrokerErrorException;
import com.stompws.client.exception.ConnectTimeoutException;
import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.exception.NotConnectedException;
import com.stompws.client.exception.StompProtocolException;
import com.stompws.client.frame.StompFrame;
import com.stompws.client.frame.StompFrameCodec;
import com.stompws.client.frame.StompProtocol;
import com.stompws.client.listener.StompClientListener;
import com.stompws.client.transport.ITransport;
import com.stompws.client.transport.ITransportListener;
import com.stompws.client.utils.ClientUtils;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One STOMP connection over one transport.
 *
 * <pre>
 * DISCONNECTED --open()--> CONNECTING --CONNECTED--> ACTIVE --disconnect()--> CLOSED
 * CONNECTING|ACTIVE --ERROR--> FAILED
 * CONNECTING --timeout--> FAILED
 * CONNECTING|ACTIVE|FAILED --transport closed/error--> CLOSED
 * </pre>
 *
 * Inbound frames are decoded and dispatched on the transport thread. Outbound writes are
 * serialized by a single writer lock.
 */
public class StompSession implements ITransportListener {
  // non-static logger to prefix it with logPrefix
  private Logger log;

  private final StompClientConfig config;
  private final SubscriptionRegistry registry;
  private final StompClientListener listener;

  private final Object stateLock = new Object();
  private final Object writeLock = new Object();
  private StompSessionState state; // guarded by stateLock
  private volatile ITransport transport;
  private final AtomicLong unroutedCount = new AtomicLong();

  public StompSession(
      StompClientConfig config,
      SubscriptionRegistry registry,
      StompClientListener listener,
      String logPrefix) {
    this.log = ClientUtils.prefixLogger(LoggerFactory.getLogger(StompSession.class), logPrefix);
    this.config = config;
    this.registry = registry;
    this.listener = listener;
    this.state = StompSessionState.DISCONNECTED;
  }

  /**
   * Open the transport and wait until the broker accepts or rejects the connection, or the
   * connect timeout elapses.
   *
   * @return ACTIVE on success, FAILED or CLOSED otherwise
   */
  public StompSessionState open() {
    if (transition(StompSessionState.CONNECTING, StompSessionState.DISCONNECTED) == null) {
      StompSessionState current = getState();
      log.error("Cannot open: session is " + current);
      return current;
    }
    String url = config.computeUrl();
    if (log.isDebugEnabled()) {
      log.debug("connecting to " + url);
    }
    ITransport newTransport = config.getTransportService().newTransport();
    this.transport = newTransport;
    newTransport.open(url, config.getTlsTrustPolicy(), this);
    return awaitSettled(config.getConnectTimeout());
  }

  private StompSessionState awaitSettled(long timeoutMillis) {
    long deadline = System.currentTimeMillis() + timeoutMillis;
    boolean interrupted = false;
    synchronized (stateLock) {
      while (!state.isSettled()) {
        long remaining = timeoutMillis > 0 ? deadline - System.currentTimeMillis() : 0;
        if (timeoutMillis > 0 && remaining <= 0) {
          break;
        }
        try {
          stateLock.wait(remaining);
        } catch (InterruptedException e) {
          interrupted = true;
          break;
        }
      }
      if (state.isSettled()) {
        return state;
      }
    }

    // still CONNECTING
    if (interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for CONNECTED");
    }
    if (transition(StompSessionState.FAILED, StompSessionState.CONNECTING) != null) {
      if (!interrupted) {
        listener.onConnectTimeout(new ConnectTimeoutException(timeoutMillis));
      }
      closeTransport();
    }
    return getState();
  }

  // transport events

  @Override
  public void onTransportOpened() {
    if (!StompSessionState.CONNECTING.equals(getState())) {
      log.warn("transport opened while " + getState() + ", CONNECT not sent");
      return;
    }
    try {
      write(StompFrameCodec.encode(StompProtocol.COMMAND_CONNECT, computeConnectHeaders(), null));
    } catch (ConnectionLostException e) {
      log.error("Unable to send CONNECT: " + e.getMessage());
    }
  }

  @Override
  public void onTransportMessage(String text) {
    if (log.isDebugEnabled()) {
      log.debug("<<< " + ClientUtils.printable(text));
    }
    if (StompFrameCodec.isHeartbeat(text)) {
      if (log.isTraceEnabled()) {
        log.trace("heartbeat received");
      }
      return;
    }
    StompFrame frame;
    try {
      frame = StompFrameCodec.decode(text);
    } catch (StompProtocolException e) {
      listener.onProtocolError(e);
      return;
    }
    try {
      dispatch(frame);
    } catch (RuntimeException e) {
      log.error("Unable to handle " + frame.getCommand() + " frame", e);
    }
  }

  @Override
  public void onTransportError(Throwable error) {
    onTransportDown(
        new ConnectionLostException("Transport error: " + error.getMessage(), error));
  }

  @Override
  public void onTransportClosed(Integer code, String reason) {
    onTransportDown(
        new ConnectionLostException(
            "Transport closed"
                + (code != null ? " (" + code + ")" : "")
                + (reason != null && !reason.isEmpty() ? ": " + reason : "")));
  }

  private void onTransportDown(ConnectionLostException e) {
    if (transition(
            StompSessionState.CLOSED,
            StompSessionState.CONNECTING,
            StompSessionState.ACTIVE,
            StompSessionState.FAILED)
        != null) {
      listener.onConnectionLost(e);
    } else if (log.isDebugEnabled()) {
      log.debug("ignored while " + getState() + ": " + e.getMessage());
    }
  }

  // inbound frames

  private void dispatch(StompFrame frame) {
    String command = frame.getCommand();
    if (StompProtocol.COMMAND_CONNECTED.equals(command)) {
      onConnected(frame);
    } else if (StompProtocol.COMMAND_ERROR.equals(command)) {
      onError(frame);
    } else if (StompProtocol.COMMAND_MESSAGE.equals(command)) {
      onMessage(frame);
    } else if (log.isDebugEnabled()) {
      log.debug("frame ignored: " + command);
    }
  }

  private void onConnected(StompFrame frame) {
    if (transition(StompSessionState.ACTIVE, StompSessionState.CONNECTING) == null) {
      log.warn("CONNECTED ignored (session is " + getState() + ")");
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "connected: version="
              + frame.getHeader(StompProtocol.HEADER_VERSION)
              + ", heart-beat="
              + frame.getHeader(StompProtocol.HEADER_HEART_BEAT));
    }
  }

  private void onError(StompFrame frame) {
    String message = frame.getHeader(StompProtocol.HEADER_MESSAGE);
    BrokerErrorException error =
        new BrokerErrorException(message != null ? message : "Unknown error", frame.getBody());
    transition(StompSessionState.FAILED, StompSessionState.CONNECTING, StompSessionState.ACTIVE);
    listener.onBrokerError(error);
  }

  private void onMessage(StompFrame frame) {
    String destination = frame.getHeader(StompProtocol.HEADER_DESTINATION);
    if (!StompSessionState.ACTIVE.equals(getState())) {
      log.warn("frame ignored (" + getState() + ") (" + destination + ")");
      return;
    }
    StompSubscription subscription = registry.resolve(destination);
    if (subscription == null) {
      unroutedCount.incrementAndGet();
      listener.onUnroutedMessage(destination, frame);
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("--> (" + destination + ") " + subscription.getId());
    }
    try {
      subscription.getCallback().onMessage(frame.getBody());
    } catch (Exception e) {
      log.error("callback failed for " + destination, e);
    }
  }

  // outbound frames

  /**
   * Transmit a frame. Refused unless the session is ACTIVE.
   *
   * @throws NotConnectedException session not ACTIVE, nothing sent
   * @throws ConnectionLostException transport is down
   */
  public void transmit(String command, Map<String, String> headers, String body)
      throws NotConnectedException, ConnectionLostException {
    StompSessionState current = getState();
    if (!StompSessionState.ACTIVE.equals(current)) {
      throw new NotConnectedException(command, current);
    }
    write(StompFrameCodec.encode(command, headers, body));
  }

  /**
   * Send an EOL heartbeat.
   *
   * @return false when the session is not ACTIVE (nothing sent)
   */
  public boolean transmitHeartbeat() throws ConnectionLostException {
    if (!isActive()) {
      return false;
    }
    write(StompProtocol.HEARTBEAT);
    return true;
  }

  /** Failures are reported to the listener, then thrown to the caller. */
  private void write(String text) throws ConnectionLostException {
    try {
      ITransport currentTransport = transport;
      if (currentTransport == null) {
        throw new ConnectionLostException("Transport not opened");
      }
      synchronized (writeLock) {
        if (log.isDebugEnabled()) {
          log.debug(">>> " + ClientUtils.printable(text));
        }
        currentTransport.send(text);
      }
    } catch (ConnectionLostException e) {
      listener.onConnectionLost(e);
      throw e;
    }
  }

  private Map<String, String> computeConnectHeaders() {
    Map<String, String> headers = new LinkedHashMap<String, String>();
    headers.put(StompProtocol.HEADER_HOST, config.computeUrl());
    headers.put(StompProtocol.HEADER_ACCEPT_VERSION, StompProtocol.ACCEPT_VERSIONS);
    headers.put(StompProtocol.HEADER_HEART_BEAT, StompProtocol.HEART_BEAT_CLIENT);
    StompCredentials credentials = config.getCredentials();
    if (credentials.getUsername() != null) {
      headers.put(StompProtocol.HEADER_LOGIN, credentials.getUsername());
    }
    if (credentials.getPasscode() != null) {
      headers.put(StompProtocol.HEADER_PASSCODE, credentials.getPasscode());
    }
    return headers;
  }

  /** Send DISCONNECT (best effort) and close the transport. No-op unless ACTIVE. */
  public void disconnect() {
    if (!isActive()) {
      if (log.isDebugEnabled()) {
        log.debug("disconnect ignored (session is " + getState() + ")");
      }
      return;
    }
    try {
      write(
          StompFrameCodec.encode(
              StompProtocol.COMMAND_DISCONNECT, Collections.<String, String>emptyMap(), null));
    } catch (ConnectionLostException e) {
      log.warn("DISCONNECT not delivered: " + e.getMessage());
    }
    transition(StompSessionState.CLOSED, StompSessionState.ACTIVE);
    closeTransport();
  }

  /** Release the transport whatever the state, without sending DISCONNECT. */
  public void close() {
    transition(
        StompSessionState.CLOSED,
        StompSessionState.DISCONNECTED,
        StompSessionState.CONNECTING,
        StompSessionState.ACTIVE,
        StompSessionState.FAILED);
    closeTransport();
  }

  private void closeTransport() {
    ITransport currentTransport = transport;
    if (currentTransport != null) {
      currentTransport.close();
    }
  }

  /** @return previous state, or null when the current state is not in allowedFrom */
  private StompSessionState transition(StompSessionState next, StompSessionState... allowedFrom) {
    List<StompSessionState> allowed = Arrays.asList(allowedFrom);
    StompSessionState previous;
    synchronized (stateLock) {
      previous = state;
      if (!allowed.contains(previous)) {
        return null;
      }
      state = next;
      stateLock.notifyAll();
    }
    listener.onStateChanged(previous, next);
    return previous;
  }

  public StompSessionState getState() {
    synchronized (stateLock) {
      return state;
    }
  }

  public boolean isActive() {
    return StompSessionState.ACTIVE.equals(getState());
  }

  /** @return number of MESSAGE frames dropped for lack of subscription */
  public long getUnroutedCount() {
    return unroutedCount.get();
  }

  public SubscriptionRegistry getRegistry() {
    return registry;
  }

  protected ITransport __getTransport() {
    return transport;
  }
}
