package com.stompws.client;

import com.stompws.client.transport.ITransportService;
import com.stompws.client.transport.TlsTrustPolicy;

public class StompClientConfig {
  public static final int HEARTBEAT_DELAY_DEFAULT = 10000;
  public static final int CONNECT_TIMEOUT_DEFAULT = 30000;

  private ITransportService transportService;
  private String host;
  private boolean sockjs;
  private boolean wss;
  private StompCredentials credentials;
  private TlsTrustPolicy tlsTrustPolicy;
  private int heartbeatDelay;
  private int connectTimeout;

  public StompClientConfig(
      ITransportService transportService, String host, StompCredentials credentials) {
    this(
        transportService,
        host,
        false,
        true,
        credentials,
        TlsTrustPolicy.VERIFY,
        HEARTBEAT_DELAY_DEFAULT,
        CONNECT_TIMEOUT_DEFAULT);
  }

  public StompClientConfig(
      ITransportService transportService,
      String host,
      boolean sockjs,
      boolean wss,
      StompCredentials credentials,
      TlsTrustPolicy tlsTrustPolicy,
      int heartbeatDelay,
      int connectTimeout) {
    this.transportService = transportService;
    this.host = host;
    this.sockjs = sockjs;
    this.wss = wss;
    this.credentials = credentials != null ? credentials : StompCredentials.none();
    this.tlsTrustPolicy = tlsTrustPolicy;
    this.heartbeatDelay = heartbeatDelay;
    this.connectTimeout = connectTimeout;
  }

  /** @return (wss|ws)://host, with the "/websocket" suffix in SockJS mode */
  public String computeUrl() {
    String wsHost = sockjs ? host + "/websocket" : host;
    String protocol = wss ? "wss://" : "ws://";
    return protocol + wsHost;
  }

  public ITransportService getTransportService() {
    return transportService;
  }

  public void setTransportService(ITransportService transportService) {
    this.transportService = transportService;
  }

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public boolean isSockjs() {
    return sockjs;
  }

  public void setSockjs(boolean sockjs) {
    this.sockjs = sockjs;
  }

  public boolean isWss() {
    return wss;
  }

  public void setWss(boolean wss) {
    this.wss = wss;
  }

  public StompCredentials getCredentials() {
    return credentials;
  }

  public TlsTrustPolicy getTlsTrustPolicy() {
    return tlsTrustPolicy;
  }

  public void setTlsTrustPolicy(TlsTrustPolicy tlsTrustPolicy) {
    this.tlsTrustPolicy = tlsTrustPolicy;
  }

  /** @return milliseconds between two heartbeats */
  public int getHeartbeatDelay() {
    return heartbeatDelay;
  }

  public void setHeartbeatDelay(int heartbeatDelay) {
    this.heartbeatDelay = heartbeatDelay;
  }

  /** @return milliseconds to wait for CONNECTED, 0 to wait forever */
  public int getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(int connectTimeout) {
    this.connectTimeout = connectTimeout;
  }
}
