package com.stompws.client.transport.tyrus;

import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.transport.ITransport;
import com.stompws.client.transport.ITransportListener;
import com.stompws.client.transport.TlsTrustPolicy;
import com.stompws.client.utils.SSLUtil;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import javax.net.ssl.SSLContext;
import javax.websocket.ClientEndpointConfig;
import javax.websocket.CloseReason;
import javax.websocket.Endpoint;
import javax.websocket.EndpointConfig;
import javax.websocket.MessageHandler;
import javax.websocket.Session;
import org.glassfish.tyrus.client.ClientManager;
import org.glassfish.tyrus.client.ClientProperties;
import org.glassfish.tyrus.client.SslEngineConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** WebSocket transport on the Tyrus JSR-356 client. */
public class TyrusTransport implements ITransport {
  private static final Logger log = LoggerFactory.getLogger(TyrusTransport.class);

  private final ExecutorService connectExecutor;
  private volatile Session session;
  private volatile boolean closed;

  public TyrusTransport() {
    this.connectExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "stomp-transport-connect");
                thread.setDaemon(true);
                return thread;
              }
            });
  }

  @Override
  public void open(
      final String url, final TlsTrustPolicy tlsTrustPolicy, final ITransportListener listener) {
    if (log.isDebugEnabled()) {
      log.debug("opening " + url + " (tls=" + tlsTrustPolicy + ")");
    }
    connectExecutor.submit(
        new Runnable() {
          @Override
          public void run() {
            try {
              ClientManager client = computeClientManager(url, tlsTrustPolicy);
              ClientEndpointConfig endpointConfig = ClientEndpointConfig.Builder.create().build();
              client.connectToServer(computeEndpoint(listener), endpointConfig, new URI(url));
            } catch (Exception e) {
              log.error("Unable to open " + url + ": " + e.getMessage());
              listener.onTransportError(e);
            }
          }
        });
  }

  private ClientManager computeClientManager(String url, TlsTrustPolicy tlsTrustPolicy)
      throws Exception {
    ClientManager client = ClientManager.createClient();
    if (url.startsWith("wss://") && TlsTrustPolicy.TRUST_ALL.equals(tlsTrustPolicy)) {
      SSLContext sslContext = SSLUtil.newTrustAllSslContext();
      SslEngineConfigurator sslEngineConfigurator = new SslEngineConfigurator(sslContext);
      sslEngineConfigurator.setHostVerificationEnabled(false);
      client.getProperties().put(ClientProperties.SSL_ENGINE_CONFIGURATOR, sslEngineConfigurator);
    }
    return client;
  }

  private Endpoint computeEndpoint(final ITransportListener listener) {
    return new Endpoint() {
      @Override
      public void onOpen(Session session, EndpointConfig config) {
        TyrusTransport.this.session = session;
        session.addMessageHandler(
            String.class,
            new MessageHandler.Whole<String>() {
              @Override
              public void onMessage(String message) {
                listener.onTransportMessage(message);
              }
            });
        session.addMessageHandler(
            byte[].class,
            new MessageHandler.Whole<byte[]>() {
              @Override
              public void onMessage(byte[] message) {
                listener.onTransportMessage(new String(message, StandardCharsets.UTF_8));
              }
            });
        if (log.isDebugEnabled()) {
          log.debug("opened, sessionId=" + session.getId());
        }
        listener.onTransportOpened();
      }

      @Override
      public void onClose(Session session, CloseReason closeReason) {
        if (log.isDebugEnabled()) {
          log.debug("closed: " + closeReason);
        }
        listener.onTransportClosed(
            closeReason.getCloseCode().getCode(), closeReason.getReasonPhrase());
      }

      @Override
      public void onError(Session session, Throwable error) {
        log.error("websocket error: " + error.getMessage());
        listener.onTransportError(error);
      }
    };
  }

  @Override
  public void send(String text) throws ConnectionLostException {
    Session currentSession = session;
    if (closed || currentSession == null || !currentSession.isOpen()) {
      throw new ConnectionLostException("Connection to remote host was lost");
    }
    try {
      currentSession.getBasicRemote().sendText(text);
    } catch (IOException e) {
      throw new ConnectionLostException("Connection to remote host was lost", e);
    } catch (IllegalStateException e) {
      throw new ConnectionLostException("Connection to remote host was lost", e);
    }
  }

  @Override
  public boolean isOpen() {
    Session currentSession = session;
    return !closed && currentSession != null && currentSession.isOpen();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    Session currentSession = session;
    if (currentSession != null && currentSession.isOpen()) {
      try {
        currentSession.close();
      } catch (IOException e) {
        log.error("close failed", e);
      }
    }
    connectExecutor.shutdownNow();
  }
}
