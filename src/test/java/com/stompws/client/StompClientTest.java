package com.stompws.client;

import com.stompws.client.exception.ConnectionLostException;
import com.stompws.client.exception.NotConnectedException;
import com.stompws.client.frame.StompFrame;
import com.stompws.client.session.StompSessionState;
import com.stompws.client.test.AbstractTest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class StompClientTest extends AbstractTest {
  private StompClient client;
  private List<String> received;

  @BeforeEach
  public void setUp() throws Exception {
    client = new StompClient(newConfig(), recordingListener);
    received = new CopyOnWriteArrayList<String>();
  }

  @AfterEach
  public void tearDown() throws Exception {
    client.close();
  }

  private void connect() {
    transport.replyOnConnect(CONNECTED);
    Assertions.assertTrue(client.connect());
  }

  @Test
  public void connect_success() throws Exception {
    connect();

    Assertions.assertTrue(client.isConnected());
    Assertions.assertEquals(StompSessionState.ACTIVE, client.getState());
    Assertions.assertTrue(client.__getHeartbeatScheduler().isStarted());
    Assertions.assertEquals("wss://" + HOST, client.getUrl());

    // already connected
    Assertions.assertTrue(client.connect());
    Assertions.assertEquals(1, transportService.getNbTransports());
  }

  @Test
  public void connect_brokerError() throws Exception {
    transport.replyOnConnect(ERROR_BAD_CREDS);

    Assertions.assertFalse(client.connect());

    Assertions.assertFalse(client.isConnected());
    Assertions.assertEquals(StompSessionState.FAILED, client.getState());
    Assertions.assertEquals("bad creds", recordingListener.brokerErrors.get(0).getMessage());
    Assertions.assertFalse(client.__getHeartbeatScheduler().isStarted());
  }

  @Test
  public void connect_timeout() throws Exception {
    client = new StompClient(newConfig(StompCredentials.none(), 100), recordingListener);

    Assertions.assertFalse(client.connect());

    Assertions.assertEquals(StompSessionState.FAILED, client.getState());
    Assertions.assertEquals(1, recordingListener.connectTimeouts.size());
    Assertions.assertFalse(client.__getHeartbeatScheduler().isStarted());
  }

  @Test
  public void connect_afterConnectionLost() throws Exception {
    connect();
    transport.fireClosed(1006, "abnormal");

    Assertions.assertFalse(client.connect());
    Assertions.assertFalse(client.isConnected());
    Assertions.assertEquals(StompSessionState.CLOSED, client.getState());
    Assertions.assertEquals(1, transportService.getNbTransports());
  }

  @Test
  public void connect_afterBrokerError() throws Exception {
    connect();
    transport.inject(ERROR_BAD_CREDS);

    Assertions.assertFalse(client.connect());
    Assertions.assertFalse(client.isConnected());
    Assertions.assertEquals(StompSessionState.FAILED, client.getState());
    Assertions.assertEquals(1, transportService.getNbTransports());
  }

  @Test
  public void connect_retryAfterFailure() throws Exception {
    transport.replyOnConnect(ERROR_BAD_CREDS);
    Assertions.assertFalse(client.connect());

    Assertions.assertFalse(client.connect());
    Assertions.assertFalse(client.__getHeartbeatScheduler().isStarted());
    Assertions.assertEquals(1, transportService.getNbTransports());
  }

  @Test
  public void subscribe() throws Exception {
    connect();

    String subscriptionId = client.subscribe("/topic/x", message -> received.add(message));

    List<StompFrame> subscribes = transport.getSentFrames("SUBSCRIBE");
    Assertions.assertEquals(1, subscribes.size());
    StompFrame subscribe = subscribes.get(0);
    Assertions.assertEquals(
        Arrays.asList("id", "ack", "destination"),
        new ArrayList<String>(subscribe.getHeaders().keySet()));
    Assertions.assertEquals(subscriptionId, subscribe.getHeader("id"));
    Assertions.assertEquals("client", subscribe.getHeader("ack"));
    Assertions.assertEquals("/topic/x", subscribe.getHeader("destination"));
    Assertions.assertTrue(transport.getSent().get(1).startsWith("SUBSCRIBE\n"));

    transport.inject(message("/topic/x", "hello"));
    Assertions.assertEquals(Arrays.asList("hello"), received);
  }

  @Test
  public void subscribe_replace() throws Exception {
    connect();
    final List<String> received2 = new CopyOnWriteArrayList<String>();

    String firstId = client.subscribe("/topic/x", message -> received.add(message));
    String secondId = client.subscribe("/topic/x", message -> received2.add(message));
    Assertions.assertNotEquals(firstId, secondId);

    List<StompFrame> unsubscribes = transport.getSentFrames("UNSUBSCRIBE");
    Assertions.assertEquals(1, unsubscribes.size());
    Assertions.assertEquals(firstId, unsubscribes.get(0).getHeader("id"));

    transport.inject(message("/topic/x", "hello"));
    Assertions.assertTrue(received.isEmpty());
    Assertions.assertEquals(Arrays.asList("hello"), received2);
  }

  @Test
  public void subscribe_replaceUnsubscribeFailure() throws Exception {
    connect();
    final List<String> received2 = new CopyOnWriteArrayList<String>();
    String firstId = client.subscribe("/topic/x", message -> received.add(message));
    transport.failNextSends(1);

    Assertions.assertThrows(
        ConnectionLostException.class,
        () -> client.subscribe("/topic/x", message -> received2.add(message)));

    // UNSUBSCRIBE not delivered: broker still sends to the first subscription
    Assertions.assertEquals(
        firstId, client.__getSession().getRegistry().resolve("/topic/x").getId());
    transport.inject(message("/topic/x", "hello"));
    Assertions.assertEquals(Arrays.asList("hello"), received);
    Assertions.assertTrue(received2.isEmpty());
  }

  @Test
  public void subscribe_replaceSubscribeFailure() throws Exception {
    connect();
    client.subscribe("/topic/x", message -> received.add(message));
    // UNSUBSCRIBE delivered, SUBSCRIBE lost
    transport.failNextSends("SUBSCRIBE", 1);

    Assertions.assertThrows(
        ConnectionLostException.class,
        () -> client.subscribe("/topic/x", message -> received.add(message)));

    Assertions.assertNull(client.__getSession().getRegistry().resolve("/topic/x"));
  }

  @Test
  public void subscribe_notConnected() throws Exception {
    NotConnectedException e =
        Assertions.assertThrows(
            NotConnectedException.class,
            () -> client.subscribe("/topic/x", message -> received.add(message)));
    Assertions.assertEquals(StompSessionState.DISCONNECTED, e.getState());
    Assertions.assertNull(client.__getSession().getRegistry().resolve("/topic/x"));
  }

  @Test
  public void subscribe_connectionLost() throws Exception {
    connect();
    transport.failNextSends(1);

    Assertions.assertThrows(
        ConnectionLostException.class,
        () -> client.subscribe("/topic/x", message -> received.add(message)));

    // not registered
    Assertions.assertNull(client.__getSession().getRegistry().resolve("/topic/x"));
  }

  @Test
  public void unsubscribe() throws Exception {
    connect();
    String subscriptionId = client.subscribe("/topic/x", message -> received.add(message));

    Assertions.assertTrue(client.unsubscribe("/topic/x"));
    Assertions.assertFalse(client.unsubscribe("/topic/x"));

    List<StompFrame> unsubscribes = transport.getSentFrames("UNSUBSCRIBE");
    Assertions.assertEquals(1, unsubscribes.size());
    Assertions.assertEquals(subscriptionId, unsubscribes.get(0).getHeader("id"));

    transport.inject(message("/topic/x", "hello"));
    Assertions.assertTrue(received.isEmpty());
    Assertions.assertEquals(1, recordingListener.unrouted.size());
  }

  @Test
  public void send() throws Exception {
    connect();

    client.send("/topic/x", "abc");
    client.send("/topic/x", "héllo");

    List<StompFrame> sends = transport.getSentFrames("SEND");
    Assertions.assertEquals(2, sends.size());
    Assertions.assertEquals("/topic/x", sends.get(0).getHeader("destination"));
    Assertions.assertEquals("3", sends.get(0).getHeader("content-length"));
    Assertions.assertEquals("abc", sends.get(0).getBody());
    Assertions.assertEquals("6", sends.get(1).getHeader("content-length"));
    Assertions.assertEquals("héllo", sends.get(1).getBody());
  }

  @Test
  public void send_beforeConnect() throws Exception {
    Assertions.assertThrows(NotConnectedException.class, () -> client.send("/topic/x", "abc"));

    // nothing queued: a later connect transmits CONNECT only
    connect();
    Assertions.assertEquals(1, transport.getSent().size());
    Assertions.assertTrue(transport.getSentFrames("SEND").isEmpty());
  }

  @Test
  public void send_afterBrokerError() throws Exception {
    connect();
    transport.inject(ERROR_BAD_CREDS);

    Assertions.assertFalse(client.isConnected());
    Assertions.assertThrows(NotConnectedException.class, () -> client.send("/topic/x", "abc"));
  }

  @Test
  public void send_invalidArguments() throws Exception {
    connect();

    Assertions.assertThrows(IllegalArgumentException.class, () -> client.send("", "abc"));
    Assertions.assertThrows(NullPointerException.class, () -> client.send("/topic/x", null));
  }

  @Test
  public void disconnect() throws Exception {
    connect();

    client.disconnect();

    Assertions.assertFalse(client.isConnected());
    Assertions.assertEquals(StompSessionState.CLOSED, client.getState());
    Assertions.assertEquals(1, transport.getSentFrames("DISCONNECT").size());
    Assertions.assertTrue(transport.isClosed());
    Assertions.assertFalse(client.__getHeartbeatScheduler().isStarted());

    // no-op once disconnected
    client.disconnect();
    Assertions.assertEquals(1, transport.getSentFrames("DISCONNECT").size());
  }

  @Test
  public void disconnect_notConnected() throws Exception {
    client.disconnect();

    Assertions.assertEquals(StompSessionState.DISCONNECTED, client.getState());
    Assertions.assertTrue(transport.getSent().isEmpty());
  }

  @Test
  public void connectionLost() throws Exception {
    connect();

    transport.fireClosed(1006, "abnormal");

    Assertions.assertFalse(client.isConnected());
    Assertions.assertEquals(StompSessionState.CLOSED, client.getState());
    Assertions.assertEquals(1, recordingListener.connectionLosts.size());
  }
}
