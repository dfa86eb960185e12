package com.stompws.client;

import com.stompws.client.test.AbstractTest;
import com.stompws.client.transport.TlsTrustPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StompClientConfigTest extends AbstractTest {

  @Test
  public void defaults() throws Exception {
    StompClientConfig config = new StompClientConfig(transportService, HOST, null);

    Assertions.assertEquals("wss://" + HOST, config.computeUrl());
    Assertions.assertEquals(TlsTrustPolicy.VERIFY, config.getTlsTrustPolicy());
    Assertions.assertEquals(10000, config.getHeartbeatDelay());
    Assertions.assertEquals(30000, config.getConnectTimeout());
    Assertions.assertNull(config.getCredentials().getUsername());
    Assertions.assertNull(config.getCredentials().getPasscode());
  }

  @Test
  public void computeUrl() throws Exception {
    StompClientConfig config = newConfig();

    config.setWss(false);
    Assertions.assertEquals("ws://broker.local:61614", config.computeUrl());

    config.setSockjs(true);
    Assertions.assertEquals("ws://broker.local:61614/websocket", config.computeUrl());

    config.setWss(true);
    Assertions.assertEquals("wss://broker.local:61614/websocket", config.computeUrl());
  }
}
