package com.stompws.client.session;

import com.stompws.client.utils.MessageListener;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SubscriptionRegistryTest {
  private SubscriptionRegistry registry;
  private MessageListener<String> callback1;
  private MessageListener<String> callback2;

  @BeforeEach
  public void setUp() throws Exception {
    registry = new SubscriptionRegistry();
    callback1 = body -> {};
    callback2 = body -> {};
  }

  @Test
  public void registerAndResolve() throws Exception {
    StompSubscription subscription = registry.register("/topic/x", callback1);

    Assertions.assertSame(subscription, registry.resolve("/topic/x"));
    Assertions.assertSame(callback1, registry.resolve("/topic/x").getCallback());
    Assertions.assertEquals("client", subscription.getAckMode());
    Assertions.assertTrue(subscription.getId().startsWith("sub-"));
    Assertions.assertNull(registry.resolve("/topic/y"));
    Assertions.assertNull(registry.resolve(null));
  }

  @Test
  public void registerOverwrites() throws Exception {
    StompSubscription first = new StompSubscription("/topic/x", "sub-1", callback1);
    StompSubscription second = new StompSubscription("/topic/x", "sub-2", callback2);

    Assertions.assertNull(registry.register(first));
    Assertions.assertSame(first, registry.register(second));

    Assertions.assertEquals(1, registry.size());
    Assertions.assertSame(callback2, registry.resolve("/topic/x").getCallback());
  }

  @Test
  public void unregister() throws Exception {
    StompSubscription subscription = registry.register("/topic/x", callback1);

    Assertions.assertSame(subscription, registry.unregister("/topic/x"));
    Assertions.assertNull(registry.resolve("/topic/x"));
    Assertions.assertNull(registry.unregister("/topic/x"));
    Assertions.assertEquals(0, registry.size());
  }

  @Test
  public void unregisterSubscriptionOnlyIfCurrent() throws Exception {
    StompSubscription first = new StompSubscription("/topic/x", "sub-1", callback1);
    StompSubscription second = new StompSubscription("/topic/x", "sub-2", callback2);
    registry.register(first);
    registry.register(second);

    Assertions.assertFalse(registry.unregister(first));
    Assertions.assertSame(second, registry.resolve("/topic/x"));
    Assertions.assertTrue(registry.unregister(second));
    Assertions.assertNull(registry.resolve("/topic/x"));
  }

  @Test
  public void replace() throws Exception {
    StompSubscription first = new StompSubscription("/topic/x", "sub-1", callback1);
    StompSubscription second = new StompSubscription("/topic/x", "sub-2", callback2);
    registry.register(first);
    registry.register(second);

    Assertions.assertFalse(registry.replace(first, second));
    Assertions.assertTrue(registry.replace(second, first));
    Assertions.assertSame(first, registry.resolve("/topic/x"));
  }
}
