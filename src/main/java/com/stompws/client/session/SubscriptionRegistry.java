package com.stompws.client.session;

import com.stompws.client.utils.ClientUtils;
import com.stompws.client.utils.MessageListener;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Destination to subscription mapping, one subscription per destination. Written from the caller
 * thread, read from the transport thread on every MESSAGE.
 */
public class SubscriptionRegistry {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final ConcurrentMap<String, StompSubscription> subscriptions;

  public SubscriptionRegistry() {
    this.subscriptions = new ConcurrentHashMap<String, StompSubscription>();
  }

  /**
   * Register a subscription, replacing any subscription on the same destination.
   *
   * @return the replaced subscription, or null
   */
  public StompSubscription register(StompSubscription subscription) {
    StompSubscription previous =
        subscriptions.put(subscription.getDestination(), subscription);
    if (previous != null && log.isDebugEnabled()) {
      log.debug("subscription replaced: " + previous + " -> " + subscription);
    }
    return previous;
  }

  public StompSubscription register(String destination, MessageListener<String> callback) {
    StompSubscription subscription =
        new StompSubscription(destination, ClientUtils.newSubscriptionId(), callback);
    register(subscription);
    return subscription;
  }

  public StompSubscription resolve(String destination) {
    if (destination == null) {
      return null;
    }
    return subscriptions.get(destination);
  }

  /** @return the removed subscription, or null */
  public StompSubscription unregister(String destination) {
    return subscriptions.remove(destination);
  }

  /** Remove only if the destination still maps to this subscription. */
  public boolean unregister(StompSubscription subscription) {
    return subscriptions.remove(subscription.getDestination(), subscription);
  }

  /** Put back a replaced subscription, only if the destination still maps to current. */
  public boolean replace(StompSubscription current, StompSubscription restored) {
    return subscriptions.replace(current.getDestination(), current, restored);
  }

  public int size() {
    return subscriptions.size();
  }
}
