package com.acme.enginesync.spi;

/**
 * Publish/subscribe transport. Delivery is at-least-once to the listeners subscribed to a channel
 * at publish time; messages for a channel nobody listens on are dropped.
 *
 * <p>All operations throw {@link com.acme.enginesync.core.TransportException} when the bus is
 * unreachable.
 */
public interface PubSub {

  void subscribe(String channel, MessageListener listener);

  void unsubscribe(String channel);

  void publish(String channel, String message);
}
