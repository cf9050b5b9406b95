package com.acme.enginesync.redis;

import com.acme.enginesync.core.TransportException;
import com.acme.enginesync.spi.MessageListener;
import com.acme.enginesync.spi.PubSub;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis PUBLISH/SUBSCRIBE through Redisson topics. Payloads travel as plain strings so that nodes
 * written against other Redis clients can read them.
 */
@Singleton
@Requires(beans = RedissonClient.class)
public class RedissonPubSub implements PubSub {
  private static final Logger LOG = LoggerFactory.getLogger(RedissonPubSub.class);

  private final RedissonClient redisson;

  public RedissonPubSub(RedissonClient redisson) {
    this.redisson = redisson;
  }

  @Override
  public void subscribe(String channel, MessageListener listener) {
    try {
      topic(channel)
          .addListener(String.class, (ch, message) -> listener.onMessage(ch.toString(), message));
      LOG.info("Subscribed to Redis channel={}", channel);
    } catch (RedisException e) {
      throw new TransportException("Failed to subscribe to " + channel, e);
    }
  }

  @Override
  public void unsubscribe(String channel) {
    try {
      topic(channel).removeAllListeners();
      LOG.info("Unsubscribed from Redis channel={}", channel);
    } catch (RedisException e) {
      throw new TransportException("Failed to unsubscribe from " + channel, e);
    }
  }

  @Override
  public void publish(String channel, String message) {
    try {
      long receivers = topic(channel).publish(message);
      LOG.debug("Published to Redis channel={} receivers={}", channel, receivers);
    } catch (RedisException e) {
      throw new TransportException("Failed to publish to " + channel, e);
    }
  }

  private RTopic topic(String channel) {
    return redisson.getTopic(channel, StringCodec.INSTANCE);
  }
}
