package com.acme.enginesync.pubsub;

import com.acme.enginesync.spi.MessageListener;
import com.acme.enginesync.spi.PubSub;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local pub/sub. Each publish is handed to every listener subscribed at that moment through
 * the configured executor; by default listeners run on the publishing thread.
 */
public class InMemoryPubSub implements PubSub {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryPubSub.class);

  private final Map<String, List<MessageListener>> channels = new ConcurrentHashMap<>();
  private final Executor executor;

  public InMemoryPubSub() {
    this(Runnable::run);
  }

  public InMemoryPubSub(Executor executor) {
    this.executor = executor;
  }

  @Override
  public void subscribe(String channel, MessageListener listener) {
    // Added inside the map update so a concurrent unsubscribe cannot orphan the list.
    channels.compute(
        channel,
        (c, listeners) -> {
          List<MessageListener> list = listeners == null ? new CopyOnWriteArrayList<>() : listeners;
          list.add(listener);
          return list;
        });
    LOG.debug("Subscribed to channel={}", channel);
  }

  @Override
  public void unsubscribe(String channel) {
    channels.remove(channel);
    LOG.debug("Unsubscribed from channel={}", channel);
  }

  @Override
  public void publish(String channel, String message) {
    List<MessageListener> listeners = channels.getOrDefault(channel, List.of());
    LOG.debug("Publishing to channel={} receivers={}", channel, listeners.size());
    for (MessageListener listener : listeners) {
      executor.execute(() -> listener.onMessage(channel, message));
    }
  }

  public int subscriberCount(String channel) {
    return channels.getOrDefault(channel, List.of()).size();
  }
}
