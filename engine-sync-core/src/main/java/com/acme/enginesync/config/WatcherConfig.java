package com.acme.enginesync.config;

import java.time.Duration;

/**
 * Configuration for the engine response watcher. Pure POJO - no framework dependencies.
 */
public class WatcherConfig {

  public static final String DEFAULT_CHANNEL_PREFIX = "engine-run:sync:";

  private Duration webhookTimeout = Duration.ofSeconds(30);
  private String channelPrefix = DEFAULT_CHANNEL_PREFIX;

  public Duration getWebhookTimeout() {
    return webhookTimeout;
  }

  public void setWebhookTimeout(Duration webhookTimeout) {
    if (webhookTimeout == null || webhookTimeout.isNegative() || webhookTimeout.isZero()) {
      throw new IllegalArgumentException("webhookTimeout must be positive: " + webhookTimeout);
    }
    this.webhookTimeout = webhookTimeout;
  }

  public long getWebhookTimeoutSeconds() {
    return webhookTimeout.toSeconds();
  }

  /** Bound from {@code watcher.webhook-timeout-seconds}. */
  public void setWebhookTimeoutSeconds(long seconds) {
    setWebhookTimeout(Duration.ofSeconds(seconds));
  }

  public long getWebhookTimeoutMillis() {
    return webhookTimeout.toMillis();
  }

  public String getChannelPrefix() {
    return channelPrefix;
  }

  public void setChannelPrefix(String channelPrefix) {
    if (channelPrefix == null || channelPrefix.isBlank()) {
      throw new IllegalArgumentException("channelPrefix must not be blank");
    }
    this.channelPrefix = channelPrefix;
  }

  /** Private channel of a handler. Example: H1 -> engine-run:sync:H1 */
  public String buildChannel(String handlerId) {
    return channelPrefix + handlerId;
  }
}
