package com.acme.enginesync.redis;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/**
 * Shared Redisson client. Every instance holds one subscription for its private response channel
 * and publishes to the channels of its peers, so the subscription pool is sized separately from
 * the command pool.
 */
@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  static final String DEFAULT_CLIENT_NAME = "engine-sync";

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(
      @Property(name = "redisson.address") String address,
      @Property(name = "redisson.client-name", defaultValue = DEFAULT_CLIENT_NAME) String clientName,
      @Property(name = "redisson.subscription-pool-size", defaultValue = "50")
          int subscriptionPoolSize) {
    return Redisson.create(config(address, clientName, subscriptionPoolSize));
  }

  static Config config(String address, String clientName, int subscriptionPoolSize) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("redisson.address must not be blank");
    }
    if (subscriptionPoolSize < 1) {
      throw new IllegalArgumentException(
          "redisson.subscription-pool-size must be positive: " + subscriptionPoolSize);
    }
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(address)
        .setClientName(clientName)
        .setSubscriptionConnectionPoolSize(subscriptionPoolSize);
    return config;
  }
}
