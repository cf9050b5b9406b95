package com.acme.enginesync.config;

import com.acme.enginesync.dispatch.InMemoryJobQueue;
import com.acme.enginesync.pubsub.InMemoryPubSub;
import com.acme.enginesync.spi.IdGenerator;
import com.acme.enginesync.spi.PubSub;
import com.acme.enginesync.watcher.EngineResponseWatcher;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Composition root for the framework-free core. The core module has no Micronaut dependency; this
 * factory binds its POJOs to application.yml and wires the watcher with its collaborators.
 */
@Factory
public class WatcherBeansFactory {

  /** Creates WatcherConfig bean populated from application.yml watcher.* properties */
  @Singleton
  @ConfigurationProperties("watcher")
  public WatcherConfig watcherConfig() {
    return new WatcherConfig();
  }

  /** Creates JobsConfig bean populated from application.yml jobs.* properties */
  @Singleton
  @ConfigurationProperties("jobs")
  public JobsConfig jobsConfig() {
    return new JobsConfig();
  }

  @Singleton
  public IdGenerator idGenerator() {
    return IdGenerator.uuid();
  }

  /** One watcher, and so one handler id, per process. */
  @Singleton
  public EngineResponseWatcher engineResponseWatcher(
      PubSub pubSub, IdGenerator idGenerator, WatcherConfig watcherConfig) {
    return new EngineResponseWatcher(pubSub, idGenerator, watcherConfig);
  }

  /** Single-node mode: bus and job queue stay inside this process. */
  @Singleton
  @Requires(property = "redisson.enabled", value = "false")
  public InMemoryPubSub inMemoryPubSub() {
    return new InMemoryPubSub();
  }

  @Singleton
  @Requires(property = "redisson.enabled", value = "false")
  public InMemoryJobQueue inMemoryJobQueue() {
    return new InMemoryJobQueue();
  }
}
