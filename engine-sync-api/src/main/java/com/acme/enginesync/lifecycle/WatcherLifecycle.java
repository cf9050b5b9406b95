package com.acme.enginesync.lifecycle;

import com.acme.enginesync.watcher.EngineResponseWatcher;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes the watcher when the context starts and unsubscribes it when the context closes. A
 * subscribe failure is rethrown so that startup fails instead of serving requests that can never
 * be answered.
 */
@Singleton
public class WatcherLifecycle implements ApplicationEventListener<StartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(WatcherLifecycle.class);

  private final EngineResponseWatcher watcher;

  public WatcherLifecycle(EngineResponseWatcher watcher) {
    this.watcher = watcher;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    watcher.init();
    LOG.info("Engine response watcher started handlerId={}", watcher.getHandlerId());
  }

  @PreDestroy
  public void stop() {
    LOG.info("Stopping engine response watcher handlerId={} pending={}",
        watcher.getHandlerId(), watcher.pendingCount());
    watcher.shutdown();
  }
}
