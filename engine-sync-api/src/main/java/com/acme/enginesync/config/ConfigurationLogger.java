package com.acme.enginesync.config;

import com.acme.enginesync.spi.JobDispatcher;
import com.acme.enginesync.spi.PubSub;
import com.acme.enginesync.watcher.EngineResponseWatcher;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final WatcherConfig watcherConfig;
    private final JobsConfig jobsConfig;
    private final EngineResponseWatcher watcher;
    private final PubSub pubSub;
    private final JobDispatcher jobDispatcher;
    private final int serverPort;
    private final String redisAddress;

    public ConfigurationLogger(
            WatcherConfig watcherConfig,
            JobsConfig jobsConfig,
            EngineResponseWatcher watcher,
            PubSub pubSub,
            JobDispatcher jobDispatcher,
            @Property(name = "micronaut.server.port", defaultValue = "8080") int serverPort,
            @Property(name = "redisson.address") @Nullable String redisAddress) {
        this.watcherConfig = watcherConfig;
        this.jobsConfig = jobsConfig;
        this.watcher = watcher;
        this.pubSub = pubSub;
        this.jobDispatcher = jobDispatcher;
        this.serverPort = serverPort;
        this.redisAddress = redisAddress;
    }

    @Override
    public void onApplicationEvent(ServerStartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Server Configuration ━━━");
        LOG.info("  Port:               {} (HTTP endpoint listening port)", serverPort);
        LOG.info("");

        LOG.info("━━━ Response Watcher ━━━");
        LOG.info("  Handler Id:         {} (suffix of this instance's private channel)", watcher.getHandlerId());
        LOG.info("  Channel:            {}", watcherConfig.buildChannel(watcher.getHandlerId()));
        LOG.info("  Webhook Timeout:    {} (bounded waits answer 204 after this)", watcherConfig.getWebhookTimeout());
        LOG.info("");

        LOG.info("━━━ Messaging Configuration ━━━");
        LOG.info("  Pub/Sub:            {}", pubSub.getClass().getSimpleName());
        LOG.info("  Job Dispatcher:     {}", jobDispatcher.getClass().getSimpleName());
        LOG.info("  Job Queue:          {}", jobsConfig.getQueue());
        LOG.info("  Redis Address:      {}", redisAddress != null ? redisAddress : "(in-memory mode)");
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
