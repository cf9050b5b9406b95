package com.acme.enginesync.redis;

import com.acme.enginesync.config.JobsConfig;
import com.acme.enginesync.core.TransportException;
import com.acme.enginesync.dispatch.SyncWebhookJob;
import com.acme.enginesync.spi.JobDispatcher;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends sync-webhook jobs to a Redis list that engine workers pop. */
@Singleton
@Requires(beans = RedissonClient.class)
public class RedisJobDispatcher implements JobDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(RedisJobDispatcher.class);

  private final RedissonClient redisson;
  private final String queue;

  public RedisJobDispatcher(RedissonClient redisson, JobsConfig jobsConfig) {
    this.redisson = redisson;
    this.queue = jobsConfig.getQueue();
  }

  @Override
  public void dispatch(SyncWebhookJob job) {
    try {
      redisson.getQueue(queue, StringCodec.INSTANCE).add(job.toJson());
      LOG.debug("Dispatched job requestId={} flowId={} queue={}", job.requestId(), job.flowId(), queue);
    } catch (RedisException e) {
      throw new TransportException("Failed to dispatch job requestId=" + job.requestId(), e);
    }
  }
}
