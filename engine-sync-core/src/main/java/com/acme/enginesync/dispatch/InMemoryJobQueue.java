package com.acme.enginesync.dispatch;

import com.acme.enginesync.spi.JobDispatcher;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Single-process job queue used when Redis is disabled. An in-process engine polls it. */
public class InMemoryJobQueue implements JobDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryJobQueue.class);

  private final BlockingQueue<SyncWebhookJob> jobs = new LinkedBlockingQueue<>();

  @Override
  public void dispatch(SyncWebhookJob job) {
    jobs.add(job);
    LOG.debug("Queued job requestId={} flowId={}", job.requestId(), job.flowId());
  }

  /** Waits up to {@code timeout} for the next job. */
  public Optional<SyncWebhookJob> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(jobs.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public int size() {
    return jobs.size();
  }
}
