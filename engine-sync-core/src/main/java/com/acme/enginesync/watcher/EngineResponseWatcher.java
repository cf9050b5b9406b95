package com.acme.enginesync.watcher;

import com.acme.enginesync.config.WatcherConfig;
import com.acme.enginesync.core.MalformedEnvelopeException;
import com.acme.enginesync.spi.IdGenerator;
import com.acme.enginesync.spi.PubSub;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets a request handler wait for a result that some other process produces.
 *
 * <p>Every watcher owns a handler id and listens on its private channel ({@code
 * engine-run:sync:<handlerId>}). A caller registers interest with {@link #listen}, passes its
 * request id and {@link #getHandlerId()} along with the job it dispatches, and whichever process
 * runs the job answers with {@link #publish}. Only the watcher holding the request id resolves the
 * wait; duplicate or late messages find no entry and are dropped.
 *
 * <p>Bounded waits resolve with {@link EngineHttpResponse#noContent()} once the configured webhook
 * timeout passes. Unbounded waits resolve only on delivery, so callers must be sure a result will
 * eventually be published. Shutdown does not cancel outstanding waits.
 */
public class EngineResponseWatcher {
  private static final Logger LOG = LoggerFactory.getLogger(EngineResponseWatcher.class);

  private final PubSub pubSub;
  private final WatcherConfig config;
  private final ResponseRegistry registry;
  private final ScheduledExecutorService timer;
  private final String handlerId;
  private final AtomicBoolean subscribed = new AtomicBoolean(false);

  public EngineResponseWatcher(PubSub pubSub, IdGenerator idGenerator, WatcherConfig config) {
    this(pubSub, idGenerator, config, new ResponseRegistry(), newTimer());
  }

  public EngineResponseWatcher(
      PubSub pubSub,
      IdGenerator idGenerator,
      WatcherConfig config,
      ResponseRegistry registry,
      ScheduledExecutorService timer) {
    this.pubSub = pubSub;
    this.config = config;
    this.registry = registry;
    this.timer = timer;
    this.handlerId = idGenerator.nextId();
  }

  public String getHandlerId() {
    return handlerId;
  }

  /**
   * Subscribes to this watcher's private channel. Repeated calls are ignored.
   *
   * @throws com.acme.enginesync.core.TransportException if the subscription fails
   */
  public void init() {
    if (!subscribed.compareAndSet(false, true)) {
      return;
    }
    String channel = config.buildChannel(handlerId);
    LOG.info("[engineWatcher#init] Initializing engine run watcher channel={}", channel);
    try {
      pubSub.subscribe(channel, (ch, message) -> onMessage(message));
    } catch (RuntimeException e) {
      subscribed.set(false);
      throw e;
    }
  }

  /**
   * Registers a wait for {@code requestId}.
   *
   * @param timeoutRequest whether the wait ends with a 204 fallback after the webhook timeout
   * @return a future completed exactly once, with the published response or the fallback
   */
  public CompletableFuture<EngineHttpResponse> listen(String requestId, boolean timeoutRequest) {
    requireId(requestId, "requestId");
    LOG.info("[engineWatcher#listen] requestId={} timeout={}", requestId, timeoutRequest);

    PendingResponse pending = new PendingResponse(requestId);
    // Register before arming so an early timer can always find its entry.
    registry.register(requestId, pending);
    if (timeoutRequest) {
      pending.armTimeout(
          timer.schedule(
              () -> expire(pending), config.getWebhookTimeoutMillis(), TimeUnit.MILLISECONDS));
    }
    return pending.future().copy();
  }

  /**
   * Sends {@code response} to the watcher owning {@code workerHandlerId}. Returns once the bus has
   * accepted the message; if nobody is subscribed the message is lost.
   *
   * @throws com.acme.enginesync.core.TransportException if the bus rejects the publish
   */
  public void publish(String requestId, String workerHandlerId, EngineHttpResponse response) {
    requireId(requestId, "requestId");
    requireId(workerHandlerId, "workerHandlerId");
    if (response == null) {
      throw new IllegalArgumentException("response must not be null");
    }
    LOG.info("[engineWatcher#publish] requestId={} handlerId={}", requestId, workerHandlerId);
    EngineResponseEnvelope envelope = new EngineResponseEnvelope(requestId, response);
    pubSub.publish(config.buildChannel(workerHandlerId), envelope.encode());
  }

  /**
   * Unsubscribes from the private channel. Pending waits are left as they are.
   *
   * @throws com.acme.enginesync.core.TransportException if the unsubscribe fails
   */
  public void shutdown() {
    if (!subscribed.compareAndSet(true, false)) {
      return;
    }
    LOG.info("[engineWatcher#shutdown] pending={}", registry.size());
    pubSub.unsubscribe(config.buildChannel(handlerId));
  }

  public int pendingCount() {
    return registry.size();
  }

  void onMessage(String message) {
    EngineResponseEnvelope envelope;
    try {
      envelope = EngineResponseEnvelope.decode(message);
    } catch (MalformedEnvelopeException e) {
      LOG.warn("[engineWatcher#init] Dropping malformed message: {}", e.getMessage());
      return;
    }
    String requestId = envelope.requestId();
    registry
        .takeAndClear(requestId)
        .ifPresentOrElse(
            pending -> {
              pending.resolve(envelope.httpResponse());
              LOG.info("[engineWatcher#init] message={} delivered", requestId);
            },
            () -> LOG.debug("[engineWatcher#init] message={} has no pending wait", requestId));
  }

  private void expire(PendingResponse pending) {
    // A displaced wait is out of the registry and can only end here.
    if (registry.takeAndClear(pending.requestId(), pending) || pending.isDisplaced()) {
      if (pending.resolve(EngineHttpResponse.noContent())) {
        LOG.info("[engineWatcher#listen] requestId={} timed out", pending.requestId());
      }
    }
  }

  private static void requireId(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }

  private static ScheduledExecutorService newTimer() {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              Thread t = new Thread(r, "engine-watcher-timeout");
              t.setDaemon(true);
              return t;
            });
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }
}
