package com.acme.enginesync.web;

import com.acme.enginesync.dispatch.SyncWebhookJob;
import com.acme.enginesync.spi.IdGenerator;
import com.acme.enginesync.spi.JobDispatcher;
import com.acme.enginesync.watcher.EngineHttpResponse;
import com.acme.enginesync.watcher.EngineResponseWatcher;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous webhooks. The request is turned into a job for the engine fleet and the HTTP call is
 * held open until the engine publishes the flow's response back to this instance.
 */
@Controller("/v1/webhooks")
public class WebhookController {
  private static final Logger LOG = LoggerFactory.getLogger(WebhookController.class);

  private final EngineResponseWatcher watcher;
  private final JobDispatcher jobDispatcher;
  private final IdGenerator idGenerator;

  public WebhookController(
      EngineResponseWatcher watcher, JobDispatcher jobDispatcher, IdGenerator idGenerator) {
    this.watcher = watcher;
    this.jobDispatcher = jobDispatcher;
    this.idGenerator = idGenerator;
  }

  /** Waits at most the configured webhook timeout, then answers 204. */
  @Post("/{flowId}/sync")
  public CompletableFuture<MutableHttpResponse<Object>> sync(
      @PathVariable String flowId,
      HttpRequest<?> request,
      @Body @Nullable Map<String, Object> payload) {
    return run(flowId, request, payload, true);
  }

  /**
   * Waits until the engine answers, however long that takes. For internal callers whose engine is
   * guaranteed to publish a result.
   */
  @Post("/{flowId}/sync/unbounded")
  public CompletableFuture<MutableHttpResponse<Object>> syncUnbounded(
      @PathVariable String flowId,
      HttpRequest<?> request,
      @Body @Nullable Map<String, Object> payload) {
    return run(flowId, request, payload, false);
  }

  private CompletableFuture<MutableHttpResponse<Object>> run(
      String flowId, HttpRequest<?> request, Map<String, Object> payload, boolean timeoutRequest) {
    String requestId = idGenerator.nextId();
    CompletableFuture<EngineHttpResponse> response = watcher.listen(requestId, timeoutRequest);
    try {
      jobDispatcher.dispatch(
          new SyncWebhookJob(
              requestId, watcher.getHandlerId(), flowId, payload, headersOf(request.getHeaders())));
    } catch (RuntimeException e) {
      release(requestId, e);
      throw e;
    }
    LOG.debug("Dispatched sync webhook flowId={} requestId={}", flowId, requestId);
    return response.thenApply(WebhookController::toHttpResponse);
  }

  /** No engine answers a job that was never dispatched, so the wait gets the fallback now. */
  private void release(String requestId, RuntimeException dispatchFailure) {
    LOG.warn("Dispatch failed requestId={}: {}", requestId, dispatchFailure.getMessage());
    try {
      watcher.publish(requestId, watcher.getHandlerId(), EngineHttpResponse.noContent());
    } catch (RuntimeException e) {
      dispatchFailure.addSuppressed(e);
    }
  }

  static MutableHttpResponse<Object> toHttpResponse(EngineHttpResponse response) {
    MutableHttpResponse<Object> http = HttpResponse.<Object>ok().status(response.status());
    response.headers().forEach(http::header);
    if (response.status() != EngineHttpResponse.NO_CONTENT && response.body() != null) {
      http.body(response.body());
    }
    return http;
  }

  private static Map<String, String> headersOf(HttpHeaders headers) {
    Map<String, String> result = new HashMap<>();
    for (String name : headers.names()) {
      String value = headers.get(name);
      if (value != null) {
        result.put(name.toLowerCase(Locale.ROOT), value);
      }
    }
    return result;
  }
}
