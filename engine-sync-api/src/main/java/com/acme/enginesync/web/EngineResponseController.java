package com.acme.enginesync.web;

import com.acme.enginesync.watcher.EngineResponseWatcher;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;

/**
 * Lets an engine without a Redis connection report a webhook result. The result is forwarded to
 * the instance named by {@code handlerId}, whichever instance receives this call.
 */
@Controller("/v1/engine")
public class EngineResponseController {

  private final EngineResponseWatcher watcher;

  public EngineResponseController(EngineResponseWatcher watcher) {
    this.watcher = watcher;
  }

  @Post("/responses")
  public HttpResponse<Void> report(@Body EngineResponseRequest request) {
    watcher.publish(request.requestId(), request.handlerId(), request.httpResponse());
    return HttpResponse.accepted();
  }
}
