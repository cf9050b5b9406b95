package com.acme.enginesync.web;

import com.acme.enginesync.watcher.EngineResponseWatcher;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.Map;

@Controller
public class HealthController {

  private final EngineResponseWatcher watcher;

  public HealthController(EngineResponseWatcher watcher) {
    this.watcher = watcher;
  }

  @Get("/health")
  public HttpResponse<Map<String, Object>> health() {
    return HttpResponse.ok(
        Map.of(
            "status", "UP",
            "handlerId", watcher.getHandlerId(),
            "pendingWaits", watcher.pendingCount()));
  }
}
