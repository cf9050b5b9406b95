package com.acme.enginesync.watcher;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/** One outstanding wait: the future handed to the caller plus its timer, if one was armed. */
public final class PendingResponse {

  private final String requestId;
  private final CompletableFuture<EngineHttpResponse> future = new CompletableFuture<>();
  private volatile ScheduledFuture<?> timeout;
  private volatile boolean displaced;

  public PendingResponse(String requestId) {
    this.requestId = requestId;
  }

  public String requestId() {
    return requestId;
  }

  CompletableFuture<EngineHttpResponse> future() {
    return future;
  }

  void armTimeout(ScheduledFuture<?> timeout) {
    this.timeout = timeout;
  }

  /** Set when a later wait registered under the same request id replaced this one. */
  void markDisplaced() {
    this.displaced = true;
  }

  boolean isDisplaced() {
    return displaced;
  }

  /**
   * Completes the wait. Only the path that claimed this entry from the registry may call it.
   *
   * @return false if the wait was already resolved
   */
  boolean resolve(EngineHttpResponse response) {
    ScheduledFuture<?> t = timeout;
    if (t != null) {
      t.cancel(false);
    }
    return future.complete(response);
  }

  public boolean isResolved() {
    return future.isDone();
  }
}
