package com.acme.enginesync.config;

/** Where dispatched sync-webhook jobs are queued. Pure POJO - no framework dependencies. */
public class JobsConfig {

  private String queue = "engine-run:jobs";

  public String getQueue() {
    return queue;
  }

  public void setQueue(String queue) {
    this.queue = queue;
  }
}
