package com.acme.enginesync.spi;

import com.acme.enginesync.dispatch.SyncWebhookJob;

/** Hands a job to the flow engine fleet. Does not wait for the job to run. */
public interface JobDispatcher {
  void dispatch(SyncWebhookJob job);
}
