package com.acme.enginesync.web;

import com.acme.enginesync.watcher.EngineHttpResponse;

/** Body of {@code POST /v1/engine/responses}, sent by an engine that finished a sync webhook. */
public record EngineResponseRequest(
    String requestId, String handlerId, EngineHttpResponse httpResponse) {}
