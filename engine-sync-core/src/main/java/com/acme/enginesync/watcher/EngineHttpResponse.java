package com.acme.enginesync.watcher;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The HTTP answer a flow run produced for a synchronous webhook. The body is any JSON value and is
 * passed through untouched.
 */
@JsonPropertyOrder({"status", "body", "headers"})
public record EngineHttpResponse(int status, Object body, Map<String, String> headers) {

    public static final int NO_CONTENT = 204;

    public EngineHttpResponse {
        headers = headers == null ? Map.of() : withoutNullValues(headers);
    }

    /** Engines may send {@code "name": null}; such headers are treated as absent. */
    private static Map<String, String> withoutNullValues(Map<String, String> headers) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    /** Returned to a caller whose bounded wait expired before any result was published. */
    public static EngineHttpResponse noContent() {
        return new EngineHttpResponse(NO_CONTENT, Map.of(), Map.of());
    }
}
