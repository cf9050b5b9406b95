package com.acme.enginesync.dispatch;

import com.acme.enginesync.core.Jsons;
import java.util.Map;

/**
 * A webhook execution request. The engine that runs it reports its result back with {@code
 * publish(requestId, handlerId, response)}.
 */
public record SyncWebhookJob(
    String requestId,
    String handlerId,
    String flowId,
    Object payload,
    Map<String, String> headers
) {
    public SyncWebhookJob {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        if (handlerId == null || handlerId.isBlank()) {
            throw new IllegalArgumentException("handlerId must not be blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String toJson() {
        return Jsons.toJson(this);
    }
}
