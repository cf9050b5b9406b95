package com.acme.enginesync.watcher;

import com.acme.enginesync.core.Jsons;
import com.acme.enginesync.core.MalformedEnvelopeException;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Wire message carried on a handler's private channel. */
@JsonPropertyOrder({"requestId", "httpResponse"})
public record EngineResponseEnvelope(String requestId, EngineHttpResponse httpResponse) {

    public String encode() {
        return Jsons.toJson(this);
    }

    /**
     * Decodes and validates a channel payload.
     *
     * @throws MalformedEnvelopeException if the payload is not JSON, or lacks a request id or a
     *     response
     */
    public static EngineResponseEnvelope decode(String payload) {
        EngineResponseEnvelope envelope;
        try {
            envelope = Jsons.fromJson(payload, EngineResponseEnvelope.class);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Undecodable envelope: " + e.getMessage(), e);
        }
        if (envelope == null) {
            throw new MalformedEnvelopeException("Envelope is null");
        }
        if (envelope.requestId() == null || envelope.requestId().isBlank()) {
            throw new MalformedEnvelopeException("Envelope has no requestId");
        }
        if (envelope.httpResponse() == null) {
            throw new MalformedEnvelopeException(
                    "Envelope for requestId=" + envelope.requestId() + " has no httpResponse");
        }
        return envelope;
    }
}
