package com.acme.enginesync.watcher;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local map from request id to the wait that owns it. Delivery and timeout race to claim an
 * entry; removal from this map decides the winner, the loser sees nothing.
 */
public class ResponseRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ResponseRegistry.class);

    private final Map<String, PendingResponse> pending = new ConcurrentHashMap<>();

    /** Inserts {@code response}, replacing any wait already registered under the same id. */
    public void register(String requestId, PendingResponse response) {
        // The displaced flag is set inside the map update so an expiring timer always sees either
        // its own entry or the flag.
        pending.compute(requestId, (id, previous) -> {
            if (previous != null && previous != response) {
                previous.markDisplaced();
                LOG.warn("Replaced pending wait for requestId={}; request ids must not be reused", id);
            }
            return response;
        });
    }

    /** Removes and returns the wait for {@code requestId}, if any. */
    public Optional<PendingResponse> takeAndClear(String requestId) {
        return Optional.ofNullable(pending.remove(requestId));
    }

    /** Removes the entry only while it is still {@code expected}. */
    public boolean takeAndClear(String requestId, PendingResponse expected) {
        return pending.remove(requestId, expected);
    }

    public boolean contains(String requestId) {
        return pending.containsKey(requestId);
    }

    public int size() {
        return pending.size();
    }
}
