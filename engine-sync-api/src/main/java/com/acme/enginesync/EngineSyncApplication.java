package com.acme.enginesync;

import io.micronaut.runtime.Micronaut;

/**
 * Engine Sync Application - accepts synchronous webhooks, dispatches them to the flow engine fleet
 * and holds the HTTP request open until the engine publishes the result back to this instance.
 * Run as many instances as needed; each listens on its own private Redis channel.
 */
public class EngineSyncApplication {
    public static void main(String[] args) {
        Micronaut.run(EngineSyncApplication.class, args);
    }
}
