package com.permission.engine.config;

import com.permission.engine.core.model.PermissionConfiguration;

import java.util.concurrent.CompletableFuture;

/**
 * Produces a structurally valid configuration snapshot.
 */
public interface ConfigurationSource {

    /**
     * Loads the configuration synchronously.
     *
     * @throws com.permission.engine.core.error.ConfigurationLoadException    if the source cannot be read
     * @throws com.permission.engine.core.error.ConfigurationInvalidException if the document is malformed
     */
    PermissionConfiguration load();

    /**
     * Loads the configuration without blocking the caller. The default runs {@link #load()}
     * on the common pool; sources with native asynchronous I/O override it.
     */
    default CompletableFuture<PermissionConfiguration> loadAsync() {
        return CompletableFuture.supplyAsync(this::load);
    }

    /**
     * Human readable description used in logs, events and errors.
     */
    String describe();
}
