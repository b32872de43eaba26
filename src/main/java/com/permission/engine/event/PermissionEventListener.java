package com.permission.engine.event;

/**
 * Receives configuration change events. Called synchronously on the mutating thread,
 * after the engine lock has been released. A listener that throws is logged and skipped.
 */
@FunctionalInterface
public interface PermissionEventListener {

    void onEvent(PermissionEvent event);
}
