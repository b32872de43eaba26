package com.permission.engine.core.error;

import java.time.Instant;

/**
 * Base class for all errors raised by the permission engine.
 * Errors are raised synchronously by the operation that detects them and are never
 * downgraded to a negative permission decision.
 */
public abstract class PermissionException extends RuntimeException {

    private final ErrorCode code;
    private final Instant timestamp;

    protected PermissionException(ErrorCode code, String message) {
        this(code, message, null);
    }

    protected PermissionException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.timestamp = Instant.now();
    }

    public ErrorCode getCode() {
        return code;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [" + code + "] (" + timestamp + "): " + getMessage();
    }
}
