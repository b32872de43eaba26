package com.permission.engine.core.error;

/**
 * Raised when a configuration document or object is structurally invalid.
 * The path points at the offending element, e.g. {@code roles.editor.inherits}.
 */
public class ConfigurationInvalidException extends PermissionException {

    private final String path;

    public ConfigurationInvalidException(String path, String message) {
        super(ErrorCode.CONFIGURATION_INVALID, message);
        this.path = path;
    }

    public ConfigurationInvalidException(String path, String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_INVALID, message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
