package com.permission.engine.core.error;

/**
 * Raised when a configuration source cannot produce a document (I/O failure,
 * unexpected HTTP status, missing file).
 */
public class ConfigurationLoadException extends PermissionException {

    private final String source;

    public ConfigurationLoadException(String source, String message) {
        super(ErrorCode.CONFIGURATION_LOAD_FAILED, message);
        this.source = source;
    }

    public ConfigurationLoadException(String source, String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_LOAD_FAILED, message, cause);
        this.source = source;
    }

    /**
     * Description of the source, e.g. a file path or URL.
     */
    public String getSource() {
        return source;
    }
}
